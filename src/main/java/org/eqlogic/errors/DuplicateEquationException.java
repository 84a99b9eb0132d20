package org.eqlogic.errors;

/**
 * 等式名已被另一条不同的等式占用。
 */
public class DuplicateEquationException extends EquationalException {

    public DuplicateEquationException(String message) {
        super(ErrorKind.DUPLICATE_EQUATION, message);
    }
}
