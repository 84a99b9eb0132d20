package org.eqlogic.errors;

/**
 * 推导步骤引用的等式不在注册表中，或在本次验证开始之后才登记。
 */
public class UnknownEquationException extends EquationalException {

    public UnknownEquationException(String message) {
        super(ErrorKind.UNKNOWN_EQUATION, message);
    }
}
