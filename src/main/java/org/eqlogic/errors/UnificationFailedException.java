package org.eqlogic.errors;

/**
 * 子项在给定代换下无法匹配等式的模式一侧。
 */
public class UnificationFailedException extends EquationalException {

    public UnificationFailedException(String message) {
        super(ErrorKind.UNIFICATION_FAILED, message);
    }
}
