package org.eqlogic.errors;

/**
 * 等式的某一侧引用了未声明的运算，或运算的参数个数/排序与声明不符。
 */
public class IllTypedEquationException extends EquationalException {

    public IllTypedEquationException(String message) {
        super(ErrorKind.ILL_TYPED_EQUATION, message);
    }

    public IllTypedEquationException(String message, Throwable cause) {
        super(ErrorKind.ILL_TYPED_EQUATION, message, cause);
    }
}
