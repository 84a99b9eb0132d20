package org.eqlogic.errors;

/**
 * 具体实例缺少某个排序的载体，或缺少某个运算的解释，或解释的元数不符。
 */
public class IncompleteInstanceException extends EquationalException {

    public IncompleteInstanceException(String message) {
        super(ErrorKind.INCOMPLETE_INSTANCE, message);
    }
}
