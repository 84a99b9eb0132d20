package org.eqlogic.errors;

/**
 * 运算名已在签名中声明，或在签名合并时同名运算的类型冲突。
 */
public class DuplicateOperationException extends EquationalException {

    public DuplicateOperationException(String message) {
        super(ErrorKind.DUPLICATE_OPERATION, message);
    }
}
