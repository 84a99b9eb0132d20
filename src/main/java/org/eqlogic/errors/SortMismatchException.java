package org.eqlogic.errors;

/**
 * 排序不一致：等式两侧排序不同、运算引用了未声明的排序，或重写会改变项的排序。
 */
public class SortMismatchException extends EquationalException {

    public SortMismatchException(String message) {
        super(ErrorKind.SORT_MISMATCH, message);
    }
}
