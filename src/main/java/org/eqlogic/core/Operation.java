package org.eqlogic.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 代表签名中的一个运算，形如 name: S1 × ... × Sn → S。
 * 元数为 0 的运算即常量（例如单位元 e）。
 * 此类是不可变的。
 * @see org.eqlogic.signature.Signature
 * @author Ayalyt
 */
@Getter
public final class Operation implements Comparable<Operation> {

    private static final Logger logger = LoggerFactory.getLogger(Operation.class);

    private final String name;
    private final List<Sort> argumentSorts;
    private final Sort resultSort;

    private final int hashCode;

    private Operation(String name, List<Sort> argumentSorts, Sort resultSort) {
        this.name = name;
        this.argumentSorts = Collections.unmodifiableList(List.copyOf(argumentSorts));
        this.resultSort = resultSort;
        this.hashCode = Objects.hash(name, this.argumentSorts, resultSort);
        logger.debug("创建了一个Operation: {}", this);
    }

    /**
     * 工厂方法：创建一个运算。
     * @param name 运算名称。
     * @param argumentSorts 参数排序列表，按参数顺序。
     * @param resultSort 结果排序。
     * @return Operation 实例。
     */
    public static Operation of(String name, List<Sort> argumentSorts, Sort resultSort) {
        Objects.requireNonNull(name, "Operation name cannot be null");
        Objects.requireNonNull(argumentSorts, "Argument sorts cannot be null");
        Objects.requireNonNull(resultSort, "Result sort cannot be null");
        if (name.isBlank()) {
            logger.error("尝试创建名称为空的运算");
            throw new IllegalArgumentException("运算名称不能为空");
        }
        argumentSorts.forEach(s -> Objects.requireNonNull(s, "Argument sort cannot be null"));
        return new Operation(name, argumentSorts, resultSort);
    }

    /**
     * 工厂方法：创建单排序签名中的运算，所有参数和结果都属于同一排序。
     * @param name 运算名称。
     * @param arity 元数。
     * @param sort 唯一的排序。
     * @return Operation 实例。
     */
    public static Operation of(String name, int arity, Sort sort) {
        if (arity < 0) {
            logger.error("运算 {} 的元数 {} 为负数", name, arity);
            throw new IllegalArgumentException("运算元数不能为负数: " + arity);
        }
        return of(name, Collections.nCopies(arity, sort), sort);
    }

    public static Operation constant(String name, Sort sort) {
        return of(name, List.of(), sort);
    }

    public int getArity() {
        return argumentSorts.size();
    }

    public boolean isConstant() {
        return argumentSorts.isEmpty();
    }

    /**
     * 检查另一个运算是否与此运算同名但类型不同。
     * 签名合并时据此判断冲突。
     */
    public boolean conflictsWith(Operation other) {
        return name.equals(other.name) && !this.equals(other);
    }

    @Override
    public int compareTo(Operation other) {
        int cmp = this.name.compareTo(other.name);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(this.getArity(), other.getArity());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Operation that = (Operation) o;
        return name.equals(that.name)
                && argumentSorts.equals(that.argumentSorts)
                && resultSort.equals(that.resultSort);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String args = argumentSorts.isEmpty()
                ? "()"
                : argumentSorts.stream().map(Sort::getName).collect(Collectors.joining("×"));
        return name + ": " + args + "→" + resultSort;
    }
}
