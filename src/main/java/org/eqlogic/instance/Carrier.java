package org.eqlogic.instance;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * 代表一个排序的载体集合：有限的值列表，或无穷（无界）载体的描述。
 * 有限载体的枚举顺序就是构造时给出的顺序。
 * @param <T> 载体元素的 Java 类型。
 * @author Ayalyt
 */
public final class Carrier<T> {

    @Getter
    private final String description;
    private final List<T> elements;
    private final boolean finite;

    private Carrier(String description, List<T> elements, boolean finite) {
        this.description = description;
        this.elements = elements;
        this.finite = finite;
    }

    /**
     * 工厂方法：创建有限载体。重复元素只保留第一次出现。
     * @param elements 载体元素，不能为空集合。
     */
    public static <T> Carrier<T> finite(Collection<? extends T> elements) {
        Objects.requireNonNull(elements, "Elements cannot be null");
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("有限载体不能为空");
        }
        List<T> distinct = new ArrayList<>(new LinkedHashSet<>(elements));
        distinct.forEach(e -> Objects.requireNonNull(e, "Carrier element cannot be null"));
        return new Carrier<>("{" + distinct.size() + " elements}", Collections.unmodifiableList(distinct), true);
    }

    @SafeVarargs
    public static <T> Carrier<T> finite(T... elements) {
        return finite(List.of(elements));
    }

    /**
     * 工厂方法：创建无穷载体，例如整数。无穷载体上的公理需要外部提供证明义务的证书。
     * @param description 载体的描述，例如 "ℤ"。
     */
    public static <T> Carrier<T> infinite(String description) {
        return new Carrier<>(Objects.requireNonNull(description, "Description cannot be null"), List.of(), false);
    }

    public boolean isFinite() {
        return finite;
    }

    /**
     * @return 有限载体的元素。
     * @throws IllegalStateException 如果载体是无穷的。
     */
    public List<T> getElements() {
        if (!finite) {
            throw new IllegalStateException("无穷载体 " + description + " 不能枚举");
        }
        return elements;
    }

    public int size() {
        if (!finite) {
            throw new IllegalStateException("无穷载体 " + description + " 没有有限大小");
        }
        return elements.size();
    }

    /**
     * 有限载体按成员关系判断；无穷载体总是返回 true。
     */
    public boolean contains(T value) {
        return !finite || elements.contains(value);
    }

    @Override
    public String toString() {
        return finite ? elements.toString() : description;
    }
}
