package org.eqlogic.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表一个排序（载体类型的占位符），例如群论中的 G。
 * 此类是不可变的，按名称比较。
 * @author Ayalyt
 */
@Getter
public final class Sort implements Comparable<Sort> {

    private static final Logger logger = LoggerFactory.getLogger(Sort.class);

    private final String name;

    private final int hashCode;

    private Sort(String name) {
        this.name = name;
        this.hashCode = Objects.hash(name);
        logger.debug("创建了一个Sort: {}", name);
    }

    /**
     * 工厂方法：创建指定名称的排序。
     * @param name 排序名称，不能为空串。
     * @return Sort 实例。
     */
    public static Sort of(String name) {
        Objects.requireNonNull(name, "Sort name cannot be null");
        if (name.isBlank()) {
            logger.error("尝试创建名称为空的排序");
            throw new IllegalArgumentException("排序名称不能为空");
        }
        return new Sort(name);
    }

    @Override
    public int compareTo(Sort other) {
        return this.name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Sort sort = (Sort) o;
        return name.equals(sort.name);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }
}
