package org.eqlogic.expressions;

import lombok.Getter;
import org.eqlogic.core.Sort;
import org.eqlogic.errors.PositionOutOfBoundsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 代表一个带排序的变量。等式中的变量隐式地被全称量化。
 * 此类是不可变的，按名称和排序比较。
 * @author Ayalyt
 */
@Getter
public final class Variable implements Term, Comparable<Variable> {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    private final String name;
    private final Sort sort;

    private final int hashCode;

    private Variable(String name, Sort sort) {
        this.name = name;
        this.sort = sort;
        this.hashCode = Objects.hash(name, sort);
        logger.debug("创建了一个Variable: {}:{}", name, sort);
    }

    public static Variable of(String name, Sort sort) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        Objects.requireNonNull(sort, "Variable sort cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("变量名称不能为空");
        }
        return new Variable(name, sort);
    }

    @Override
    public Set<Variable> getVariables() {
        return Set.of(this);
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public boolean isVariable() {
        return true;
    }

    @Override
    public Term subtermAt(Position position) {
        if (!position.isRoot()) {
            logger.error("变量 {} 没有位于 {} 的子项", name, position);
            throw new PositionOutOfBoundsException("变量 " + name + " 没有位于 " + position + " 的子项");
        }
        return this;
    }

    @Override
    public Term replaceAt(Position position, Term replacement) {
        if (!position.isRoot()) {
            logger.error("变量 {} 没有位于 {} 的子项", name, position);
            throw new PositionOutOfBoundsException("变量 " + name + " 没有位于 " + position + " 的子项");
        }
        return Objects.requireNonNull(replacement, "Replacement cannot be null");
    }

    @Override
    public List<Position> positions() {
        return List.of(Position.ROOT);
    }

    @Override
    public int compareTo(Variable other) {
        int cmp = this.name.compareTo(other.name);
        return cmp != 0 ? cmp : this.sort.compareTo(other.sort);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable variable = (Variable) o;
        return name.equals(variable.name) && sort.equals(variable.sort);
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
