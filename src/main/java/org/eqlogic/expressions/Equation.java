package org.eqlogic.expressions;

import lombok.Getter;
import org.eqlogic.core.Sort;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 代表等式 lhs = rhs，隐式地对两侧出现的全部变量全称量化。
 * 两侧排序是否一致由注册表在登记时检查。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class Equation {

    private final Term lhs;
    private final Term rhs;

    private final int hashCode;

    private Equation(Term lhs, Term rhs) {
        this.lhs = lhs;
        this.rhs = rhs;
        this.hashCode = Objects.hash(lhs, rhs);
    }

    public static Equation of(Term lhs, Term rhs) {
        Objects.requireNonNull(lhs, "Equation lhs cannot be null");
        Objects.requireNonNull(rhs, "Equation rhs cannot be null");
        return new Equation(lhs, rhs);
    }

    /**
     * @return 等式左侧的排序。
     */
    public Sort getSort() {
        return lhs.getSort();
    }

    public boolean isSortConsistent() {
        return lhs.getSort().equals(rhs.getSort());
    }

    public Set<Variable> getVariables() {
        Set<Variable> variables = new LinkedHashSet<>(lhs.getVariables());
        variables.addAll(rhs.getVariables());
        return Collections.unmodifiableSet(variables);
    }

    public Equation flip() {
        return new Equation(rhs, lhs);
    }

    public Equation substitute(Substitution substitution) {
        return new Equation(substitution.apply(lhs), substitution.apply(rhs));
    }

    /**
     * 检查 {first, last} 作为无序对是否与 {lhs, rhs} 相同。
     */
    public boolean hasSides(Term first, Term last) {
        return (lhs.equals(first) && rhs.equals(last)) || (lhs.equals(last) && rhs.equals(first));
    }

    /**
     * 检查两个等式是否只差方向。
     */
    public boolean equalsUpToOrientation(Equation other) {
        return hasSides(other.lhs, other.rhs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Equation that = (Equation) o;
        return lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return lhs + " = " + rhs;
    }
}
