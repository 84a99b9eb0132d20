package org.eqlogic.signature;

import lombok.Getter;
import org.eqlogic.expressions.Equation;

import java.util.Objects;

/**
 * 代表已登记在 {@link AxiomRegistry} 中的命名等式。
 * 登记后永不修改。序号反映登记的先后，推导只能引用序号早于验证开始时刻的条目。
 */
@Getter
public abstract class RegisteredEquation {

    private final String name;
    private final Equation equation;
    private final long sequence;

    protected RegisteredEquation(String name, Equation equation, long sequence) {
        this.name = Objects.requireNonNull(name, "Equation name cannot be null");
        this.equation = Objects.requireNonNull(equation, "Equation cannot be null");
        this.sequence = sequence;
    }

    public abstract EquationKind getKind();

    /**
     * @return 此等式是否由推导链证明（公理和假设返回 false）。
     */
    public boolean isProven() {
        return getKind() == EquationKind.LEMMA;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RegisteredEquation that = (RegisteredEquation) o;
        return sequence == that.sequence && name.equals(that.name) && equation.equals(that.equation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, equation, sequence);
    }

    @Override
    public String toString() {
        return getKind().name().toLowerCase() + " " + name + ": " + equation;
    }
}
