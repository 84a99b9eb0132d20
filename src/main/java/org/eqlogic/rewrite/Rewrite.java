package org.eqlogic.rewrite;

import lombok.Getter;
import org.eqlogic.expressions.Term;

import java.util.Objects;

/**
 * 一次可行的重写：完整实例化的步骤以及它产生的项。
 */
@Getter
public final class Rewrite {

    private final DerivationStep step;
    private final Term result;

    public Rewrite(DerivationStep step, Term result) {
        this.step = Objects.requireNonNull(step, "Step cannot be null");
        this.result = Objects.requireNonNull(result, "Result cannot be null");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Rewrite rewrite = (Rewrite) o;
        return step.equals(rewrite.step) && result.equals(rewrite.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(step, result);
    }

    @Override
    public String toString() {
        return step + " ⇒ " + result;
    }
}
