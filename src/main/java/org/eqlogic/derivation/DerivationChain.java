package org.eqlogic.derivation;

import org.eqlogic.expressions.Term;
import org.eqlogic.rewrite.DerivationStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 代表一条推导链 t0 = t1 = ... = tn，第 i 步说明 t_i 如何重写为 t_{i+1}。
 * 推导链是数据而不是控制流，可以被缓存、序列化以及独立地重新检查。
 * 此类是不可变的。
 * @author Ayalyt
 */
public final class DerivationChain {

    private final List<Term> terms;
    private final List<DerivationStep> steps;

    private final int hashCode;

    private DerivationChain(List<Term> terms, List<DerivationStep> steps) {
        if (terms.size() != steps.size() + 1) {
            throw new IllegalArgumentException("推导链需要 n+1 个项和 n 个步骤，实际为 "
                    + terms.size() + " 个项、" + steps.size() + " 个步骤");
        }
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.hashCode = Objects.hash(this.terms, this.steps);
    }

    public static DerivationChain of(List<Term> terms, List<DerivationStep> steps) {
        Objects.requireNonNull(terms, "Terms cannot be null");
        Objects.requireNonNull(steps, "Steps cannot be null");
        terms.forEach(t -> Objects.requireNonNull(t, "Term cannot be null"));
        steps.forEach(s -> Objects.requireNonNull(s, "Step cannot be null"));
        return new DerivationChain(terms, steps);
    }

    /**
     * 只有起点、没有步骤的推导链，证明 t = t。
     */
    public static DerivationChain reflexive(Term term) {
        return new DerivationChain(List.of(Objects.requireNonNull(term, "Term cannot be null")), List.of());
    }

    public static Builder builder(Term start) {
        return new Builder(start);
    }

    public Term getStart() {
        return terms.get(0);
    }

    public Term getEnd() {
        return terms.get(terms.size() - 1);
    }

    public Term getTerm(int index) {
        return terms.get(index);
    }

    public DerivationStep getStep(int index) {
        return steps.get(index);
    }

    public List<Term> getTerms() {
        return terms;
    }

    public List<DerivationStep> getSteps() {
        return steps;
    }

    /**
     * @return 步骤数。
     */
    public int length() {
        return steps.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DerivationChain that = (DerivationChain) o;
        return terms.equals(that.terms) && steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("  ").append(terms.get(0));
        for (int i = 0; i < steps.size(); i++) {
            sb.append("\n= ").append(terms.get(i + 1)).append("    [").append(steps.get(i)).append(']');
        }
        return sb.toString();
    }

    /**
     * 逐步构造推导链：每一步同时给出步骤和预期得到的项。
     */
    public static final class Builder {

        private final List<Term> terms = new ArrayList<>();
        private final List<DerivationStep> steps = new ArrayList<>();

        private Builder(Term start) {
            terms.add(Objects.requireNonNull(start, "Start term cannot be null"));
        }

        public Builder then(DerivationStep step, Term expected) {
            steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            terms.add(Objects.requireNonNull(expected, "Expected term cannot be null"));
            return this;
        }

        public DerivationChain build() {
            return new DerivationChain(terms, steps);
        }
    }
}
