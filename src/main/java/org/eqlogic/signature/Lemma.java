package org.eqlogic.signature;

import lombok.Getter;
import org.eqlogic.derivation.DerivationChain;
import org.eqlogic.expressions.Equation;

import java.util.Objects;

/**
 * 已验证的引理：等式加上证明它的推导链。
 * 登记后可以像公理一样被后续推导引用。
 * @author Ayalyt
 */
@Getter
public final class Lemma extends RegisteredEquation {

    private final DerivationChain derivation;

    Lemma(String name, Equation equation, long sequence, DerivationChain derivation) {
        super(name, equation, sequence);
        this.derivation = Objects.requireNonNull(derivation, "Derivation cannot be null");
    }

    @Override
    public EquationKind getKind() {
        return EquationKind.LEMMA;
    }

    /**
     * @return 推导链的步数。
     */
    public int getLength() {
        return derivation.length();
    }
}
