package org.eqlogic.theories;

import lombok.Getter;
import org.eqlogic.core.Operation;
import org.eqlogic.core.Sort;
import org.eqlogic.derivation.DerivationChain;
import org.eqlogic.derivation.DerivationVerifier;
import org.eqlogic.expressions.Application;
import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Position;
import org.eqlogic.expressions.Substitution;
import org.eqlogic.expressions.Term;
import org.eqlogic.expressions.Variable;
import org.eqlogic.instance.Carrier;
import org.eqlogic.instance.ConcreteInstance;
import org.eqlogic.rewrite.DerivationStep;
import org.eqlogic.signature.AxiomRegistry;
import org.eqlogic.signature.Lemma;
import org.eqlogic.signature.Signature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 群论：签名 (G, mul/2, inv/1, e/0)，公理为结合律、左单位元、左逆元。
 * 由公理推出右逆元、右单位元、双重逆元，以及单位元的唯一性。
 * <p>
 * 每个实例持有自己的签名和注册表；引理按 {@link #proveAll()} 的顺序登记，
 * 后面的证明会引用前面的引理。
 * @author Ayalyt
 */
public final class GroupTheory {

    private static final Logger logger = LoggerFactory.getLogger(GroupTheory.class);

    public static final String ASSOCIATIVITY = "assoc";
    public static final String LEFT_IDENTITY = "leftIdentity";
    public static final String LEFT_INVERSE = "leftInverse";

    public static final String RIGHT_INVERSE = "rightInverse";
    public static final String RIGHT_IDENTITY = "rightIdentity";
    public static final String DOUBLE_INVERSE = "doubleInverse";
    public static final String IDENTITY_UNIQUE = "identityUnique";
    public static final String OTHER_IDENTITY = "otherIdentity";

    private static final Position ROOT = Position.ROOT;

    @Getter
    private final Signature signature;
    @Getter
    private final AxiomRegistry registry;
    @Getter
    private final DerivationVerifier verifier;

    @Getter
    private final Sort sort;
    private final Operation mul;
    private final Operation inv;
    private final Operation e;

    private final Variable a;
    private final Variable x;

    public GroupTheory() {
        signature = Signature.singleSorted("Group", "G");
        sort = signature.getDefaultSort().orElseThrow();
        mul = signature.declareOperation("mul", 2);
        inv = signature.declareOperation("inv", 1);
        e = signature.declareConstant("e");

        registry = new AxiomRegistry(signature);
        registry.declareAxiom(ASSOCIATIVITY, "mul(mul(a, b), c) = mul(a, mul(b, c))");
        registry.declareAxiom(LEFT_IDENTITY, "mul(e, a) = a");
        registry.declareAxiom(LEFT_INVERSE, "mul(inv(a), a) = e");
        verifier = new DerivationVerifier(registry);

        a = Variable.of("a", sort);
        x = Variable.of("x", sort);
    }

    public Term mul(Term left, Term right) {
        return Application.of(mul, left, right);
    }

    public Term inv(Term term) {
        return Application.of(inv, term);
    }

    public Term e() {
        return Application.of(e);
    }

    /**
     * mul(x, inv(x)) = e
     */
    public Equation rightInverseGoal() {
        return Equation.of(mul(x, inv(x)), e());
    }

    /**
     * mul(x, e) = x
     */
    public Equation rightIdentityGoal() {
        return Equation.of(mul(x, e()), x);
    }

    /**
     * inv(inv(x)) = x
     */
    public Equation doubleInverseGoal() {
        return Equation.of(inv(inv(x)), x);
    }

    /**
     * 右逆元的推导：在 mul(x, inv(x)) 左边乘上 inv(inv(x)) · inv(x) 再化简。
     */
    public DerivationChain rightInverseChain() {
        Term ix = inv(x);
        Term iix = inv(ix);
        return DerivationChain.builder(mul(x, ix))
                .then(DerivationStep.backward(LEFT_IDENTITY, ROOT),
                        mul(e(), mul(x, ix)))
                .then(DerivationStep.backward(LEFT_INVERSE, Position.of(0), Substitution.of(a, ix)),
                        mul(mul(iix, ix), mul(x, ix)))
                .then(DerivationStep.forward(ASSOCIATIVITY, ROOT),
                        mul(iix, mul(ix, mul(x, ix))))
                .then(DerivationStep.backward(ASSOCIATIVITY, Position.of(1)),
                        mul(iix, mul(mul(ix, x), ix)))
                .then(DerivationStep.forward(LEFT_INVERSE, Position.of(1, 0)),
                        mul(iix, mul(e(), ix)))
                .then(DerivationStep.forward(LEFT_IDENTITY, Position.of(1)),
                        mul(iix, ix))
                .then(DerivationStep.forward(LEFT_INVERSE, ROOT),
                        e())
                .build();
    }

    /**
     * 右单位元的推导，依赖右逆元。
     */
    public DerivationChain rightIdentityChain() {
        return DerivationChain.builder(mul(x, e()))
                .then(DerivationStep.backward(LEFT_INVERSE, Position.of(1), Substitution.of(a, x)),
                        mul(x, mul(inv(x), x)))
                .then(DerivationStep.backward(ASSOCIATIVITY, ROOT),
                        mul(mul(x, inv(x)), x))
                .then(DerivationStep.forward(RIGHT_INVERSE, Position.of(0)),
                        mul(e(), x))
                .then(DerivationStep.forward(LEFT_IDENTITY, ROOT),
                        x)
                .build();
    }

    /**
     * 双重逆元的推导，依赖右单位元。
     */
    public DerivationChain doubleInverseChain() {
        Term iix = inv(inv(x));
        return DerivationChain.builder(iix)
                .then(DerivationStep.backward(RIGHT_IDENTITY, ROOT),
                        mul(iix, e()))
                .then(DerivationStep.backward(LEFT_INVERSE, Position.of(1), Substitution.of(a, x)),
                        mul(iix, mul(inv(x), x)))
                .then(DerivationStep.backward(ASSOCIATIVITY, ROOT),
                        mul(mul(iix, inv(x)), x))
                .then(DerivationStep.forward(LEFT_INVERSE, Position.of(0)),
                        mul(e(), x))
                .then(DerivationStep.forward(LEFT_IDENTITY, ROOT),
                        x)
                .build();
    }

    public Lemma proveRightInverse() {
        return verifier.verify(RIGHT_INVERSE, rightInverseChain(), rightInverseGoal());
    }

    public Lemma proveRightIdentity() {
        return verifier.verify(RIGHT_IDENTITY, rightIdentityChain(), rightIdentityGoal());
    }

    public Lemma proveDoubleInverse() {
        return verifier.verify(DOUBLE_INVERSE, doubleInverseChain(), doubleInverseGoal());
    }

    /**
     * 单位元的唯一性：在子作用域中引入新常量 e'，假设它是左单位元，推出 e' = e。
     * 引理登记在子作用域中，根注册表不受影响。需要先证明右单位元。
     * @return 子作用域中的引理。
     */
    public Lemma proveIdentityUnique() {
        Signature extended = Signature.extending("Group+e'", signature);
        Operation otherIdentity = extended.declareConstant("e'");
        AxiomRegistry scope = registry.extend(extended);
        scope.assume(OTHER_IDENTITY, "mul(e', a) = a");

        Term ePrime = Application.of(otherIdentity);
        DerivationChain chain = DerivationChain.builder(ePrime)
                .then(DerivationStep.backward(RIGHT_IDENTITY, ROOT), mul(ePrime, e()))
                .then(DerivationStep.forward(OTHER_IDENTITY, ROOT), e())
                .build();
        return new DerivationVerifier(scope).verify(IDENTITY_UNIQUE, chain, Equation.of(ePrime, e()));
    }

    /**
     * 按依赖顺序证明全部引理。
     * @return 右逆元、右单位元、双重逆元、单位元唯一性。
     */
    public List<Lemma> proveAll() {
        List<Lemma> lemmas = new ArrayList<>();
        lemmas.add(proveRightInverse());
        lemmas.add(proveRightIdentity());
        lemmas.add(proveDoubleInverse());
        lemmas.add(proveIdentityUnique());
        logger.info("群论: 证明了 {} 条引理", lemmas.size());
        return lemmas;
    }

    /**
     * 模 n 加法构成的循环群 Z/n。
     * @param n 阶，必须为正。
     */
    public ConcreteInstance<Integer> cyclic(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("循环群的阶必须为正: " + n);
        }
        List<Integer> elements = IntStream.range(0, n).boxed().collect(Collectors.toList());
        return ConcreteInstance.<Integer>builder("Z/" + n)
                .carrier(sort, Carrier.finite(elements))
                .binary(mul, (p, q) -> (p + q) % n)
                .unary(inv, p -> (n - p) % n)
                .constant(e, 0)
                .build();
    }
}
