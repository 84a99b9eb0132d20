package org.eqlogic.derivation;

import lombok.Getter;
import org.eqlogic.errors.EquationalException;
import org.eqlogic.errors.GoalNotReachedException;
import org.eqlogic.errors.StepMismatchException;
import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Term;
import org.eqlogic.rewrite.DerivationStep;
import org.eqlogic.rewrite.RewriteEngine;
import org.eqlogic.signature.AxiomRegistry;
import org.eqlogic.signature.Lemma;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 推导链验证器：按等式传递性检查推导链，并把证明成功的目标作为引理登记进注册表。
 * <p>
 * 推导链只能引用本次验证开始之前已经登记的条目，因此引理不可能用来证明它自己。
 * 验证失败时注册表保持不变。
 * @author Ayalyt
 */
public final class DerivationVerifier {

    private static final Logger logger = LoggerFactory.getLogger(DerivationVerifier.class);

    @Getter
    private final AxiomRegistry registry;
    private final RewriteEngine engine;

    public DerivationVerifier(AxiomRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.engine = new RewriteEngine(registry);
    }

    /**
     * 验证推导链证明了目标等式，成功后登记为引理。
     * <ol>
     *   <li>从 t0 开始依次重放每一步，结果必须与记录的 t_{i+1} 结构相等；</li>
     *   <li>{t0, tn} 作为无序对必须等于 {goal.lhs, goal.rhs}。</li>
     * </ol>
     * @param name 引理名称。
     * @param chain 推导链。
     * @param goal 目标等式。
     * @return 登记后的引理。
     * @throws StepMismatchException 第一个结果与记录不符的步骤。
     * @throws GoalNotReachedException 如果首尾两项不是目标等式的两侧。
     * @throws EquationalException 单步重写的其他错误，以及目标等式的类型错误。
     */
    public Lemma verify(String name, DerivationChain chain, Equation goal) {
        Objects.requireNonNull(name, "Lemma name cannot be null");
        check(chain, goal);
        Lemma lemma = registry.registerLemma(name, goal, chain);
        logger.info("引理 {} 验证通过: {}", name, goal);
        return lemma;
    }

    /**
     * 只验证、不登记。
     * @see #verify(String, DerivationChain, Equation)
     */
    public void check(DerivationChain chain, Equation goal) {
        Objects.requireNonNull(chain, "Chain cannot be null");
        Objects.requireNonNull(goal, "Goal cannot be null");
        registry.validate(goal);

        // 验证开始时刻的快照：之后登记的条目一律不可引用
        long bound = registry.currentSequence();
        logger.debug("开始验证目标 {}，共 {} 步，可引用序号 < {}", goal, chain.length(), bound);

        Term current = chain.getStart();
        for (int i = 0; i < chain.length(); i++) {
            DerivationStep step = chain.getStep(i);
            Term computed;
            try {
                computed = engine.applyStep(current, step, bound);
            } catch (EquationalException e) {
                logger.error("目标 {} 的第 {} 步 {} 失败: {}", goal, i, step, e.getMessage());
                throw e;
            }
            Term recorded = chain.getTerm(i + 1);
            if (!computed.equals(recorded)) {
                logger.error("目标 {} 的第 {} 步 {} 得到 {}，记录的是 {}", goal, i, step, computed, recorded);
                throw new StepMismatchException(i, "第 " + i + " 步 " + step + " 得到 " + computed
                        + "，记录的是 " + recorded);
            }
            current = recorded;
        }

        if (!goal.hasSides(chain.getStart(), chain.getEnd())) {
            logger.error("推导链 {} ... {} 没有到达目标 {}", chain.getStart(), chain.getEnd(), goal);
            throw new GoalNotReachedException("推导链证明的是 " + chain.getStart() + " = " + chain.getEnd()
                    + "，不是目标 " + goal);
        }
    }

    /**
     * 脚本形式的证明：只给出步骤，从 goal.lhs 出发依次计算中间项，最后一项必须是 goal.rhs。
     * @param name 引理名称。
     * @param goal 目标等式。
     * @param steps 推导步骤。
     * @return 登记后的引理，其推导链包含计算出的全部中间项。
     * @throws GoalNotReachedException 如果最后一项不是 goal.rhs。
     */
    public Lemma prove(String name, Equation goal, List<DerivationStep> steps) {
        Objects.requireNonNull(goal, "Goal cannot be null");
        Objects.requireNonNull(steps, "Steps cannot be null");
        registry.validate(goal);
        long bound = registry.currentSequence();

        List<Term> terms = new ArrayList<>(steps.size() + 1);
        Term current = goal.getLhs();
        terms.add(current);
        for (int i = 0; i < steps.size(); i++) {
            try {
                current = engine.applyStep(current, steps.get(i), bound);
            } catch (EquationalException e) {
                logger.error("目标 {} 的第 {} 步 {} 失败: {}", goal, i, steps.get(i), e.getMessage());
                throw e;
            }
            terms.add(current);
        }
        if (!current.equals(goal.getRhs())) {
            logger.error("从 {} 出发的 {} 步推导停在 {}，没有到达 {}", goal.getLhs(), steps.size(), current, goal.getRhs());
            throw new GoalNotReachedException("推导停在 " + current + "，没有到达 " + goal.getRhs());
        }
        return verify(name, DerivationChain.of(terms, steps), goal);
    }
}
