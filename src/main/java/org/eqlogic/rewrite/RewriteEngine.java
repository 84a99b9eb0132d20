package org.eqlogic.rewrite;

import lombok.Getter;
import org.eqlogic.errors.SortMismatchException;
import org.eqlogic.errors.UnificationFailedException;
import org.eqlogic.errors.UnknownEquationException;
import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Matcher;
import org.eqlogic.expressions.Position;
import org.eqlogic.expressions.Substitution;
import org.eqlogic.expressions.Term;
import org.eqlogic.signature.AxiomRegistry;
import org.eqlogic.signature.RegisteredEquation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 等式重写引擎：对一个项执行单步推导。
 * 所有操作都是纯函数，不修改注册表。
 * @author Ayalyt
 */
public final class RewriteEngine {

    private static final Logger logger = LoggerFactory.getLogger(RewriteEngine.class);

    @Getter
    private final AxiomRegistry registry;

    public RewriteEngine(AxiomRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    }

    /**
     * 对项执行一步推导，可以引用注册表中当前的任何条目。
     * @see #applyStep(Term, DerivationStep, long)
     */
    public Term applyStep(Term term, DerivationStep step) {
        return applyStep(term, step, Long.MAX_VALUE);
    }

    /**
     * 对项执行一步推导：
     * <ol>
     *   <li>按名称找到等式，只接受序号小于 sequenceBound 的条目；</li>
     *   <li>取出 step 位置上的子项；</li>
     *   <li>以 step 的代换为前提，将子项与等式的模式一侧匹配；</li>
     *   <li>用完整代换实例化另一侧，替换该子项。</li>
     * </ol>
     * @param term 当前项。
     * @param step 推导步骤。
     * @param sequenceBound 可引用条目的序号上界（不含）。
     * @return 重写后的项。
     * @throws UnknownEquationException 如果等式不存在或登记得太晚。
     * @throws org.eqlogic.errors.PositionOutOfBoundsException 如果位置不指向合法子项。
     * @throws UnificationFailedException 如果子项在给定代换下不匹配模式。
     * @throws SortMismatchException 如果替换会改变子项的排序。
     * @throws org.eqlogic.errors.IllTypedEquationException 如果代换引入了签名中不存在的运算。
     */
    public Term applyStep(Term term, DerivationStep step, long sequenceBound) {
        Objects.requireNonNull(term, "Term cannot be null");
        Objects.requireNonNull(step, "Step cannot be null");
        RegisteredEquation entry = registry.lookupBefore(step.getEquationName(), sequenceBound)
                .orElseThrow(() -> {
                    logger.error("步骤 {} 引用的等式 {} 不存在或在本次推导开始后才登记", step, step.getEquationName());
                    return new UnknownEquationException("等式 " + step.getEquationName()
                            + " 不存在，或在本次推导开始后才登记");
                });
        return rewrite(term, entry.getEquation(), step);
    }

    private Term rewrite(Term term, Equation equation, DerivationStep step) {
        Term subterm = term.subtermAt(step.getPosition());
        Term pattern = step.getDirection().patternSide().of(equation);
        Term replacement = step.getDirection().replacementSide().of(equation);

        Substitution full = Matcher.match(pattern, subterm, step.getSubstitution()).orElseThrow(() -> {
            logger.error("步骤 {} 失败：{} 在代换 {} 下不匹配 {}", step, subterm, step.getSubstitution(), pattern);
            return new UnificationFailedException("子项 " + subterm + " 在代换 " + step.getSubstitution()
                    + " 下不匹配 " + step.getEquationName() + " 的模式 " + pattern);
        });

        Term instantiated = full.apply(replacement);
        // 代换给出的项可能含有签名之外的运算
        registry.getSignature().checkWellFormed(instantiated);
        if (!instantiated.getSort().equals(subterm.getSort())) {
            logger.error("步骤 {} 会把排序 {} 的子项替换为排序 {} 的项", step, subterm.getSort(), instantiated.getSort());
            throw new SortMismatchException("步骤 " + step + " 会把排序 " + subterm.getSort()
                    + " 的子项替换为排序 " + instantiated.getSort() + " 的项");
        }
        Term result = term.replaceAt(step.getPosition(), instantiated);
        logger.debug("{} --[{}]--> {}", term, step, result);
        return result;
    }

    /**
     * 列出某条等式在项中所有可用的位置和方向（只读的辅助功能，不做搜索）。
     * 返回的步骤带有匹配得到的完整代换，可以直接放进推导链。
     * 替换侧中匹配无法确定的变量保持未绑定。
     * @param term 当前项。
     * @param equationName 等式名称。
     * @return 可行的重写，按位置先序、先左到右后右到左排列。
     * @throws UnknownEquationException 如果等式不存在。
     */
    public List<Rewrite> rewritesAt(Term term, String equationName) {
        RegisteredEquation entry = registry.lookup(equationName).orElseThrow(() -> {
            logger.error("等式 {} 不存在", equationName);
            return new UnknownEquationException("等式 " + equationName + " 不存在");
        });
        List<Rewrite> result = new ArrayList<>();
        for (Position position : term.positions()) {
            Term subterm = term.subtermAt(position);
            for (Direction direction : Direction.values()) {
                Term pattern = direction.patternSide().of(entry.getEquation());
                Optional<Substitution> match = Matcher.match(pattern, subterm);
                if (match.isEmpty()) {
                    continue;
                }
                Term instantiated = match.get().apply(direction.replacementSide().of(entry.getEquation()));
                if (!instantiated.getSort().equals(subterm.getSort())
                        || !registry.getSignature().isWellFormed(instantiated)) {
                    continue;
                }
                DerivationStep step = DerivationStep.of(equationName, direction, position, match.get());
                result.add(new Rewrite(step, term.replaceAt(position, instantiated)));
            }
        }
        logger.debug("等式 {} 在 {} 中有 {} 处可用", equationName, term, result.size());
        return result;
    }
}
