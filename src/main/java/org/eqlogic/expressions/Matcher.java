package org.eqlogic.expressions;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 一阶项之间的单向匹配：寻找代换 σ 使 σ(pattern) 与 concrete 结构相等。
 * 只绑定模式中的变量，具体项中的变量被视为常量。
 * 项都是有限树，因此不需要出现检查。
 * @author Ayalyt
 */
public final class Matcher {

    private static final Logger logger = LoggerFactory.getLogger(Matcher.class);

    private Matcher() {
    }

    /**
     * 匹配模式与具体项。
     * @return 使两者相等的最小代换；不匹配时返回空。
     */
    public static Optional<Substitution> match(Term pattern, Term concrete) {
        return match(pattern, concrete, Substitution.EMPTY);
    }

    /**
     * 以给定代换为前提匹配模式与具体项。
     * hint 中已有的绑定必须与具体项一致；hint 中与模式无关的绑定原样保留在结果里。
     * 按从左到右的顺序贪心地绑定变量，一个变量需要两个不同绑定时失败。
     * @param pattern 模式项。
     * @param concrete 具体项。
     * @param hint 预先给定的绑定。
     * @return hint 扩展后的代换；不匹配时返回空。
     */
    public static Optional<Substitution> match(Term pattern, Term concrete, Substitution hint) {
        Map<Variable, Term> bindings = new LinkedHashMap<>(hint.getBindings());
        Deque<Pair<Term, Term>> pending = new ArrayDeque<>();
        pending.push(Pair.of(pattern, concrete));

        while (!pending.isEmpty()) {
            Pair<Term, Term> pair = pending.pop();
            Term p = pair.getLeft();
            Term c = pair.getRight();

            if (p instanceof Variable) {
                Variable variable = (Variable) p;
                Term bound = bindings.get(variable);
                if (bound != null) {
                    if (!bound.equals(c)) {
                        logger.debug("变量 {} 已绑定到 {}，与 {} 冲突", variable, bound, c);
                        return Optional.empty();
                    }
                    continue;
                }
                if (!variable.getSort().equals(c.getSort())) {
                    logger.debug("变量 {}:{} 与排序为 {} 的项 {} 不匹配", variable, variable.getSort(), c.getSort(), c);
                    return Optional.empty();
                }
                bindings.put(variable, c);
                continue;
            }

            if (!(c instanceof Application)) {
                logger.debug("模式 {} 与变量 {} 不匹配", p, c);
                return Optional.empty();
            }
            Application pa = (Application) p;
            Application ca = (Application) c;
            if (!pa.getOperation().equals(ca.getOperation()) || pa.getArity() != ca.getArity()) {
                logger.debug("运算不一致: {} vs {}", pa.getOperation().getName(), ca.getOperation().getName());
                return Optional.empty();
            }
            // 逆序入栈，保证从左到右处理参数
            for (int i = pa.getArity() - 1; i >= 0; i--) {
                pending.push(Pair.of(pa.getArgument(i), ca.getArgument(i)));
            }
        }
        Substitution result = Substitution.of(bindings);
        logger.debug("匹配 {} 与 {} 成功: {}", pattern, concrete, result);
        return Optional.of(result);
    }

    public static boolean matches(Term pattern, Term concrete) {
        return match(pattern, concrete).isPresent();
    }
}
