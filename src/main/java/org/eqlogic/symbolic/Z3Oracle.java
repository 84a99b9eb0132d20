package org.eqlogic.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.eqlogic.expressions.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Z3 求解器的封装，用于为无穷载体的公理卸载证明义务。
 * 一个 Oracle 拥有自己的 Context，只应在单线程中使用，用完必须关闭。
 * @author Ayalyt
 */
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    public static final int DEFAULT_TIMEOUT_MILLIS = 10_000;

    /**
     * 有效性检查的结果。
     */
    public enum OracleResult {
        /** 断言在所有赋值下成立。 */
        VALID,
        /** 找到了反例。 */
        INVALID,
        /** 求解器无法判定（超时或不完备）。 */
        UNKNOWN
    }

    /**
     * 有效性检查的结论及反例（如果有）。
     */
    @Getter
    public static final class Verdict {

        private final OracleResult result;
        private final Map<Variable, String> counterexample;

        Verdict(OracleResult result, Map<Variable, String> counterexample) {
            this.result = result;
            this.counterexample = Collections.unmodifiableMap(new LinkedHashMap<>(counterexample));
        }

        public boolean isValid() {
            return result == OracleResult.VALID;
        }

        @Override
        public String toString() {
            return counterexample.isEmpty() ? result.name() : result + " " + counterexample;
        }
    }

    @Getter
    private final Context context;
    @Getter
    private final Z3VariableManager varManager;
    private final int timeoutMillis;

    public Z3Oracle() {
        this(DEFAULT_TIMEOUT_MILLIS);
    }

    /**
     * @param timeoutMillis 单次求解的超时时间（毫秒）。
     */
    public Z3Oracle(int timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("超时时间必须为正数: " + timeoutMillis);
        }
        this.context = new Context();
        this.varManager = new Z3VariableManager(context);
        this.timeoutMillis = timeoutMillis;
        logger.info("Z3Oracle 初始化完成，超时 {} ms", timeoutMillis);
    }

    /**
     * 检查一组断言的可满足性。
     * @param assertions Z3 布尔表达式。
     * @return Z3 的求解状态。
     */
    public Status check(BoolExpr... assertions) {
        Solver solver = newSolver();
        solver.add(assertions);
        Status status = solver.check();
        logger.debug("Z3 检查 {} 个断言，结果 {}", assertions.length, status);
        return status;
    }

    /**
     * 检查断言在所有赋值下是否成立：其否定不可满足即有效。
     * 否定可满足时，从模型中读出 variables 的取值作为反例。
     * @param claim 要证明的断言。
     * @param variables 断言中出现的变量，用于报告反例。
     * @return 检查结论。
     */
    public Verdict checkValid(BoolExpr claim, Collection<Variable> variables) {
        Solver solver = newSolver();
        solver.add(context.mkNot(claim));
        Status status = solver.check();
        logger.debug("Z3 有效性检查 {}: 否定的求解结果为 {}", claim, status);

        if (status == Status.UNSATISFIABLE) {
            return new Verdict(OracleResult.VALID, Map.of());
        }
        if (status == Status.SATISFIABLE) {
            Model model = solver.getModel();
            Map<Variable, String> counterexample = new LinkedHashMap<>();
            for (Variable variable : variables) {
                Expr value = model.eval(varManager.getZ3Var(variable), true);
                counterexample.put(variable, value.toString());
            }
            logger.info("Z3 找到反例: {}", counterexample);
            return new Verdict(OracleResult.INVALID, counterexample);
        }
        logger.warn("Z3 无法判定 {}: {}", claim, solver.getReasonUnknown());
        return new Verdict(OracleResult.UNKNOWN, Map.of());
    }

    private Solver newSolver() {
        Solver solver = context.mkSolver();
        Params params = context.mkParams();
        params.add("timeout", timeoutMillis);
        solver.setParameters(params);
        return solver;
    }

    @Override
    public void close() {
        context.close();
        logger.debug("Z3Oracle 已关闭");
    }
}
