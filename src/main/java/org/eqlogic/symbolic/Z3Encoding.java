package org.eqlogic.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.eqlogic.core.Operation;
import org.eqlogic.errors.IncompleteInstanceException;
import org.eqlogic.expressions.Application;
import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Term;
import org.eqlogic.expressions.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 签名中运算到 Z3 的翻译表，用来把项和等式翻译为 Z3 表达式。
 * @author Ayalyt
 */
public final class Z3Encoding {

    private static final Logger logger = LoggerFactory.getLogger(Z3Encoding.class);

    private final Map<Operation, Z3OperationEncoder> encoders = new HashMap<>();

    public Z3Encoding operation(Operation operation, Z3OperationEncoder encoder) {
        encoders.put(Objects.requireNonNull(operation), Objects.requireNonNull(encoder));
        return this;
    }

    /**
     * 常用的算术翻译：把常量翻译为整数字面量。
     */
    public Z3Encoding integerConstant(Operation operation, int value) {
        return operation(operation, (ctx, args) -> ctx.mkInt(value));
    }

    /**
     * 常用的算术翻译：把二元运算翻译为加法。
     */
    public Z3Encoding addition(Operation operation) {
        return operation(operation, (ctx, args) -> ctx.mkAdd((ArithExpr) args.get(0), (ArithExpr) args.get(1)));
    }

    /**
     * 常用的算术翻译：把二元运算翻译为乘法。
     */
    public Z3Encoding multiplication(Operation operation) {
        return operation(operation, (ctx, args) -> ctx.mkMul((ArithExpr) args.get(0), (ArithExpr) args.get(1)));
    }

    /**
     * 常用的算术翻译：把一元运算翻译为取负。
     */
    public Z3Encoding negation(Operation operation) {
        return operation(operation, (ctx, args) -> ctx.mkUnaryMinus((ArithExpr) args.get(0)));
    }

    public boolean covers(Operation operation) {
        return encoders.containsKey(operation);
    }

    /**
     * 将项翻译为 Z3 表达式。
     * @throws IncompleteInstanceException 如果某个运算没有翻译。
     */
    public Expr encode(Term term, Z3VariableManager varManager) {
        if (term instanceof Variable) {
            return varManager.getZ3Var((Variable) term);
        }
        Application application = (Application) term;
        Z3OperationEncoder encoder = encoders.get(application.getOperation());
        if (encoder == null) {
            logger.error("运算 {} 没有 Z3 翻译", application.getOperation());
            throw new IncompleteInstanceException("运算 " + application.getOperation() + " 没有 Z3 翻译");
        }
        List<Expr> arguments = new ArrayList<>(application.getArity());
        for (Term argument : application.getArguments()) {
            arguments.add(encode(argument, varManager));
        }
        return encoder.encode(varManager.getCtx(), arguments);
    }

    /**
     * 将等式翻译为 Z3 的 lhs == rhs。
     */
    public BoolExpr encode(Equation equation, Z3VariableManager varManager) {
        Context ctx = varManager.getCtx();
        return ctx.mkEq(encode(equation.getLhs(), varManager), encode(equation.getRhs(), varManager));
    }
}
