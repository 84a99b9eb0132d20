package org.eqlogic.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

import java.util.List;

/**
 * 把一个运算翻译为 Z3 表达式，例如把 add 翻译为 {@code ctx.mkAdd(a, b)}。
 * @author Ayalyt
 */
@FunctionalInterface
public interface Z3OperationEncoder {

    /**
     * @param ctx Z3 Context 实例。
     * @param arguments 已翻译好的参数，个数等于运算的元数。
     * @return 对应的 Z3 表达式。
     */
    Expr encode(Context ctx, List<Expr> arguments);
}
