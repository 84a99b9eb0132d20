package org.eqlogic.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.eqlogic.core.Sort;
import org.eqlogic.expressions.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 负责管理项中的 Variable 到 Z3 常量的映射。
 * 确保每个变量在 Z3 Context 中有唯一的对应常量。
 * 排序到 Z3 排序的映射由 {@link #bindSort} 指定，未指定的排序映射为整数。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 使用 HashMap 存储映射，一个 Context 只在单线程中使用，不会有并发问题
    private final Map<Variable, Expr> z3Vars;
    private final Map<Sort, com.microsoft.z3.Sort> z3Sorts;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.z3Vars = new HashMap<>();
        this.z3Sorts = new HashMap<>();
        logger.debug("Z3VariableManager 初始化完成");
    }

    /**
     * 指定排序在 Z3 中的表示，例如把 G 映射为实数排序。
     * 必须在为该排序的变量创建常量之前调用。
     * @param sort 签名中的排序。
     * @param z3Sort 对应的 Z3 排序。
     */
    public void bindSort(Sort sort, com.microsoft.z3.Sort z3Sort) {
        Objects.requireNonNull(sort, "Sort cannot be null");
        Objects.requireNonNull(z3Sort, "Z3 sort cannot be null");
        boolean alreadyUsed = z3Vars.keySet().stream().anyMatch(v -> v.getSort().equals(sort));
        if (alreadyUsed) {
            logger.error("排序 {} 已经有变量映射到 Z3，不能再改变它的表示", sort);
            throw new IllegalStateException("排序 " + sort + " 已经有变量映射到 Z3");
        }
        z3Sorts.put(sort, z3Sort);
        logger.info("排序 {} 在 Z3 中表示为 {}", sort, z3Sort);
    }

    public com.microsoft.z3.Sort getZ3Sort(Sort sort) {
        return z3Sorts.computeIfAbsent(sort, s -> ctx.mkIntSort());
    }

    /**
     * 获取指定 Variable 对应的 Z3 常量。
     * 如果常量尚未创建，则会创建并缓存。
     * @param variable 项中的变量。
     * @return 对应的 Z3 常量。
     */
    public Expr getZ3Var(Variable variable) {
        return z3Vars.computeIfAbsent(variable, v -> {
            logger.debug("创建 Z3 变量: {}:{}", v.getName(), v.getSort());
            return ctx.mkConst(v.getSort().getName() + "!" + v.getName(), getZ3Sort(v.getSort()));
        });
    }
}
