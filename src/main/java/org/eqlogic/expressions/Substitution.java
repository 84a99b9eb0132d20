package org.eqlogic.expressions;

import org.eqlogic.errors.SortMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 代表从变量到项的代换。每个变量至多绑定一次，且只能绑定到同排序的项。
 * 应用代换会同时替换每个被绑定变量的所有出现；未绑定的变量原样保留。
 * 此类是不可变的。
 * @author Ayalyt
 */
public final class Substitution {

    private static final Logger logger = LoggerFactory.getLogger(Substitution.class);

    public static final Substitution EMPTY = new Substitution(Collections.emptyMap());

    private final Map<Variable, Term> bindings;

    private final int hashCode;

    private Substitution(Map<Variable, Term> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.hashCode = Objects.hash(this.bindings);
    }

    /**
     * 工厂方法：从映射创建代换。
     * @param bindings 变量到项的映射。
     * @return Substitution 实例。
     * @throws SortMismatchException 如果某个变量被绑定到不同排序的项。
     */
    public static Substitution of(Map<Variable, ? extends Term> bindings) {
        Objects.requireNonNull(bindings, "Bindings cannot be null");
        if (bindings.isEmpty()) {
            return EMPTY;
        }
        Map<Variable, Term> checked = new LinkedHashMap<>();
        bindings.forEach((variable, term) -> {
            checkSort(Objects.requireNonNull(variable, "Variable cannot be null"),
                    Objects.requireNonNull(term, "Bound term cannot be null"));
            checked.put(variable, term);
        });
        return new Substitution(checked);
    }

    public static Substitution of(Variable variable, Term term) {
        return of(Map.of(variable, term));
    }

    public static Substitution of(Variable v1, Term t1, Variable v2, Term t2) {
        Map<Variable, Term> map = new LinkedHashMap<>();
        map.put(v1, t1);
        map.put(v2, t2);
        return of(map);
    }

    public static Substitution of(Variable v1, Term t1, Variable v2, Term t2, Variable v3, Term t3) {
        Map<Variable, Term> map = new LinkedHashMap<>();
        map.put(v1, t1);
        map.put(v2, t2);
        map.put(v3, t3);
        return of(map);
    }

    private static void checkSort(Variable variable, Term term) {
        if (!variable.getSort().equals(term.getSort())) {
            logger.error("变量 {}:{} 不能绑定到排序为 {} 的项 {}", variable, variable.getSort(), term.getSort(), term);
            throw new SortMismatchException("变量 " + variable + ":" + variable.getSort()
                    + " 不能绑定到排序为 " + term.getSort() + " 的项 " + term);
        }
    }

    /**
     * 将代换应用到项上。纯函数，总是成功。
     * 没有变化的子树按引用复用。
     * @param term 目标项。
     * @return 代换后的项。
     */
    public Term apply(Term term) {
        if (bindings.isEmpty() || term.isGround()) {
            return term;
        }
        if (term instanceof Variable) {
            return bindings.getOrDefault(term, term);
        }
        Application application = (Application) term;
        List<Term> newArguments = new ArrayList<>(application.getArity());
        boolean changed = false;
        for (Term argument : application.getArguments()) {
            Term newArgument = apply(argument);
            changed |= newArgument != argument;
            newArguments.add(newArgument);
        }
        return changed ? Application.of(application.getOperation(), newArguments) : application;
    }

    public Optional<Term> get(Variable variable) {
        return Optional.ofNullable(bindings.get(variable));
    }

    public boolean binds(Variable variable) {
        return bindings.containsKey(variable);
    }

    /**
     * 在此代换上增加一个绑定，返回新的代换。
     * @throws IllegalArgumentException 如果变量已绑定到另一个项。
     */
    public Substitution extend(Variable variable, Term term) {
        Term existing = bindings.get(variable);
        if (existing != null) {
            if (existing.equals(term)) {
                return this;
            }
            throw new IllegalArgumentException("变量 " + variable + " 已绑定到 " + existing + "，不能再绑定到 " + term);
        }
        checkSort(variable, term);
        Map<Variable, Term> newBindings = new LinkedHashMap<>(bindings);
        newBindings.put(variable, term);
        return new Substitution(newBindings);
    }

    /**
     * 合并两个代换。两者对同一变量的绑定必须一致，否则返回空。
     */
    public Optional<Substitution> merge(Substitution other) {
        Map<Variable, Term> merged = new LinkedHashMap<>(bindings);
        for (Map.Entry<Variable, Term> entry : other.bindings.entrySet()) {
            Term existing = merged.putIfAbsent(entry.getKey(), entry.getValue());
            if (existing != null && !existing.equals(entry.getValue())) {
                logger.debug("合并代换时变量 {} 的绑定冲突: {} vs {}", entry.getKey(), existing, entry.getValue());
                return Optional.empty();
            }
        }
        return Optional.of(new Substitution(merged));
    }

    public Set<Variable> getDomain() {
        return bindings.keySet();
    }

    public Map<Variable, Term> getBindings() {
        return bindings;
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    public int size() {
        return bindings.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return bindings.equals(((Substitution) o).bindings);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return bindings.entrySet().stream()
                .map(entry -> entry.getKey() + " ↦ " + entry.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
