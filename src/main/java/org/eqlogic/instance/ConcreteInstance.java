package org.eqlogic.instance;

import lombok.Getter;
import org.eqlogic.core.Operation;
import org.eqlogic.core.Sort;
import org.eqlogic.errors.IncompleteInstanceException;
import org.eqlogic.expressions.Application;
import org.eqlogic.expressions.Term;
import org.eqlogic.expressions.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * 代表签名的一个具体实例：每个排序的载体以及每个运算的 Java 实现。
 * 构造一次，之后由 {@link InstanceChecker} 对照全部公理检查。
 * 此类是不可变的。
 * @param <T> 载体元素的 Java 类型（多排序时取公共超类型）。
 * @author Ayalyt
 */
public final class ConcreteInstance<T> {

    private static final Logger logger = LoggerFactory.getLogger(ConcreteInstance.class);

    /**
     * 一个运算的具体实现及其元数。
     */
    @Getter
    public static final class Interpretation<T> {

        private final int arity;
        private final Function<List<T>, T> function;

        private Interpretation(int arity, Function<List<T>, T> function) {
            this.arity = arity;
            this.function = function;
        }

        public T apply(List<T> arguments) {
            if (arguments.size() != arity) {
                throw new IllegalArgumentException("需要 " + arity + " 个参数，实际有 " + arguments.size() + " 个");
            }
            return Objects.requireNonNull(function.apply(arguments), "Interpretation returned null");
        }
    }

    @Getter
    private final String name;
    private final Map<Sort, Carrier<T>> carriers;
    private final Map<Operation, Interpretation<T>> interpretations;

    private ConcreteInstance(String name, Map<Sort, Carrier<T>> carriers, Map<Operation, Interpretation<T>> interpretations) {
        this.name = name;
        this.carriers = Collections.unmodifiableMap(new LinkedHashMap<>(carriers));
        this.interpretations = Collections.unmodifiableMap(new LinkedHashMap<>(interpretations));
        logger.info("创建具体实例 {}: {} 个载体，{} 个运算", name, carriers.size(), interpretations.size());
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    public Optional<Carrier<T>> getCarrier(Sort sort) {
        return Optional.ofNullable(carriers.get(sort));
    }

    public Optional<Interpretation<T>> getInterpretation(Operation operation) {
        return Optional.ofNullable(interpretations.get(operation));
    }

    public Map<Sort, Carrier<T>> getCarriers() {
        return carriers;
    }

    /**
     * 在给定的变量赋值下计算项的值。
     * @param term 要计算的项。
     * @param assignment 变量赋值，必须覆盖项中的全部变量。
     * @return 项的值。
     * @throws IncompleteInstanceException 如果某个运算没有实现。
     * @throws IllegalArgumentException 如果某个变量没有赋值。
     */
    public T evaluate(Term term, Map<Variable, T> assignment) {
        if (term instanceof Variable) {
            T value = assignment.get(term);
            if (value == null) {
                throw new IllegalArgumentException("变量 " + term + " 没有赋值");
            }
            return value;
        }
        Application application = (Application) term;
        Interpretation<T> interpretation = interpretations.get(application.getOperation());
        if (interpretation == null) {
            logger.error("实例 {} 没有运算 {} 的实现", name, application.getOperation());
            throw new IncompleteInstanceException("实例 " + name + " 没有运算 " + application.getOperation() + " 的实现");
        }
        List<T> arguments = new ArrayList<>(application.getArity());
        for (Term argument : application.getArguments()) {
            arguments.add(evaluate(argument, assignment));
        }
        return interpretation.apply(arguments);
    }

    @Override
    public String toString() {
        return "ConcreteInstance(" + name + ", carriers=" + carriers + ")";
    }

    public static final class Builder<T> {

        private final String name;
        private final Map<Sort, Carrier<T>> carriers = new LinkedHashMap<>();
        private final Map<Operation, Interpretation<T>> interpretations = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Instance name cannot be null");
        }

        public Builder<T> carrier(Sort sort, Carrier<T> carrier) {
            carriers.put(Objects.requireNonNull(sort), Objects.requireNonNull(carrier));
            return this;
        }

        /**
         * 指定运算的实现。
         * @param operation 签名中的运算。
         * @param arity 实现接受的参数个数，检查时与运算的元数比对。
         * @param function 实现。
         */
        public Builder<T> operation(Operation operation, int arity, Function<List<T>, T> function) {
            interpretations.put(Objects.requireNonNull(operation), new Interpretation<>(arity, Objects.requireNonNull(function)));
            return this;
        }

        public Builder<T> constant(Operation operation, T value) {
            Objects.requireNonNull(value, "Constant value cannot be null");
            return operation(operation, 0, args -> value);
        }

        public Builder<T> unary(Operation operation, UnaryOperator<T> function) {
            return operation(operation, 1, args -> function.apply(args.get(0)));
        }

        public Builder<T> binary(Operation operation, BinaryOperator<T> function) {
            return operation(operation, 2, args -> function.apply(args.get(0), args.get(1)));
        }

        public ConcreteInstance<T> build() {
            return new ConcreteInstance<>(name, carriers, interpretations);
        }
    }
}
