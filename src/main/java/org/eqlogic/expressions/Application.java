package org.eqlogic.expressions;

import lombok.Getter;
import org.eqlogic.core.Operation;
import org.eqlogic.core.Sort;
import org.eqlogic.errors.PositionOutOfBoundsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 代表运算应用 f(t1, ..., tn)。
 * 构造时不检查参数与运算声明是否一致，良构性由签名检查，
 * 这样非良构的输入才能作为 IllTypedEquation 报告出来。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class Application implements Term {

    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    private final Operation operation;
    private final List<Term> arguments;

    private final int hashCode;
    private final int size;
    private final Set<Variable> variables;

    private Application(Operation operation, List<Term> arguments) {
        this.operation = operation;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.hashCode = Objects.hash(operation, this.arguments);
        this.size = 1 + this.arguments.stream().mapToInt(Term::size).sum();
        Set<Variable> vars = new LinkedHashSet<>();
        for (Term argument : this.arguments) {
            vars.addAll(argument.getVariables());
        }
        this.variables = Collections.unmodifiableSet(vars);
    }

    /**
     * 工厂方法：创建运算应用。
     * @param operation 被应用的运算。
     * @param arguments 参数列表。
     * @return Application 实例。
     */
    public static Application of(Operation operation, List<? extends Term> arguments) {
        Objects.requireNonNull(operation, "Operation cannot be null");
        Objects.requireNonNull(arguments, "Arguments cannot be null");
        arguments.forEach(a -> Objects.requireNonNull(a, "Argument cannot be null"));
        return new Application(operation, new ArrayList<>(arguments));
    }

    public static Application of(Operation operation, Term... arguments) {
        return of(operation, List.of(arguments));
    }

    public Term getArgument(int index) {
        return arguments.get(index);
    }

    public int getArity() {
        return arguments.size();
    }

    @Override
    public Sort getSort() {
        return operation.getResultSort();
    }

    @Override
    public Set<Variable> getVariables() {
        return variables;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean isVariable() {
        return false;
    }

    @Override
    public Term subtermAt(Position position) {
        Term current = this;
        for (int i = 0; i < position.depth(); i++) {
            int index = position.indexAt(i);
            if (!(current instanceof Application) || index >= ((Application) current).getArity()) {
                logger.error("位置 {} 超出了项 {} 的范围", position, this);
                throw new PositionOutOfBoundsException("位置 " + position + " 超出了项 " + this + " 的范围");
            }
            current = ((Application) current).getArgument(index);
        }
        return current;
    }

    @Override
    public Term replaceAt(Position position, Term replacement) {
        Objects.requireNonNull(replacement, "Replacement cannot be null");
        if (position.isRoot()) {
            return replacement;
        }
        int index = position.indexAt(0);
        if (index >= arguments.size()) {
            logger.error("位置 {} 超出了项 {} 的范围", position, this);
            throw new PositionOutOfBoundsException("位置 " + position + " 超出了项 " + this + " 的范围");
        }
        List<Term> newArguments = new ArrayList<>(arguments);
        newArguments.set(index, arguments.get(index).replaceAt(position.tail(), replacement));
        return new Application(operation, newArguments);
    }

    @Override
    public List<Position> positions() {
        List<Position> result = new ArrayList<>();
        result.add(Position.ROOT);
        for (int i = 0; i < arguments.size(); i++) {
            for (Position sub : arguments.get(i).positions()) {
                result.add(sub.under(i));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Application that = (Application) o;
        return hashCode == that.hashCode
                && operation.equals(that.operation)
                && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return operation.getName();
        }
        return operation.getName() + arguments.stream()
                .map(Term::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
