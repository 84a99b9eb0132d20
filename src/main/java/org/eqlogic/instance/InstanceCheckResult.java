package org.eqlogic.instance;

import org.eqlogic.core.Operation;
import org.eqlogic.expressions.Variable;
import org.eqlogic.signature.RegisteredEquation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 具体实例检查的结果：接受，或第一个发现的问题。
 * @param <T> 载体元素的 Java 类型。
 * @author Ayalyt
 */
public final class InstanceCheckResult<T> {

    public enum Status {
        /** 全部公理成立，实例被接受为模型。 */
        ACCEPTED,
        /** 某条公理在某个赋值下不成立。 */
        AXIOM_VIOLATION,
        /** 有限载体上某个运算的结果落在载体之外。 */
        CLOSURE_VIOLATION,
        /** 无穷载体上的公理没有证书。 */
        MISSING_CERTIFICATE,
        /** 证书既没有证明公理，也没有给出反例。 */
        UNDISCHARGED_OBLIGATION
    }

    private final Status status;
    private final RegisteredEquation axiom;
    private final Map<Variable, T> witness;
    private final Operation operation;
    private final List<T> arguments;
    private final String detail;

    private InstanceCheckResult(Status status, RegisteredEquation axiom, Map<Variable, T> witness,
                                Operation operation, List<T> arguments, String detail) {
        this.status = status;
        this.axiom = axiom;
        this.witness = Collections.unmodifiableMap(new LinkedHashMap<>(witness));
        this.operation = operation;
        this.arguments = List.copyOf(arguments);
        this.detail = Objects.requireNonNull(detail);
    }

    static <T> InstanceCheckResult<T> accepted(String detail) {
        return new InstanceCheckResult<>(Status.ACCEPTED, null, Map.of(), null, List.of(), detail);
    }

    static <T> InstanceCheckResult<T> axiomViolation(RegisteredEquation axiom, Map<Variable, T> witness, String detail) {
        return new InstanceCheckResult<>(Status.AXIOM_VIOLATION, axiom, witness, null, List.of(), detail);
    }

    static <T> InstanceCheckResult<T> closureViolation(Operation operation, List<T> arguments, String detail) {
        return new InstanceCheckResult<>(Status.CLOSURE_VIOLATION, null, Map.of(), operation, arguments, detail);
    }

    static <T> InstanceCheckResult<T> missingCertificate(RegisteredEquation axiom) {
        return new InstanceCheckResult<>(Status.MISSING_CERTIFICATE, axiom, Map.of(), null, List.of(),
                "公理 " + axiom.getName() + " 涉及无穷载体，需要证书");
    }

    static <T> InstanceCheckResult<T> undischarged(RegisteredEquation axiom, String detail) {
        return new InstanceCheckResult<>(Status.UNDISCHARGED_OBLIGATION, axiom, Map.of(), null, List.of(), detail);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    /**
     * @return 出问题的公理（接受或闭包问题时为空）。
     */
    public Optional<RegisteredEquation> getAxiom() {
        return Optional.ofNullable(axiom);
    }

    /**
     * @return 使公理不成立的变量赋值；由证书反驳时为空，反例写在 detail 中。
     */
    public Map<Variable, T> getWitness() {
        return witness;
    }

    public Optional<Operation> getOperation() {
        return Optional.ofNullable(operation);
    }

    public List<T> getArguments() {
        return arguments;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return status + ": " + detail;
    }
}
