package org.eqlogic.instance;

import lombok.Getter;
import org.eqlogic.core.Operation;
import org.eqlogic.core.Sort;
import org.eqlogic.errors.IncompleteInstanceException;
import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Variable;
import org.eqlogic.signature.AxiomRegistry;
import org.eqlogic.signature.RegisteredEquation;
import org.eqlogic.signature.Signature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * 具体实例检查器：检查一个具体结构是否满足注册表中的全部公理。
 * <ul>
 *   <li>有限载体：穷举公理变量的全部赋值，计算两侧并比较，报告第一个反例；</li>
 *   <li>无穷载体：不做枚举，要求每条公理都有外部提供的证书。</li>
 * </ul>
 * 只检查公理；假设和引理都可以由公理推出，不需要单独检查。
 * 以引理为依据的证书会用同一个检查器递归地检查引理所在的基础理论。
 * @author Ayalyt
 */
public final class InstanceChecker {

    private static final Logger logger = LoggerFactory.getLogger(InstanceChecker.class);

    @Getter
    private final InstanceCheckerOptions options;

    public InstanceChecker() {
        this(InstanceCheckerOptions.defaults());
    }

    public InstanceChecker(InstanceCheckerOptions options) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }

    public <T> InstanceCheckResult<T> check(ConcreteInstance<T> instance, AxiomRegistry registry) {
        return check(instance, registry, List.of());
    }

    /**
     * 检查具体实例。
     * @param instance 具体实例。
     * @param registry 公理所在的注册表，其签名决定需要解释哪些排序和运算。
     * @param certificates 无穷载体上公理的证书，每条公理至多一个。
     * @return 接受，或第一个发现的问题。
     * @throws IncompleteInstanceException 如果实例缺少载体或运算实现，或实现的元数不符。
     * @throws IllegalStateException 如果某条公理需要枚举的赋值个数超过上限。
     */
    public <T> InstanceCheckResult<T> check(ConcreteInstance<T> instance, AxiomRegistry registry,
                                            Collection<? extends AxiomCertificate> certificates) {
        Objects.requireNonNull(instance, "Instance cannot be null");
        Objects.requireNonNull(registry, "Registry cannot be null");
        return check(new ObligationContext<>(instance, this, List.of(registry)), registry, certificates);
    }

    /**
     * 在给定上下文中检查实例；registry 必须是上下文中最内层的注册表。
     */
    <T> InstanceCheckResult<T> check(ObligationContext<T> context, AxiomRegistry registry,
                                     Collection<? extends AxiomCertificate> certificates) {
        Objects.requireNonNull(certificates, "Certificates cannot be null");
        ConcreteInstance<T> instance = context.getInstance();
        Signature signature = registry.getSignature();
        checkComplete(instance, signature);

        Map<String, AxiomCertificate> certificatesByName = new LinkedHashMap<>();
        for (AxiomCertificate certificate : certificates) {
            if (certificatesByName.put(certificate.getAxiomName(), certificate) != null) {
                throw new IllegalArgumentException("公理 " + certificate.getAxiomName() + " 有多个证书");
            }
        }

        for (Operation operation : signature.getOperations()) {
            Optional<InstanceCheckResult<T>> breach = checkClosure(instance, operation);
            if (breach.isPresent()) {
                logger.warn("实例 {} 不封闭: {}", instance.getName(), breach.get().getDetail());
                return breach.get();
            }
        }

        List<RegisteredEquation> axioms = registry.getAxioms();
        for (RegisteredEquation axiom : axioms) {
            InstanceCheckResult<T> result = checkAxiom(context, axiom, certificatesByName.get(axiom.getName()));
            if (!result.isAccepted()) {
                logger.warn("实例 {} 未通过公理 {}: {}", instance.getName(), axiom.getName(), result.getDetail());
                return result;
            }
        }
        logger.info("实例 {} 满足全部 {} 条公理", instance.getName(), axioms.size());
        return InstanceCheckResult.accepted("满足全部 " + axioms.size() + " 条公理");
    }

    private <T> void checkComplete(ConcreteInstance<T> instance, Signature signature) {
        for (Sort sort : signature.getSorts()) {
            if (instance.getCarrier(sort).isEmpty()) {
                logger.error("实例 {} 没有排序 {} 的载体", instance.getName(), sort);
                throw new IncompleteInstanceException("实例 " + instance.getName() + " 没有排序 " + sort + " 的载体");
            }
        }
        for (Operation operation : signature.getOperations()) {
            ConcreteInstance.Interpretation<T> interpretation = instance.getInterpretation(operation)
                    .orElseThrow(() -> {
                        logger.error("实例 {} 没有运算 {} 的实现", instance.getName(), operation);
                        return new IncompleteInstanceException("实例 " + instance.getName()
                                + " 没有运算 " + operation + " 的实现");
                    });
            if (interpretation.getArity() != operation.getArity()) {
                logger.error("实例 {} 中运算 {} 的实现接受 {} 个参数", instance.getName(), operation, interpretation.getArity());
                throw new IncompleteInstanceException("实例 " + instance.getName() + " 中运算 " + operation
                        + " 的实现接受 " + interpretation.getArity() + " 个参数，应为 " + operation.getArity());
            }
        }
    }

    private <T> Optional<InstanceCheckResult<T>> checkClosure(ConcreteInstance<T> instance, Operation operation) {
        Carrier<T> resultCarrier = carrierOf(instance, operation.getResultSort());
        if (!resultCarrier.isFinite()) {
            return Optional.empty();
        }
        List<List<T>> domains = new ArrayList<>();
        for (Sort sort : operation.getArgumentSorts()) {
            Carrier<T> carrier = carrierOf(instance, sort);
            if (!carrier.isFinite()) {
                logger.debug("运算 {} 的参数载体是无穷的，跳过闭包检查", operation);
                return Optional.empty();
            }
            domains.add(carrier.getElements());
        }
        checkBudget(domains, "运算 " + operation.getName() + " 的闭包检查");

        ConcreteInstance.Interpretation<T> interpretation = instance.getInterpretation(operation).orElseThrow();
        List<T> breach = firstFailure(domains, arguments -> resultCarrier.contains(interpretation.apply(arguments)));
        if (breach == null) {
            return Optional.empty();
        }
        return Optional.of(InstanceCheckResult.closureViolation(operation, breach,
                "运算 " + operation.getName() + breach + " = " + interpretation.apply(breach) + " 不在载体中"));
    }

    private <T> InstanceCheckResult<T> checkAxiom(ObligationContext<T> context, RegisteredEquation axiom,
                                                  AxiomCertificate certificate) {
        ConcreteInstance<T> instance = context.getInstance();
        Equation equation = axiom.getEquation();
        List<Variable> variables = new ArrayList<>(equation.getVariables());
        List<List<T>> domains = new ArrayList<>();
        boolean finite = true;
        for (Variable variable : variables) {
            Carrier<T> carrier = carrierOf(instance, variable.getSort());
            if (!carrier.isFinite()) {
                finite = false;
                break;
            }
            domains.add(carrier.getElements());
        }

        if (!finite) {
            return dischargeWithCertificate(axiom, certificate, context);
        }

        checkBudget(domains, "公理 " + axiom.getName());
        List<T> failing = firstFailure(domains, values -> {
            Map<Variable, T> assignment = assign(variables, values);
            return Objects.equals(instance.evaluate(equation.getLhs(), assignment),
                    instance.evaluate(equation.getRhs(), assignment));
        });
        if (failing == null) {
            logger.debug("公理 {} 在全部赋值下成立", axiom.getName());
            return InstanceCheckResult.accepted("公理 " + axiom.getName() + " 成立");
        }
        Map<Variable, T> witness = assign(variables, failing);
        return InstanceCheckResult.axiomViolation(axiom, witness, "公理 " + axiom.getName() + " 在 " + witness
                + " 下不成立: " + instance.evaluate(equation.getLhs(), witness) + " ≠ "
                + instance.evaluate(equation.getRhs(), witness));
    }

    private <T> InstanceCheckResult<T> dischargeWithCertificate(RegisteredEquation axiom, AxiomCertificate certificate,
                                                                ObligationContext<T> context) {
        if (certificate == null) {
            return InstanceCheckResult.missingCertificate(axiom);
        }
        ObligationResult obligation = certificate.discharge(axiom, context);
        logger.debug("公理 {} 的证书结论: {}", axiom.getName(), obligation);
        switch (obligation.getOutcome()) {
            case DISCHARGED:
                return InstanceCheckResult.accepted(obligation.getDetail());
            case REFUTED:
                return InstanceCheckResult.axiomViolation(axiom, Map.of(),
                        "公理 " + axiom.getName() + " 被证书反驳: " + obligation.getDetail());
            default:
                return InstanceCheckResult.undischarged(axiom,
                        "公理 " + axiom.getName() + " 的证明义务未卸载: " + obligation.getDetail());
        }
    }

    private static <T> Carrier<T> carrierOf(ConcreteInstance<T> instance, Sort sort) {
        return instance.getCarrier(sort).orElseThrow(() ->
                new IncompleteInstanceException("实例 " + instance.getName() + " 没有排序 " + sort + " 的载体"));
    }

    private static <T> Map<Variable, T> assign(List<Variable> variables, List<T> values) {
        Map<Variable, T> assignment = new LinkedHashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            assignment.put(variables.get(i), values.get(i));
        }
        return assignment;
    }

    private void checkBudget(List<? extends List<?>> domains, String what) {
        long total = 1;
        for (List<?> domain : domains) {
            if (total > options.getMaxAssignments() / domain.size()) {
                logger.error("{} 需要枚举的赋值超过上限 {}", what, options.getMaxAssignments());
                throw new IllegalStateException(what + " 需要枚举的赋值超过上限 " + options.getMaxAssignments());
            }
            total *= domain.size();
        }
    }

    /**
     * 按字典序（最后一个分量变化最快）枚举笛卡尔积，返回第一个使 test 为 false 的元组。
     * @return 失败的元组；全部通过时返回 null。
     */
    private static <T> List<T> firstFailure(List<List<T>> domains, Function<List<T>, Boolean> test) {
        int[] indices = new int[domains.size()];
        while (true) {
            List<T> tuple = new ArrayList<>(domains.size());
            for (int i = 0; i < domains.size(); i++) {
                tuple.add(domains.get(i).get(indices[i]));
            }
            if (!test.apply(tuple)) {
                return tuple;
            }
            int position = domains.size() - 1;
            while (position >= 0) {
                indices[position]++;
                if (indices[position] < domains.get(position).size()) {
                    break;
                }
                indices[position] = 0;
                position--;
            }
            if (position < 0) {
                return null;
            }
        }
    }
}
