package org.eqlogic.instance;

import lombok.Getter;
import org.eqlogic.signature.AxiomRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 证书卸载证明义务时可用的上下文：正在检查的实例，以及当前仍在检查中的注册表。
 * 以引理为依据的证书通过 {@link #checkBase} 先让同一个实例通过引理所在理论的检查。
 * 此类是不可变的，每进入一层基础理论就得到一个新的上下文。
 * @param <T> 载体元素的 Java 类型。
 * @author Ayalyt
 */
public final class ObligationContext<T> {

    @Getter
    private final ConcreteInstance<T> instance;
    private final InstanceChecker checker;
    // 从最外层开始，正在检查中的注册表
    private final List<AxiomRegistry> activeRegistries;

    ObligationContext(ConcreteInstance<T> instance, InstanceChecker checker, List<AxiomRegistry> activeRegistries) {
        this.instance = Objects.requireNonNull(instance, "Instance cannot be null");
        this.checker = Objects.requireNonNull(checker, "Checker cannot be null");
        this.activeRegistries = Collections.unmodifiableList(new ArrayList<>(activeRegistries));
    }

    /**
     * @return 注册表是否正在检查中；以它为依据卸载义务是循环论证。
     */
    public boolean isUnderCheck(AxiomRegistry registry) {
        return activeRegistries.stream().anyMatch(active -> active == registry);
    }

    public List<AxiomRegistry> getActiveRegistries() {
        return activeRegistries;
    }

    /**
     * 用同一个检查器检查实例是否满足基础理论的全部公理。
     * @param base 基础理论的注册表，不能正在检查中。
     * @param certificates 基础理论在无穷载体上的证书。
     * @return 检查结果。
     * @throws IllegalStateException 如果 base 正在检查中。
     */
    public InstanceCheckResult<T> checkBase(AxiomRegistry base, Collection<? extends AxiomCertificate> certificates) {
        if (isUnderCheck(base)) {
            throw new IllegalStateException("注册表 " + base + " 正在检查中，不能再作为基础理论");
        }
        List<AxiomRegistry> nested = new ArrayList<>(activeRegistries);
        nested.add(base);
        return checker.check(new ObligationContext<>(instance, checker, nested), base, certificates);
    }
}
