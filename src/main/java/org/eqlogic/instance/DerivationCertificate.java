package org.eqlogic.instance;

import lombok.Getter;
import org.eqlogic.errors.IncompleteInstanceException;
import org.eqlogic.signature.AxiomRegistry;
import org.eqlogic.signature.EquationKind;
import org.eqlogic.signature.Lemma;
import org.eqlogic.signature.RegisteredEquation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 以推导链为依据的证书：公理在另一个理论（基础理论）中已被证明为引理。
 * <p>
 * 引理只在基础理论的模型中成立，因此卸载义务前要先检查同一个实例满足基础理论的全部公理，
 * 基础理论在无穷载体上的公理由它自己的证书负责。以下情况不能卸载：
 * <ul>
 *   <li>引理没有登记在基础理论中，或等式与公理不同（方向可以相反）；</li>
 *   <li>基础理论正在检查中（循环论证）；</li>
 *   <li>基础理论含有假设，引理可能依赖于实例不满足的假设；</li>
 *   <li>实例不是基础理论的模型。</li>
 * </ul>
 * @author Ayalyt
 */
@Getter
public final class DerivationCertificate implements AxiomCertificate {

    private static final Logger logger = LoggerFactory.getLogger(DerivationCertificate.class);

    private final String axiomName;
    private final Lemma lemma;
    private final AxiomRegistry baseRegistry;
    private final List<AxiomCertificate> baseCertificates;

    public DerivationCertificate(String axiomName, Lemma lemma, AxiomRegistry baseRegistry) {
        this(axiomName, lemma, baseRegistry, List.of());
    }

    /**
     * @param axiomName 负责的公理名称。
     * @param lemma 基础理论中证明的引理。
     * @param baseRegistry 引理所在的注册表。
     * @param baseCertificates 基础理论在无穷载体上的公理所需的证书。
     */
    public DerivationCertificate(String axiomName, Lemma lemma, AxiomRegistry baseRegistry,
                                 Collection<? extends AxiomCertificate> baseCertificates) {
        this.axiomName = Objects.requireNonNull(axiomName, "Axiom name cannot be null");
        this.lemma = Objects.requireNonNull(lemma, "Lemma cannot be null");
        this.baseRegistry = Objects.requireNonNull(baseRegistry, "Base registry cannot be null");
        this.baseCertificates = List.copyOf(Objects.requireNonNull(baseCertificates, "Base certificates cannot be null"));
    }

    @Override
    public <T> ObligationResult discharge(RegisteredEquation axiom, ObligationContext<T> context) {
        Optional<RegisteredEquation> registered = baseRegistry.lookup(lemma.getName());
        if (!lemma.isProven() || registered.isEmpty() || registered.get().getKind() != EquationKind.LEMMA
                || !registered.get().getEquation().equals(lemma.getEquation())) {
            return ObligationResult.inconclusive("引理 " + lemma.getName() + " 没有在基础理论 " + baseRegistry + " 中证明");
        }
        if (!lemma.getEquation().equalsUpToOrientation(axiom.getEquation())) {
            return ObligationResult.inconclusive("引理 " + lemma.getName() + " 证明的是 " + lemma.getEquation()
                    + "，不是公理 " + axiom.getEquation());
        }
        if (context.isUnderCheck(baseRegistry)) {
            logger.warn("公理 {} 的证书引用了正在检查中的注册表 {}", axiom.getName(), baseRegistry);
            return ObligationResult.inconclusive("基础理论 " + baseRegistry + " 正在检查中，不能用它的引理卸载公理 "
                    + axiom.getName());
        }
        if (!baseRegistry.getEntries(EquationKind.HYPOTHESIS).isEmpty()) {
            return ObligationResult.inconclusive("基础理论 " + baseRegistry + " 含有假设，引理 " + lemma.getName()
                    + " 不能用于卸载公理");
        }

        InstanceCheckResult<T> base;
        try {
            base = context.checkBase(baseRegistry, baseCertificates);
        } catch (IncompleteInstanceException e) {
            logger.warn("实例 {} 没有实现基础理论 {}: {}", context.getInstance().getName(), baseRegistry, e.getMessage());
            return ObligationResult.inconclusive("实例没有实现基础理论 " + baseRegistry + ": " + e.getMessage());
        }
        if (!base.isAccepted()) {
            return ObligationResult.inconclusive("实例不是基础理论 " + baseRegistry + " 的模型: " + base);
        }
        return ObligationResult.discharged("实例满足基础理论 " + baseRegistry + "，由引理 " + lemma.getName()
                + " 的 " + lemma.getLength() + " 步推导证明");
    }
}
