package org.eqlogic.instance;

import org.eqlogic.signature.RegisteredEquation;

/**
 * 无穷载体上一条公理的外部证明义务。
 * 检查器不会在无穷载体上枚举，而是把公理交给对应名称的证书。
 */
public interface AxiomCertificate {

    /**
     * @return 此证书负责的公理名称。
     */
    String getAxiomName();

    /**
     * 尝试卸载公理在给定实例中的证明义务。
     * @param axiom 注册表中的公理。
     * @param context 正在检查的实例及检查状态。
     * @return 结论。
     */
    <T> ObligationResult discharge(RegisteredEquation axiom, ObligationContext<T> context);
}
