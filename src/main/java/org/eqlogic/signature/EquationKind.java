package org.eqlogic.signature;

/**
 * 注册表中等式的来源。
 */
public enum EquationKind {
    /** 基本假设，不可证明。 */
    AXIOM,
    /** 只在扩展作用域内成立的局部假设，用来证明条件命题。 */
    HYPOTHESIS,
    /** 由推导链从先前条目证明的等式。 */
    LEMMA
}
