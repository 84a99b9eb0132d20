package org.eqlogic.signature;

import org.eqlogic.expressions.Equation;

/**
 * 扩展作用域内的局部假设。
 * 例如证明单位元唯一时，引入新常量 e' 并假设 mul(e', a) = a。
 */
public final class Hypothesis extends RegisteredEquation {

    Hypothesis(String name, Equation equation, long sequence) {
        super(name, equation, sequence);
    }

    @Override
    public EquationKind getKind() {
        return EquationKind.HYPOTHESIS;
    }
}
