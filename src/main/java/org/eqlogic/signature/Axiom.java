package org.eqlogic.signature;

import org.eqlogic.expressions.Equation;

public final class Axiom extends RegisteredEquation {

    Axiom(String name, Equation equation, long sequence) {
        super(name, equation, sequence);
    }

    @Override
    public EquationKind getKind() {
        return EquationKind.AXIOM;
    }
}
