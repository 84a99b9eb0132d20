package org.eqlogic.signature;

import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Term;

public enum Side {
    LEFT,
    RIGHT;

    public Term of(Equation equation) {
        return this == LEFT ? equation.getLhs() : equation.getRhs();
    }

    public Side opposite() {
        return this == LEFT ? RIGHT : LEFT;
    }
}
