package org.eqlogic.rewrite;

import org.eqlogic.signature.Side;

/**
 * 等式的使用方向。等式是对称的，推导步骤必须说明按哪个方向使用。
 */
public enum Direction {

    LEFT_TO_RIGHT("→"),
    RIGHT_TO_LEFT("←");

    private final String symbol;

    Direction(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @return 被匹配的一侧：从左到右时匹配左侧。
     */
    public Side patternSide() {
        return this == LEFT_TO_RIGHT ? Side.LEFT : Side.RIGHT;
    }

    /**
     * @return 替换进去的一侧。
     */
    public Side replacementSide() {
        return patternSide().opposite();
    }

    public Direction reverse() {
        return this == LEFT_TO_RIGHT ? RIGHT_TO_LEFT : LEFT_TO_RIGHT;
    }
}
