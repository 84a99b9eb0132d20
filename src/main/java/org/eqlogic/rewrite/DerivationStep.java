package org.eqlogic.rewrite;

import lombok.Getter;
import org.eqlogic.expressions.Position;
import org.eqlogic.expressions.Substitution;

import java.util.Objects;

/**
 * 推导中的一步：使用哪条公理或引理、按哪个方向、在哪个位置、变量如何实例化。
 * 代换可以只给出一部分绑定，其余由匹配补全；
 * 替换侧中匹配无法确定的变量必须在这里给出，否则原样保留。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class DerivationStep {

    private final String equationName;
    private final Direction direction;
    private final Position position;
    private final Substitution substitution;

    private final int hashCode;

    private DerivationStep(String equationName, Direction direction, Position position, Substitution substitution) {
        this.equationName = Objects.requireNonNull(equationName, "Equation name cannot be null");
        this.direction = Objects.requireNonNull(direction, "Direction cannot be null");
        this.position = Objects.requireNonNull(position, "Position cannot be null");
        this.substitution = Objects.requireNonNull(substitution, "Substitution cannot be null");
        this.hashCode = Objects.hash(equationName, direction, position, substitution);
    }

    public static DerivationStep of(String equationName, Direction direction, Position position, Substitution substitution) {
        return new DerivationStep(equationName, direction, position, substitution);
    }

    /**
     * 从左到右使用等式。
     */
    public static DerivationStep forward(String equationName, Position position, Substitution substitution) {
        return new DerivationStep(equationName, Direction.LEFT_TO_RIGHT, position, substitution);
    }

    public static DerivationStep forward(String equationName, Position position) {
        return forward(equationName, position, Substitution.EMPTY);
    }

    /**
     * 从右到左使用等式。
     */
    public static DerivationStep backward(String equationName, Position position, Substitution substitution) {
        return new DerivationStep(equationName, Direction.RIGHT_TO_LEFT, position, substitution);
    }

    public static DerivationStep backward(String equationName, Position position) {
        return backward(equationName, position, Substitution.EMPTY);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DerivationStep that = (DerivationStep) o;
        return equationName.equals(that.equationName)
                && direction == that.direction
                && position.equals(that.position)
                && substitution.equals(that.substitution);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return equationName + direction.getSymbol() + " @" + position + (substitution.isEmpty() ? "" : " " + substitution);
    }
}
