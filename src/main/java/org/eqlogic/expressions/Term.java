package org.eqlogic.expressions;

import org.eqlogic.core.Sort;

import java.util.List;
import java.util.Set;

/**
 * 代表代数中的一个符号表达式：变量或运算应用。
 * 项是有限的不可变树，可以安全地按引用共享。
 * 相等性是结构相等。
 * @author Ayalyt
 */
public interface Term {

    Sort getSort();

    /**
     * @return 项中出现的全部变量，按从左到右第一次出现的顺序。
     */
    Set<Variable> getVariables();

    /**
     * @return 项中的节点个数。
     */
    int size();

    boolean isVariable();

    /**
     * 获取指定位置的子项。
     * @param position 从根出发的参数下标路径。
     * @return 该位置的子项。
     * @throws org.eqlogic.errors.PositionOutOfBoundsException 如果位置不指向合法子项。
     */
    Term subtermAt(Position position);

    /**
     * 将指定位置的子项替换为新项，返回新的项；原项不变。
     * @throws org.eqlogic.errors.PositionOutOfBoundsException 如果位置不指向合法子项。
     */
    Term replaceAt(Position position, Term replacement);

    /**
     * @return 项中所有合法位置，先序遍历顺序（根在最前）。
     */
    List<Position> positions();

    default Term substitute(Substitution substitution) {
        return substitution.apply(this);
    }

    default boolean isGround() {
        return getVariables().isEmpty();
    }
}
