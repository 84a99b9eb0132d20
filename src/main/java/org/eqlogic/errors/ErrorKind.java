package org.eqlogic.errors;

/**
 * 推导引擎中所有可报告错误的分类。
 * 每个 {@link EquationalException} 子类对应其中一种。
 */
public enum ErrorKind {

    DUPLICATE_OPERATION("重复声明的运算"),
    ILL_TYPED_EQUATION("等式在当前签名下不是良构的"),
    SORT_MISMATCH("排序不一致"),
    POSITION_OUT_OF_BOUNDS("位置没有指向合法的子项"),
    UNIFICATION_FAILED("子项与模式不匹配"),
    STEP_MISMATCH("推导步骤的结果与记录不符"),
    GOAL_NOT_REACHED("推导链没有到达目标等式"),
    UNKNOWN_EQUATION("引用了注册表中不存在的公理或引理"),
    UNKNOWN_SYMBOL("引用了签名中不存在的符号"),
    DUPLICATE_EQUATION("等式名称已被占用"),
    TERM_SYNTAX("项的文本语法错误"),
    INCOMPLETE_INSTANCE("具体实例没有解释全部运算或排序");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
