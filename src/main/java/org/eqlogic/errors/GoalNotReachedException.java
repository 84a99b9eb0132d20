package org.eqlogic.errors;

/**
 * 推导链的首尾两项与目标等式的两侧不一致。
 */
public class GoalNotReachedException extends EquationalException {

    public GoalNotReachedException(String message) {
        super(ErrorKind.GOAL_NOT_REACHED, message);
    }
}
