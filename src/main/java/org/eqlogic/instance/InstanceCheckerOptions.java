package org.eqlogic.instance;

import lombok.Getter;

/**
 * 实例检查的参数。
 */
@Getter
public final class InstanceCheckerOptions {

    public static final long DEFAULT_MAX_ASSIGNMENTS = 1_000_000L;

    // 单条公理允许枚举的赋值个数上限
    private final long maxAssignments;

    private InstanceCheckerOptions(long maxAssignments) {
        if (maxAssignments <= 0) {
            throw new IllegalArgumentException("maxAssignments 必须为正数: " + maxAssignments);
        }
        this.maxAssignments = maxAssignments;
    }

    public static InstanceCheckerOptions defaults() {
        return new InstanceCheckerOptions(DEFAULT_MAX_ASSIGNMENTS);
    }

    public InstanceCheckerOptions withMaxAssignments(long maxAssignments) {
        return new InstanceCheckerOptions(maxAssignments);
    }
}
