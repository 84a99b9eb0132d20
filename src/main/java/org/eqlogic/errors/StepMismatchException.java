package org.eqlogic.errors;

import lombok.Getter;

/**
 * 重放推导链时，第一个计算结果与记录项不一致的步骤。
 * 步骤下标从 0 开始，第 i 步负责 t_i 到 t_{i+1} 的转换。
 */
@Getter
public class StepMismatchException extends EquationalException {

    private final int stepIndex;

    public StepMismatchException(int stepIndex, String message) {
        super(ErrorKind.STEP_MISMATCH, message);
        this.stepIndex = stepIndex;
    }
}
