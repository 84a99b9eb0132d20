package org.eqlogic.errors;

import lombok.Getter;

import java.util.Objects;

/**
 * 引擎所有错误的基类。
 * 错误只影响单次 declare/verify/check 调用，不会破坏注册表的状态。
 * @author Ayalyt
 */
@Getter
public abstract class EquationalException extends RuntimeException {

    private final ErrorKind kind;

    protected EquationalException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "ErrorKind cannot be null");
    }

    protected EquationalException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "ErrorKind cannot be null");
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
