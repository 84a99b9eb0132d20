package org.eqlogic.errors;

import lombok.Getter;

@Getter
public class TermSyntaxException extends EquationalException {

    // 出错字符在输入中的偏移
    private final int offset;

    public TermSyntaxException(int offset, String message) {
        super(ErrorKind.TERM_SYNTAX, message + " (offset " + offset + ")");
        this.offset = offset;
    }
}
