package org.csu.pltlf.common.exception;

import lombok.Getter;

/**
 * 词法分析阶段的异常：输入中存在无法匹配任何 Token 的字符序列。
 */
@Getter
public class LexException extends RuntimeException {

    private final int offset;
    private final int line;
    private final int column;
    private final String fragment;

    public LexException(int offset, int line, int column, String fragment) {
        super(String.format("Lexical Error at line %d, column %d (offset %d): Unrecognized input '%s'",
                line, column, offset, fragment));
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.fragment = fragment;
    }
}
