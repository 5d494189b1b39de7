package org.csu.pltlf.common.exception;

import lombok.Getter;
import org.csu.pltlf.compiler.lexer.Token;
import org.csu.pltlf.compiler.lexer.TokenType;

/**
 * 语法分析阶段的异常：Token 序列不符合文法。
 */
@Getter
public class ParseException extends RuntimeException {

    private final String expected;
    private final Token found;

    public ParseException(String message) {
        super(message);
        this.expected = null;
        this.found = null;
    }

    public ParseException(Token token, String expected) {
        super(String.format("Syntax Error at line %d, column %d: Expected %s, but found %s",
                token.line(),
                token.column(),
                expected,
                describe(token)));
        this.expected = expected;
        this.found = token;
    }

    /**
     * @return 出错 Token 的偏移，没有 Token 时为 -1
     */
    public int getOffset() {
        return found == null ? -1 : found.offset();
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.EOF) {
            return "end of input";
        }
        return String.format("'%s' (%s)", token.lexeme(), token.type());
    }
}
