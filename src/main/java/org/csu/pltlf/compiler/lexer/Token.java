package org.csu.pltlf.compiler.lexer;

/**
 * @param type   词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param offset 在输入串中的起始偏移 (从0开始)
 * @param line   所在的行号
 * @param column 所在的列号
 */
public record Token(TokenType type, String lexeme, int offset, int line, int column) {

    @Override
    public String toString() {
        return String.format("Token[Type=%-13s, Lexeme='%s', Position=%d:%d]",
                type, lexeme, line, column);
    }
}
