package org.csu.pltlf.compiler.lexer;

import org.csu.pltlf.common.exception.LexException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @description: 命题逻辑词法分析器
 *
 * 负责共享的命题逻辑 Token：否定、合取、析取、蕴含、等价、括号、true/false 以及命题符号。
 * 时序逻辑的词法分析器通过继承本类并覆盖 {@link #readUppercaseOperator(int)}、
 * {@link #caseInsensitiveKeyword(String)} 和 {@link #lowercaseKeyword(String)} 扩展 Token 集合。
 */
public class PropositionalLexer {

    protected final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    // 只接受这几种写法的常量
    private static final Map<String, TokenType> constants;

    static {
        constants = new HashMap<>();
        constants.put("true", TokenType.TRUE);
        constants.put("True", TokenType.TRUE);
        constants.put("TRUE", TokenType.TRUE);
        constants.put("false", TokenType.FALSE);
        constants.put("False", TokenType.FALSE);
        constants.put("FALSE", TokenType.FALSE);
    }

    public PropositionalLexer(String input) {
        this.input = input;
    }

    /**
     * 执行词法分析并返回所有Token，最后一个总是 EOF。
     * 每次调用都从头开始，可以重复调用。
     *
     * @return Token列表
     * @throws LexException 遇到无法识别的字符序列
     */
    public List<Token> tokenize() {
        position = 0;
        line = 1;
        column = 1;
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token nextToken() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", position, line, column);
        }

        char currentChar = peek();

        if (isLetter(currentChar)) {
            return readWord();
        }

        switch (currentChar) {
            case '(':
                return consumeAndReturn(TokenType.LPAREN, 1);
            case ')':
                return consumeAndReturn(TokenType.RPAREN, 1);
            case '!':
            case '~':
                return consumeAndReturn(TokenType.NOT, 1);
            case '&':
                return consumeAndReturn(TokenType.AND, peekNext() == '&' ? 2 : 1);
            case '|':
                return consumeAndReturn(TokenType.OR, peekNext() == '|' ? 2 : 1);
            case '-':
                if (peekNext() == '>') {
                    return consumeAndReturn(TokenType.IMPLY, 2);
                }
                throw illegal(1);
            case '>':
                if (peekNext() == '>') {
                    return consumeAndReturn(TokenType.IMPLY, 2);
                }
                throw illegal(1);
            case '<':
                if (input.startsWith("<->", position)) {
                    return consumeAndReturn(TokenType.EQUIVALENCE, 3);
                }
                throw illegal(Math.min(3, input.length() - position));
            default:
                throw illegal(1);
        }
    }

    /**
     * 读取以字母开头的单词。先按整个单词匹配关键字，
     * 否则小写开头取最长的 [a-z][a-z0-9_]* 前缀作为符号，大写开头交给算子识别。
     */
    private Token readWord() {
        int start = position;
        int wordEnd = start;
        while (wordEnd < input.length() && isWordChar(input.charAt(wordEnd))) {
            wordEnd++;
        }
        String word = input.substring(start, wordEnd);

        TokenType keyword = caseInsensitiveKeyword(word.toLowerCase());
        if (keyword == null) {
            keyword = constants.get(word);
        }
        if (keyword != null) {
            return consumeAndReturn(keyword, word.length());
        }

        if (isLowercase(word.charAt(0))) {
            int symbolEnd = start + 1;
            while (symbolEnd < wordEnd && isSymbolChar(input.charAt(symbolEnd))) {
                symbolEnd++;
            }
            String symbol = input.substring(start, symbolEnd);
            TokenType type = lowercaseKeyword(symbol);
            return consumeAndReturn(type == null ? TokenType.SYMBOL : type, symbol.length());
        }

        Token operator = readUppercaseOperator(start);
        if (operator == null) {
            throw illegal(word.length());
        }
        return operator;
    }

    /**
     * 不区分大小写的关键字，参数已转为小写。命题逻辑中没有这类关键字。
     */
    protected TokenType caseInsensitiveKeyword(String lowercaseWord) {
        return null;
    }

    /**
     * 小写符号前缀恰好是关键字时返回对应类型。
     */
    protected TokenType lowercaseKeyword(String symbol) {
        return constants.get(symbol);
    }

    /**
     * 识别从 start 开始的大写算子；无法识别时返回 null。
     */
    protected Token readUppercaseOperator(int start) {
        return null;
    }

    /**
     * 边界规则：位于 end 的字符不能是小写字母 (或已到达输入末尾)。
     */
    protected boolean atBoundary(int end) {
        return end >= input.length() || !isLowercase(input.charAt(end));
    }

    protected Token consumeAndReturn(TokenType type, int length) {
        Token token = new Token(type, input.substring(position, position + length), position, line, column);
        position += length;
        column += length;
        return token;
    }

    private LexException illegal(int length) {
        return new LexException(position, line, column, input.substring(position, position + length));
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r') {
                position++;
                column++;
            } else if (ch == '\n') {
                position++;
                line++;
                column = 1;
            } else {
                break;
            }
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private static boolean isLowercase(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isLetter(char c) {
        return isLowercase(c) || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isSymbolChar(char c) {
        return isLowercase(c) || isDigit(c) || c == '_';
    }

    private static boolean isWordChar(char c) {
        return isLetter(c) || isDigit(c) || c == '_';
    }
}
