package org.csu.pltlf.compiler.lexer;

import java.util.HashMap;
import java.util.Map;

/**
 * @description: LTLf/PLTLf 词法分析器
 *
 * 在命题逻辑 Token 的基础上增加时序算子 (单个或两个大写字母) 和 last/init 关键字。
 * 符号只能以小写字母开头，所以大写算子不会和符号混淆；
 * 边界规则保证算子后面紧跟小写字母时不会被识别为算子。
 */
public class LtlfLexer extends PropositionalLexer {

    private static final Map<Character, TokenType> operators;
    private static final Map<String, TokenType> weakOperators;
    private static final Map<String, TokenType> keywords;

    static {
        operators = new HashMap<>();
        operators.put('U', TokenType.UNTIL);
        operators.put('R', TokenType.RELEASE);
        operators.put('G', TokenType.ALWAYS);
        operators.put('F', TokenType.EVENTUALLY);
        operators.put('X', TokenType.NEXT);
        operators.put('S', TokenType.SINCE);
        operators.put('T', TokenType.TRIGGER);
        operators.put('H', TokenType.HISTORICALLY);
        operators.put('O', TokenType.ONCE);
        operators.put('Y', TokenType.BEFORE);

        weakOperators = new HashMap<>();
        weakOperators.put("WX", TokenType.WEAK_NEXT);
        weakOperators.put("WY", TokenType.WBEFORE);

        keywords = new HashMap<>();
        keywords.put("last", TokenType.LAST);
        keywords.put("init", TokenType.INIT);
    }

    public LtlfLexer(String input) {
        super(input);
    }

    @Override
    protected TokenType caseInsensitiveKeyword(String lowercaseWord) {
        return keywords.get(lowercaseWord);
    }

    @Override
    protected TokenType lowercaseKeyword(String symbol) {
        TokenType keyword = keywords.get(symbol);
        return keyword != null ? keyword : super.lowercaseKeyword(symbol);
    }

    @Override
    protected Token readUppercaseOperator(int start) {
        // WX / WY 必须先于单字母算子尝试
        if (start + 2 <= input.length()) {
            TokenType weak = weakOperators.get(input.substring(start, start + 2));
            if (weak != null && atBoundary(start + 2)) {
                return consumeAndReturn(weak, 2);
            }
        }
        TokenType type = operators.get(input.charAt(start));
        if (type != null && atBoundary(start + 1)) {
            return consumeAndReturn(type, 1);
        }
        return null;
    }
}
