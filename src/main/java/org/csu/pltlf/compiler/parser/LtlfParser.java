package org.csu.pltlf.compiler.parser;

import org.csu.pltlf.common.exception.ParseException;
import org.csu.pltlf.compiler.lexer.Token;
import org.csu.pltlf.compiler.lexer.TokenType;
import org.csu.pltlf.compiler.parser.ast.*;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * @description: LTLf/PLTLf 语法分析器
 *
 * 在命题逻辑的合取层之上依次插入 Until -> Release -> Trigger -> Since 四个左结合的二元层，
 * 并在一元层加入所有时序前缀算子，在原子层加入 last/init。
 */
public class LtlfParser extends PropositionalParser {

    private static final Map<TokenType, Operator> PREFIX_OPERATORS = new EnumMap<>(TokenType.class);

    static {
        PREFIX_OPERATORS.put(TokenType.ALWAYS, Operator.ALWAYS);
        PREFIX_OPERATORS.put(TokenType.EVENTUALLY, Operator.EVENTUALLY);
        PREFIX_OPERATORS.put(TokenType.NEXT, Operator.NEXT);
        PREFIX_OPERATORS.put(TokenType.WEAK_NEXT, Operator.WEAK_NEXT);
        PREFIX_OPERATORS.put(TokenType.ONCE, Operator.ONCE);
        PREFIX_OPERATORS.put(TokenType.BEFORE, Operator.BEFORE);
        PREFIX_OPERATORS.put(TokenType.WBEFORE, Operator.WEAK_BEFORE);
        PREFIX_OPERATORS.put(TokenType.HISTORICALLY, Operator.HISTORICALLY);
    }

    private final ParserOptions options;

    public LtlfParser(List<Token> tokens) {
        this(tokens, ParserOptions.defaults());
    }

    public LtlfParser(List<Token> tokens, ParserOptions options) {
        super(tokens);
        this.options = options == null ? ParserOptions.defaults() : options;
    }

    @Override
    protected FormulaNode parseConjunct() {
        return parseUntil();
    }

    private FormulaNode parseUntil() {
        return parseLeftAssociative(TokenType.UNTIL, Operator.UNTIL, this::parseRelease);
    }

    private FormulaNode parseRelease() {
        return parseLeftAssociative(TokenType.RELEASE, Operator.RELEASE, this::parseTrigger);
    }

    private FormulaNode parseTrigger() {
        return parseLeftAssociative(TokenType.TRIGGER, Operator.TRIGGER, this::parseSince);
    }

    private FormulaNode parseSince() {
        return parseLeftAssociative(TokenType.SINCE, Operator.SINCE, this::parseUnary);
    }

    @Override
    protected FormulaNode parseUnary() {
        Token token = peek();
        Operator operator = PREFIX_OPERATORS.get(token.type());
        if (operator == null) {
            return super.parseUnary();
        }
        if (operator == Operator.HISTORICALLY && !options.isHistoricallyEnabled()) {
            throw new ParseException(token, expectedAtom() + "; 'H' is disabled");
        }
        advance();
        return new UnaryFormulaNode(operator, parseUnary());
    }

    @Override
    protected FormulaNode parseAtom() {
        if (match(TokenType.LAST)) {
            return new LastNode();
        }
        if (match(TokenType.INIT)) {
            return new InitNode();
        }
        return super.parseAtom();
    }

    @Override
    protected String expectedAtom() {
        return "a formula (a symbol, 'true', 'false', 'last', 'init', a unary operator or '(')";
    }
}
