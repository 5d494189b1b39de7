package org.csu.pltlf.compiler.parser;

import org.csu.pltlf.common.exception.ParseException;
import org.csu.pltlf.compiler.lexer.Token;
import org.csu.pltlf.compiler.lexer.TokenType;
import org.csu.pltlf.compiler.parser.ast.*;

import java.util.List;
import java.util.function.Supplier;

/**
 * @description: 命题逻辑语法分析器
 * 采用递归下降 (算符优先分层)，将Token流转换为抽象语法树(AST)。
 *
 * 层次从松到紧：等价 -> 蕴含 -> 析取 -> 合取 -> 否定 -> 原子。
 * 每一层都是左结合的循环，操作数交给更紧的一层。
 * 时序逻辑解析器通过覆盖 {@link #parseConjunct()}、{@link #parseUnary()} 和
 * {@link #parseAtom()} 在合取之上插入时序层。
 */
public class PropositionalParser {

    private final List<Token> tokens;
    private int position = 0;

    public PropositionalParser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with an EOF token");
        }
        this.tokens = tokens;
    }

    /**
     * 解析整个Token序列，返回唯一的根节点。
     *
     * @throws ParseException 输入为空、提前结束、括号不匹配或公式后还有多余Token
     */
    public FormulaNode parse() {
        position = 0;
        FormulaNode formula = parseFormula();
        if (!isAtEnd()) {
            throw new ParseException(peek(), "end of input");
        }
        return formula;
    }

    protected FormulaNode parseFormula() {
        return parseEquivalence();
    }

    private FormulaNode parseEquivalence() {
        return parseLeftAssociative(TokenType.EQUIVALENCE, Operator.EQUIVALENCE, this::parseImplication);
    }

    private FormulaNode parseImplication() {
        return parseLeftAssociative(TokenType.IMPLY, Operator.IMPLIES, this::parseOr);
    }

    private FormulaNode parseOr() {
        return parseLeftAssociative(TokenType.OR, Operator.OR, this::parseAnd);
    }

    private FormulaNode parseAnd() {
        return parseLeftAssociative(TokenType.AND, Operator.AND, this::parseConjunct);
    }

    /**
     * 合取的操作数。命题逻辑中直接是一元层。
     */
    protected FormulaNode parseConjunct() {
        return parseUnary();
    }

    /**
     * 一元层：前缀算子可以叠加，从右向左作用。
     */
    protected FormulaNode parseUnary() {
        if (match(TokenType.NOT)) {
            return new UnaryFormulaNode(Operator.NOT, parseUnary());
        }
        return parseAtom();
    }

    protected FormulaNode parseAtom() {
        if (match(TokenType.SYMBOL)) {
            return new SymbolNode(previous().lexeme());
        }
        if (match(TokenType.TRUE)) {
            return new TrueNode();
        }
        if (match(TokenType.FALSE)) {
            return new FalseNode();
        }
        if (match(TokenType.LPAREN)) {
            FormulaNode formula = parseFormula();
            consume(TokenType.RPAREN, "')' after formula");
            return formula;
        }
        throw new ParseException(peek(), expectedAtom());
    }

    /**
     * 原子位置出错时报告的期望内容。
     */
    protected String expectedAtom() {
        return "a formula (a symbol, 'true', 'false', '!' or '(')";
    }

    /**
     * 左结合的一层：a op b op c 折叠为 ((a op b) op c)。
     */
    protected FormulaNode parseLeftAssociative(TokenType tokenType, Operator operator, Supplier<FormulaNode> operand) {
        FormulaNode left = operand.get();
        while (match(tokenType)) {
            FormulaNode right = operand.get();
            left = new BinaryFormulaNode(operator, left, right);
        }
        return left;
    }

    protected boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    protected Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), message);
    }

    protected boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    protected Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    protected boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    protected Token peek() {
        return tokens.get(position);
    }

    protected Token previous() {
        return tokens.get(position - 1);
    }
}
