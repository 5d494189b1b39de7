package org.csu.pltlf.compiler;

import org.csu.pltlf.common.exception.LexException;
import org.csu.pltlf.compiler.lexer.LtlfLexer;
import org.csu.pltlf.compiler.lexer.PropositionalLexer;
import org.csu.pltlf.compiler.lexer.Token;
import org.csu.pltlf.compiler.lexer.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 词法分析器的单元测试
 */
public class LexerTest {

    private List<Token> tokenize(String formula) {
        List<Token> tokens = new LtlfLexer(formula).tokenize();
        System.out.println("Input: " + formula + " -> " + tokens);
        return tokens;
    }

    private void assertTypes(List<Token> tokens, TokenType... expectedTypes) {
        assertEquals(expectedTypes.length, tokens.size(), "Token数量不匹配: " + tokens);
        for (int i = 0; i < expectedTypes.length; i++) {
            assertEquals(expectedTypes[i], tokens.get(i).type(), "Token类型不匹配 at index " + i);
        }
    }

    @Test
    void testValidSymbolsAreSingleSymbolTokens() {
        System.out.println("--- Running test: testValidSymbolsAreSingleSymbolTokens ---");
        for (String s : List.of("a", "p", "until", "until1", "req_1", "x9", "b_", "last_seen", "initial", "trueish", "g")) {
            List<Token> tokens = tokenize(s);
            assertTypes(tokens, TokenType.SYMBOL, TokenType.EOF);
            assertEquals(s, tokens.get(0).lexeme());
        }
    }

    @Test
    void testUntilBoundaryRule() {
        assertTypes(tokenize("U"), TokenType.UNTIL, TokenType.EOF);
        assertTypes(tokenize("a U(b)"),
                TokenType.SYMBOL, TokenType.UNTIL, TokenType.LPAREN, TokenType.SYMBOL, TokenType.RPAREN, TokenType.EOF);
        assertTypes(tokenize("aU b"), TokenType.SYMBOL, TokenType.UNTIL, TokenType.SYMBOL, TokenType.EOF);

        List<Token> until = tokenize("until");
        assertTypes(until, TokenType.SYMBOL, TokenType.EOF);
        assertEquals("until", until.get(0).lexeme());
    }

    @Test
    void testOperatorFollowedByLowercaseIsRejected() {
        LexException e = assertThrows(LexException.class, () -> tokenize("Ux"));
        assertEquals(0, e.getOffset());
        assertEquals("Ux", e.getFragment());

        LexException glued = assertThrows(LexException.class, () -> tokenize("aUb"));
        assertEquals(1, glued.getOffset());
        assertEquals("Ub", glued.getFragment());

        assertThrows(LexException.class, () -> tokenize("WXa"));
        assertThrows(LexException.class, () -> tokenize("Ga"));
    }

    @Test
    void testAllTemporalOperators() {
        assertTypes(tokenize("U R G F X WX S T H O Y WY"),
                TokenType.UNTIL, TokenType.RELEASE, TokenType.ALWAYS, TokenType.EVENTUALLY,
                TokenType.NEXT, TokenType.WEAK_NEXT, TokenType.SINCE, TokenType.TRIGGER,
                TokenType.HISTORICALLY, TokenType.ONCE, TokenType.BEFORE, TokenType.WBEFORE,
                TokenType.EOF);
    }

    @Test
    void testAdjacentOperatorsSplitAtUppercaseBoundary() {
        assertTypes(tokenize("GF a"), TokenType.ALWAYS, TokenType.EVENTUALLY, TokenType.SYMBOL, TokenType.EOF);
        assertTypes(tokenize("WXWY(a)"),
                TokenType.WEAK_NEXT, TokenType.WBEFORE, TokenType.LPAREN, TokenType.SYMBOL, TokenType.RPAREN,
                TokenType.EOF);
    }

    @Test
    void testLastAndInitAreCaseInsensitive() {
        for (String s : List.of("last", "LAST", "Last", "lAsT")) {
            List<Token> tokens = tokenize(s);
            assertTypes(tokens, TokenType.LAST, TokenType.EOF);
            assertEquals(s, tokens.get(0).lexeme());
        }
        for (String s : List.of("init", "INIT", "Init")) {
            assertTypes(tokenize(s), TokenType.INIT, TokenType.EOF);
        }
    }

    @Test
    void testConstants() {
        for (String s : List.of("true", "True", "TRUE")) {
            assertTypes(tokenize(s), TokenType.TRUE, TokenType.EOF);
        }
        for (String s : List.of("false", "False", "FALSE")) {
            assertTypes(tokenize(s), TokenType.FALSE, TokenType.EOF);
        }
    }

    @Test
    void testPropositionalConnectives() {
        System.out.println("--- Running test: testPropositionalConnectives ---");
        List<Token> tokens = tokenize("!a & b && c | d || e -> f >> g <-> h ~i");
        assertTypes(tokens,
                TokenType.NOT, TokenType.SYMBOL, TokenType.AND, TokenType.SYMBOL,
                TokenType.AND, TokenType.SYMBOL, TokenType.OR, TokenType.SYMBOL,
                TokenType.OR, TokenType.SYMBOL, TokenType.IMPLY, TokenType.SYMBOL,
                TokenType.IMPLY, TokenType.SYMBOL, TokenType.EQUIVALENCE, TokenType.SYMBOL,
                TokenType.NOT, TokenType.SYMBOL, TokenType.EOF);
        assertEquals("&&", tokens.get(4).lexeme());
        assertEquals("<->", tokens.get(14).lexeme());
    }

    @Test
    void testPositionsAcrossLines() {
        List<Token> tokens = tokenize("a\n  U b");
        Token until = tokens.get(1);
        assertEquals(TokenType.UNTIL, until.type());
        assertEquals(4, until.offset());
        assertEquals(2, until.line());
        assertEquals(3, until.column());

        Token eof = tokens.get(3);
        assertEquals(TokenType.EOF, eof.type());
        assertEquals(7, eof.offset());
    }

    @Test
    void testWhitespaceOnlyInput() {
        assertTypes(tokenize(" \t\r\n "), TokenType.EOF);
    }

    @Test
    void testIllegalCharacters() {
        LexException e = assertThrows(LexException.class, () -> tokenize("a # b"));
        assertEquals(2, e.getOffset());
        assertEquals(1, e.getLine());
        assertEquals(3, e.getColumn());
        assertEquals("#", e.getFragment());
        assertTrue(e.getMessage().contains("'#'"));

        assertEquals("-", assertThrows(LexException.class, () -> tokenize("a - b")).getFragment());
        assertEquals("<-", assertThrows(LexException.class, () -> tokenize("a <-")).getFragment());
        assertThrows(LexException.class, () -> tokenize("1a"));
        assertThrows(LexException.class, () -> tokenize("_a"));
        assertThrows(LexException.class, () -> tokenize("G1"));
        assertThrows(LexException.class, () -> tokenize("Abc"));
    }

    @Test
    void testTokenizeIsRestartable() {
        LtlfLexer lexer = new LtlfLexer("G (req -> F grant)");
        List<Token> first = lexer.tokenize();
        List<Token> second = lexer.tokenize();
        assertEquals(first, second);
        assertEquals(8, first.size());
    }

    @Test
    void testPropositionalLexerHasNoTemporalTokens() {
        LexException e = assertThrows(LexException.class, () -> new PropositionalLexer("a U b").tokenize());
        assertEquals("U", e.getFragment());

        List<Token> tokens = new PropositionalLexer("last & TRUE").tokenize();
        assertEquals(TokenType.SYMBOL, tokens.get(0).type());
        assertEquals(TokenType.AND, tokens.get(1).type());
        assertEquals(TokenType.TRUE, tokens.get(2).type());
        assertTrue(tokens.stream().allMatch(t -> t.type().isPropositional() || t.type() == TokenType.EOF));
        assertFalse(TokenType.UNTIL.isPropositional());
    }
}
