package org.csu.pltlf.engine;

import lombok.Getter;
import org.csu.pltlf.common.exception.ParseException;
import org.csu.pltlf.compiler.lexer.LtlfLexer;
import org.csu.pltlf.compiler.lexer.Token;
import org.csu.pltlf.compiler.parser.LtlfParser;
import org.csu.pltlf.compiler.parser.ParserOptions;
import org.csu.pltlf.compiler.parser.ast.FormulaNode;

import java.util.List;

/**
 * 公式处理入口：文本 -> Token 序列 -> AST。
 * 只持有不可变的配置，每次调用都新建词法/语法分析器，因此可以被多个线程共享。
 */
public class FormulaProcessor {

    @Getter
    private final ParserOptions options;

    public FormulaProcessor() {
        this(ParserOptions.defaults());
    }

    public FormulaProcessor(ParserOptions options) {
        this.options = options == null ? ParserOptions.defaults() : options;
    }

    public List<Token> tokenize(String formula) {
        if (formula == null) {
            throw new ParseException("Formula text must not be null");
        }
        return new LtlfLexer(formula).tokenize();
    }

    public FormulaNode parse(String formula) {
        List<Token> tokens = tokenize(formula);
        if (options.isVerbose()) {
            System.out.println("[DEBUG] Parsing formula: " + formula);
            System.out.println("[DEBUG] Tokens: " + tokens);
        }

        FormulaNode ast = new LtlfParser(tokens, options).parse();

        if (options.isVerbose()) {
            System.out.println("[DEBUG] AST type: " + ast.getClass().getSimpleName() + ", formula: " + ast);
        }
        return ast;
    }
}
