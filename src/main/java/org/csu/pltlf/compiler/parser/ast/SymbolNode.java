package org.csu.pltlf.compiler.parser.ast;

import java.util.regex.Pattern;

/**
 * AST 节点: 命题符号 (e.g., a, req_1)
 */
public record SymbolNode(String name) implements FormulaNode {

    private static final Pattern NAME = Pattern.compile("[a-z][a-z0-9_]*");

    public SymbolNode {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid symbol name: " + name);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
