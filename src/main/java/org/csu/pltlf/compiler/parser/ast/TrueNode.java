package org.csu.pltlf.compiler.parser.ast;

/**
 * AST 节点: 常量 true
 */
public record TrueNode() implements FormulaNode {

    @Override
    public String toString() {
        return "true";
    }
}
