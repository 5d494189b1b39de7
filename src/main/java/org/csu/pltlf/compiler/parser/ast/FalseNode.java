package org.csu.pltlf.compiler.parser.ast;

/**
 * AST 节点: 常量 false
 */
public record FalseNode() implements FormulaNode {

    @Override
    public String toString() {
        return "false";
    }
}
