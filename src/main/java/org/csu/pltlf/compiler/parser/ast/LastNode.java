package org.csu.pltlf.compiler.parser.ast;

/**
 * AST 节点: 迹的最后一个时刻 (last)
 */
public record LastNode() implements FormulaNode {

    @Override
    public String toString() {
        return "last";
    }
}
