package org.csu.pltlf.compiler.parser.ast;

/**
 * AST 节点: 迹的第一个时刻 (init)
 */
public record InitNode() implements FormulaNode {

    @Override
    public String toString() {
        return "init";
    }
}
