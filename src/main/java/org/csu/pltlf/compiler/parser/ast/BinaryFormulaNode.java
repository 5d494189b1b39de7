package org.csu.pltlf.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 二元算子。左结合的链表示为嵌套节点，a U b U c 即 ((a U b) U c)
 */
public record BinaryFormulaNode(
        Operator operator,
        FormulaNode left,
        FormulaNode right
) implements FormulaNode {

    public BinaryFormulaNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (!operator.isBinary()) {
            throw new IllegalArgumentException(operator + " is not a binary operator");
        }
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
