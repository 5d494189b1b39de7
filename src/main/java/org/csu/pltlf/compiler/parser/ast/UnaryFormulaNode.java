package org.csu.pltlf.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 一元算子 (否定和所有一元时序算子), e.g., G(a), !(b)
 */
public record UnaryFormulaNode(Operator operator, FormulaNode operand) implements FormulaNode {

    public UnaryFormulaNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
        if (!operator.isUnary()) {
            throw new IllegalArgumentException(operator + " is not a unary operator");
        }
    }

    @Override
    public String toString() {
        return operator.symbol() + "(" + operand + ")";
    }
}
