package org.csu.pltlf.compiler.parser.ast;

/**
 * AST 节点的公共接口。所有实现都是不可变的 record，按结构比较相等。
 */
public interface FormulaNode {
}
