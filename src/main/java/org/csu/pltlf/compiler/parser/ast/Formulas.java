package org.csu.pltlf.compiler.parser.ast;

/**
 * 构造 AST 节点的静态工厂方法。
 */
public final class Formulas {

    private Formulas() {
    }

    public static SymbolNode symbol(String name) {
        return new SymbolNode(name);
    }

    public static TrueNode tt() {
        return new TrueNode();
    }

    public static FalseNode ff() {
        return new FalseNode();
    }

    public static LastNode last() {
        return new LastNode();
    }

    public static InitNode init() {
        return new InitNode();
    }

    public static FormulaNode unary(Operator operator, FormulaNode operand) {
        return new UnaryFormulaNode(operator, operand);
    }

    public static FormulaNode binary(Operator operator, FormulaNode left, FormulaNode right) {
        return new BinaryFormulaNode(operator, left, right);
    }

    public static FormulaNode not(FormulaNode f) {
        return unary(Operator.NOT, f);
    }

    public static FormulaNode next(FormulaNode f) {
        return unary(Operator.NEXT, f);
    }

    public static FormulaNode weakNext(FormulaNode f) {
        return unary(Operator.WEAK_NEXT, f);
    }

    public static FormulaNode always(FormulaNode f) {
        return unary(Operator.ALWAYS, f);
    }

    public static FormulaNode eventually(FormulaNode f) {
        return unary(Operator.EVENTUALLY, f);
    }

    public static FormulaNode before(FormulaNode f) {
        return unary(Operator.BEFORE, f);
    }

    public static FormulaNode weakBefore(FormulaNode f) {
        return unary(Operator.WEAK_BEFORE, f);
    }

    public static FormulaNode historically(FormulaNode f) {
        return unary(Operator.HISTORICALLY, f);
    }

    public static FormulaNode once(FormulaNode f) {
        return unary(Operator.ONCE, f);
    }

    public static FormulaNode and(FormulaNode left, FormulaNode right) {
        return binary(Operator.AND, left, right);
    }

    public static FormulaNode or(FormulaNode left, FormulaNode right) {
        return binary(Operator.OR, left, right);
    }

    public static FormulaNode implies(FormulaNode left, FormulaNode right) {
        return binary(Operator.IMPLIES, left, right);
    }

    public static FormulaNode equivalence(FormulaNode left, FormulaNode right) {
        return binary(Operator.EQUIVALENCE, left, right);
    }

    public static FormulaNode until(FormulaNode left, FormulaNode right) {
        return binary(Operator.UNTIL, left, right);
    }

    public static FormulaNode release(FormulaNode left, FormulaNode right) {
        return binary(Operator.RELEASE, left, right);
    }

    public static FormulaNode since(FormulaNode left, FormulaNode right) {
        return binary(Operator.SINCE, left, right);
    }

    public static FormulaNode trigger(FormulaNode left, FormulaNode right) {
        return binary(Operator.TRIGGER, left, right);
    }
}
