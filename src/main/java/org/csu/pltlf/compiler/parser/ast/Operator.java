package org.csu.pltlf.compiler.parser.ast;

/**
 * 公式中的算子：打印符号、元数以及时间方向。
 */
public enum Operator {
    NOT("!", 1, Direction.NONE),
    AND("&", 2, Direction.NONE),
    OR("|", 2, Direction.NONE),
    IMPLIES("->", 2, Direction.NONE),
    EQUIVALENCE("<->", 2, Direction.NONE),

    NEXT("X", 1, Direction.FUTURE),
    WEAK_NEXT("WX", 1, Direction.FUTURE),
    ALWAYS("G", 1, Direction.FUTURE),
    EVENTUALLY("F", 1, Direction.FUTURE),
    UNTIL("U", 2, Direction.FUTURE),
    RELEASE("R", 2, Direction.FUTURE),

    BEFORE("Y", 1, Direction.PAST),
    WEAK_BEFORE("WY", 1, Direction.PAST),
    HISTORICALLY("H", 1, Direction.PAST),
    ONCE("O", 1, Direction.PAST),
    SINCE("S", 2, Direction.PAST),
    TRIGGER("T", 2, Direction.PAST);

    public enum Direction {
        NONE, FUTURE, PAST
    }

    private final String symbol;
    private final int arity;
    private final Direction direction;

    Operator(String symbol, int arity, Direction direction) {
        this.symbol = symbol;
        this.arity = arity;
        this.direction = direction;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    public boolean isTemporal() {
        return direction != Direction.NONE;
    }

    public boolean isFuture() {
        return direction == Direction.FUTURE;
    }

    public boolean isPast() {
        return direction == Direction.PAST;
    }

    public Direction direction() {
        return direction;
    }
}
