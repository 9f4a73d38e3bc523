package com.tlang.ir.node;

/**
 * 二元运算符。
 */
public enum BinaryOpType {
    // 算术
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),

    // 比较
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    EQ("=="),
    NE("!=");

    private final String symbol;

    BinaryOpType(String symbol) {
        this.symbol = symbol;
    }

    /** 运算符符号，打印 IR 时使用 */
    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        switch (this) {
            case LT: case LE: case GT: case GE: case EQ: case NE: return true;
            default: return false;
        }
    }
}
