package com.verilang.frontend.ast.expr;

/**
 * 运算符
 *
 * <p>Verilog 中部分符号同时用作一元（归约）和二元运算，如 &amp;、|、^、-。</p>
 */
public enum Operator {
    // 算术
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    DIV("/"),
    MOD("%"),
    POW("**"),

    // 逻辑
    L_NEG("!"),
    L_AND("&&"),
    L_OR("||"),

    // 相等
    L_EQ("=="),
    L_NEQ("!="),
    C_EQ("==="),
    C_NEQ("!=="),

    // 关系
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),

    // 位运算 / 归约
    B_NEG("~"),
    B_AND("&"),
    B_OR("|"),
    B_XOR("^"),
    B_NAND("~&"),
    B_NOR("~|"),
    B_EQU("~^"),

    // 移位
    LSL("<<"),
    LSR(">>"),
    ASL("<<<"),
    ASR(">>>"),

    TERNARY("?:");

    private final String source;

    Operator(String source) {
        this.source = source;
    }

    /** 返回 Verilog 源码中对应的运算符 */
    public String toSourceString() {
        return source;
    }

    /** 是否可作为一元运算符 */
    public boolean isUnary() {
        switch (this) {
            case PLUS:
            case MINUS:
            case L_NEG:
            case B_NEG:
            case B_AND:
            case B_OR:
            case B_XOR:
            case B_NAND:
            case B_NOR:
            case B_EQU:
                return true;
            default:
                return false;
        }
    }

    /** 是否可作为二元运算符 */
    public boolean isBinary() {
        switch (this) {
            case L_NEG:
            case B_NEG:
            case B_NAND:
            case B_NOR:
            case TERNARY:
                return false;
            default:
                return true;
        }
    }
}
