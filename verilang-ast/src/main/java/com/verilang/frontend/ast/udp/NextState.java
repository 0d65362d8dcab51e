package com.verilang.frontend.ast.udp;

/**
 * UDP 输出 / 下一状态
 */
public enum NextState {
    ZERO("0"),
    ONE("1"),
    X("x"),
    /** - 保持当前状态，只用于时序 UDP */
    UNCHANGED("-");

    private final String symbol;

    NextState(String symbol) {
        this.symbol = symbol;
    }

    public String toTableString() {
        return symbol;
    }
}
