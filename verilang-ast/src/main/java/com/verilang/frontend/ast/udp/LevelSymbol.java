package com.verilang.frontend.ast.udp;

/**
 * UDP 电平符号
 */
public enum LevelSymbol implements UdpInputSymbol {
    ZERO("0"),
    ONE("1"),
    X("x"),
    /** ? 匹配 0/1/x */
    QUESTION("?"),
    /** b 匹配 0/1 */
    B("b");

    private final String symbol;

    LevelSymbol(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String toTableString() {
        return symbol;
    }
}
