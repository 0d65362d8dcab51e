package com.verilang.frontend.ast.timing;

/**
 * 触发边沿
 */
public enum Edge {
    POS("posedge"),
    NEG("negedge"),
    ANY(""),
    NONE("");

    private final String keyword;

    Edge(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
