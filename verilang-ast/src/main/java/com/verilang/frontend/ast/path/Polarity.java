package com.verilang.frontend.ast.path;

/**
 * 路径极性 +=> / -=>
 */
public enum Polarity {
    POSITIVE("+"),
    NEGATIVE("-"),
    NONE("");

    private final String source;

    Polarity(String source) {
        this.source = source;
    }

    public String toSourceString() {
        return source;
    }
}
