package com.verilang.frontend.ast;

/**
 * 原语驱动强度
 */
public enum PrimitiveStrength {
    SUPPLY("supply"),
    STRONG("strong"),
    PULL("pull"),
    WEAK("weak"),
    HIGHZ("highz"),
    NONE("");

    private final String keyword;

    PrimitiveStrength(String keyword) {
        this.keyword = keyword;
    }

    /** 不含 0/1 后缀的关键字 */
    public String getKeyword() {
        return keyword;
    }
}
