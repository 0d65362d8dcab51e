package com.verilang.frontend.ast.decl;

/**
 * 线网类型
 */
public enum NetType {
    SUPPLY0("supply0"),
    SUPPLY1("supply1"),
    TRI("tri"),
    TRIAND("triand"),
    TRIOR("trior"),
    TRIREG("trireg"),
    TRI0("tri0"),
    TRI1("tri1"),
    WIRE("wire"),
    WAND("wand"),
    WOR("wor"),
    NONE("");

    private final String keyword;

    NetType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
