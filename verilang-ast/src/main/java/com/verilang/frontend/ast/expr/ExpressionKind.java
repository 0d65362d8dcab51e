package com.verilang.frontend.ast.expr;

/**
 * 表达式种类标签
 */
public enum ExpressionKind {
    PRIMARY,
    UNARY,
    BINARY,
    RANGE_UP_DOWN,
    RANGE_INDEX,
    STRING,
    CONDITIONAL,
    MINTYPMAX
}
