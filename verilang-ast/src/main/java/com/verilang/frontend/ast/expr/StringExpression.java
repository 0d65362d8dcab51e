package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstVisitor;

/**
 * 字符串字面量表达式，恒为常量
 */
public class StringExpression extends Expression {
    private final String value;

    public StringExpression(String value) {
        super(null, true);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.STRING;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStringExpression(this, context);
    }
}
