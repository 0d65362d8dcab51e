package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstVisitor;

/**
 * 包装 Primary 的表达式，常量性取决于 primary 的种类
 */
public class PrimaryExpression extends Expression {
    private final Primary primary;

    public PrimaryExpression(Primary primary) {
        super(null, primary.getPrimaryType() == Primary.PrimaryType.CONSTANT_PRIMARY);
        this.primary = primary;
    }

    public Primary getPrimary() {
        return primary;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.PRIMARY;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPrimaryExpression(this, context);
    }
}
