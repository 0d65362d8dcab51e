package com.verilang.frontend.ast;

import com.verilang.frontend.ast.expr.Expression;

/**
 * 双值延迟 #(rise, fall)，fall 可为空
 */
public final class Delay2 extends AstNode {
    private final Expression rise;
    private final Expression fall;

    public Delay2(Expression rise, Expression fall) {
        this.rise = rise;
        this.fall = fall;
    }

    public Expression getRise() {
        return rise;
    }

    public Expression getFall() {
        return fall;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDelay2(this, context);
    }
}
