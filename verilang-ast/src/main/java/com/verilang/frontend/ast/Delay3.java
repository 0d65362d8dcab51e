package com.verilang.frontend.ast;

import com.verilang.frontend.ast.expr.Expression;

/**
 * 三值延迟 #(rise, fall, turn-off)，后两项可为空
 */
public final class Delay3 extends AstNode {
    private final Expression rise;
    private final Expression fall;
    private final Expression turnOff;

    public Delay3(Expression rise, Expression fall, Expression turnOff) {
        this.rise = rise;
        this.fall = fall;
        this.turnOff = turnOff;
    }

    public Expression getRise() {
        return rise;
    }

    public Expression getFall() {
        return fall;
    }

    public Expression getTurnOff() {
        return turnOff;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDelay3(this, context);
    }
}
