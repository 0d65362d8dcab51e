package com.verilang.frontend.ast;

import com.verilang.frontend.ast.expr.Expression;

/**
 * 位宽范围 [msb:lsb]
 */
public final class Range extends AstNode {
    private final Expression upper;
    private final Expression lower;

    public Range(Expression upper, Expression lower) {
        this.upper = upper;
        this.lower = lower;
    }

    public Expression getUpper() {
        return upper;
    }

    public Expression getLower() {
        return lower;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRange(this, context);
    }
}
