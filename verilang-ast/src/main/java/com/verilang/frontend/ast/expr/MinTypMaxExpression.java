package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstVisitor;

/**
 * min:typ:max 表达式，只给出典型值时 min/max 为 null
 */
public class MinTypMaxExpression extends Expression {
    private final Expression min;
    private final Expression typ;
    private final Expression max;

    public MinTypMaxExpression(Expression min, Expression typ, Expression max) {
        super(null, false);
        this.min = min;
        this.typ = typ;
        this.max = max;
    }

    public Expression getMin() {
        return min;
    }

    public Expression getTyp() {
        return typ;
    }

    public Expression getMax() {
        return max;
    }

    /** 是否只有典型值 */
    public boolean isTypicalOnly() {
        return min == null && max == null;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.MINTYPMAX;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMinTypMaxExpression(this, context);
    }
}
