package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstVisitor;

/**
 * 范围表达式：[left:right] 或单下标 [index]
 */
public class RangeExpression extends Expression {
    private final Expression left;
    private final Expression right;

    public RangeExpression(Expression left, Expression right, boolean constant) {
        super(null, constant);
        this.left = left;
        this.right = right;
    }

    /** 上界，或下标形式中的下标 */
    public Expression getLeft() {
        return left;
    }

    /** 下界，下标形式为 null */
    public Expression getRight() {
        return right;
    }

    public boolean isIndex() {
        return right == null;
    }

    @Override
    public ExpressionKind getKind() {
        return right == null ? ExpressionKind.RANGE_INDEX : ExpressionKind.RANGE_UP_DOWN;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRangeExpression(this, context);
    }
}
