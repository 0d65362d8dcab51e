package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.AttributeList;

/**
 * 二元表达式
 */
public class BinaryExpression extends Expression {
    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryExpression(Expression left, Expression right, Operator operator,
                            AttributeList attributes, boolean constant) {
        super(attributes, constant);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.BINARY;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpression(this, context);
    }
}
