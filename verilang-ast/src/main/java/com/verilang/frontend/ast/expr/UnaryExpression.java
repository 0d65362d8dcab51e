package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.AttributeList;

/**
 * 一元表达式（含归约运算）
 */
public class UnaryExpression extends Expression {
    private final Operator operator;
    private final Expression operand;

    public UnaryExpression(Expression operand, Operator operator, AttributeList attributes, boolean constant) {
        super(attributes, constant);
        this.operand = operand;
        this.operator = operator;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.UNARY;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpression(this, context);
    }
}
