package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.AttributeList;

/**
 * 条件表达式 condition ? ifTrue : ifFalse
 */
public class ConditionalExpression extends Expression {
    private final Expression condition;
    private final Expression ifTrue;
    private final Expression ifFalse;

    public ConditionalExpression(Expression condition, Expression ifTrue, Expression ifFalse,
                                 AttributeList attributes) {
        super(attributes, false);
        this.condition = condition;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getIfTrue() {
        return ifTrue;
    }

    public Expression getIfFalse() {
        return ifFalse;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.CONDITIONAL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConditionalExpression(this, context);
    }
}
