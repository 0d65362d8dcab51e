package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.expr.Expression;

/**
 * if (condition) statement
 */
public class ConditionalStatement extends AstNode {
    private final Statement statement;
    private final Expression condition;

    public ConditionalStatement(Statement statement, Expression condition) {
        this.statement = statement;
        this.condition = condition;
    }

    public Statement getStatement() {
        return statement;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConditionalStatement(this, context);
    }
}
