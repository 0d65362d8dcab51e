package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * lvalue = expression
 */
public class SingleAssignment extends AstNode {
    private final Lvalue lvalue;
    private final Expression expression;

    public SingleAssignment(Lvalue lvalue, Expression expression) {
        this.lvalue = lvalue;
        this.expression = expression;
    }

    public Lvalue getLvalue() {
        return lvalue;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSingleAssignment(this, context);
    }
}
