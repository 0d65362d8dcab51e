package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;

/**
 * 任务调用 task_name(args); 或系统任务 $display(...);
 */
public class TaskEnableStatement extends AstNode {
    private final AstList<Expression> expressions;
    private final Identifier identifier;
    private final boolean system;

    public TaskEnableStatement(AstList<Expression> expressions, Identifier identifier, boolean system) {
        this.expressions = expressions;
        this.identifier = identifier;
        this.system = system;
    }

    public AstList<Expression> getExpressions() {
        return expressions;
    }

    public Identifier getIdentifier() {
        return identifier;
    }

    public boolean isSystem() {
        return system;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTaskEnableStatement(this, context);
    }
}
