package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.expr.Expression;

/**
 * case 分支，default 分支的条件列表为空
 */
public class CaseItem extends AstNode {
    private final AstList<Expression> conditions;
    private final Statement body;
    private final boolean isDefault;

    public CaseItem(AstList<Expression> conditions, Statement body, boolean isDefault) {
        this.conditions = conditions;
        this.body = body;
        this.isDefault = isDefault;
    }

    public AstList<Expression> getConditions() {
        return conditions;
    }

    public Statement getBody() {
        return body;
    }

    public boolean isDefault() {
        return isDefault;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCaseItem(this, context);
    }
}
