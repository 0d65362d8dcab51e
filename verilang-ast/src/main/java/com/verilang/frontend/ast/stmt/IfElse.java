package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;

/**
 * if / else if / else 链
 *
 * <p>按列表顺序测试条件，第一项优先级最高。扩展时追加到尾部，与拼接的头插相反。</p>
 */
public class IfElse extends AstNode {
    private final AstList<ConditionalStatement> conditionalStatements;
    private final Statement elseStatement;

    public IfElse(AstList<ConditionalStatement> conditionalStatements, Statement elseStatement) {
        this.conditionalStatements = conditionalStatements;
        this.elseStatement = elseStatement;
    }

    public AstList<ConditionalStatement> getConditionalStatements() {
        return conditionalStatements;
    }

    /** 末尾的 else 分支，可为 null */
    public Statement getElseStatement() {
        return elseStatement;
    }

    public boolean hasElse() {
        return elseStatement != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfElse(this, context);
    }
}
