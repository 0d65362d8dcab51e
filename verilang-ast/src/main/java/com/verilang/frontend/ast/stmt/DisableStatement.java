package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;

/**
 * disable 语句
 */
public class DisableStatement extends AstNode {
    private final Identifier identifier;

    public DisableStatement(Identifier identifier) {
        this.identifier = identifier;
    }

    public Identifier getIdentifier() {
        return identifier;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDisableStatement(this, context);
    }
}
