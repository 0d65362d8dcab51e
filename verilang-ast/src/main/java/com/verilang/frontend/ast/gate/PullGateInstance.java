package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * 单个上拉/下拉门实例 pullup p0 (net)
 */
public class PullGateInstance extends AstNode {
    private final Identifier name;
    private final Lvalue outputTerminal;

    public PullGateInstance(Identifier name, Lvalue outputTerminal) {
        this.name = name;
        this.outputTerminal = outputTerminal;
    }

    public Identifier getName() {
        return name;
    }

    public Lvalue getOutputTerminal() {
        return outputTerminal;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPullGateInstance(this, context);
    }
}
