package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * 单个传输管实例 tran t0 (a, b)
 */
public class PassSwitchInstance extends AstNode {
    private final Identifier name;
    private final Lvalue terminal1;
    private final Lvalue terminal2;

    public PassSwitchInstance(Identifier name, Lvalue terminal1, Lvalue terminal2) {
        this.name = name;
        this.terminal1 = terminal1;
        this.terminal2 = terminal2;
    }

    public Identifier getName() {
        return name;
    }

    public Lvalue getTerminal1() {
        return terminal1;
    }

    public Lvalue getTerminal2() {
        return terminal2;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPassSwitchInstance(this, context);
    }
}
