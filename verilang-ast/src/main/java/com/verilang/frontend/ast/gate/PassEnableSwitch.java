package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * 单个带使能的传输管实例 tranif1 t0 (a, b, en)
 */
public class PassEnableSwitch extends AstNode {
    private final Identifier name;
    private final Lvalue terminal1;
    private final Lvalue terminal2;
    private final Expression enable;

    public PassEnableSwitch(Identifier name, Lvalue terminal1, Lvalue terminal2, Expression enable) {
        this.name = name;
        this.terminal1 = terminal1;
        this.terminal2 = terminal2;
        this.enable = enable;
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

    public Expression getEnable() {
        return enable;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPassEnableSwitch(this, context);
    }
}
