package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * 单个 CMOS 开关实例 cmos c0 (out, in, ncontrol, pcontrol)
 */
public class CmosSwitchInstance extends AstNode {
    private final Identifier name;
    private final Lvalue outputTerminal;
    private final Expression ncontrolTerminal;
    private final Expression pcontrolTerminal;
    private final Expression inputTerminal;

    public CmosSwitchInstance(Identifier name, Lvalue outputTerminal, Expression ncontrolTerminal,
                              Expression pcontrolTerminal, Expression inputTerminal) {
        this.name = name;
        this.outputTerminal = outputTerminal;
        this.ncontrolTerminal = ncontrolTerminal;
        this.pcontrolTerminal = pcontrolTerminal;
        this.inputTerminal = inputTerminal;
    }

    public Identifier getName() {
        return name;
    }

    public Lvalue getOutputTerminal() {
        return outputTerminal;
    }

    public Expression getNcontrolTerminal() {
        return ncontrolTerminal;
    }

    public Expression getPcontrolTerminal() {
        return pcontrolTerminal;
    }

    public Expression getInputTerminal() {
        return inputTerminal;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCmosSwitchInstance(this, context);
    }
}
