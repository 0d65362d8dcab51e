package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * 单个 MOS 开关实例 nmos n0 (out, in, enable)
 */
public class MosSwitchInstance extends ControlledGateInstance {

    public MosSwitchInstance(Identifier name, Lvalue outputTerminal, Expression enableTerminal,
                             Expression inputTerminal) {
        super(name, outputTerminal, enableTerminal, inputTerminal);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMosSwitchInstance(this, context);
    }
}
