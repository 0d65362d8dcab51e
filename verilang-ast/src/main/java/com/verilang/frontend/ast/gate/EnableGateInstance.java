package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * 单个使能门实例 bufif1 b0 (out, in, enable)
 */
public class EnableGateInstance extends ControlledGateInstance {

    public EnableGateInstance(Identifier name, Lvalue outputTerminal, Expression enableTerminal,
                              Expression inputTerminal) {
        super(name, outputTerminal, enableTerminal, inputTerminal);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnableGateInstance(this, context);
    }
}
