package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * 多输出门实例 buf b0 (o1, o2, in)
 */
public class NOutputGateInstance extends AstNode {
    private final Identifier name;
    private final AstList<Lvalue> outputs;
    private final Expression input;

    public NOutputGateInstance(Identifier name, AstList<Lvalue> outputs, Expression input) {
        this.name = name;
        this.outputs = outputs;
        this.input = input;
    }

    public Identifier getName() {
        return name;
    }

    public AstList<Lvalue> getOutputs() {
        return outputs;
    }

    public Expression getInput() {
        return input;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNOutputGateInstance(this, context);
    }
}
