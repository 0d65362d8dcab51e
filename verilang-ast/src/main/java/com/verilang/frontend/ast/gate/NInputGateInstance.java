package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * 多输入门实例，如三输入 nand g0 (out, a, b, c)
 */
public class NInputGateInstance extends AstNode {
    private final Identifier name;
    private final AstList<Expression> inputTerminals;
    private final Lvalue outputTerminal;

    public NInputGateInstance(Identifier name, AstList<Expression> inputTerminals, Lvalue outputTerminal) {
        this.name = name;
        this.inputTerminals = inputTerminals;
        this.outputTerminal = outputTerminal;
    }

    public Identifier getName() {
        return name;
    }

    public AstList<Expression> getInputTerminals() {
        return inputTerminals;
    }

    public Lvalue getOutputTerminal() {
        return outputTerminal;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNInputGateInstance(this, context);
    }
}
