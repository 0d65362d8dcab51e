package com.verilang.frontend.ast.udp;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.Range;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * 单个 UDP 实例 u0 [range] (out, in1, in2)
 */
public class UdpInstance extends AstNode {
    private final Identifier identifier;
    private final Range range;
    private final Lvalue output;
    private final AstList<Expression> inputs;

    public UdpInstance(Identifier identifier, Range range, Lvalue output, AstList<Expression> inputs) {
        this.identifier = identifier;
        this.range = range;
        this.output = output;
        this.inputs = inputs;
    }

    /** 实例名，可省略 */
    public Identifier getIdentifier() {
        return identifier;
    }

    /** 实例数组范围，可为 null */
    public Range getRange() {
        return range;
    }

    public Lvalue getOutput() {
        return output;
    }

    public AstList<Expression> getInputs() {
        return inputs;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUdpInstance(this, context);
    }
}
