package com.verilang.frontend.ast.udp;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.NumberLiteral;

/**
 * 时序 UDP 的 initial q = 1'b0;
 */
public class UdpInitialStatement extends AstNode {
    private final Identifier outputPort;
    private final NumberLiteral initialValue;

    public UdpInitialStatement(Identifier outputPort, NumberLiteral initialValue) {
        this.outputPort = outputPort;
        this.initialValue = initialValue;
    }

    public Identifier getOutputPort() {
        return outputPort;
    }

    public NumberLiteral getInitialValue() {
        return initialValue;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUdpInitialStatement(this, context);
    }
}
