package com.verilang.frontend.ast.inst;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;

/**
 * 单个模块实例 u0 (.a(x), .b(y))
 */
public class ModuleInstance extends AstNode {
    private final Identifier instanceIdentifier;
    private final AstList<PortConnection> portConnections;

    public ModuleInstance(Identifier instanceIdentifier, AstList<PortConnection> portConnections) {
        this.instanceIdentifier = instanceIdentifier;
        this.portConnections = portConnections;
    }

    public Identifier getInstanceIdentifier() {
        return instanceIdentifier;
    }

    public AstList<PortConnection> getPortConnections() {
        return portConnections;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleInstance(this, context);
    }
}
