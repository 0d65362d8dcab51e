package com.verilang.frontend.ast.udp;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.AttributeList;
import com.verilang.frontend.ast.Identifier;

/**
 * primitive ... endprimitive 声明
 */
public class UdpDeclaration extends AstNode {
    private final AttributeList attributes;
    private final Identifier identifier;
    private final AstList<UdpPort> ports;
    private final UdpBody body;

    public UdpDeclaration(AttributeList attributes, Identifier identifier, AstList<UdpPort> ports, UdpBody body) {
        this.attributes = attributes;
        this.identifier = identifier;
        this.ports = ports;
        this.body = body;
    }

    public AttributeList getAttributes() {
        return attributes;
    }

    public Identifier getIdentifier() {
        return identifier;
    }

    public AstList<UdpPort> getPorts() {
        return ports;
    }

    public UdpBody getBody() {
        return body;
    }

    public UdpBody.UdpBodyType getBodyType() {
        return body.getBodyType();
    }

    /** 时序 UDP 的初始语句，组合 UDP 或未声明时为 null */
    public UdpInitialStatement getInitial() {
        return body instanceof SequentialUdpBody ? ((SequentialUdpBody) body).getInitial() : null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUdpDeclaration(this, context);
    }
}
