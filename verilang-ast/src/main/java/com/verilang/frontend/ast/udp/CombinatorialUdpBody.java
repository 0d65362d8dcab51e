package com.verilang.frontend.ast.udp;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstVisitor;

/**
 * 组合 UDP 主体，没有初始状态
 */
public class CombinatorialUdpBody extends UdpBody {
    private final AstList<UdpCombinatorialEntry> entries;

    public CombinatorialUdpBody(AstList<UdpCombinatorialEntry> entries) {
        this.entries = entries;
    }

    @Override
    public UdpBodyType getBodyType() {
        return UdpBodyType.COMBINATORIAL;
    }

    public AstList<UdpCombinatorialEntry> getEntries() {
        return entries;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCombinatorialUdpBody(this, context);
    }
}
