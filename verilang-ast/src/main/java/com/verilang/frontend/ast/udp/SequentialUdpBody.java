package com.verilang.frontend.ast.udp;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstVisitor;

/**
 * 时序 UDP 主体，initial 语句可选
 */
public class SequentialUdpBody extends UdpBody {
    private final UdpInitialStatement initial;
    private final AstList<UdpSequentialEntry> entries;

    public SequentialUdpBody(UdpInitialStatement initial, AstList<UdpSequentialEntry> entries) {
        this.initial = initial;
        this.entries = entries;
    }

    @Override
    public UdpBodyType getBodyType() {
        return UdpBodyType.SEQUENTIAL;
    }

    public UdpInitialStatement getInitial() {
        return initial;
    }

    public AstList<UdpSequentialEntry> getEntries() {
        return entries;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSequentialUdpBody(this, context);
    }
}
