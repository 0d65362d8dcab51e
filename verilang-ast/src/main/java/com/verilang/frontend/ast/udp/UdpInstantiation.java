package com.verilang.frontend.ast.udp;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Delay2;
import com.verilang.frontend.ast.DriveStrength;
import com.verilang.frontend.ast.Identifier;

/**
 * 共享强度与延迟的一组 UDP 实例
 */
public class UdpInstantiation extends AstNode {
    private final AstList<UdpInstance> instances;
    private final Identifier identifier;
    private final DriveStrength driveStrength;
    private final Delay2 delay;

    public UdpInstantiation(AstList<UdpInstance> instances, Identifier identifier,
                            DriveStrength driveStrength, Delay2 delay) {
        this.instances = instances;
        this.identifier = identifier;
        this.driveStrength = driveStrength;
        this.delay = delay;
    }

    public AstList<UdpInstance> getInstances() {
        return instances;
    }

    /** 被实例化的 UDP 名 */
    public Identifier getIdentifier() {
        return identifier;
    }

    public DriveStrength getDriveStrength() {
        return driveStrength;
    }

    public Delay2 getDelay() {
        return delay;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUdpInstantiation(this, context);
    }
}
