package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;

/**
 * 共享方向与强度的一组上拉/下拉门
 */
public class PullGates extends AstNode {
    private final PrimitivePullStrength pullStrength;
    private final AstList<PullGateInstance> instances;

    public PullGates(PrimitivePullStrength pullStrength, AstList<PullGateInstance> instances) {
        this.pullStrength = pullStrength;
        this.instances = instances;
    }

    public PrimitivePullStrength getPullStrength() {
        return pullStrength;
    }

    public AstList<PullGateInstance> getInstances() {
        return instances;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPullGates(this, context);
    }
}
