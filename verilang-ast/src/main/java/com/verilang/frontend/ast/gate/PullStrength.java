package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.PrimitiveStrength;

/**
 * 对 1 和 0 的上拉强度
 */
public class PullStrength extends AstNode {
    private final PrimitiveStrength strength1;
    private final PrimitiveStrength strength2;

    public PullStrength(PrimitiveStrength strength1, PrimitiveStrength strength2) {
        this.strength1 = strength1;
        this.strength2 = strength2;
    }

    public PrimitiveStrength getStrength1() {
        return strength1;
    }

    public PrimitiveStrength getStrength2() {
        return strength2;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPullStrength(this, context);
    }
}
