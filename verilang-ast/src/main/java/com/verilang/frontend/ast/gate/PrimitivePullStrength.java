package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.PrimitiveStrength;

/**
 * pullup / pulldown 原语的方向与强度
 */
public class PrimitivePullStrength extends AstNode {
    private final PullDirection direction;
    private final PrimitiveStrength strength1;
    private final PrimitiveStrength strength0;

    public PrimitivePullStrength(PullDirection direction, PrimitiveStrength strength1,
                                 PrimitiveStrength strength0) {
        this.direction = direction;
        this.strength1 = strength1;
        this.strength0 = strength0;
    }

    public PullDirection getDirection() {
        return direction;
    }

    public PrimitiveStrength getStrength1() {
        return strength1;
    }

    public PrimitiveStrength getStrength0() {
        return strength0;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPrimitivePullStrength(this, context);
    }
}
