package com.verilang.frontend.ast;

/**
 * 驱动强度 (strength0, strength1)
 */
public final class DriveStrength extends AstNode {
    private final PrimitiveStrength strength0;
    private final PrimitiveStrength strength1;

    public DriveStrength(PrimitiveStrength strength0, PrimitiveStrength strength1) {
        this.strength0 = strength0;
        this.strength1 = strength1;
    }

    public PrimitiveStrength getStrength0() {
        return strength0;
    }

    public PrimitiveStrength getStrength1() {
        return strength1;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDriveStrength(this, context);
    }
}
