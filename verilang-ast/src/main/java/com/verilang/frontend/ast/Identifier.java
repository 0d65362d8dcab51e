package com.verilang.frontend.ast;

/**
 * 标识符（可带层次路径，如 top.u0.sig）
 */
public final class Identifier extends AstNode {
    private final String name;

    public Identifier(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** 是否为系统标识符（$display 等） */
    public boolean isSystem() {
        return name.startsWith("$");
    }

    /** 是否为层次化标识符 */
    public boolean isHierarchical() {
        return name.indexOf('.') > 0;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }

    @Override
    public String toString() {
        return name;
    }
}
