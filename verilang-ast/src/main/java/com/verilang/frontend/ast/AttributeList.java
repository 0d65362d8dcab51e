package com.verilang.frontend.ast;

/**
 * 属性列表，按源码顺序保存
 */
public final class AttributeList extends AstNode {
    private final AstList<Attribute> attributes;

    public AttributeList(AstList<Attribute> attributes) {
        this.attributes = attributes;
    }

    public AstList<Attribute> getAttributes() {
        return attributes;
    }

    /** 按名称查找属性，不存在时返回 null */
    public Attribute find(String name) {
        for (Attribute attribute : attributes) {
            if (attribute.getName().getName().equals(name)) {
                return attribute;
            }
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAttributeList(this, context);
    }
}
