package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AttributeList;

/**
 * 表达式基类
 *
 * <p>{@code constant} 在构造时确定，之后不会根据子节点重新计算。</p>
 */
public abstract class Expression extends AstNode {
    private final AttributeList attributes;
    private final boolean constant;

    protected Expression(AttributeList attributes, boolean constant) {
        this.attributes = attributes;
        this.constant = constant;
    }

    public abstract ExpressionKind getKind();

    public AttributeList getAttributes() {
        return attributes;
    }

    public boolean isConstant() {
        return constant;
    }
}
