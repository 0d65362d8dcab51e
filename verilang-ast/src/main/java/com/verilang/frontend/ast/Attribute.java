package com.verilang.frontend.ast;

import com.verilang.frontend.ast.expr.Expression;

/**
 * 单个属性 (* name = value *)，value 可为空
 */
public final class Attribute extends AstNode {
    private final Identifier name;
    private final Expression value;

    public Attribute(Identifier name, Expression value) {
        this.name = name;
        this.value = value;
    }

    public Identifier getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAttribute(this, context);
    }
}
