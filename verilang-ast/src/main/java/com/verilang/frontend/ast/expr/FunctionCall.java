package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.AttributeList;
import com.verilang.frontend.ast.Identifier;

/**
 * 函数调用，无参数时 arguments 为空列表而非 null
 */
public class FunctionCall extends AstNode {
    private final Identifier function;
    private final boolean constant;
    private final boolean system;
    private final AttributeList attributes;
    private final AstList<Expression> arguments;

    public FunctionCall(Identifier function, boolean constant, boolean system,
                        AttributeList attributes, AstList<Expression> arguments) {
        this.function = function;
        this.constant = constant;
        this.system = system;
        this.attributes = attributes;
        this.arguments = arguments;
    }

    public Identifier getFunction() {
        return function;
    }

    public boolean isConstant() {
        return constant;
    }

    /** 系统函数（$clog2 等） */
    public boolean isSystem() {
        return system;
    }

    public AttributeList getAttributes() {
        return attributes;
    }

    public AstList<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCall(this, context);
    }
}
