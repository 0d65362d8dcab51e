package com.verilang.frontend.ast.udp;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.AttributeList;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.decl.PortDirection;
import com.verilang.frontend.ast.expr.Expression;

/**
 * UDP 端口声明
 *
 * <p>输入端口是一条声明里的多个标识符（identifiers），不可能是 reg，也没有默认值；
 * 输出/双向端口只有单个 identifier。</p>
 */
public class UdpPort extends AstNode {
    private final PortDirection direction;
    private final Identifier identifier;
    private final AstList<Identifier> identifiers;
    private final AttributeList attributes;
    private final boolean reg;
    private final Expression defaultValue;

    public UdpPort(PortDirection direction, Identifier identifier, AstList<Identifier> identifiers,
                   AttributeList attributes, boolean reg, Expression defaultValue) {
        this.direction = direction;
        this.identifier = identifier;
        this.identifiers = identifiers;
        this.attributes = attributes;
        this.reg = reg;
        this.defaultValue = defaultValue;
    }

    public PortDirection getDirection() {
        return direction;
    }

    /** 输出/双向端口的名字，输入端口为 null */
    public Identifier getIdentifier() {
        return identifier;
    }

    /** 输入端口的名字列表，输出/双向端口为 null */
    public AstList<Identifier> getIdentifiers() {
        return identifiers;
    }

    public AttributeList getAttributes() {
        return attributes;
    }

    public boolean isReg() {
        return reg;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUdpPort(this, context);
    }
}
