package com.verilang.frontend.ast.inst;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.AttributeList;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.decl.ParameterDeclarations;
import com.verilang.frontend.ast.stmt.Statement;

/**
 * 模块声明，一次解析会话的顶层结构之一
 */
public class ModuleDeclaration extends AstNode {
    private final AttributeList attributes;
    private final Identifier identifier;
    private final AstList<ParameterDeclarations> parameters;
    private final AstList<AstNode> ports;
    private final AstList<Statement> items;

    public ModuleDeclaration(AttributeList attributes, Identifier identifier,
                             AstList<ParameterDeclarations> parameters, AstList<AstNode> ports,
                             AstList<Statement> items) {
        this.attributes = attributes;
        this.identifier = identifier;
        this.parameters = parameters;
        this.ports = ports;
        this.items = items;
    }

    public AttributeList getAttributes() {
        return attributes;
    }

    public Identifier getIdentifier() {
        return identifier;
    }

    /** #( parameter ... ) 头部参数 */
    public AstList<ParameterDeclarations> getParameters() {
        return parameters;
    }

    /** 端口：Verilog-1995 风格为 Identifier，ANSI 风格为 PortDeclaration */
    public AstList<AstNode> getPorts() {
        return ports;
    }

    public AstList<Statement> getItems() {
        return items;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDeclaration(this, context);
    }
}
