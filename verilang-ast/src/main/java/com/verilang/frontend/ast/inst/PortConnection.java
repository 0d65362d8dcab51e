package com.verilang.frontend.ast.inst;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;

/**
 * 端口连接：.port(expr) 或按位置的 expr
 *
 * <p>按位置连接时 portName 为 null；.port() 未连接时 expression 为 null。</p>
 */
public class PortConnection extends AstNode {
    private final Identifier portName;
    private final Expression expression;

    public PortConnection(Identifier portName, Expression expression) {
        this.portName = portName;
        this.expression = expression;
    }

    public Identifier getPortName() {
        return portName;
    }

    public Expression getExpression() {
        return expression;
    }

    public boolean isNamed() {
        return portName != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPortConnection(this, context);
    }
}
