package com.verilang.frontend.ast.decl;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.Range;

/**
 * 端口声明 input wire signed [7:0] a, b;
 */
public class PortDeclaration extends AstNode {
    private final PortDirection direction;
    private final NetType netType;
    private final boolean netSigned;
    private final boolean reg;
    private final boolean variable;
    private final Range range;
    private final AstList<Identifier> portNames;

    public PortDeclaration(PortDirection direction, NetType netType, boolean netSigned, boolean reg,
                           boolean variable, Range range, AstList<Identifier> portNames) {
        this.direction = direction;
        this.netType = netType;
        this.netSigned = netSigned;
        this.reg = reg;
        this.variable = variable;
        this.range = range;
        this.portNames = portNames;
    }

    public PortDirection getDirection() {
        return direction;
    }

    public NetType getNetType() {
        return netType;
    }

    public boolean isNetSigned() {
        return netSigned;
    }

    /** 显式声明为 reg */
    public boolean isReg() {
        return reg;
    }

    /** 变量（而非线网） */
    public boolean isVariable() {
        return variable;
    }

    public Range getRange() {
        return range;
    }

    public AstList<Identifier> getPortNames() {
        return portNames;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPortDeclaration(this, context);
    }
}
