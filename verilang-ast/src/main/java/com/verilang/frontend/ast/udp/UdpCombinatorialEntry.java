package com.verilang.frontend.ast.udp;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;

/**
 * 组合 UDP 真值表的一行：inputs : output;
 */
public class UdpCombinatorialEntry extends AstNode {
    private final AstList<LevelSymbol> inputLevels;
    private final NextState outputSymbol;

    public UdpCombinatorialEntry(AstList<LevelSymbol> inputLevels, NextState outputSymbol) {
        this.inputLevels = inputLevels;
        this.outputSymbol = outputSymbol;
    }

    public AstList<LevelSymbol> getInputLevels() {
        return inputLevels;
    }

    public NextState getOutputSymbol() {
        return outputSymbol;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUdpCombinatorialEntry(this, context);
    }
}
