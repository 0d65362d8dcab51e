package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;

/**
 * 同类型开关的一组实例
 *
 * <p>实例类型由开关分类决定：CMOS 为 {@link CmosSwitchInstance}，
 * MOS 为 {@link MosSwitchInstance}，PASS 为 {@link PassSwitchInstance}。</p>
 */
public class Switches extends AstNode {
    private final SwitchGate type;
    private final AstList<AstNode> switches;

    public Switches(SwitchGate type, AstList<AstNode> switches) {
        this.type = type;
        this.switches = switches;
    }

    public SwitchGate getType() {
        return type;
    }

    public AstList<AstNode> getSwitches() {
        return switches;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSwitches(this, context);
    }
}
