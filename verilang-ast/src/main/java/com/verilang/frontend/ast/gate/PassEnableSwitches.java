package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Delay2;

/**
 * 同类型带使能传输管的一组实例
 */
public class PassEnableSwitches extends AstNode {
    private final PassEnableSwitchType type;
    private final Delay2 delay;
    private final AstList<PassEnableSwitch> switches;

    public PassEnableSwitches(PassEnableSwitchType type, Delay2 delay, AstList<PassEnableSwitch> switches) {
        this.type = type;
        this.delay = delay;
        this.switches = switches;
    }

    public PassEnableSwitchType getType() {
        return type;
    }

    public Delay2 getDelay() {
        return delay;
    }

    public AstList<PassEnableSwitch> getSwitches() {
        return switches;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPassEnableSwitches(this, context);
    }

    /**
     * 带使能传输管类型
     */
    public enum PassEnableSwitchType {
        TRANIF0,
        TRANIF1,
        RTRANIF0,
        RTRANIF1
    }
}
