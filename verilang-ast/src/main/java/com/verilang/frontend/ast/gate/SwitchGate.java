package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Delay2;
import com.verilang.frontend.ast.Delay3;

/**
 * 开关类型及其延迟，delay2 / delay3 只有一个按类型存在
 */
public class SwitchGate extends AstNode {
    private final SwitchType type;
    private final Delay3 delay3;
    private final Delay2 delay2;

    private SwitchGate(SwitchType type, Delay3 delay3, Delay2 delay2) {
        this.type = type;
        this.delay3 = delay3;
        this.delay2 = delay2;
    }

    public static SwitchGate withDelay3(SwitchType type, Delay3 delay) {
        return new SwitchGate(type, delay, null);
    }

    public static SwitchGate withDelay2(SwitchType type, Delay2 delay) {
        return new SwitchGate(type, null, delay);
    }

    public SwitchType getType() {
        return type;
    }

    public Delay3 getDelay3() {
        return delay3;
    }

    public Delay2 getDelay2() {
        return delay2;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchGate(this, context);
    }
}
