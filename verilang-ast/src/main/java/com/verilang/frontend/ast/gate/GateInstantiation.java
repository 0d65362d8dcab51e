package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;

/**
 * 门级实例化信封：类型标签 + 对应的实例集合
 */
public class GateInstantiation extends AstNode {
    private final GateType type;
    private final AstNode gates;

    public GateInstantiation(GateType type, AstNode gates) {
        this.type = type;
        this.gates = gates;
    }

    public GateType getType() {
        return type;
    }

    public AstNode getGates() {
        return gates;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGateInstantiation(this, context);
    }

    /**
     * 门类别，每种类别绑定一种实例集合类型
     */
    public enum GateType {
        CMOS(Switches.class),
        MOS(Switches.class),
        PASS(Switches.class),
        ENABLE(EnableGateInstances.class),
        N_OUTPUT(NOutputGateInstances.class),
        N_INPUT(NInputGateInstances.class),
        PASS_EN(PassEnableSwitches.class),
        PULL(PullGates.class);

        private final Class<? extends AstNode> payloadType;

        GateType(Class<? extends AstNode> payloadType) {
            this.payloadType = payloadType;
        }

        public Class<? extends AstNode> getPayloadType() {
            return payloadType;
        }
    }
}
