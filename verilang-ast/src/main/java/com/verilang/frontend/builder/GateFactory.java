package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.Delay2;
import com.verilang.frontend.ast.Delay3;
import com.verilang.frontend.ast.DriveStrength;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.PrimitiveStrength;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;
import com.verilang.frontend.ast.gate.*;

/**
 * 门级原语与开关的构造辅助类
 */
class GateFactory {

    final AstFactory factory;

    GateFactory(AstFactory factory) {
        this.factory = factory;
    }

    // ============ 开关 ============

    SwitchGate newSwitchGateD3(SwitchType type, Delay3 delay) {
        factory.requireChild(type, "switch gate", "type");
        factory.check(!type.usesDelay2(), AstViolation.SWITCH_DELAY_MISMATCH, "switch gate",
                type.getKeyword() + " takes a two-value delay");
        return factory.register(SwitchGate.withDelay3(type, delay));
    }

    SwitchGate newSwitchGateD2(SwitchType type, Delay2 delay) {
        factory.requireChild(type, "switch gate", "type");
        factory.check(type.usesDelay2(), AstViolation.SWITCH_DELAY_MISMATCH, "switch gate",
                type.getKeyword() + " takes a three-value delay");
        return factory.register(SwitchGate.withDelay2(type, delay));
    }

    Switches newSwitches(SwitchGate type, AstList<AstNode> switches) {
        factory.requireChild(type, "switches", "switch gate");
        factory.requireChild(switches, "switches", "instances");
        Class<? extends AstNode> expected = instanceClass(type.getType().getCategory());
        for (AstNode instance : switches) {
            factory.check(expected.isInstance(instance), AstViolation.SWITCH_INSTANCE_MISMATCH, "switches",
                    type.getType().getKeyword() + " expects " + expected.getSimpleName());
        }
        return factory.register(new Switches(type, switches));
    }

    private static Class<? extends AstNode> instanceClass(SwitchType.SwitchCategory category) {
        switch (category) {
            case CMOS:
                return CmosSwitchInstance.class;
            case MOS:
                return MosSwitchInstance.class;
            default:
                return PassSwitchInstance.class;
        }
    }

    PassSwitchInstance newPassSwitchInstance(Identifier name, Lvalue terminal1, Lvalue terminal2) {
        factory.requireChild(terminal1, "pass switch", "terminal 1");
        factory.requireChild(terminal2, "pass switch", "terminal 2");
        return factory.register(new PassSwitchInstance(name, terminal1, terminal2));
    }

    MosSwitchInstance newMosSwitchInstance(Identifier name, Lvalue output, Expression enable, Expression input) {
        factory.requireChild(output, "mos switch", "output terminal");
        factory.requireChild(enable, "mos switch", "enable terminal");
        factory.requireChild(input, "mos switch", "input terminal");
        return factory.register(new MosSwitchInstance(name, output, enable, input));
    }

    CmosSwitchInstance newCmosSwitchInstance(Identifier name, Lvalue output, Expression ncontrol,
                                             Expression pcontrol, Expression input) {
        factory.requireChild(output, "cmos switch", "output terminal");
        factory.requireChild(ncontrol, "cmos switch", "n-control terminal");
        factory.requireChild(pcontrol, "cmos switch", "p-control terminal");
        factory.requireChild(input, "cmos switch", "input terminal");
        return factory.register(new CmosSwitchInstance(name, output, ncontrol, pcontrol, input));
    }

    PassEnableSwitch newPassEnableSwitch(Identifier name, Lvalue terminal1, Lvalue terminal2, Expression enable) {
        factory.requireChild(terminal1, "pass enable switch", "terminal 1");
        factory.requireChild(terminal2, "pass enable switch", "terminal 2");
        factory.requireChild(enable, "pass enable switch", "enable");
        return factory.register(new PassEnableSwitch(name, terminal1, terminal2, enable));
    }

    PassEnableSwitches newPassEnableSwitches(PassEnableSwitches.PassEnableSwitchType type, Delay2 delay,
                                             AstList<PassEnableSwitch> switches) {
        factory.requireChild(type, "pass enable switches", "type");
        factory.requireChild(switches, "pass enable switches", "instances");
        return factory.register(new PassEnableSwitches(type, delay, switches));
    }

    // ============ 逻辑门 ============

    NInputGateInstance newNInputGateInstance(Identifier name, AstList<Expression> inputs, Lvalue output) {
        factory.requireChild(inputs, "n-input gate", "input terminals");
        factory.requireChild(output, "n-input gate", "output terminal");
        return factory.register(new NInputGateInstance(name, inputs, output));
    }

    NInputGateInstances newNInputGateInstances(NInputGateInstances.NInputGateType type, Delay3 delay,
                                               DriveStrength driveStrength, AstList<NInputGateInstance> instances) {
        factory.requireChild(type, "n-input gates", "type");
        factory.requireChild(instances, "n-input gates", "instances");
        return factory.register(new NInputGateInstances(type, delay, driveStrength, instances));
    }

    EnableGateInstance newEnableGateInstance(Identifier name, Lvalue output, Expression enable, Expression input) {
        factory.requireChild(output, "enable gate", "output terminal");
        factory.requireChild(enable, "enable gate", "enable terminal");
        factory.requireChild(input, "enable gate", "input terminal");
        return factory.register(new EnableGateInstance(name, output, enable, input));
    }

    EnableGateInstances newEnableGateInstances(EnableGateInstances.EnableGateType type, Delay3 delay,
                                               DriveStrength driveStrength, AstList<EnableGateInstance> instances) {
        factory.requireChild(type, "enable gates", "type");
        factory.requireChild(instances, "enable gates", "instances");
        return factory.register(new EnableGateInstances(type, delay, driveStrength, instances));
    }

    NOutputGateInstance newNOutputGateInstance(Identifier name, AstList<Lvalue> outputs, Expression input) {
        factory.requireChild(outputs, "n-output gate", "output terminals");
        factory.requireChild(input, "n-output gate", "input terminal");
        return factory.register(new NOutputGateInstance(name, outputs, input));
    }

    NOutputGateInstances newNOutputGateInstances(NOutputGateInstances.NOutputGateType type, Delay2 delay,
                                                 DriveStrength driveStrength,
                                                 AstList<NOutputGateInstance> instances) {
        factory.requireChild(type, "n-output gates", "type");
        factory.requireChild(instances, "n-output gates", "instances");
        return factory.register(new NOutputGateInstances(type, delay, driveStrength, instances));
    }

    // ============ 上拉 / 下拉 ============

    PrimitivePullStrength newPrimitivePullStrength(PullDirection direction, PrimitiveStrength strength1,
                                                   PrimitiveStrength strength0) {
        factory.requireChild(direction, "pull strength", "direction");
        return factory.register(new PrimitivePullStrength(direction, strength1, strength0));
    }

    PullStrength newPullStrength(PrimitiveStrength strength1, PrimitiveStrength strength2) {
        return factory.register(new PullStrength(strength1, strength2));
    }

    PullGateInstance newPullGateInstance(Identifier name, Lvalue output) {
        factory.requireChild(output, "pull gate", "output terminal");
        return factory.register(new PullGateInstance(name, output));
    }

    PullGates newPullGates(PrimitivePullStrength pullStrength, AstList<PullGateInstance> instances) {
        factory.requireChild(instances, "pull gates", "instances");
        return factory.register(new PullGates(pullStrength, instances));
    }

    // ============ 实例化信封 ============

    GateInstantiation newGateInstantiation(GateInstantiation.GateType type, AstNode gates) {
        factory.requireChild(type, "gate instantiation", "type");
        factory.requireChild(gates, "gate instantiation", "gates");
        factory.check(type.getPayloadType().isInstance(gates), AstViolation.GATE_PAYLOAD_MISMATCH,
                "gate instantiation", type + " cannot hold " + gates.getClass().getSimpleName());
        if (gates instanceof Switches) {
            SwitchType switchType = ((Switches) gates).getType().getType();
            factory.check(switchType.getCategory().getGateType() == type, AstViolation.GATE_PAYLOAD_MISMATCH,
                    "gate instantiation", type + " cannot hold " + switchType.getKeyword() + " switches");
        }
        return factory.register(new GateInstantiation(type, gates));
    }
}
