package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.Delay2;
import com.verilang.frontend.ast.Delay3;
import com.verilang.frontend.ast.PrimitiveStrength;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;
import com.verilang.frontend.ast.expr.Primary;
import com.verilang.frontend.ast.gate.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("门级原语构造测试")
class GateFactoryTest {

    private AstArena arena;
    private AstFactory f;

    @BeforeEach
    void setUp() {
        arena = new AstArena();
        f = new AstFactory(arena, new AstConfig());
    }

    private Expression id(String name) {
        return f.newPrimaryExpression(f.newPrimary(Primary.PrimaryValueType.IDENTIFIER, f.newIdentifier(name)));
    }

    private Lvalue net(String name) {
        return f.newIdentifierLvalue(Lvalue.LvalueType.NET_IDENTIFIER, f.newIdentifier(name));
    }

    private static void assertViolation(Throwable thrown, AstViolation violation) {
        assertThat(thrown).isInstanceOf(AstConstructionException.class);
        assertThat(((AstConstructionException) thrown).getViolation()).isEqualTo(violation);
    }

    // ============ 开关 ============

    @Nested
    @DisplayName("开关")
    class SwitchGates {

        @Test
        @DisplayName("MOS / CMOS 开关带三值延迟")
        void testDelay3() {
            Delay3 delay = f.newDelay3(id("t1"), id("t2"), null);

            SwitchGate g = f.newSwitchGateD3(SwitchType.NMOS, delay);

            assertThat(g.getType()).isEqualTo(SwitchType.NMOS);
            assertThat(g.getDelay3()).isSameAs(delay);
            assertThat(g.getDelay2()).isNull();
        }

        @Test
        @DisplayName("tran 开关带双值延迟")
        void testDelay2() {
            Delay2 delay = f.newDelay2(id("t1"), null);

            SwitchGate g = f.newSwitchGateD2(SwitchType.RTRAN, delay);

            assertThat(g.getDelay2()).isSameAs(delay);
            assertThat(g.getDelay3()).isNull();
        }

        @Test
        @DisplayName("延迟形式与开关类型不符被拒绝")
        void testDelayMismatch() {
            Delay2 delay2 = f.newDelay2(id("t1"), null);
            Delay3 delay3 = f.newDelay3(id("t1"), null, null);

            assertViolation(catchThrowable(() -> f.newSwitchGateD2(SwitchType.CMOS, delay2)),
                    AstViolation.SWITCH_DELAY_MISMATCH);
            assertViolation(catchThrowable(() -> f.newSwitchGateD3(SwitchType.TRAN, delay3)),
                    AstViolation.SWITCH_DELAY_MISMATCH);
        }

        @Test
        @DisplayName("实例形状与开关类别一致")
        void testSwitches() {
            SwitchGate gate = f.newSwitchGateD3(SwitchType.PMOS, null);
            AstList<AstNode> instances = f.newList();
            instances.append(f.newMosSwitchInstance(f.newIdentifier("m0"), net("out"), id("en"), id("in")));

            Switches s = f.newSwitches(gate, instances);
            GateInstantiation g = f.newGateInstantiation(GateInstantiation.GateType.MOS, s);

            assertThat(s.getType()).isSameAs(gate);
            assertThat(s.getSwitches().get(0)).isInstanceOf(MosSwitchInstance.class);
            assertThat(g.getGates()).isSameAs(s);
        }

        @Test
        @DisplayName("实例形状不符被拒绝")
        void testSwitchInstanceMismatch() {
            SwitchGate gate = f.newSwitchGateD3(SwitchType.CMOS, null);
            AstList<AstNode> instances = f.newList();
            instances.append(f.newPassSwitchInstance(null, net("a"), net("b")));

            assertViolation(catchThrowable(() -> f.newSwitches(gate, instances)),
                    AstViolation.SWITCH_INSTANCE_MISMATCH);
        }

        @Test
        @DisplayName("CMOS 开关")
        void testCmos() {
            CmosSwitchInstance c = f.newCmosSwitchInstance(f.newIdentifier("c0"), net("out"), id("n"), id("p"),
                    id("in"));

            assertThat(c.getNcontrolTerminal()).isNotNull();
            assertThat(c.getPcontrolTerminal()).isNotNull();
            assertThat(c.getName().getName()).isEqualTo("c0");
        }

        @Test
        @DisplayName("带使能的传输开关")
        void testPassEnable() {
            AstList<PassEnableSwitch> switches = f.newList();
            switches.append(f.newPassEnableSwitch(null, net("a"), net("b"), id("en")));

            PassEnableSwitches s = f.newPassEnableSwitches(PassEnableSwitches.PassEnableSwitchType.TRANIF1, null,
                    switches);
            GateInstantiation g = f.newGateInstantiation(GateInstantiation.GateType.PASS_EN, s);

            assertThat(s.getSwitches().size()).isEqualTo(1);
            assertThat(g.getType()).isEqualTo(GateInstantiation.GateType.PASS_EN);
        }
    }

    // ============ 逻辑门 ============

    @Nested
    @DisplayName("逻辑门")
    class LogicGates {

        @Test
        @DisplayName("多输入门")
        void testNInput() {
            AstList<Expression> inputs = f.newList();
            inputs.append(id("a"));
            inputs.append(id("b"));
            AstList<NInputGateInstance> instances = f.newList();
            instances.append(f.newNInputGateInstance(f.newIdentifier("g0"), inputs, net("y")));

            NInputGateInstances gates = f.newNInputGateInstances(NInputGateInstances.NInputGateType.NAND, null,
                    f.newDriveStrength(PrimitiveStrength.STRONG, PrimitiveStrength.STRONG), instances);

            assertThat(gates.getType()).isEqualTo(NInputGateInstances.NInputGateType.NAND);
            assertThat(gates.getInstances().get(0).getInputTerminals().size()).isEqualTo(2);
            assertThat(gates.getDriveStrength()).isNotNull();
        }

        @Test
        @DisplayName("使能门")
        void testEnable() {
            AstList<EnableGateInstance> instances = f.newList();
            instances.append(f.newEnableGateInstance(null, net("y"), id("oe"), id("d")));

            EnableGateInstances gates = f.newEnableGateInstances(EnableGateInstances.EnableGateType.BUFIF1, null,
                    null, instances);

            assertThat(gates.getInstances().get(0).getEnableTerminal()).isNotNull();
        }

        @Test
        @DisplayName("多输出门")
        void testNOutput() {
            AstList<Lvalue> outputs = f.newList();
            outputs.append(net("y0"));
            outputs.append(net("y1"));
            AstList<NOutputGateInstance> instances = f.newList();
            instances.append(f.newNOutputGateInstance(null, outputs, id("a")));

            NOutputGateInstances gates = f.newNOutputGateInstances(NOutputGateInstances.NOutputGateType.BUF, null,
                    null, instances);
            GateInstantiation g = f.newGateInstantiation(GateInstantiation.GateType.N_OUTPUT, gates);

            assertThat(gates.getInstances().get(0).getOutputs().size()).isEqualTo(2);
            assertThat(g.getGates()).isSameAs(gates);
        }

        @Test
        @DisplayName("多输入门缺少输出端被拒绝")
        void testMissingOutput() {
            AstList<Expression> inputs = f.newList();

            assertViolation(catchThrowable(() -> f.newNInputGateInstance(null, inputs, null)),
                    AstViolation.MISSING_CHILD);
        }
    }

    // ============ 上拉 / 下拉 ============

    @Nested
    @DisplayName("上拉与下拉")
    class Pulls {

        @Test
        @DisplayName("上拉门带强度")
        void testPullUp() {
            PrimitivePullStrength strength = f.newPrimitivePullStrength(PullDirection.PULL_UP,
                    PrimitiveStrength.PULL, null);
            AstList<PullGateInstance> instances = f.newList();
            instances.append(f.newPullGateInstance(f.newIdentifier("pu0"), net("bus")));

            PullGates gates = f.newPullGates(strength, instances);
            GateInstantiation g = f.newGateInstantiation(GateInstantiation.GateType.PULL, gates);

            assertThat(gates.getPullStrength().getDirection()).isEqualTo(PullDirection.PULL_UP);
            assertThat(gates.getPullStrength().getStrength1()).isEqualTo(PrimitiveStrength.PULL);
            assertThat(gates.getInstances().size()).isEqualTo(1);
            assertThat(g.getType()).isEqualTo(GateInstantiation.GateType.PULL);
        }

        @Test
        @DisplayName("拉强度")
        void testPullStrength() {
            PullStrength s = f.newPullStrength(PrimitiveStrength.WEAK, PrimitiveStrength.PULL);

            assertThat(s.getStrength1()).isEqualTo(PrimitiveStrength.WEAK);
            assertThat(s.getStrength2()).isEqualTo(PrimitiveStrength.PULL);
        }
    }

    // ============ 实例化信封 ============

    @Nested
    @DisplayName("门实例化")
    class Instantiation {

        @Test
        @DisplayName("载荷与门类别不符被拒绝")
        void testPayloadMismatch() {
            AstList<PullGateInstance> instances = f.newList();
            PullGates pulls = f.newPullGates(null, instances);
            int before = arena.size();

            Throwable thrown = catchThrowable(() -> f.newGateInstantiation(GateInstantiation.GateType.N_INPUT, pulls));

            assertViolation(thrown, AstViolation.GATE_PAYLOAD_MISMATCH);
            assertThat(arena.size()).isEqualTo(before);
        }

        @Test
        @DisplayName("开关类别必须与门类别一致")
        void testSwitchCategoryMismatch() {
            SwitchGate gate = f.newSwitchGateD2(SwitchType.TRAN, null);
            AstList<AstNode> instances = f.newList();
            instances.append(f.newPassSwitchInstance(null, net("a"), net("b")));
            Switches s = f.newSwitches(gate, instances);

            assertThat(f.newGateInstantiation(GateInstantiation.GateType.PASS, s).getGates()).isSameAs(s);
            assertViolation(catchThrowable(() -> f.newGateInstantiation(GateInstantiation.GateType.MOS, s)),
                    AstViolation.GATE_PAYLOAD_MISMATCH);
        }

        @Test
        @DisplayName("每种开关只能放进自己的门类别")
        void testEverySwitchTypeCategory() {
            GateInstantiation.GateType[] switchGateTypes = {
                    GateInstantiation.GateType.CMOS, GateInstantiation.GateType.MOS, GateInstantiation.GateType.PASS
            };
            for (SwitchType switchType : SwitchType.values()) {
                SwitchGate gate = switchType.usesDelay2()
                        ? f.newSwitchGateD2(switchType, null)
                        : f.newSwitchGateD3(switchType, null);
                Switches s = f.newSwitches(gate, f.newList());
                GateInstantiation.GateType expected = expectedGateType(switchType);

                for (GateInstantiation.GateType gateType : switchGateTypes) {
                    Throwable thrown = catchThrowable(() -> f.newGateInstantiation(gateType, s));
                    if (gateType == expected) {
                        assertThat(thrown).as(switchType + " in " + gateType).isNull();
                    } else {
                        assertViolation(thrown, AstViolation.GATE_PAYLOAD_MISMATCH);
                    }
                }
            }
        }

        private GateInstantiation.GateType expectedGateType(SwitchType switchType) {
            switch (switchType) {
                case CMOS:
                case RCMOS:
                    return GateInstantiation.GateType.CMOS;
                case TRAN:
                case RTRAN:
                    return GateInstantiation.GateType.PASS;
                default:
                    return GateInstantiation.GateType.MOS;
            }
        }
    }
}
