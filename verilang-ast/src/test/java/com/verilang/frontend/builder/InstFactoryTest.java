package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AttributeList;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.decl.ParameterDeclarations;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Primary;
import com.verilang.frontend.ast.inst.*;
import com.verilang.frontend.ast.stmt.Statement;
import com.verilang.frontend.ast.stmt.StatementKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("模块与 generate 构造测试")
class InstFactoryTest {

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

    private ModuleInstantiation counterInstance(String instanceName) {
        AstList<PortConnection> connections = f.newList();
        connections.append(f.newNamedPortConnection(f.newIdentifier("clk"), id("sys_clk")));
        connections.append(f.newNamedPortConnection(f.newIdentifier("q"), null));
        AstList<ModuleInstance> instances = f.newList();
        instances.append(f.newModuleInstance(f.newIdentifier(instanceName), connections));
        return f.newModuleInstantiation(f.newIdentifier("counter"), null, instances);
    }

    private static void assertViolation(Throwable thrown, AstViolation violation) {
        assertThat(thrown).isInstanceOf(AstConstructionException.class);
        assertThat(((AstConstructionException) thrown).getViolation()).isEqualTo(violation);
    }

    // ============ 模块实例化 ============

    @Nested
    @DisplayName("模块实例化")
    class Instantiation {

        @Test
        @DisplayName("按名连接")
        void testNamedConnections() {
            ModuleInstantiation m = counterInstance("u_counter");

            assertThat(m.getModuleIdentifier().getName()).isEqualTo("counter");
            assertThat(m.getModuleParameters()).isNull();
            ModuleInstance inst = m.getModuleInstances().get(0);
            assertThat(inst.getInstanceIdentifier().getName()).isEqualTo("u_counter");
            assertThat(inst.getPortConnections().asList()).allMatch(PortConnection::isNamed);
            assertThat(inst.getPortConnections().get(1).getExpression()).isNull();
        }

        @Test
        @DisplayName("按位置连接")
        void testOrderedConnections() {
            Expression clk = id("sys_clk");

            PortConnection c = f.newOrderedPortConnection(clk);

            assertThat(c.isNamed()).isFalse();
            assertThat(c.getPortName()).isNull();
            assertThat(c.getExpression()).isSameAs(clk);
        }

        @Test
        @DisplayName("参数覆盖列表")
        void testParameterOverrides() {
            AstList<PortConnection> params = f.newList();
            params.append(f.newNamedPortConnection(f.newIdentifier("WIDTH"), id("W")));
            AstList<ModuleInstance> instances = f.newList();
            instances.append(f.newModuleInstance(f.newIdentifier("u0"), null));

            ModuleInstantiation m = f.newModuleInstantiation(f.newIdentifier("fifo"), params, instances);

            assertThat(m.getModuleParameters()).isSameAs(params);
            assertThat(m.getModuleInstances().get(0).getPortConnections()).isNull();
        }

        @Test
        @DisplayName("缺少实例列表被拒绝")
        void testMissingInstances() {
            Identifier name = f.newIdentifier("fifo");

            assertViolation(catchThrowable(() -> f.newModuleInstantiation(name, null, null)),
                    AstViolation.MISSING_CHILD);
        }
    }

    // ============ generate ============

    @Nested
    @DisplayName("generate 块")
    class Generate {

        @Test
        @DisplayName("generate 项带标记")
        void testGenerateItem() {
            Statement item = f.newGenerateItem(StatementKind.MODULE_INSTANTIATION, counterInstance("u0"));

            assertThat(item.isGenerateStatement()).isTrue();
            assertThat(item.getKind()).isEqualTo(StatementKind.MODULE_INSTANTIATION);
        }

        @Test
        @DisplayName("generate 块保存项的顺序")
        void testBlock() {
            Statement first = f.newGenerateItem(StatementKind.MODULE_INSTANTIATION, counterInstance("u0"));
            Statement second = f.newGenerateItem(StatementKind.MODULE_INSTANTIATION, counterInstance("u1"));
            AstList<Statement> items = f.newList();
            items.append(first);
            items.append(second);

            GenerateBlock block = f.newGenerateBlock(f.newIdentifier("gen_counters"), items);

            assertThat(block.getIdentifier().getName()).isEqualTo("gen_counters");
            assertThat(block.getGenerateItems().asList()).containsExactly(first, second);
        }

        @Test
        @DisplayName("普通语句不能放进 generate 块")
        void testPlainStatementRejected() {
            AstList<Statement> items = f.newList();
            items.append(f.newStatement(null, false, StatementKind.MODULE_INSTANTIATION, counterInstance("u0")));
            int before = arena.size();

            Throwable thrown = catchThrowable(() -> f.newGenerateBlock(null, items));

            assertViolation(thrown, AstViolation.GENERATE_ITEM_MISMATCH);
            assertThat(arena.size()).isEqualTo(before);
        }

        @Test
        @DisplayName("generate 项载荷仍需匹配种类")
        void testGenerateItemPayload() {
            ModuleInstantiation m = counterInstance("u0");

            assertViolation(catchThrowable(() -> f.newGenerateItem(StatementKind.GATE_INSTANTIATION, m)),
                    AstViolation.STATEMENT_PAYLOAD_MISMATCH);
        }
    }

    // ============ 模块声明 ============

    @Nested
    @DisplayName("模块声明")
    class Declaration {

        @Test
        @DisplayName("模块声明保存所有部分")
        void testModuleDeclaration() {
            AttributeList attrs = f.newAttributeList(f.newAttribute(f.newIdentifier("keep"), null));
            AstList<ParameterDeclarations> params = f.newList();
            AstList<AstNode> ports = f.newList();
            ports.append(f.newIdentifier("clk"));
            AstList<Statement> items = f.newList();
            items.append(f.newStatement(null, false, StatementKind.MODULE_INSTANTIATION, counterInstance("u0")));

            ModuleDeclaration m = f.newModuleDeclaration(attrs, f.newIdentifier("top"), params, ports, items);

            assertThat(m.getIdentifier().getName()).isEqualTo("top");
            assertThat(m.getAttributes()).isSameAs(attrs);
            assertThat(m.getParameters()).isSameAs(params);
            assertThat(m.getPorts().size()).isEqualTo(1);
            assertThat(m.getItems().size()).isEqualTo(1);
            assertThat(arena.owns(m)).isTrue();
        }

        @Test
        @DisplayName("缺少模块名被拒绝")
        void testMissingName() {
            AstList<Statement> items = f.newList();

            assertViolation(catchThrowable(() -> f.newModuleDeclaration(null, null, null, null, items)),
                    AstViolation.MISSING_CHILD);
        }
    }
}
