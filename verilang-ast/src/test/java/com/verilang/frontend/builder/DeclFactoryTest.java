package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.Delay3;
import com.verilang.frontend.ast.DriveStrength;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.NumberLiteral;
import com.verilang.frontend.ast.PrimitiveStrength;
import com.verilang.frontend.ast.Range;
import com.verilang.frontend.ast.decl.*;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;
import com.verilang.frontend.ast.expr.Primary;
import com.verilang.frontend.ast.stmt.SingleAssignment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("声明构造测试")
class DeclFactoryTest {

    private AstArena arena;
    private AstFactory f;

    @BeforeEach
    void setUp() {
        arena = new AstArena();
        f = new AstFactory(arena, new AstConfig());
    }

    private Expression number(String digits) {
        NumberLiteral n = f.newNumber(NumberLiteral.NumberBase.DECIMAL, digits);
        return f.newPrimaryExpression(f.newConstantPrimary(Primary.PrimaryValueType.NUMBER, n));
    }

    private AstList<SingleAssignment> assignment(String name, String value) {
        Lvalue lvalue = f.newIdentifierLvalue(Lvalue.LvalueType.VAR_IDENTIFIER, f.newIdentifier(name));
        AstList<SingleAssignment> list = f.newList();
        list.append(f.newSingleAssignment(lvalue, number(value)));
        return list;
    }

    private Range range(String msb, String lsb) {
        return f.newRange(number(msb), number(lsb));
    }

    // ============ 参数声明 ============

    @Nested
    @DisplayName("参数声明")
    class Parameters {

        @Test
        @DisplayName("普通参数保留位宽和符号")
        void testGeneric() {
            Range r = range("7", "0");

            ParameterDeclarations p = f.newParameterDeclarations(assignment("WIDTH", "8"), true, false, r,
                    ParameterDeclarations.ParameterType.GENERIC);

            assertThat(p.getRange()).isSameAs(r);
            assertThat(p.isSignedValues()).isTrue();
            assertThat(p.isLocal()).isFalse();
            assertThat(p.getAssignments().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("带类型的参数丢弃位宽和符号")
        void testTypedSuppressesRangeAndSign() {
            for (ParameterDeclarations.ParameterType type : ParameterDeclarations.ParameterType.values()) {
                if (type == ParameterDeclarations.ParameterType.GENERIC) {
                    continue;
                }

                ParameterDeclarations p = f.newParameterDeclarations(assignment("P", "1"), true, true,
                        range("3", "0"), type);

                assertThat(p.getRange()).as(type.name()).isNull();
                assertThat(p.isSignedValues()).as(type.name()).isFalse();
                assertThat(p.isLocal()).as(type.name()).isTrue();
                assertThat(p.getType()).isEqualTo(type);
            }
        }

        @Test
        @DisplayName("缺少赋值列表被拒绝")
        void testMissingAssignments() {
            Throwable thrown = catchThrowable(() -> f.newParameterDeclarations(null, false, false, null,
                    ParameterDeclarations.ParameterType.GENERIC));

            assertThat(thrown).isInstanceOf(AstConstructionException.class);
            assertThat(((AstConstructionException) thrown).getViolation()).isEqualTo(AstViolation.MISSING_CHILD);
        }
    }

    // ============ 端口声明 ============

    @Nested
    @DisplayName("端口声明")
    class Ports {

        @Test
        @DisplayName("字段原样保存")
        void testFields() {
            AstList<Identifier> names = f.newList();
            names.append(f.newIdentifier("q"));
            names.append(f.newIdentifier("q_n"));
            Range r = range("3", "0");

            PortDeclaration p = f.newPortDeclaration(PortDirection.OUTPUT, NetType.WIRE, true, false, false, r, names);

            assertThat(p.getDirection()).isEqualTo(PortDirection.OUTPUT);
            assertThat(p.getNetType()).isEqualTo(NetType.WIRE);
            assertThat(p.isNetSigned()).isTrue();
            assertThat(p.isReg()).isFalse();
            assertThat(p.getRange()).isSameAs(r);
            assertThat(p.getPortNames().asList()).extracting(Identifier::getName).containsExactly("q", "q_n");
        }

        @Test
        @DisplayName("未给出线网类型时为 NONE")
        void testDefaultNetType() {
            AstList<Identifier> names = f.newList();
            names.append(f.newIdentifier("count"));

            PortDeclaration p = f.newPortDeclaration(PortDirection.OUTPUT, null, false, true, false, null, names);

            assertThat(p.getNetType()).isEqualTo(NetType.NONE);
            assertThat(p.isReg()).isTrue();
        }
    }

    // ============ 类型声明 ============

    @Nested
    @DisplayName("类型声明")
    class Types {

        @Test
        @DisplayName("只带类型创建，其余字段逐步填写")
        void testIncremental() {
            TypeDeclaration t = f.newTypeDeclaration(TypeDeclaration.DeclarationType.NET);

            assertThat(t.getType()).isEqualTo(TypeDeclaration.DeclarationType.NET);
            assertThat(t.getIdentifiers()).isNull();
            assertThat(t.isSigned()).isFalse();

            AstList<Identifier> names = f.newList();
            names.append(f.newIdentifier("bus"));
            Delay3 delay = f.newDelay3(number("1"), null, null);
            t.setIdentifiers(names);
            t.setNetType(NetType.TRI);
            t.setVectored(true);
            t.setDelay(delay);
            t.setRange(range("15", "0"));

            assertThat(t.getIdentifiers()).isSameAs(names);
            assertThat(t.getNetType()).isEqualTo(NetType.TRI);
            assertThat(t.isVectored()).isTrue();
            assertThat(t.isScalared()).isFalse();
            assertThat(t.getDelay()).isSameAs(delay);
            assertThat(arena.owns(t)).isTrue();
        }

        @Test
        @DisplayName("驱动强度")
        void testDriveStrength() {
            DriveStrength d = f.newDriveStrength(PrimitiveStrength.STRONG, PrimitiveStrength.WEAK);

            assertThat(d.getStrength0()).isEqualTo(PrimitiveStrength.STRONG);
            assertThat(d.getStrength1()).isEqualTo(PrimitiveStrength.WEAK);
        }
    }
}
