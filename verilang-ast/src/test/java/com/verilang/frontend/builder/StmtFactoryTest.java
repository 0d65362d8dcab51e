package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.Delay3;
import com.verilang.frontend.ast.DriveStrength;
import com.verilang.frontend.ast.NumberLiteral;
import com.verilang.frontend.ast.PrimitiveStrength;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;
import com.verilang.frontend.ast.expr.Primary;
import com.verilang.frontend.ast.stmt.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("语句构造测试")
class StmtFactoryTest {

    private AstArena arena;
    private AstConfig config;
    private AstFactory f;

    @BeforeEach
    void setUp() {
        arena = new AstArena();
        config = new AstConfig();
        f = new AstFactory(arena, config);
    }

    private Expression id(String name) {
        return f.newPrimaryExpression(f.newPrimary(Primary.PrimaryValueType.IDENTIFIER, f.newIdentifier(name)));
    }

    private Expression number(String digits) {
        NumberLiteral n = f.newNumber(NumberLiteral.NumberBase.DECIMAL, digits);
        return f.newPrimaryExpression(f.newConstantPrimary(Primary.PrimaryValueType.NUMBER, n));
    }

    private Lvalue var(String name) {
        return f.newIdentifierLvalue(Lvalue.LvalueType.VAR_IDENTIFIER, f.newIdentifier(name));
    }

    private Statement nullStatement() {
        return f.newStatement(null, false, StatementKind.NULL, null);
    }

    private Statement blocking(String target, String value) {
        return f.newStatement(null, false, StatementKind.ASSIGNMENT,
                f.newBlockingAssignment(var(target), id(value), null));
    }

    private static void assertViolation(Throwable thrown, AstViolation violation) {
        assertThat(thrown).isInstanceOf(AstConstructionException.class);
        assertThat(((AstConstructionException) thrown).getViolation()).isEqualTo(violation);
    }

    // ============ 语句信封 ============

    @Nested
    @DisplayName("语句信封")
    class Envelope {

        @Test
        @DisplayName("载荷与种类匹配")
        void testPayload() {
            Statement s = f.newStatement(null, true, StatementKind.DISABLE, f.newDisableStatement(f.newIdentifier("blk")));

            assertThat(s.getKind()).isEqualTo(StatementKind.DISABLE);
            assertThat(s.isFunctionStatement()).isTrue();
            assertThat(s.isGenerateStatement()).isFalse();
            assertThat(s.getPayload(DisableStatement.class).getIdentifier().getName()).isEqualTo("blk");
        }

        @Test
        @DisplayName("载荷与种类不匹配被拒绝，arena 不变")
        void testPayloadMismatch() {
            WaitStatement wait = f.newWaitStatement(id("ready"), null);
            int before = arena.size();

            Throwable thrown = catchThrowable(() -> f.newStatement(null, false, StatementKind.LOOP, wait));

            assertViolation(thrown, AstViolation.STATEMENT_PAYLOAD_MISMATCH);
            assertThat(arena.size()).isEqualTo(before);
        }

        @Test
        @DisplayName("空语句不带载荷")
        void testNullStatement() {
            assertThat(nullStatement().getPayload()).isNull();

            Throwable thrown = catchThrowable(() ->
                    f.newStatement(null, false, StatementKind.NULL, f.newIdentifier("x")));
            assertViolation(thrown, AstViolation.STATEMENT_PAYLOAD_MISMATCH);
        }

        @Test
        @DisplayName("非 NULL 种类必须有载荷")
        void testMissingPayload() {
            Throwable thrown = catchThrowable(() -> f.newStatement(null, false, StatementKind.CASE, null));

            assertViolation(thrown, AstViolation.STATEMENT_PAYLOAD_MISMATCH);
        }

        @Test
        @DisplayName("事件触发语句携带标识符")
        void testEventTrigger() {
            Statement s = f.newStatement(null, false, StatementKind.EVENT_TRIGGER, f.newIdentifier("done"));

            assertThat(s.getPayload()).isInstanceOf(com.verilang.frontend.ast.Identifier.class);
        }

        @Test
        @DisplayName("按错误类型取载荷抛出异常")
        void testGetPayloadWrongType() {
            Statement s = blocking("a", "b");

            assertThatThrownBy(() -> s.getPayload(LoopStatement.class)).isInstanceOf(IllegalStateException.class);
        }
    }

    // ============ 赋值 ============

    @Nested
    @DisplayName("赋值")
    class Assignments {

        @Test
        @DisplayName("阻塞与非阻塞赋值")
        void testProcedural() {
            Lvalue q = var("q");
            Expression d = id("d");

            ProceduralAssignment blocking = f.newBlockingAssignment(q, d, null);
            ProceduralAssignment nonblocking = f.newNonblockingAssignment(q, d, null);

            assertThat(blocking.getKind()).isEqualTo(Assignment.AssignmentKind.BLOCKING);
            assertThat(blocking.isBlocking()).isTrue();
            assertThat(nonblocking.getKind()).isEqualTo(Assignment.AssignmentKind.NONBLOCKING);
            assertThat(nonblocking.getLvalue()).isSameAs(q);
            assertThat(nonblocking.getExpression()).isSameAs(d);
            assertThat(nonblocking.getDelayOrEvent()).isNull();
        }

        @Test
        @DisplayName("连续赋值保留强度与延迟")
        void testContinuous() {
            AstList<SingleAssignment> list = f.newList();
            list.append(f.newSingleAssignment(var("y"), id("a")));
            DriveStrength strength = f.newDriveStrength(PrimitiveStrength.STRONG, PrimitiveStrength.PULL);
            Delay3 delay = f.newDelay3(number("5"), null, null);

            ContinuousAssignment c = f.newContinuousAssignment(list, strength, delay);

            assertThat(c.getKind()).isEqualTo(Assignment.AssignmentKind.CONTINUOUS);
            assertThat(c.getAssignments()).isSameAs(list);
            assertThat(c.getDriveStrength()).isSameAs(strength);
            assertThat(c.getDelay()).isSameAs(delay);
        }

        @Test
        @DisplayName("复合赋值携带完整赋值")
        void testHybridAssignment() {
            SingleAssignment s = f.newSingleAssignment(var("i"), number("2"));

            HybridAssignment h = f.newHybridAssignment(HybridAssignment.HybridAssignmentType.ADD_ASSIGN, s);

            assertThat(h.getAssignment()).isSameAs(s);
            assertThat(h.getLvalue()).isNull();
        }

        @Test
        @DisplayName("自增只携带 lvalue")
        void testIncrement() {
            Lvalue i = var("i");

            HybridAssignment h = f.newHybridLvalueAssignment(HybridAssignment.HybridAssignmentType.POST_INCREMENT, i);

            assertThat(h.getLvalue()).isSameAs(i);
            assertThat(h.getAssignment()).isNull();
        }

        @Test
        @DisplayName("形式与运算符不匹配被拒绝")
        void testHybridFormMismatch() {
            Lvalue i = var("i");
            SingleAssignment s = f.newSingleAssignment(var("j"), number("1"));

            assertViolation(catchThrowable(() ->
                    f.newHybridLvalueAssignment(HybridAssignment.HybridAssignmentType.ADD_ASSIGN, i)),
                    AstViolation.HYBRID_ASSIGNMENT_FORM);
            assertViolation(catchThrowable(() ->
                    f.newHybridAssignment(HybridAssignment.HybridAssignmentType.PRE_DECREMENT, s)),
                    AstViolation.HYBRID_ASSIGNMENT_FORM);
        }
    }

    // ============ 循环 ============

    @Nested
    @DisplayName("循环")
    class Loops {

        @Test
        @DisplayName("forever 只有循环体")
        void testForever() {
            Statement body = nullStatement();

            LoopStatement loop = f.newForeverLoop(body);

            assertThat(loop.getType()).isEqualTo(LoopStatement.LoopType.FOREVER);
            assertThat(loop.getBody()).isSameAs(body);
            assertThat(loop.getCondition()).isNull();
            assertThat(loop.getInitial()).isNull();
            assertThat(loop.getModify()).isNull();
        }

        @Test
        @DisplayName("for 保留初始、条件与修改")
        void testFor() {
            SingleAssignment init = f.newSingleAssignment(var("i"), number("0"));
            SingleAssignment step = f.newSingleAssignment(var("i"), id("next"));
            Expression cond = id("more");

            LoopStatement loop = f.newForLoop(nullStatement(), init, step, cond);

            assertThat(loop.getType()).isEqualTo(LoopStatement.LoopType.FOR);
            assertThat(loop.getInitial()).isSameAs(init);
            assertThat(loop.getModify()).isSameAs(step);
            assertThat(loop.getCondition()).isSameAs(cond);
        }

        @Test
        @DisplayName("while 与 repeat 只有条件")
        void testWhileAndRepeat() {
            LoopStatement w = f.newWhileLoop(nullStatement(), id("busy"));
            LoopStatement r = f.newRepeatLoop(nullStatement(), number("8"));

            assertThat(w.getType()).isEqualTo(LoopStatement.LoopType.WHILE);
            assertThat(w.getInitial()).isNull();
            assertThat(r.getType()).isEqualTo(LoopStatement.LoopType.REPEAT);
            assertThat(r.getCondition()).isNotNull();
            assertThat(r.getModify()).isNull();
        }

        @Test
        @DisplayName("while 缺少条件被拒绝")
        void testWhileWithoutCondition() {
            assertViolation(catchThrowable(() -> f.newWhileLoop(nullStatement(), null)), AstViolation.MISSING_CHILD);
        }
    }

    // ============ case ============

    @Nested
    @DisplayName("case")
    class Cases {

        private CaseItem item(String value) {
            AstList<Expression> conditions = f.newList();
            conditions.append(number(value));
            return f.newCaseItem(conditions, nullStatement());
        }

        @Test
        @DisplayName("缓存唯一的 default")
        void testSingleDefault() {
            AstList<CaseItem> items = f.newList();
            items.append(item("0"));
            CaseItem dflt = f.newDefaultCaseItem(nullStatement());
            items.append(dflt);

            CaseStatement cs = f.newCaseStatement(id("sel"), items, CaseStatement.CaseType.CASEZ);

            assertThat(cs.getDefaultItem()).isSameAs(dflt);
            assertThat(cs.hasDefault()).isTrue();
            assertThat(cs.getType()).isEqualTo(CaseStatement.CaseType.CASEZ);
            assertThat(cs.isFunction()).isFalse();
        }

        @Test
        @DisplayName("没有 default 时为 null")
        void testNoDefault() {
            AstList<CaseItem> items = f.newList();
            items.append(item("0"));

            CaseStatement cs = f.newCaseStatement(id("sel"), items, CaseStatement.CaseType.CASE);

            assertThat(cs.getDefaultItem()).isNull();
            assertThat(cs.hasDefault()).isFalse();
        }

        @Test
        @DisplayName("FIRST_WINS：多个 default 时缓存第一个")
        void testDuplicateDefaultFirstWins() {
            CaseItem i0 = item("0");
            CaseItem i1 = f.newDefaultCaseItem(nullStatement());
            CaseItem i2 = f.newDefaultCaseItem(nullStatement());
            AstList<CaseItem> items = f.newList();
            items.append(i0);
            items.append(i1);
            items.append(i2);

            CaseStatement cs = f.newCaseStatement(id("sel"), items, CaseStatement.CaseType.CASE);

            assertThat(cs.getDefaultItem()).isSameAs(i1);
            assertThat(cs.getCases().asList()).containsExactly(i0, i1, i2);
        }

        @Test
        @DisplayName("REJECT：多个 default 时构造失败")
        void testDuplicateDefaultRejected() {
            config.setDuplicateDefaultPolicy(AstConfig.DuplicateDefaultPolicy.REJECT);
            AstList<CaseItem> items = f.newList();
            items.append(item("0"));
            items.append(f.newDefaultCaseItem(nullStatement()));
            items.append(f.newDefaultCaseItem(nullStatement()));
            Expression sel = id("sel");
            int before = arena.size();

            Throwable thrown = catchThrowable(() -> f.newCaseStatement(sel, items, CaseStatement.CaseType.CASE));

            assertViolation(thrown, AstViolation.DUPLICATE_DEFAULT_CASE);
            assertThat(arena.size()).isEqualTo(before);
        }

        @Test
        @DisplayName("default 查找在 null 分支处停止")
        void testDefaultScanStopsAtNull() {
            CaseItem dflt = f.newDefaultCaseItem(nullStatement());
            AstList<CaseItem> items = f.newList();
            items.append(item("0"));
            items.append(null);
            items.append(dflt);

            CaseStatement cs = f.newCaseStatement(id("sel"), items, CaseStatement.CaseType.CASE);

            assertThat(cs.getDefaultItem()).isNull();
            assertThat(cs.getCases().size()).isEqualTo(3);
        }

        @Test
        @DisplayName("null 之后的重复 default 不计入")
        void testDuplicateAfterNullNotCounted() {
            config.setDuplicateDefaultPolicy(AstConfig.DuplicateDefaultPolicy.REJECT);
            CaseItem first = f.newDefaultCaseItem(nullStatement());
            AstList<CaseItem> items = f.newList();
            items.append(first);
            items.append(null);
            items.append(f.newDefaultCaseItem(nullStatement()));

            CaseStatement cs = f.newCaseStatement(id("sel"), items, CaseStatement.CaseType.CASE);

            assertThat(cs.getDefaultItem()).isSameAs(first);
        }

        @Test
        @DisplayName("REJECT 不影响单个 default")
        void testRejectPolicySingleDefault() {
            config.setDuplicateDefaultPolicy(AstConfig.DuplicateDefaultPolicy.REJECT);
            AstList<CaseItem> items = f.newList();
            items.append(f.newDefaultCaseItem(nullStatement()));

            assertThat(f.newCaseStatement(id("sel"), items, CaseStatement.CaseType.CASEX).hasDefault()).isTrue();
        }

        @Test
        @DisplayName("函数体中的 case")
        void testFunctionCase() {
            AstList<CaseItem> items = f.newList();
            items.append(item("1"));

            assertThat(f.newCaseStatement(id("op"), items, CaseStatement.CaseType.CASE, true).isFunction()).isTrue();
        }

        @Test
        @DisplayName("default 分支没有条件")
        void testDefaultItem() {
            CaseItem dflt = f.newDefaultCaseItem(nullStatement());

            assertThat(dflt.isDefault()).isTrue();
            assertThat(dflt.getConditions().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("普通分支必须有条件")
        void testItemWithoutConditions() {
            AstList<Expression> empty = f.newList();

            assertViolation(catchThrowable(() -> f.newCaseItem(empty, nullStatement())), AstViolation.MISSING_CHILD);
        }
    }

    // ============ if / else ============

    @Nested
    @DisplayName("if / else")
    class IfElses {

        @Test
        @DisplayName("扩展追加到链尾：c1 加 [c2, c3] 得到 [c1, c2, c3]")
        void testExtendOrder() {
            ConditionalStatement c1 = f.newConditionalStatement(blocking("y", "a"), id("s1"));
            ConditionalStatement c2 = f.newConditionalStatement(blocking("y", "b"), id("s2"));
            ConditionalStatement c3 = f.newConditionalStatement(blocking("y", "c"), id("s3"));
            IfElse chain = f.newIfElse(c1, null);
            AstList<ConditionalStatement> more = f.newList();
            more.append(c2);
            more.append(c3);

            f.extendIfElse(chain, more);

            assertThat(chain.getConditionalStatements().asList()).containsExactly(c1, c2, c3);
            assertThat(more.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("扩展 null 无效果")
        void testExtendNull() {
            IfElse chain = f.newIfElse(f.newConditionalStatement(nullStatement(), id("s")), null);

            f.extendIfElse(chain, null);

            assertThat(chain.getConditionalStatements().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("保留 else 分支")
        void testElse() {
            Statement otherwise = blocking("y", "z");

            IfElse chain = f.newIfElse(f.newConditionalStatement(nullStatement(), id("s")), otherwise);

            assertThat(chain.hasElse()).isTrue();
            assertThat(chain.getElseStatement()).isSameAs(otherwise);
        }
    }

    // ============ 其它语句 ============

    @Nested
    @DisplayName("其它语句")
    class Others {

        @Test
        @DisplayName("任务调用")
        void testTaskEnable() {
            AstList<Expression> args = f.newList();
            args.append(f.newStringExpression("done"));

            TaskEnableStatement t = f.newTaskEnableStatement(args, f.newIdentifier("$display"), true);

            assertThat(t.getExpressions()).isSameAs(args);
            assertThat(t.getIdentifier().getName()).isEqualTo("$display");
            assertThat(t.isSystem()).isTrue();
        }

        @Test
        @DisplayName("语句块")
        void testBlock() {
            AstList<Statement> body = f.newList();
            body.append(blocking("a", "b"));

            StatementBlock block = f.newStatementBlock(StatementBlock.BlockType.PARALLEL, f.newIdentifier("fork1"),
                    null, body);

            assertThat(block.getType()).isEqualTo(StatementBlock.BlockType.PARALLEL);
            assertThat(block.getIdentifier().getName()).isEqualTo("fork1");
            assertThat(block.getDeclarations()).isNull();
            assertThat(block.getStatements()).isSameAs(body);
        }

        @Test
        @DisplayName("wait 语句")
        void testWait() {
            Expression ready = id("ready");
            Statement then = nullStatement();

            WaitStatement w = f.newWaitStatement(ready, then);

            assertThat(w.getExpression()).isSameAs(ready);
            assertThat(w.getStatement()).isSameAs(then);
        }
    }
}
