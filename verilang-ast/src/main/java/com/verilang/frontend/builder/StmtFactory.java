package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AttributeList;
import com.verilang.frontend.ast.Delay3;
import com.verilang.frontend.ast.DriveStrength;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;
import com.verilang.frontend.ast.stmt.*;
import com.verilang.frontend.ast.timing.TimingControlStatement;

import java.util.logging.Logger;

/**
 * 语句 / 赋值 / 控制结构的构造辅助类
 */
class StmtFactory {
    private static final Logger LOG = Logger.getLogger(StmtFactory.class.getName());

    final AstFactory factory;

    StmtFactory(AstFactory factory) {
        this.factory = factory;
    }

    // ============ 语句信封 ============

    Statement newStatement(AttributeList attributes, boolean functionStatement, StatementKind kind,
                           AstNode payload) {
        checkPayload("statement", kind, payload);
        return factory.register(new Statement(kind, attributes, functionStatement, false, payload));
    }

    Statement newGenerateItem(StatementKind kind, AstNode payload) {
        checkPayload("generate item", kind, payload);
        return factory.register(new Statement(kind, null, false, true, payload));
    }

    private void checkPayload(String construct, StatementKind kind, AstNode payload) {
        factory.requireChild(kind, construct, "kind");
        if (kind.accepts(payload)) {
            return;
        }
        String detail = payload == null
                ? kind + " requires a " + kind.getPayloadType().getSimpleName()
                : kind + " cannot carry " + payload.getClass().getSimpleName();
        throw new AstConstructionException(AstViolation.STATEMENT_PAYLOAD_MISMATCH, construct, detail);
    }

    // ============ 赋值 ============

    SingleAssignment newSingleAssignment(Lvalue lvalue, Expression expression) {
        factory.requireChild(lvalue, "single assignment", "lvalue");
        factory.requireChild(expression, "single assignment", "expression");
        return factory.register(new SingleAssignment(lvalue, expression));
    }

    ProceduralAssignment newProceduralAssignment(boolean blocking, Lvalue lvalue, Expression expression,
                                                 TimingControlStatement delayOrEvent) {
        String construct = blocking ? "blocking assignment" : "nonblocking assignment";
        factory.requireChild(lvalue, construct, "lvalue");
        factory.requireChild(expression, construct, "expression");
        return factory.register(new ProceduralAssignment(blocking, lvalue, expression, delayOrEvent));
    }

    ContinuousAssignment newContinuousAssignment(AstList<SingleAssignment> assignments,
                                                 DriveStrength driveStrength, Delay3 delay) {
        factory.requireChild(assignments, "continuous assignment", "assignments");
        return factory.register(new ContinuousAssignment(assignments, driveStrength, delay));
    }

    HybridAssignment newHybridAssignment(HybridAssignment.HybridAssignmentType type,
                                         SingleAssignment assignment) {
        factory.requireChild(type, "hybrid assignment", "type");
        factory.requireChild(assignment, "hybrid assignment", "assignment");
        factory.check(!type.isLvalueOnly(), AstViolation.HYBRID_ASSIGNMENT_FORM, "hybrid assignment",
                type + " takes only an lvalue");
        return factory.register(HybridAssignment.ofAssignment(type, assignment));
    }

    HybridAssignment newHybridLvalueAssignment(HybridAssignment.HybridAssignmentType type, Lvalue lvalue) {
        factory.requireChild(type, "hybrid assignment", "type");
        factory.requireChild(lvalue, "hybrid assignment", "lvalue");
        factory.check(type.isLvalueOnly(), AstViolation.HYBRID_ASSIGNMENT_FORM, "hybrid assignment",
                type + " requires a full assignment");
        return factory.register(HybridAssignment.ofLvalue(type, lvalue));
    }

    // ============ 循环 ============

    LoopStatement newForeverLoop(Statement body) {
        return factory.register(new LoopStatement(LoopStatement.LoopType.FOREVER, body, null, null, null));
    }

    LoopStatement newForLoop(Statement body, SingleAssignment initial, SingleAssignment modify,
                             Expression condition) {
        factory.requireChild(initial, "for loop", "initial assignment");
        factory.requireChild(condition, "for loop", "condition");
        factory.requireChild(modify, "for loop", "modify assignment");
        return factory.register(new LoopStatement(LoopStatement.LoopType.FOR, body, initial, condition, modify));
    }

    LoopStatement newWhileLoop(Statement body, Expression condition) {
        factory.requireChild(condition, "while loop", "condition");
        return factory.register(new LoopStatement(LoopStatement.LoopType.WHILE, body, null, condition, null));
    }

    LoopStatement newRepeatLoop(Statement body, Expression count) {
        factory.requireChild(count, "repeat loop", "count");
        return factory.register(new LoopStatement(LoopStatement.LoopType.REPEAT, body, null, count, null));
    }

    // ============ case ============

    CaseItem newCaseItem(AstList<Expression> conditions, Statement body) {
        factory.requireChild(conditions, "case item", "conditions");
        factory.check(!conditions.isEmpty(), AstViolation.MISSING_CHILD, "case item", "no conditions");
        return factory.register(new CaseItem(conditions, body, false));
    }

    CaseItem newDefaultCaseItem(Statement body) {
        AstList<Expression> conditions = new AstList<>();
        return factory.register(new CaseItem(conditions, body, true), conditions);
    }

    /**
     * 扫描一次分支列表，缓存第一个 default；多个 default 的处理由
     * {@link AstConfig#getDuplicateDefaultPolicy()} 决定。
     * 扫描在第一个 null 分支处停止，之后的分支不参与 default 查找。
     */
    CaseStatement newCaseStatement(Expression expression, AstList<CaseItem> cases, CaseStatement.CaseType type,
                                   boolean function) {
        factory.requireChild(expression, "case statement", "selector");
        factory.requireChild(cases, "case statement", "items");
        factory.requireChild(type, "case statement", "type");

        CaseItem defaultItem = null;
        int defaults = 0;
        for (CaseItem item : cases) {
            if (item == null) {
                break;
            }
            if (item.isDefault()) {
                if (defaultItem == null) {
                    defaultItem = item;
                }
                defaults++;
            }
        }
        if (defaults > 1) {
            factory.check(factory.getConfig().getDuplicateDefaultPolicy() != AstConfig.DuplicateDefaultPolicy.REJECT,
                    AstViolation.DUPLICATE_DEFAULT_CASE, "case statement", defaults + " default items");
            LOG.warning("case 语句包含 " + defaults + " 个 default 分支，只有第一个生效");
        }
        return factory.register(new CaseStatement(expression, cases, type, defaultItem, function));
    }

    // ============ if / else ============

    ConditionalStatement newConditionalStatement(Statement statement, Expression condition) {
        factory.requireChild(condition, "conditional statement", "condition");
        return factory.register(new ConditionalStatement(statement, condition));
    }

    IfElse newIfElse(ConditionalStatement ifCondition, Statement elseStatement) {
        factory.requireChild(ifCondition, "if-else", "if condition");
        AstList<ConditionalStatement> chain = new AstList<>();
        chain.append(ifCondition);
        return factory.register(new IfElse(chain, elseStatement), chain);
    }

    /**
     * 追加 else-if 分支到链尾，先加入的分支优先判断。
     * 与拼接的头插相反，两者不要统一。
     */
    void extendIfElse(IfElse ifElse, AstList<ConditionalStatement> statements) {
        factory.requireChild(ifElse, "if-else", "if-else");
        if (statements == null) {
            return;
        }
        ifElse.getConditionalStatements().concat(statements);
    }

    // ============ 其它语句 ============

    WaitStatement newWaitStatement(Expression expression, Statement statement) {
        factory.requireChild(expression, "wait statement", "expression");
        return factory.register(new WaitStatement(expression, statement));
    }

    DisableStatement newDisableStatement(Identifier identifier) {
        factory.requireChild(identifier, "disable statement", "identifier");
        return factory.register(new DisableStatement(identifier));
    }

    TaskEnableStatement newTaskEnableStatement(AstList<Expression> expressions, Identifier identifier,
                                               boolean system) {
        factory.requireChild(identifier, "task enable", "identifier");
        return factory.register(new TaskEnableStatement(expressions, identifier, system));
    }

    StatementBlock newStatementBlock(StatementBlock.BlockType type, Identifier identifier,
                                     AstList<Statement> declarations, AstList<Statement> statements) {
        factory.requireChild(type, "statement block", "type");
        return factory.register(new StatementBlock(type, identifier, declarations, statements));
    }
}
