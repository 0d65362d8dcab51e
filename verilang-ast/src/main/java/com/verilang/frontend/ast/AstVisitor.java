package com.verilang.frontend.ast;

import com.verilang.frontend.ast.expr.*;
import com.verilang.frontend.ast.stmt.*;
import com.verilang.frontend.ast.timing.*;
import com.verilang.frontend.ast.decl.*;
import com.verilang.frontend.ast.inst.*;
import com.verilang.frontend.ast.gate.*;
import com.verilang.frontend.ast.udp.*;
import com.verilang.frontend.ast.path.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 基础 ============

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitNumberLiteral(NumberLiteral node, C ctx) { return null; }

    default R visitRange(Range node, C ctx) { return null; }

    default R visitAttribute(Attribute node, C ctx) { return null; }

    default R visitAttributeList(AttributeList node, C ctx) { return null; }

    default R visitDriveStrength(DriveStrength node, C ctx) { return null; }

    default R visitDelayValue(DelayValue node, C ctx) { return null; }

    default R visitDelay2(Delay2 node, C ctx) { return null; }

    default R visitDelay3(Delay3 node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitPrimaryExpression(PrimaryExpression node, C ctx) { return null; }

    default R visitUnaryExpression(UnaryExpression node, C ctx) { return null; }

    default R visitBinaryExpression(BinaryExpression node, C ctx) { return null; }

    default R visitRangeExpression(RangeExpression node, C ctx) { return null; }

    default R visitStringExpression(StringExpression node, C ctx) { return null; }

    default R visitConditionalExpression(ConditionalExpression node, C ctx) { return null; }

    default R visitMinTypMaxExpression(MinTypMaxExpression node, C ctx) { return null; }

    default R visitPrimary(Primary node, C ctx) { return null; }

    default R visitFunctionCall(FunctionCall node, C ctx) { return null; }

    default R visitLvalue(Lvalue node, C ctx) { return null; }

    default R visitConcatenation(Concatenation node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitStatement(Statement node, C ctx) { return null; }

    default R visitSingleAssignment(SingleAssignment node, C ctx) { return null; }

    default R visitProceduralAssignment(ProceduralAssignment node, C ctx) { return null; }

    default R visitContinuousAssignment(ContinuousAssignment node, C ctx) { return null; }

    default R visitHybridAssignment(HybridAssignment node, C ctx) { return null; }

    default R visitLoopStatement(LoopStatement node, C ctx) { return null; }

    default R visitCaseItem(CaseItem node, C ctx) { return null; }

    default R visitCaseStatement(CaseStatement node, C ctx) { return null; }

    default R visitConditionalStatement(ConditionalStatement node, C ctx) { return null; }

    default R visitIfElse(IfElse node, C ctx) { return null; }

    default R visitWaitStatement(WaitStatement node, C ctx) { return null; }

    default R visitDisableStatement(DisableStatement node, C ctx) { return null; }

    default R visitTaskEnableStatement(TaskEnableStatement node, C ctx) { return null; }

    default R visitStatementBlock(StatementBlock node, C ctx) { return null; }

    // ============ 时序与事件 ============

    default R visitEventExpression(EventExpression node, C ctx) { return null; }

    default R visitEventControl(EventControl node, C ctx) { return null; }

    default R visitDelayControl(DelayControl node, C ctx) { return null; }

    default R visitTimingControlStatement(TimingControlStatement node, C ctx) { return null; }

    // ============ 声明 ============

    default R visitParameterDeclarations(ParameterDeclarations node, C ctx) { return null; }

    default R visitPortDeclaration(PortDeclaration node, C ctx) { return null; }

    default R visitTypeDeclaration(TypeDeclaration node, C ctx) { return null; }

    // ============ 结构 / 实例化 ============

    default R visitModuleDeclaration(ModuleDeclaration node, C ctx) { return null; }

    default R visitModuleInstantiation(ModuleInstantiation node, C ctx) { return null; }

    default R visitModuleInstance(ModuleInstance node, C ctx) { return null; }

    default R visitPortConnection(PortConnection node, C ctx) { return null; }

    default R visitGenerateBlock(GenerateBlock node, C ctx) { return null; }

    // ============ 门级原语 ============

    default R visitGateInstantiation(GateInstantiation node, C ctx) { return null; }

    default R visitSwitchGate(SwitchGate node, C ctx) { return null; }

    default R visitSwitches(Switches node, C ctx) { return null; }

    default R visitPassSwitchInstance(PassSwitchInstance node, C ctx) { return null; }

    default R visitMosSwitchInstance(MosSwitchInstance node, C ctx) { return null; }

    default R visitCmosSwitchInstance(CmosSwitchInstance node, C ctx) { return null; }

    default R visitPassEnableSwitch(PassEnableSwitch node, C ctx) { return null; }

    default R visitPassEnableSwitches(PassEnableSwitches node, C ctx) { return null; }

    default R visitNInputGateInstance(NInputGateInstance node, C ctx) { return null; }

    default R visitNInputGateInstances(NInputGateInstances node, C ctx) { return null; }

    default R visitEnableGateInstance(EnableGateInstance node, C ctx) { return null; }

    default R visitEnableGateInstances(EnableGateInstances node, C ctx) { return null; }

    default R visitNOutputGateInstance(NOutputGateInstance node, C ctx) { return null; }

    default R visitNOutputGateInstances(NOutputGateInstances node, C ctx) { return null; }

    default R visitPrimitivePullStrength(PrimitivePullStrength node, C ctx) { return null; }

    default R visitPullStrength(PullStrength node, C ctx) { return null; }

    default R visitPullGateInstance(PullGateInstance node, C ctx) { return null; }

    default R visitPullGates(PullGates node, C ctx) { return null; }

    // ============ UDP ============

    default R visitUdpDeclaration(UdpDeclaration node, C ctx) { return null; }

    default R visitUdpPort(UdpPort node, C ctx) { return null; }

    default R visitCombinatorialUdpBody(CombinatorialUdpBody node, C ctx) { return null; }

    default R visitSequentialUdpBody(SequentialUdpBody node, C ctx) { return null; }

    default R visitUdpInitialStatement(UdpInitialStatement node, C ctx) { return null; }

    default R visitUdpCombinatorialEntry(UdpCombinatorialEntry node, C ctx) { return null; }

    default R visitUdpSequentialEntry(UdpSequentialEntry node, C ctx) { return null; }

    default R visitEdgeIndicator(EdgeIndicator node, C ctx) { return null; }

    default R visitUdpInstantiation(UdpInstantiation node, C ctx) { return null; }

    default R visitUdpInstance(UdpInstance node, C ctx) { return null; }

    // ============ 路径声明 ============

    default R visitPathDeclaration(PathDeclaration node, C ctx) { return null; }

    default R visitSimpleParallelPath(SimpleParallelPath node, C ctx) { return null; }

    default R visitSimpleFullPath(SimpleFullPath node, C ctx) { return null; }

    default R visitEdgeSensitiveParallelPath(EdgeSensitiveParallelPath node, C ctx) { return null; }

    default R visitEdgeSensitiveFullPath(EdgeSensitiveFullPath node, C ctx) { return null; }
}
