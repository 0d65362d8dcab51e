package com.verilang.frontend.builder;

import com.verilang.frontend.ast.*;
import com.verilang.frontend.ast.decl.*;
import com.verilang.frontend.ast.expr.*;
import com.verilang.frontend.ast.gate.*;
import com.verilang.frontend.ast.inst.*;
import com.verilang.frontend.ast.path.*;
import com.verilang.frontend.ast.stmt.*;
import com.verilang.frontend.ast.timing.*;
import com.verilang.frontend.ast.udp.*;

/**
 * AST 构造入口
 *
 * <p>每条文法产生式对应一个工厂方法，解析器按自底向上的归约顺序调用。
 * 所有方法先校验参数再登记到 arena：校验失败抛出 {@link AstConstructionException}，
 * 此时 arena 中不会留下任何部分构造的节点。</p>
 */
@SuppressWarnings("this-escape")
public class AstFactory {

    private final AstArena arena;
    private final AstConfig config;

    // === Helper 实例 ===
    final ExprFactory exprFactory = new ExprFactory(this);
    final StmtFactory stmtFactory = new StmtFactory(this);
    final TimingFactory timingFactory = new TimingFactory(this);
    final DeclFactory declFactory = new DeclFactory(this);
    final InstFactory instFactory = new InstFactory(this);
    final GateFactory gateFactory = new GateFactory(this);
    final UdpFactory udpFactory = new UdpFactory(this);
    final PathFactory pathFactory = new PathFactory(this);

    public AstFactory(AstArena arena, AstConfig config) {
        this.arena = arena;
        this.config = config;
    }

    public AstArena getArena() {
        return arena;
    }

    public AstConfig getConfig() {
        return config;
    }

    // ============ 基础方法 ============

    /**
     * 登记节点及其内部新建的列表。先检查额度，额度不足时一个也不登记。
     */
    <T> T register(T node, Object... owned) {
        arena.reserve(1 + owned.length);
        for (Object o : owned) {
            arena.register(o);
        }
        return arena.register(node);
    }

    void check(boolean condition, AstViolation violation, String construct, String detail) {
        if (!condition) {
            throw new AstConstructionException(violation, construct, detail);
        }
    }

    <T> T requireChild(T child, String construct, String name) {
        if (child == null) {
            throw new AstConstructionException(AstViolation.MISSING_CHILD, construct, name);
        }
        return child;
    }

    /**
     * 新建一个登记在 arena 中的空序列
     */
    public <T> AstList<T> newList() {
        return arena.register(new AstList<T>());
    }

    // ============ 叶子与属性 ============

    public Identifier newIdentifier(String name) { return exprFactory.newIdentifier(name); }

    public NumberLiteral newNumber(NumberLiteral.NumberBase base, String digits) {
        return exprFactory.newNumber(base, digits, -1, false);
    }

    public NumberLiteral newNumber(NumberLiteral.NumberBase base, String digits, int width, boolean signed) {
        return exprFactory.newNumber(base, digits, width, signed);
    }

    public Range newRange(Expression upper, Expression lower) { return exprFactory.newRange(upper, lower); }

    public Attribute newAttribute(Identifier name, Expression value) { return exprFactory.newAttribute(name, value); }

    public AttributeList newAttributeList(Attribute first) { return exprFactory.newAttributeList(first); }

    public void appendAttribute(AttributeList list, Attribute attribute) {
        exprFactory.appendAttribute(list, attribute);
    }

    // ============ Primary ============

    public Primary newConstantPrimary(Primary.PrimaryValueType valueType, AstNode value) {
        return exprFactory.newPrimary(Primary.PrimaryType.CONSTANT_PRIMARY, valueType, value);
    }

    public Primary newPrimary(Primary.PrimaryValueType valueType, AstNode value) {
        return exprFactory.newPrimary(Primary.PrimaryType.PRIMARY, valueType, value);
    }

    public Primary newModulePathPrimary(Primary.PrimaryValueType valueType, AstNode value) {
        return exprFactory.newPrimary(Primary.PrimaryType.MODULE_PATH_PRIMARY, valueType, value);
    }

    public Primary newPrimaryFunctionCall(FunctionCall call) {
        return exprFactory.newPrimary(Primary.PrimaryType.PRIMARY, Primary.PrimaryValueType.FUNCTION_CALL, call);
    }

    // ============ 表达式 ============

    public PrimaryExpression newPrimaryExpression(Primary primary) {
        return exprFactory.newPrimaryExpression(primary);
    }

    public UnaryExpression newUnaryExpression(Expression operand, Operator operator, AttributeList attributes,
                                              boolean constant) {
        return exprFactory.newUnaryExpression(operand, operator, attributes, constant);
    }

    public BinaryExpression newBinaryExpression(Expression left, Expression right, Operator operator,
                                                AttributeList attributes, boolean constant) {
        return exprFactory.newBinaryExpression(left, right, operator, attributes, constant);
    }

    public RangeExpression newRangeExpression(Expression left, Expression right) {
        return exprFactory.newRangeExpression(left, right, false);
    }

    public RangeExpression newRangeExpression(Expression left, Expression right, boolean constant) {
        return exprFactory.newRangeExpression(left, right, constant);
    }

    public RangeExpression newIndexExpression(Expression index) {
        return exprFactory.newIndexExpression(index, false);
    }

    public RangeExpression newIndexExpression(Expression index, boolean constant) {
        return exprFactory.newIndexExpression(index, constant);
    }

    public StringExpression newStringExpression(String value) { return exprFactory.newStringExpression(value); }

    public ConditionalExpression newConditionalExpression(Expression condition, Expression ifTrue,
                                                          Expression ifFalse, AttributeList attributes) {
        return exprFactory.newConditionalExpression(condition, ifTrue, ifFalse, attributes);
    }

    public MinTypMaxExpression newMinTypMaxExpression(Expression min, Expression typ, Expression max) {
        return exprFactory.newMinTypMaxExpression(min, typ, max);
    }

    /**
     * @param arguments 参数列表，为 null 时补一个空列表
     */
    public FunctionCall newFunctionCall(Identifier function, boolean constant, boolean system,
                                        AttributeList attributes, AstList<Expression> arguments) {
        return exprFactory.newFunctionCall(function, constant, system, attributes, arguments);
    }

    // ============ Lvalue 与拼接 ============

    public Lvalue newIdentifierLvalue(Lvalue.LvalueType type, Identifier identifier) {
        return exprFactory.newIdentifierLvalue(type, identifier);
    }

    public Lvalue newConcatenationLvalue(Lvalue.LvalueType type, Concatenation concatenation) {
        return exprFactory.newConcatenationLvalue(type, concatenation);
    }

    public Concatenation newConcatenation(Concatenation.ConcatenationType type, Expression repeat, AstNode first) {
        return exprFactory.newConcatenation(type, repeat, first);
    }

    public Concatenation newEmptyConcatenation(Concatenation.ConcatenationType type) {
        return exprFactory.newEmptyConcatenation(type);
    }

    /**
     * 插入到已有拼接项之前：A 之后依次扩展 B、C 得到 [C, B, A]
     */
    public void extendConcatenation(Concatenation concatenation, AstNode item) {
        exprFactory.extendConcatenation(concatenation, item);
    }

    // ============ 语句 ============

    public Statement newStatement(AttributeList attributes, boolean functionStatement, StatementKind kind,
                                  AstNode payload) {
        return stmtFactory.newStatement(attributes, functionStatement, kind, payload);
    }

    public SingleAssignment newSingleAssignment(Lvalue lvalue, Expression expression) {
        return stmtFactory.newSingleAssignment(lvalue, expression);
    }

    public ProceduralAssignment newBlockingAssignment(Lvalue lvalue, Expression expression,
                                                      TimingControlStatement delayOrEvent) {
        return stmtFactory.newProceduralAssignment(true, lvalue, expression, delayOrEvent);
    }

    public ProceduralAssignment newNonblockingAssignment(Lvalue lvalue, Expression expression,
                                                         TimingControlStatement delayOrEvent) {
        return stmtFactory.newProceduralAssignment(false, lvalue, expression, delayOrEvent);
    }

    public ContinuousAssignment newContinuousAssignment(AstList<SingleAssignment> assignments,
                                                        DriveStrength driveStrength, Delay3 delay) {
        return stmtFactory.newContinuousAssignment(assignments, driveStrength, delay);
    }

    public HybridAssignment newHybridAssignment(HybridAssignment.HybridAssignmentType type,
                                                SingleAssignment assignment) {
        return stmtFactory.newHybridAssignment(type, assignment);
    }

    public HybridAssignment newHybridLvalueAssignment(HybridAssignment.HybridAssignmentType type, Lvalue lvalue) {
        return stmtFactory.newHybridLvalueAssignment(type, lvalue);
    }

    public LoopStatement newForeverLoop(Statement body) { return stmtFactory.newForeverLoop(body); }

    public LoopStatement newForLoop(Statement body, SingleAssignment initial, SingleAssignment modify,
                                    Expression condition) {
        return stmtFactory.newForLoop(body, initial, modify, condition);
    }

    public LoopStatement newWhileLoop(Statement body, Expression condition) {
        return stmtFactory.newWhileLoop(body, condition);
    }

    public LoopStatement newRepeatLoop(Statement body, Expression count) {
        return stmtFactory.newRepeatLoop(body, count);
    }

    public CaseItem newCaseItem(AstList<Expression> conditions, Statement body) {
        return stmtFactory.newCaseItem(conditions, body);
    }

    public CaseItem newDefaultCaseItem(Statement body) { return stmtFactory.newDefaultCaseItem(body); }

    public CaseStatement newCaseStatement(Expression expression, AstList<CaseItem> cases,
                                          CaseStatement.CaseType type) {
        return stmtFactory.newCaseStatement(expression, cases, type, false);
    }

    public CaseStatement newCaseStatement(Expression expression, AstList<CaseItem> cases,
                                          CaseStatement.CaseType type, boolean function) {
        return stmtFactory.newCaseStatement(expression, cases, type, function);
    }

    public ConditionalStatement newConditionalStatement(Statement statement, Expression condition) {
        return stmtFactory.newConditionalStatement(statement, condition);
    }

    public IfElse newIfElse(ConditionalStatement ifCondition, Statement elseStatement) {
        return stmtFactory.newIfElse(ifCondition, elseStatement);
    }

    /**
     * 追加到链尾，先加入的条件优先：c1 之后扩展 [c2, c3] 得到 [c1, c2, c3]
     */
    public void extendIfElse(IfElse ifElse, AstList<ConditionalStatement> statements) {
        stmtFactory.extendIfElse(ifElse, statements);
    }

    public WaitStatement newWaitStatement(Expression expression, Statement statement) {
        return stmtFactory.newWaitStatement(expression, statement);
    }

    public DisableStatement newDisableStatement(Identifier identifier) {
        return stmtFactory.newDisableStatement(identifier);
    }

    public TaskEnableStatement newTaskEnableStatement(AstList<Expression> expressions, Identifier identifier,
                                                      boolean system) {
        return stmtFactory.newTaskEnableStatement(expressions, identifier, system);
    }

    public StatementBlock newStatementBlock(StatementBlock.BlockType type, Identifier identifier,
                                            AstList<Statement> declarations, AstList<Statement> statements) {
        return stmtFactory.newStatementBlock(type, identifier, declarations, statements);
    }

    // ============ 时序与事件 ============

    public DelayValue newDelayValue(NumberLiteral number) { return timingFactory.newDelayValue(number); }

    public DelayValue newDelayValue(Identifier identifier) { return timingFactory.newDelayValue(identifier); }

    public Delay2 newDelay2(Expression rise, Expression fall) { return timingFactory.newDelay2(rise, fall); }

    public Delay3 newDelay3(Expression rise, Expression fall, Expression turnOff) {
        return timingFactory.newDelay3(rise, fall, turnOff);
    }

    public EventExpression newEventExpression(Edge edge, Expression expression) {
        return timingFactory.newEventExpression(edge, expression);
    }

    public EventExpression newEventSequence(EventExpression left, EventExpression right) {
        return timingFactory.newEventSequence(left, right);
    }

    public EventControl newEventControl(EventControl.EventControlType type, EventExpression expression) {
        return timingFactory.newEventControl(type, expression);
    }

    public DelayControl newDelayControl(DelayValue value) { return timingFactory.newDelayControl(value); }

    public DelayControl newMinTypMaxDelayControl(Expression mintypmax) {
        return timingFactory.newMinTypMaxDelayControl(mintypmax);
    }

    public TimingControlStatement newDelayTimingControl(TimingControlStatement.TimingControlType type,
                                                        Statement statement, DelayControl delay) {
        return timingFactory.newDelayTimingControl(type, statement, delay);
    }

    public TimingControlStatement newEventTimingControl(TimingControlStatement.TimingControlType type,
                                                        Expression repeat, Statement statement,
                                                        EventControl eventControl) {
        return timingFactory.newEventTimingControl(type, repeat, statement, eventControl);
    }

    // ============ 声明 ============

    public DriveStrength newDriveStrength(PrimitiveStrength strength0, PrimitiveStrength strength1) {
        return declFactory.newDriveStrength(strength0, strength1);
    }

    public ParameterDeclarations newParameterDeclarations(AstList<SingleAssignment> assignments,
                                                          boolean signedValues, boolean local, Range range,
                                                          ParameterDeclarations.ParameterType type) {
        return declFactory.newParameterDeclarations(assignments, signedValues, local, range, type);
    }

    public PortDeclaration newPortDeclaration(PortDirection direction, NetType netType, boolean netSigned,
                                              boolean reg, boolean variable, Range range,
                                              AstList<Identifier> portNames) {
        return declFactory.newPortDeclaration(direction, netType, netSigned, reg, variable, range, portNames);
    }

    public TypeDeclaration newTypeDeclaration(TypeDeclaration.DeclarationType type) {
        return declFactory.newTypeDeclaration(type);
    }

    // ============ 结构 / 实例化 ============

    public ModuleDeclaration newModuleDeclaration(AttributeList attributes, Identifier identifier,
                                                  AstList<ParameterDeclarations> parameters,
                                                  AstList<AstNode> ports, AstList<Statement> items) {
        return instFactory.newModuleDeclaration(attributes, identifier, parameters, ports, items);
    }

    public ModuleInstantiation newModuleInstantiation(Identifier moduleIdentifier,
                                                      AstList<PortConnection> parameters,
                                                      AstList<ModuleInstance> instances) {
        return instFactory.newModuleInstantiation(moduleIdentifier, parameters, instances);
    }

    public ModuleInstance newModuleInstance(Identifier instanceIdentifier, AstList<PortConnection> connections) {
        return instFactory.newModuleInstance(instanceIdentifier, connections);
    }

    public PortConnection newNamedPortConnection(Identifier portName, Expression expression) {
        return instFactory.newNamedPortConnection(portName, expression);
    }

    public PortConnection newOrderedPortConnection(Expression expression) {
        return instFactory.newOrderedPortConnection(expression);
    }

    /**
     * generate 块中的项：普通语句信封，额外标记为 generate 项
     */
    public Statement newGenerateItem(StatementKind kind, AstNode construct) {
        return stmtFactory.newGenerateItem(kind, construct);
    }

    public GenerateBlock newGenerateBlock(Identifier identifier, AstList<Statement> items) {
        return instFactory.newGenerateBlock(identifier, items);
    }

    // ============ 门级原语 ============

    public SwitchGate newSwitchGateD3(SwitchType type, Delay3 delay) {
        return gateFactory.newSwitchGateD3(type, delay);
    }

    public SwitchGate newSwitchGateD2(SwitchType type, Delay2 delay) {
        return gateFactory.newSwitchGateD2(type, delay);
    }

    public Switches newSwitches(SwitchGate type, AstList<AstNode> switches) {
        return gateFactory.newSwitches(type, switches);
    }

    public PassSwitchInstance newPassSwitchInstance(Identifier name, Lvalue terminal1, Lvalue terminal2) {
        return gateFactory.newPassSwitchInstance(name, terminal1, terminal2);
    }

    public MosSwitchInstance newMosSwitchInstance(Identifier name, Lvalue output, Expression enable,
                                                  Expression input) {
        return gateFactory.newMosSwitchInstance(name, output, enable, input);
    }

    public CmosSwitchInstance newCmosSwitchInstance(Identifier name, Lvalue output, Expression ncontrol,
                                                    Expression pcontrol, Expression input) {
        return gateFactory.newCmosSwitchInstance(name, output, ncontrol, pcontrol, input);
    }

    public PassEnableSwitch newPassEnableSwitch(Identifier name, Lvalue terminal1, Lvalue terminal2,
                                                Expression enable) {
        return gateFactory.newPassEnableSwitch(name, terminal1, terminal2, enable);
    }

    public PassEnableSwitches newPassEnableSwitches(PassEnableSwitches.PassEnableSwitchType type, Delay2 delay,
                                                    AstList<PassEnableSwitch> switches) {
        return gateFactory.newPassEnableSwitches(type, delay, switches);
    }

    public NInputGateInstance newNInputGateInstance(Identifier name, AstList<Expression> inputs, Lvalue output) {
        return gateFactory.newNInputGateInstance(name, inputs, output);
    }

    public NInputGateInstances newNInputGateInstances(NInputGateInstances.NInputGateType type, Delay3 delay,
                                                      DriveStrength driveStrength,
                                                      AstList<NInputGateInstance> instances) {
        return gateFactory.newNInputGateInstances(type, delay, driveStrength, instances);
    }

    public EnableGateInstance newEnableGateInstance(Identifier name, Lvalue output, Expression enable,
                                                    Expression input) {
        return gateFactory.newEnableGateInstance(name, output, enable, input);
    }

    public EnableGateInstances newEnableGateInstances(EnableGateInstances.EnableGateType type, Delay3 delay,
                                                      DriveStrength driveStrength,
                                                      AstList<EnableGateInstance> instances) {
        return gateFactory.newEnableGateInstances(type, delay, driveStrength, instances);
    }

    public NOutputGateInstance newNOutputGateInstance(Identifier name, AstList<Lvalue> outputs, Expression input) {
        return gateFactory.newNOutputGateInstance(name, outputs, input);
    }

    public NOutputGateInstances newNOutputGateInstances(NOutputGateInstances.NOutputGateType type, Delay2 delay,
                                                        DriveStrength driveStrength,
                                                        AstList<NOutputGateInstance> instances) {
        return gateFactory.newNOutputGateInstances(type, delay, driveStrength, instances);
    }

    public PrimitivePullStrength newPrimitivePullStrength(PullDirection direction, PrimitiveStrength strength1,
                                                          PrimitiveStrength strength0) {
        return gateFactory.newPrimitivePullStrength(direction, strength1, strength0);
    }

    public PullStrength newPullStrength(PrimitiveStrength strength1, PrimitiveStrength strength2) {
        return gateFactory.newPullStrength(strength1, strength2);
    }

    public PullGateInstance newPullGateInstance(Identifier name, Lvalue output) {
        return gateFactory.newPullGateInstance(name, output);
    }

    public PullGates newPullGates(PrimitivePullStrength pullStrength, AstList<PullGateInstance> instances) {
        return gateFactory.newPullGates(pullStrength, instances);
    }

    public GateInstantiation newGateInstantiation(GateInstantiation.GateType type, AstNode gates) {
        return gateFactory.newGateInstantiation(type, gates);
    }

    // ============ UDP ============

    public UdpPort newUdpPort(PortDirection direction, Identifier identifier, AttributeList attributes,
                              boolean reg, Expression defaultValue) {
        return udpFactory.newUdpPort(direction, identifier, attributes, reg, defaultValue);
    }

    public UdpPort newUdpInputPort(AstList<Identifier> identifiers, AttributeList attributes) {
        return udpFactory.newUdpInputPort(identifiers, attributes);
    }

    public UdpDeclaration newUdpDeclaration(AttributeList attributes, Identifier identifier,
                                            AstList<UdpPort> ports, UdpBody body) {
        return udpFactory.newUdpDeclaration(attributes, identifier, ports, body);
    }

    public UdpInstance newUdpInstance(Identifier identifier, Range range, Lvalue output,
                                      AstList<Expression> inputs) {
        return udpFactory.newUdpInstance(identifier, range, output, inputs);
    }

    public UdpInstantiation newUdpInstantiation(AstList<UdpInstance> instances, Identifier identifier,
                                                DriveStrength driveStrength, Delay2 delay) {
        return udpFactory.newUdpInstantiation(instances, identifier, driveStrength, delay);
    }

    public UdpInitialStatement newUdpInitialStatement(Identifier outputPort, NumberLiteral initialValue) {
        return udpFactory.newUdpInitialStatement(outputPort, initialValue);
    }

    public SequentialUdpBody newSequentialUdpBody(UdpInitialStatement initial,
                                                  AstList<UdpSequentialEntry> entries) {
        return udpFactory.newSequentialBody(initial, entries);
    }

    public CombinatorialUdpBody newCombinatorialUdpBody(AstList<UdpCombinatorialEntry> entries) {
        return udpFactory.newCombinatorialBody(entries);
    }

    public UdpCombinatorialEntry newCombinatorialEntry(AstList<LevelSymbol> inputLevels, NextState output) {
        return udpFactory.newCombinatorialEntry(inputLevels, output);
    }

    public EdgeIndicator newEdgeIndicator(LevelSymbol from, LevelSymbol to) {
        return udpFactory.newEdgeIndicator(from, to);
    }

    public EdgeIndicator newEdgeIndicator(EdgeIndicator.EdgeSymbol symbol) {
        return udpFactory.newEdgeIndicator(symbol);
    }

    public UdpSequentialEntry newSequentialEntry(UdpSequentialEntry.EntryPrefix prefix,
                                                 AstList<UdpInputSymbol> levelsOrEdges, LevelSymbol currentState,
                                                 NextState output) {
        return udpFactory.newSequentialEntry(prefix, levelsOrEdges, currentState, output);
    }

    // ============ 路径声明 ============

    public SimpleParallelPath newSimpleParallelPath(Identifier input, Polarity polarity, Identifier output,
                                                    AstList<Expression> delayValue) {
        return pathFactory.newSimpleParallelPath(input, polarity, output, delayValue);
    }

    public SimpleFullPath newSimpleFullPath(AstList<Identifier> inputs, Polarity polarity,
                                            AstList<Identifier> outputs, AstList<Expression> delayValue) {
        return pathFactory.newSimpleFullPath(inputs, polarity, outputs, delayValue);
    }

    public EdgeSensitiveParallelPath newEdgeSensitiveParallelPath(Edge edge, Identifier input, Polarity polarity,
                                                                  Identifier output, Expression dataSource,
                                                                  AstList<Expression> delayValue) {
        return pathFactory.newEdgeSensitiveParallelPath(edge, input, polarity, output, dataSource, delayValue);
    }

    public EdgeSensitiveFullPath newEdgeSensitiveFullPath(Edge edge, AstList<Identifier> inputs, Polarity polarity,
                                                          AstList<Identifier> outputs, Expression dataSource,
                                                          AstList<Expression> delayValue) {
        return pathFactory.newEdgeSensitiveFullPath(edge, inputs, polarity, outputs, dataSource, delayValue);
    }

    public PathDeclaration newPathDeclaration(PathDeclaration.PathDeclarationType type, Expression stateExpression,
                                              ModulePath path) {
        return pathFactory.newPathDeclaration(type, stateExpression, path);
    }
}
