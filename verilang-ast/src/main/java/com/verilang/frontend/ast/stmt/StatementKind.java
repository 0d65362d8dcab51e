package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.decl.ParameterDeclarations;
import com.verilang.frontend.ast.decl.PortDeclaration;
import com.verilang.frontend.ast.decl.TypeDeclaration;
import com.verilang.frontend.ast.expr.FunctionCall;
import com.verilang.frontend.ast.gate.GateInstantiation;
import com.verilang.frontend.ast.inst.GenerateBlock;
import com.verilang.frontend.ast.inst.ModuleInstantiation;
import com.verilang.frontend.ast.path.PathDeclaration;
import com.verilang.frontend.ast.timing.TimingControlStatement;
import com.verilang.frontend.ast.udp.UdpInstantiation;

/**
 * 语句种类标签
 *
 * <p>每个种类绑定唯一的载荷类型，{@link Statement} 的载荷必须与之匹配。</p>
 */
public enum StatementKind {
    /** 空语句 ; ，无载荷 */
    NULL(null),
    ASSIGNMENT(Assignment.class),
    CASE(CaseStatement.class),
    CONDITIONAL(IfElse.class),
    BLOCK(StatementBlock.class),
    DISABLE(DisableStatement.class),
    EVENT_TRIGGER(Identifier.class),
    LOOP(LoopStatement.class),
    TASK_ENABLE(TaskEnableStatement.class),
    FUNCTION_CALL(FunctionCall.class),
    WAIT(WaitStatement.class),
    TIMING_CONTROL(TimingControlStatement.class),
    INITIAL_CONSTRUCT(Statement.class),
    ALWAYS_CONSTRUCT(Statement.class),

    // 模块项 / generate 项
    GENERATE_BLOCK(GenerateBlock.class),
    MODULE_INSTANTIATION(ModuleInstantiation.class),
    GATE_INSTANTIATION(GateInstantiation.class),
    UDP_INSTANTIATION(UdpInstantiation.class),
    TYPE_DECLARATION(TypeDeclaration.class),
    PARAMETER_DECLARATIONS(ParameterDeclarations.class),
    PORT_DECLARATION(PortDeclaration.class),
    PATH_DECLARATION(PathDeclaration.class);

    private final Class<? extends AstNode> payloadType;

    StatementKind(Class<? extends AstNode> payloadType) {
        this.payloadType = payloadType;
    }

    /** 载荷类型，NULL 种类返回 null */
    public Class<? extends AstNode> getPayloadType() {
        return payloadType;
    }

    public boolean accepts(AstNode payload) {
        if (payloadType == null) {
            return payload == null;
        }
        return payloadType.isInstance(payload);
    }
}
