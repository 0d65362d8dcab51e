package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * 输出、输入加一个控制端的三端实例（MOS 开关、使能门）
 */
public abstract class ControlledGateInstance extends AstNode {
    private final Identifier name;
    private final Lvalue outputTerminal;
    private final Expression enableTerminal;
    private final Expression inputTerminal;

    protected ControlledGateInstance(Identifier name, Lvalue outputTerminal, Expression enableTerminal,
                                     Expression inputTerminal) {
        this.name = name;
        this.outputTerminal = outputTerminal;
        this.enableTerminal = enableTerminal;
        this.inputTerminal = inputTerminal;
    }

    public Identifier getName() {
        return name;
    }

    public Lvalue getOutputTerminal() {
        return outputTerminal;
    }

    public Expression getEnableTerminal() {
        return enableTerminal;
    }

    public Expression getInputTerminal() {
        return inputTerminal;
    }
}
