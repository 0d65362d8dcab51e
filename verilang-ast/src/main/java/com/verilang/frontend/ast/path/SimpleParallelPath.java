package com.verilang.frontend.ast.path;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;

/**
 * (in => out) = delays;
 */
public class SimpleParallelPath extends ModulePath {
    private final Identifier inputTerminal;
    private final Identifier outputTerminal;

    public SimpleParallelPath(Identifier inputTerminal, Polarity polarity, Identifier outputTerminal,
                              AstList<Expression> delayValue) {
        super(polarity, delayValue);
        this.inputTerminal = inputTerminal;
        this.outputTerminal = outputTerminal;
    }

    public Identifier getInputTerminal() {
        return inputTerminal;
    }

    public Identifier getOutputTerminal() {
        return outputTerminal;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSimpleParallelPath(this, context);
    }
}
