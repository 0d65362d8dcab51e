package com.verilang.frontend.ast.path;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;

/**
 * (a, b *> x, y) = delays;
 */
public class SimpleFullPath extends ModulePath {
    private final AstList<Identifier> inputTerminals;
    private final AstList<Identifier> outputTerminals;

    public SimpleFullPath(AstList<Identifier> inputTerminals, Polarity polarity,
                          AstList<Identifier> outputTerminals, AstList<Expression> delayValue) {
        super(polarity, delayValue);
        this.inputTerminals = inputTerminals;
        this.outputTerminals = outputTerminals;
    }

    public AstList<Identifier> getInputTerminals() {
        return inputTerminals;
    }

    public AstList<Identifier> getOutputTerminals() {
        return outputTerminals;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSimpleFullPath(this, context);
    }
}
