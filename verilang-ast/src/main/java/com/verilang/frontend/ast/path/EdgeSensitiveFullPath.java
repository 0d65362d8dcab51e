package com.verilang.frontend.ast.path;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.timing.Edge;

/**
 * (posedge clk *> (q, qb +: d)) = delays;
 */
public class EdgeSensitiveFullPath extends EdgeSensitivePath {
    private final AstList<Identifier> inputTerminals;
    private final AstList<Identifier> outputTerminals;

    public EdgeSensitiveFullPath(Edge edge, AstList<Identifier> inputTerminals, Polarity polarity,
                                 AstList<Identifier> outputTerminals, Expression dataSource,
                                 AstList<Expression> delayValue) {
        super(edge, polarity, dataSource, delayValue);
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
        return visitor.visitEdgeSensitiveFullPath(this, context);
    }
}
