package com.verilang.frontend.ast.path;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.timing.Edge;

/**
 * (posedge clk => (q +: d)) = delays;
 */
public class EdgeSensitiveParallelPath extends EdgeSensitivePath {
    private final Identifier inputTerminal;
    private final Identifier outputTerminal;

    public EdgeSensitiveParallelPath(Edge edge, Identifier inputTerminal, Polarity polarity,
                                     Identifier outputTerminal, Expression dataSource,
                                     AstList<Expression> delayValue) {
        super(edge, polarity, dataSource, delayValue);
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
        return visitor.visitEdgeSensitiveParallelPath(this, context);
    }
}
