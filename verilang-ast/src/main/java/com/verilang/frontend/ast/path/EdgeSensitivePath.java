package com.verilang.frontend.ast.path;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.timing.Edge;

/**
 * 沿敏感路径：额外带触发沿和数据源表达式
 */
public abstract class EdgeSensitivePath extends ModulePath {
    private final Edge edge;
    private final Expression dataSource;

    protected EdgeSensitivePath(Edge edge, Polarity polarity, Expression dataSource,
                                AstList<Expression> delayValue) {
        super(polarity, delayValue);
        this.edge = edge;
        this.dataSource = dataSource;
    }

    public Edge getEdge() {
        return edge;
    }

    public Expression getDataSource() {
        return dataSource;
    }
}
