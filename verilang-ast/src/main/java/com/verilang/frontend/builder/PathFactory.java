package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.path.*;
import com.verilang.frontend.ast.timing.Edge;

/**
 * specify 路径声明的构造辅助类
 */
class PathFactory {

    final AstFactory factory;

    PathFactory(AstFactory factory) {
        this.factory = factory;
    }

    SimpleParallelPath newSimpleParallelPath(Identifier input, Polarity polarity, Identifier output,
                                             AstList<Expression> delayValue) {
        factory.requireChild(input, "parallel path", "input terminal");
        factory.requireChild(output, "parallel path", "output terminal");
        factory.requireChild(delayValue, "parallel path", "delay value");
        return factory.register(new SimpleParallelPath(input, polarityOrNone(polarity), output, delayValue));
    }

    SimpleFullPath newSimpleFullPath(AstList<Identifier> inputs, Polarity polarity, AstList<Identifier> outputs,
                                     AstList<Expression> delayValue) {
        factory.requireChild(inputs, "full path", "input terminals");
        factory.requireChild(outputs, "full path", "output terminals");
        factory.requireChild(delayValue, "full path", "delay value");
        return factory.register(new SimpleFullPath(inputs, polarityOrNone(polarity), outputs, delayValue));
    }

    EdgeSensitiveParallelPath newEdgeSensitiveParallelPath(Edge edge, Identifier input, Polarity polarity,
                                                           Identifier output, Expression dataSource,
                                                           AstList<Expression> delayValue) {
        factory.requireChild(input, "edge sensitive parallel path", "input terminal");
        factory.requireChild(output, "edge sensitive parallel path", "output terminal");
        factory.requireChild(dataSource, "edge sensitive parallel path", "data source");
        factory.requireChild(delayValue, "edge sensitive parallel path", "delay value");
        return factory.register(new EdgeSensitiveParallelPath(edge == null ? Edge.NONE : edge, input,
                polarityOrNone(polarity), output, dataSource, delayValue));
    }

    EdgeSensitiveFullPath newEdgeSensitiveFullPath(Edge edge, AstList<Identifier> inputs, Polarity polarity,
                                                   AstList<Identifier> outputs, Expression dataSource,
                                                   AstList<Expression> delayValue) {
        factory.requireChild(inputs, "edge sensitive full path", "input terminals");
        factory.requireChild(outputs, "edge sensitive full path", "output terminals");
        factory.requireChild(dataSource, "edge sensitive full path", "data source");
        factory.requireChild(delayValue, "edge sensitive full path", "delay value");
        return factory.register(new EdgeSensitiveFullPath(edge == null ? Edge.NONE : edge, inputs,
                polarityOrNone(polarity), outputs, dataSource, delayValue));
    }

    /**
     * 路径声明信封：类型决定载荷形状，只有状态相关的类型带条件表达式
     */
    PathDeclaration newPathDeclaration(PathDeclaration.PathDeclarationType type, Expression stateExpression,
                                       ModulePath path) {
        factory.requireChild(type, "path declaration", "type");
        factory.requireChild(path, "path declaration", "path");
        factory.check(type.getPathType().isInstance(path), AstViolation.PATH_PAYLOAD_MISMATCH, "path declaration",
                type + " cannot hold " + path.getClass().getSimpleName());
        if (type.isStateDependent()) {
            factory.check(stateExpression != null, AstViolation.PATH_STATE_EXPRESSION, "path declaration",
                    type + " requires a state expression");
        } else {
            factory.check(stateExpression == null, AstViolation.PATH_STATE_EXPRESSION, "path declaration",
                    type + " cannot carry a state expression");
        }
        return factory.register(new PathDeclaration(type, stateExpression, path));
    }

    private static Polarity polarityOrNone(Polarity polarity) {
        return polarity == null ? Polarity.NONE : polarity;
    }
}
