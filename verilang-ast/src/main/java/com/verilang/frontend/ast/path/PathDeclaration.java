package com.verilang.frontend.ast.path;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.expr.Expression;

/**
 * specify 块中的路径声明
 *
 * <p>类型决定载荷的路径形状；只有状态相关（if (...)）的类型带 stateExpression。</p>
 */
public class PathDeclaration extends AstNode {
    private final PathDeclarationType type;
    private final Expression stateExpression;
    private final ModulePath path;

    public PathDeclaration(PathDeclarationType type, Expression stateExpression, ModulePath path) {
        this.type = type;
        this.stateExpression = stateExpression;
        this.path = path;
    }

    public PathDeclarationType getType() {
        return type;
    }

    public Expression getStateExpression() {
        return stateExpression;
    }

    public ModulePath getPath() {
        return path;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPathDeclaration(this, context);
    }

    /**
     * 路径声明类别
     */
    public enum PathDeclarationType {
        SIMPLE_PARALLEL(SimpleParallelPath.class, false),
        SIMPLE_FULL(SimpleFullPath.class, false),
        EDGE_SENSITIVE_PARALLEL(EdgeSensitiveParallelPath.class, false),
        EDGE_SENSITIVE_FULL(EdgeSensitiveFullPath.class, false),
        STATE_DEPENDENT_PARALLEL(SimpleParallelPath.class, true),
        STATE_DEPENDENT_FULL(SimpleFullPath.class, true),
        STATE_DEPENDENT_EDGE_PARALLEL(EdgeSensitiveParallelPath.class, true),
        STATE_DEPENDENT_EDGE_FULL(EdgeSensitiveFullPath.class, true);

        private final Class<? extends ModulePath> pathType;
        private final boolean stateDependent;

        PathDeclarationType(Class<? extends ModulePath> pathType, boolean stateDependent) {
            this.pathType = pathType;
            this.stateDependent = stateDependent;
        }

        public Class<? extends ModulePath> getPathType() {
            return pathType;
        }

        public boolean isStateDependent() {
            return stateDependent;
        }
    }
}
