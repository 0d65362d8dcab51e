package com.verilang.frontend.ast.timing;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.expr.Expression;

/**
 * 事件表达式：posedge a / negedge a / a / (a or b)
 *
 * <p>序列形式保存为二元组 (right, left)，即最近组合进来的操作数在前。
 * 打印时依赖这个顺序，不要调整。</p>
 */
public class EventExpression extends AstNode {
    private final EventType type;
    private final Expression expression;
    private final AstList<EventExpression> sequence;

    private EventExpression(EventType type, Expression expression, AstList<EventExpression> sequence) {
        this.type = type;
        this.expression = expression;
        this.sequence = sequence;
    }

    public static EventExpression ofExpression(EventType type, Expression expression) {
        return new EventExpression(type, expression, null);
    }

    public static EventExpression ofSequence(AstList<EventExpression> sequence) {
        return new EventExpression(EventType.SEQUENCE, null, sequence);
    }

    public EventType getType() {
        return type;
    }

    /** 非序列形式时的被监视表达式 */
    public Expression getExpression() {
        return expression;
    }

    /** 序列形式时的 (right, left) */
    public AstList<EventExpression> getSequence() {
        return sequence;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEventExpression(this, context);
    }

    /**
     * 事件表达式类别
     */
    public enum EventType {
        POSEDGE,
        NEGEDGE,
        EXPRESSION,
        SEQUENCE
    }
}
