package com.verilang.frontend.ast.timing;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;

/**
 * 事件控制 @(...) / @*
 */
public class EventControl extends AstNode {
    private final EventControlType type;
    private final EventExpression expression;

    public EventControl(EventControlType type, EventExpression expression) {
        this.type = type;
        this.expression = expression;
    }

    public EventControlType getType() {
        return type;
    }

    /** @* 时为 null */
    public EventExpression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEventControl(this, context);
    }

    /**
     * 事件控制类别
     */
    public enum EventControlType {
        /** 无事件控制 */
        NONE,
        /** @* 或 @(*)，由任意读取信号触发，不带表达式 */
        ANY,
        /** @(event_expression) 或 @identifier */
        TRIGGERS
    }
}
