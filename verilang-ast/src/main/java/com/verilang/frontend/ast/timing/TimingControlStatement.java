package com.verilang.frontend.ast.timing;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.stmt.Statement;

/**
 * 带时序控制的语句：#d stmt / @(e) stmt / repeat (n) @(e)
 *
 * <p>延迟形式只有 delay，事件形式只有 eventControl，repeat 只在 EVENT_CONTROL_REPEAT 时存在。</p>
 */
public class TimingControlStatement extends AstNode {
    private final TimingControlType type;
    private final DelayControl delay;
    private final EventControl eventControl;
    private final Expression repeat;
    private final Statement statement;

    public TimingControlStatement(TimingControlType type, DelayControl delay, EventControl eventControl,
                                  Expression repeat, Statement statement) {
        this.type = type;
        this.delay = delay;
        this.eventControl = eventControl;
        this.repeat = repeat;
        this.statement = statement;
    }

    public TimingControlType getType() {
        return type;
    }

    public DelayControl getDelay() {
        return delay;
    }

    public EventControl getEventControl() {
        return eventControl;
    }

    public Expression getRepeat() {
        return repeat;
    }

    /** 受控语句，作为赋值内控制时为 null */
    public Statement getStatement() {
        return statement;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTimingControlStatement(this, context);
    }

    /**
     * 时序控制类别
     */
    public enum TimingControlType {
        DELAY_CONTROL,
        EVENT_CONTROL,
        EVENT_CONTROL_REPEAT;

        public boolean isEventControl() {
            return this != DELAY_CONTROL;
        }
    }
}
