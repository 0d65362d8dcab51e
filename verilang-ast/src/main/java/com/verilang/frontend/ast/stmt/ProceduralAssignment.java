package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;
import com.verilang.frontend.ast.timing.TimingControlStatement;

/**
 * 过程赋值：阻塞 (=) 或非阻塞 (&lt;=)，可带赋值内延迟/事件控制
 */
public class ProceduralAssignment extends Assignment {
    private final boolean blocking;
    private final Lvalue lvalue;
    private final Expression expression;
    private final TimingControlStatement delayOrEvent;

    public ProceduralAssignment(boolean blocking, Lvalue lvalue, Expression expression,
                                TimingControlStatement delayOrEvent) {
        this.blocking = blocking;
        this.lvalue = lvalue;
        this.expression = expression;
        this.delayOrEvent = delayOrEvent;
    }

    @Override
    public AssignmentKind getKind() {
        return blocking ? AssignmentKind.BLOCKING : AssignmentKind.NONBLOCKING;
    }

    public boolean isBlocking() {
        return blocking;
    }

    public Lvalue getLvalue() {
        return lvalue;
    }

    public Expression getExpression() {
        return expression;
    }

    public TimingControlStatement getDelayOrEvent() {
        return delayOrEvent;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProceduralAssignment(this, context);
    }
}
