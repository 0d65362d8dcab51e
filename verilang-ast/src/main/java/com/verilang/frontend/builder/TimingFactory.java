package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.Delay2;
import com.verilang.frontend.ast.Delay3;
import com.verilang.frontend.ast.DelayValue;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.NumberLiteral;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.stmt.Statement;
import com.verilang.frontend.ast.timing.*;

/**
 * 时序控制与事件的构造辅助类
 */
class TimingFactory {

    final AstFactory factory;

    TimingFactory(AstFactory factory) {
        this.factory = factory;
    }

    // ============ 延迟值 ============

    DelayValue newDelayValue(NumberLiteral number) {
        factory.requireChild(number, "delay value", "number");
        return factory.register(DelayValue.of(number));
    }

    DelayValue newDelayValue(Identifier identifier) {
        factory.requireChild(identifier, "delay value", "identifier");
        return factory.register(DelayValue.of(identifier));
    }

    Delay2 newDelay2(Expression rise, Expression fall) {
        factory.requireChild(rise, "delay2", "rise delay");
        return factory.register(new Delay2(rise, fall));
    }

    Delay3 newDelay3(Expression rise, Expression fall, Expression turnOff) {
        factory.requireChild(rise, "delay3", "rise delay");
        factory.check(turnOff == null || fall != null, AstViolation.MISSING_CHILD, "delay3",
                "turn-off delay without fall delay");
        return factory.register(new Delay3(rise, fall, turnOff));
    }

    // ============ 事件 ============

    /**
     * 按触发沿决定事件类型：posedge / negedge / 普通表达式
     */
    EventExpression newEventExpression(Edge edge, Expression expression) {
        factory.requireChild(edge, "event expression", "edge");
        factory.requireChild(expression, "event expression", "expression");
        EventExpression.EventType type;
        switch (edge) {
            case POS:
                type = EventExpression.EventType.POSEDGE;
                break;
            case NEG:
                type = EventExpression.EventType.NEGEDGE;
                break;
            case ANY:
                type = EventExpression.EventType.EXPRESSION;
                break;
            default:
                throw new AstConstructionException(AstViolation.EVENT_EDGE_NONE, "event expression",
                        "edge " + edge);
        }
        return factory.register(EventExpression.ofExpression(type, expression));
    }

    /**
     * a or b：按 (right, left) 的顺序保存，最近组合进来的操作数在前
     */
    EventExpression newEventSequence(EventExpression left, EventExpression right) {
        factory.requireChild(left, "event sequence", "left operand");
        factory.requireChild(right, "event sequence", "right operand");
        AstList<EventExpression> sequence = new AstList<>();
        sequence.append(right);
        sequence.append(left);
        return factory.register(EventExpression.ofSequence(sequence), sequence);
    }

    EventControl newEventControl(EventControl.EventControlType type, EventExpression expression) {
        factory.requireChild(type, "event control", "type");
        switch (type) {
            case ANY:
                factory.check(expression == null, AstViolation.EVENT_CONTROL_EXPRESSION, "event control",
                        "@* cannot carry an event expression");
                break;
            case TRIGGERS:
                factory.check(expression != null, AstViolation.EVENT_CONTROL_EXPRESSION, "event control",
                        "triggered event control requires an event expression");
                break;
            default:
                break;
        }
        return factory.register(new EventControl(type, expression));
    }

    // ============ 延迟控制 ============

    DelayControl newDelayControl(DelayValue value) {
        factory.requireChild(value, "delay control", "value");
        return factory.register(DelayControl.ofValue(value));
    }

    DelayControl newMinTypMaxDelayControl(Expression mintypmax) {
        factory.requireChild(mintypmax, "delay control", "mintypmax expression");
        return factory.register(DelayControl.ofMinTypMax(mintypmax));
    }

    // ============ 时序控制语句 ============

    TimingControlStatement newDelayTimingControl(TimingControlStatement.TimingControlType type,
                                                 Statement statement, DelayControl delay) {
        factory.requireChild(type, "timing control", "type");
        factory.check(type == TimingControlStatement.TimingControlType.DELAY_CONTROL,
                AstViolation.TIMING_CONTROL_TYPE_MISMATCH, "timing control", type + " given a delay control");
        factory.requireChild(delay, "timing control", "delay control");
        return factory.register(new TimingControlStatement(type, delay, null, null, statement));
    }

    TimingControlStatement newEventTimingControl(TimingControlStatement.TimingControlType type, Expression repeat,
                                                 Statement statement, EventControl eventControl) {
        factory.requireChild(type, "timing control", "type");
        factory.check(type.isEventControl(), AstViolation.TIMING_CONTROL_TYPE_MISMATCH, "timing control",
                type + " given an event control");
        factory.requireChild(eventControl, "timing control", "event control");
        if (type == TimingControlStatement.TimingControlType.EVENT_CONTROL_REPEAT) {
            factory.requireChild(repeat, "timing control", "repeat count");
        } else {
            factory.check(repeat == null, AstViolation.TIMING_CONTROL_TYPE_MISMATCH, "timing control",
                    "repeat count without repeat event control");
        }
        return factory.register(new TimingControlStatement(type, null, eventControl, repeat, statement));
    }
}
