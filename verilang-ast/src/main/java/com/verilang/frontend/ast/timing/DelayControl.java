package com.verilang.frontend.ast.timing;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.DelayValue;
import com.verilang.frontend.ast.expr.Expression;

/**
 * 延迟控制 #value 或 #(mintypmax)
 */
public class DelayControl extends AstNode {
    private final DelayControlType type;
    private final DelayValue value;
    private final Expression mintypmax;

    private DelayControl(DelayControlType type, DelayValue value, Expression mintypmax) {
        this.type = type;
        this.value = value;
        this.mintypmax = mintypmax;
    }

    public static DelayControl ofValue(DelayValue value) {
        return new DelayControl(DelayControlType.VALUE, value, null);
    }

    public static DelayControl ofMinTypMax(Expression mintypmax) {
        return new DelayControl(DelayControlType.MINTYPMAX, null, mintypmax);
    }

    public DelayControlType getType() {
        return type;
    }

    public DelayValue getValue() {
        return value;
    }

    public Expression getMinTypMax() {
        return mintypmax;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDelayControl(this, context);
    }

    /**
     * 延迟控制类别
     */
    public enum DelayControlType {
        VALUE,
        MINTYPMAX
    }
}
