package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.expr.Expression;

/**
 * 循环语句：forever / for / while / repeat
 *
 * <p>initial 与 modify 只在 for 循环中存在；condition 除 forever 外都存在
 * （repeat 中表示重复次数）。</p>
 */
public class LoopStatement extends AstNode {
    private final LoopType type;
    private final Statement body;
    private final SingleAssignment initial;
    private final Expression condition;
    private final SingleAssignment modify;

    public LoopStatement(LoopType type, Statement body, SingleAssignment initial,
                         Expression condition, SingleAssignment modify) {
        this.type = type;
        this.body = body;
        this.initial = initial;
        this.condition = condition;
        this.modify = modify;
    }

    public LoopType getType() {
        return type;
    }

    public Statement getBody() {
        return body;
    }

    public SingleAssignment getInitial() {
        return initial;
    }

    public Expression getCondition() {
        return condition;
    }

    public SingleAssignment getModify() {
        return modify;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLoopStatement(this, context);
    }

    /**
     * 循环类别
     */
    public enum LoopType {
        FOREVER,
        FOR,
        WHILE,
        REPEAT
    }
}
