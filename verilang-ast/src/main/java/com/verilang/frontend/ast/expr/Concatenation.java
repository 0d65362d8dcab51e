package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;

/**
 * 拼接 {a, b, c} 与复制 {n{a}}
 *
 * <p>文法左递归，后归约的项位于源码中更靠前的位置，
 * 因此扩展时插入到头部（见 {@code AstFactory#extendConcatenation}）。不要改成追加。</p>
 */
public class Concatenation extends AstNode {
    private final ConcatenationType type;
    private final Expression repeat;
    private final AstList<AstNode> items;

    public Concatenation(ConcatenationType type, Expression repeat, AstList<AstNode> items) {
        this.type = type;
        this.repeat = repeat;
        this.items = items;
    }

    public ConcatenationType getType() {
        return type;
    }

    /** 复制次数，普通拼接为 null */
    public Expression getRepeat() {
        return repeat;
    }

    public boolean isReplication() {
        return repeat != null;
    }

    public AstList<AstNode> getItems() {
        return items;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConcatenation(this, context);
    }

    /**
     * 拼接类别，决定允许的拼接项类型
     */
    public enum ConcatenationType {
        EXPRESSION,
        CONSTANT_EXPRESSION,
        NET,
        VARIABLE,
        MODULE_PATH;

        /** 是否接受该拼接项 */
        public boolean accepts(AstNode item) {
            switch (this) {
                case NET:
                case VARIABLE:
                    return item instanceof Lvalue || item instanceof Expression || item instanceof Concatenation;
                default:
                    return item instanceof Expression || item instanceof Concatenation;
            }
        }
    }
}
