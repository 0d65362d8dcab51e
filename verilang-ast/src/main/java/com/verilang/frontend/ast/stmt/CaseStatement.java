package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.expr.Expression;

/**
 * case / casez / casex 语句
 *
 * <p>defaultItem 在构造时扫描一次得到，之后不再重新计算。</p>
 */
public class CaseStatement extends AstNode {
    private final Expression expression;
    private final AstList<CaseItem> cases;
    private final CaseType type;
    private final CaseItem defaultItem;
    private final boolean function;

    public CaseStatement(Expression expression, AstList<CaseItem> cases, CaseType type,
                         CaseItem defaultItem, boolean function) {
        this.expression = expression;
        this.cases = cases;
        this.type = type;
        this.defaultItem = defaultItem;
        this.function = function;
    }

    public Expression getExpression() {
        return expression;
    }

    public AstList<CaseItem> getCases() {
        return cases;
    }

    public CaseType getType() {
        return type;
    }

    /** 第一个 default 分支，没有时为 null */
    public CaseItem getDefaultItem() {
        return defaultItem;
    }

    public boolean hasDefault() {
        return defaultItem != null;
    }

    /** 是否位于函数体内 */
    public boolean isFunction() {
        return function;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCaseStatement(this, context);
    }

    /**
     * case 关键字
     */
    public enum CaseType {
        CASE,
        CASEX,
        CASEZ
    }
}
