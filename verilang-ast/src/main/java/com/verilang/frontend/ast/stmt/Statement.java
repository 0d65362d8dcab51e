package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.AttributeList;

/**
 * 语句信封：种类标签 + 载荷
 *
 * <p>载荷的具体类型完全由 {@link StatementKind} 决定，消费者应先判断种类再取载荷。</p>
 */
public class Statement extends AstNode {
    private final StatementKind kind;
    private final AttributeList attributes;
    private final boolean functionStatement;
    private final boolean generateStatement;
    private final AstNode payload;

    public Statement(StatementKind kind, AttributeList attributes, boolean functionStatement,
                     boolean generateStatement, AstNode payload) {
        this.kind = kind;
        this.attributes = attributes;
        this.functionStatement = functionStatement;
        this.generateStatement = generateStatement;
        this.payload = payload;
    }

    public StatementKind getKind() {
        return kind;
    }

    public AttributeList getAttributes() {
        return attributes;
    }

    /** 是否出现在函数体内 */
    public boolean isFunctionStatement() {
        return functionStatement;
    }

    /** 是否为 generate 块中的项 */
    public boolean isGenerateStatement() {
        return generateStatement;
    }

    public AstNode getPayload() {
        return payload;
    }

    /**
     * 按期望类型取载荷
     *
     * @throws IllegalStateException 当前种类的载荷不是该类型
     */
    public <T extends AstNode> T getPayload(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException("Statement of kind " + kind + " does not carry a "
                    + type.getSimpleName());
        }
        return type.cast(payload);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStatement(this, context);
    }
}
