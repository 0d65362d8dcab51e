package com.verilang.frontend.ast;

/**
 * AST 节点基类
 *
 * <p>节点由 {@code AstFactory} 自底向上构造，构造完成后只挂接到唯一的父节点，不持有父引用。</p>
 */
public abstract class AstNode {

    protected AstNode() {
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
