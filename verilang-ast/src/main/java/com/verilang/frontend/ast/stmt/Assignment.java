package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstNode;

/**
 * 赋值基类
 */
public abstract class Assignment extends AstNode {

    protected Assignment() {
    }

    public abstract AssignmentKind getKind();

    /**
     * 赋值类别
     */
    public enum AssignmentKind {
        BLOCKING,
        NONBLOCKING,
        CONTINUOUS,
        HYBRID
    }
}
