package com.verilang.frontend.builder;

/**
 * arena 分配失败（超过节点上限）
 */
public class AstAllocationException extends AstException {
    private final int limit;

    public AstAllocationException(int limit) {
        super("AST arena exhausted: limit of " + limit + " allocations reached");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
