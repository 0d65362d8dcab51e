package com.verilang.frontend.builder;

/**
 * AST 构造过程中的异常基类
 */
public abstract class AstException extends RuntimeException {

    protected AstException(String message) {
        super(message);
    }
}
