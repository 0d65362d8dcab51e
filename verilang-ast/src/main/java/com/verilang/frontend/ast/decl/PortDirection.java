package com.verilang.frontend.ast.decl;

/**
 * 端口方向
 */
public enum PortDirection {
    INPUT,
    OUTPUT,
    INOUT,
    NONE
}
