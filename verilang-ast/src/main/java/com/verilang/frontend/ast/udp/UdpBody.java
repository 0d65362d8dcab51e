package com.verilang.frontend.ast.udp;

import com.verilang.frontend.ast.AstNode;

/**
 * UDP 主体：组合或时序
 */
public abstract class UdpBody extends AstNode {

    protected UdpBody() {
    }

    public abstract UdpBodyType getBodyType();

    /**
     * 主体类别
     */
    public enum UdpBodyType {
        COMBINATORIAL,
        SEQUENTIAL
    }
}
