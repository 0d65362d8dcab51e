package com.verilang.frontend.ast.udp;

/**
 * UDP 真值表输入列中的一项：电平符号或边沿指示
 */
public interface UdpInputSymbol {

    /** 表中的书写形式 */
    String toTableString();
}
