package com.verilang.frontend.ast;

/**
 * trireg 电荷强度
 */
public enum ChargeStrength {
    SMALL,
    MEDIUM,
    LARGE,
    NONE
}
