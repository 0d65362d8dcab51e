package com.verilang.frontend.ast.gate;

/**
 * 上拉 / 下拉
 */
public enum PullDirection {
    PULL_UP,
    PULL_DOWN,
    NONE
}
