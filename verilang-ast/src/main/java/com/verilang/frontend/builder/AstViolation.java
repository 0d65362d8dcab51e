package com.verilang.frontend.builder;

/**
 * 构造契约的具体条目，用于区分失败原因并转换为诊断
 */
public enum AstViolation {
    MISSING_CHILD("required child node is absent"),
    PRIMARY_VALUE_MISMATCH("primary value does not match its value type"),
    INVALID_OPERATOR("operator cannot be used in this position"),
    MINTYPMAX_INCOMPLETE("min and max must be given together"),
    LVALUE_TYPE_MISMATCH("lvalue type does not match the lvalue form"),
    CONCATENATION_ITEM_MISMATCH("item cannot appear in this kind of concatenation"),
    STATEMENT_PAYLOAD_MISMATCH("statement payload does not match its kind"),
    HYBRID_ASSIGNMENT_FORM("hybrid assignment form does not match its operator"),
    DUPLICATE_DEFAULT_CASE("case statement has more than one default item"),
    EVENT_EDGE_NONE("event expression requires an edge"),
    EVENT_CONTROL_EXPRESSION("event control expression does not match its type"),
    TIMING_CONTROL_TYPE_MISMATCH("timing control type does not match the control supplied"),
    GENERATE_ITEM_MISMATCH("generate block item was not built as a generate item"),
    SWITCH_DELAY_MISMATCH("switch type does not accept this delay form"),
    SWITCH_INSTANCE_MISMATCH("switch instance does not match the switch type"),
    GATE_PAYLOAD_MISMATCH("gate instances do not match the gate type"),
    UDP_PORT_DIRECTION("udp port constructor does not accept this direction"),
    UDP_ENTRY_MISMATCH("udp table entry does not match its body or prefix"),
    PATH_PAYLOAD_MISMATCH("path does not match the path declaration type"),
    PATH_STATE_EXPRESSION("state expression does not match the path declaration type");

    private final String description;

    AstViolation(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
