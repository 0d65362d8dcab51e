package com.verilang.frontend.ast.gate;

/**
 * 开关原语类型
 *
 * <p>tran / rtran 只接受双值延迟，其余开关只接受三值延迟。</p>
 */
public enum SwitchType {
    CMOS(SwitchCategory.CMOS),
    RCMOS(SwitchCategory.CMOS),
    NMOS(SwitchCategory.MOS),
    PMOS(SwitchCategory.MOS),
    RNMOS(SwitchCategory.MOS),
    RPMOS(SwitchCategory.MOS),
    TRAN(SwitchCategory.PASS),
    RTRAN(SwitchCategory.PASS);

    private final SwitchCategory category;

    SwitchType(SwitchCategory category) {
        this.category = category;
    }

    public SwitchCategory getCategory() {
        return category;
    }

    public boolean usesDelay2() {
        return this == TRAN || this == RTRAN;
    }

    public String getKeyword() {
        return name().toLowerCase();
    }

    /**
     * 开关分类，决定实例的端子形状
     */
    public enum SwitchCategory {
        CMOS(GateInstantiation.GateType.CMOS),
        MOS(GateInstantiation.GateType.MOS),
        PASS(GateInstantiation.GateType.PASS);

        private final GateInstantiation.GateType gateType;

        SwitchCategory(GateInstantiation.GateType gateType) {
            this.gateType = gateType;
        }

        /** 该类开关所属的门实例化类别 */
        public GateInstantiation.GateType getGateType() {
            return gateType;
        }
    }
}
