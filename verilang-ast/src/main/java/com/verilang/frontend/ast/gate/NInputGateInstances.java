package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Delay3;
import com.verilang.frontend.ast.DriveStrength;

public class NInputGateInstances
        extends GateInstances<NInputGateInstances.NInputGateType, Delay3, NInputGateInstance> {

    public NInputGateInstances(NInputGateType type, Delay3 delay, DriveStrength driveStrength,
                               AstList<NInputGateInstance> instances) {
        super(type, delay, driveStrength, instances);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNInputGateInstances(this, context);
    }

    /**
     * 多输入门类型
     */
    public enum NInputGateType {
        AND,
        NAND,
        OR,
        NOR,
        XOR,
        XNOR
    }
}
