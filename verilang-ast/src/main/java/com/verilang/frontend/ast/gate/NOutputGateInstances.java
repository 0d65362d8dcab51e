package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Delay2;
import com.verilang.frontend.ast.DriveStrength;

/**
 * buf / not：一个输入驱动多个输出
 */
public class NOutputGateInstances
        extends GateInstances<NOutputGateInstances.NOutputGateType, Delay2, NOutputGateInstance> {

    public NOutputGateInstances(NOutputGateType type, Delay2 delay, DriveStrength driveStrength,
                                AstList<NOutputGateInstance> instances) {
        super(type, delay, driveStrength, instances);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNOutputGateInstances(this, context);
    }

    public enum NOutputGateType {
        BUF,
        NOT
    }
}
