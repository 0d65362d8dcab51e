package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Delay3;
import com.verilang.frontend.ast.DriveStrength;

public class EnableGateInstances
        extends GateInstances<EnableGateInstances.EnableGateType, Delay3, EnableGateInstance> {

    public EnableGateInstances(EnableGateType type, Delay3 delay, DriveStrength driveStrength,
                               AstList<EnableGateInstance> instances) {
        super(type, delay, driveStrength, instances);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnableGateInstances(this, context);
    }

    public enum EnableGateType {
        BUFIF0,
        BUFIF1,
        NOTIF0,
        NOTIF1
    }
}
