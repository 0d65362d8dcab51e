package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Delay3;
import com.verilang.frontend.ast.DriveStrength;

/**
 * 连续赋值 assign [strength] [#delay] a = b, c = d;
 */
public class ContinuousAssignment extends Assignment {
    private final AstList<SingleAssignment> assignments;
    private final DriveStrength driveStrength;
    private final Delay3 delay;

    public ContinuousAssignment(AstList<SingleAssignment> assignments, DriveStrength driveStrength, Delay3 delay) {
        this.assignments = assignments;
        this.driveStrength = driveStrength;
        this.delay = delay;
    }

    @Override
    public AssignmentKind getKind() {
        return AssignmentKind.CONTINUOUS;
    }

    public AstList<SingleAssignment> getAssignments() {
        return assignments;
    }

    public DriveStrength getDriveStrength() {
        return driveStrength;
    }

    public Delay3 getDelay() {
        return delay;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitContinuousAssignment(this, context);
    }
}
