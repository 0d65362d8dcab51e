package com.verilang.frontend.ast.decl;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Range;
import com.verilang.frontend.ast.stmt.SingleAssignment;

/**
 * 同类型的一组参数声明 parameter [signed] [range] a = 1, b = 2;
 *
 * <p>只有 GENERIC 类型保留 range 与 signed，其余类型构造时强制清空。</p>
 */
public class ParameterDeclarations extends AstNode {
    private final AstList<SingleAssignment> assignments;
    private final boolean signedValues;
    private final boolean local;
    private final Range range;
    private final ParameterType type;

    public ParameterDeclarations(AstList<SingleAssignment> assignments, boolean signedValues, boolean local,
                                 Range range, ParameterType type) {
        this.assignments = assignments;
        this.signedValues = signedValues;
        this.local = local;
        this.range = range;
        this.type = type;
    }

    public AstList<SingleAssignment> getAssignments() {
        return assignments;
    }

    public boolean isSignedValues() {
        return signedValues;
    }

    /** localparam */
    public boolean isLocal() {
        return local;
    }

    public Range getRange() {
        return range;
    }

    public ParameterType getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameterDeclarations(this, context);
    }

    /**
     * 参数类型
     */
    public enum ParameterType {
        GENERIC,
        INTEGER,
        REAL,
        REALTIME,
        TIME
    }
}
