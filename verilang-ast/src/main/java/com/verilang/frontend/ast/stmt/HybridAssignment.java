package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.expr.Lvalue;

/**
 * 复合赋值（+= 等）与自增自减
 *
 * <p>复合赋值只持有 assignment，自增自减只持有 lvalue，二者不会同时存在。</p>
 */
public class HybridAssignment extends Assignment {
    private final HybridAssignmentType type;
    private final SingleAssignment assignment;
    private final Lvalue lvalue;

    private HybridAssignment(HybridAssignmentType type, SingleAssignment assignment, Lvalue lvalue) {
        this.type = type;
        this.assignment = assignment;
        this.lvalue = lvalue;
    }

    public static HybridAssignment ofAssignment(HybridAssignmentType type, SingleAssignment assignment) {
        return new HybridAssignment(type, assignment, null);
    }

    public static HybridAssignment ofLvalue(HybridAssignmentType type, Lvalue lvalue) {
        return new HybridAssignment(type, null, lvalue);
    }

    @Override
    public AssignmentKind getKind() {
        return AssignmentKind.HYBRID;
    }

    public HybridAssignmentType getType() {
        return type;
    }

    public SingleAssignment getAssignment() {
        return assignment;
    }

    public Lvalue getLvalue() {
        return lvalue;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitHybridAssignment(this, context);
    }

    /**
     * 复合赋值运算
     */
    public enum HybridAssignmentType {
        ADD_ASSIGN("+=", false),
        SUB_ASSIGN("-=", false),
        MUL_ASSIGN("*=", false),
        DIV_ASSIGN("/=", false),
        MOD_ASSIGN("%=", false),
        AND_ASSIGN("&=", false),
        OR_ASSIGN("|=", false),
        XOR_ASSIGN("^=", false),
        LSL_ASSIGN("<<=", false),
        LSR_ASSIGN(">>=", false),
        ASL_ASSIGN("<<<=", false),
        ASR_ASSIGN(">>>=", false),
        PRE_INCREMENT("++", true),
        PRE_DECREMENT("--", true),
        POST_INCREMENT("++", true),
        POST_DECREMENT("--", true);

        private final String source;
        private final boolean lvalueOnly;

        HybridAssignmentType(String source, boolean lvalueOnly) {
            this.source = source;
            this.lvalueOnly = lvalueOnly;
        }

        public String toSourceString() {
            return source;
        }

        /** 自增自减只有左值，没有右侧表达式 */
        public boolean isLvalueOnly() {
            return lvalueOnly;
        }
    }
}
