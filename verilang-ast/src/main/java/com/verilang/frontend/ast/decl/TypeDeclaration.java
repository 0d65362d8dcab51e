package com.verilang.frontend.ast.decl;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.ChargeStrength;
import com.verilang.frontend.ast.Delay3;
import com.verilang.frontend.ast.DriveStrength;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.Range;

/**
 * 模块项类型声明（wire / reg / integer / genvar ...）
 *
 * <p>可选修饰太多，无法用单个构造器表达：工厂只确定 type，
 * 其余字段初始为空/false，由解析器在归约过程中逐项填写。</p>
 */
public class TypeDeclaration extends AstNode {
    private final DeclarationType type;
    private AstList<Identifier> identifiers;
    private Delay3 delay;
    private DriveStrength driveStrength;
    private ChargeStrength chargeStrength;
    private Range range;
    private boolean vectored;
    private boolean scalared;
    private boolean signed;
    private NetType netType = NetType.NONE;

    public TypeDeclaration(DeclarationType type) {
        this.type = type;
    }

    public DeclarationType getType() {
        return type;
    }

    public AstList<Identifier> getIdentifiers() {
        return identifiers;
    }

    public void setIdentifiers(AstList<Identifier> identifiers) {
        this.identifiers = identifiers;
    }

    public Delay3 getDelay() {
        return delay;
    }

    public void setDelay(Delay3 delay) {
        this.delay = delay;
    }

    public DriveStrength getDriveStrength() {
        return driveStrength;
    }

    public void setDriveStrength(DriveStrength driveStrength) {
        this.driveStrength = driveStrength;
    }

    public ChargeStrength getChargeStrength() {
        return chargeStrength;
    }

    public void setChargeStrength(ChargeStrength chargeStrength) {
        this.chargeStrength = chargeStrength;
    }

    public Range getRange() {
        return range;
    }

    public void setRange(Range range) {
        this.range = range;
    }

    public boolean isVectored() {
        return vectored;
    }

    public void setVectored(boolean vectored) {
        this.vectored = vectored;
    }

    public boolean isScalared() {
        return scalared;
    }

    public void setScalared(boolean scalared) {
        this.scalared = scalared;
    }

    public boolean isSigned() {
        return signed;
    }

    public void setSigned(boolean signed) {
        this.signed = signed;
    }

    public NetType getNetType() {
        return netType;
    }

    public void setNetType(NetType netType) {
        this.netType = netType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeDeclaration(this, context);
    }

    /**
     * 声明类别
     */
    public enum DeclarationType {
        NET,
        REG,
        INTEGER,
        REAL,
        REALTIME,
        TIME,
        EVENT,
        GENVAR,
        SPECPARAM
    }
}
