package com.verilang.frontend.builder;

/**
 * 构造契约被违反：类型标签与载荷不匹配、取值越界或缺少必需子节点
 *
 * <p>抛出时尚未向 arena 登记任何节点，调用方可以转换为带源码位置的诊断后继续。</p>
 */
public class AstConstructionException extends AstException {
    private final AstViolation violation;
    private final String construct;
    private final String detail;

    public AstConstructionException(AstViolation violation, String construct, String detail) {
        super(violation.getDescription());
        this.violation = violation;
        this.construct = construct;
        this.detail = detail;
    }

    public AstViolation getViolation() {
        return violation;
    }

    /** 出错的构造（如 "lvalue"、"case statement"） */
    public String getConstruct() {
        return construct;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(construct).append(": ").append(super.getMessage());
        if (detail != null) {
            sb.append(" (").append(detail).append(")");
        }
        return sb.toString();
    }
}
