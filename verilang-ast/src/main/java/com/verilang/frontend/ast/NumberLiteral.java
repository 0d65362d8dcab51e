package com.verilang.frontend.ast;

/**
 * 数字字面量
 *
 * <p>保留词法器识别出的原始数字串，位宽缺省时为 -1（未指定）。</p>
 */
public final class NumberLiteral extends AstNode {
    private final NumberBase base;
    private final String digits;
    private final int width;
    private final boolean signed;

    public NumberLiteral(NumberBase base, String digits, int width, boolean signed) {
        this.base = base;
        this.digits = digits;
        this.width = width;
        this.signed = signed;
    }

    public NumberBase getBase() {
        return base;
    }

    public String getDigits() {
        return digits;
    }

    public int getWidth() {
        return width;
    }

    public boolean hasWidth() {
        return width >= 0;
    }

    public boolean isSigned() {
        return signed;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNumberLiteral(this, context);
    }

    @Override
    public String toString() {
        if (base == NumberBase.REAL || (base == NumberBase.DECIMAL && !hasWidth())) {
            return digits;
        }
        StringBuilder sb = new StringBuilder();
        if (hasWidth()) sb.append(width);
        sb.append('\'');
        if (signed) sb.append('s');
        sb.append(base.getPrefix()).append(digits);
        return sb.toString();
    }

    /**
     * 数字进制
     */
    public enum NumberBase {
        BINARY('b'),
        OCTAL('o'),
        DECIMAL('d'),
        HEX('h'),
        REAL('r');

        private final char prefix;

        NumberBase(char prefix) {
            this.prefix = prefix;
        }

        /** 基数前缀字符（'b / 'h 等中的字母） */
        public char getPrefix() {
            return prefix;
        }
    }
}
