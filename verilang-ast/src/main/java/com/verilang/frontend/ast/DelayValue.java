package com.verilang.frontend.ast;

/**
 * 延迟值：无符号数、实数或参数标识符
 */
public final class DelayValue extends AstNode {
    private final NumberLiteral number;
    private final Identifier identifier;

    private DelayValue(NumberLiteral number, Identifier identifier) {
        this.number = number;
        this.identifier = identifier;
    }

    public static DelayValue of(NumberLiteral number) {
        return new DelayValue(number, null);
    }

    public static DelayValue of(Identifier identifier) {
        return new DelayValue(null, identifier);
    }

    public NumberLiteral getNumber() {
        return number;
    }

    public Identifier getIdentifier() {
        return identifier;
    }

    public boolean isNumber() {
        return number != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDelayValue(this, context);
    }
}
