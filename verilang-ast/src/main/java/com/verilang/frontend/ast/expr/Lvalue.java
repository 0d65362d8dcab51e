package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;

/**
 * 赋值左值：标识符形式或拼接形式
 */
public class Lvalue extends AstNode {
    private final LvalueType type;
    private final Identifier identifier;
    private final Concatenation concatenation;

    private Lvalue(LvalueType type, Identifier identifier, Concatenation concatenation) {
        this.type = type;
        this.identifier = identifier;
        this.concatenation = concatenation;
    }

    /** 标识符形式，类型标签由调用方（工厂）保证 */
    public static Lvalue ofIdentifier(LvalueType type, Identifier identifier) {
        return new Lvalue(type, identifier, null);
    }

    /** 拼接形式，类型标签由调用方（工厂）保证 */
    public static Lvalue ofConcatenation(LvalueType type, Concatenation concatenation) {
        return new Lvalue(type, null, concatenation);
    }

    public LvalueType getType() {
        return type;
    }

    /** 标识符形式时非空 */
    public Identifier getIdentifier() {
        return identifier;
    }

    /** 拼接形式时非空 */
    public Concatenation getConcatenation() {
        return concatenation;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLvalue(this, context);
    }

    /**
     * 左值类别
     */
    public enum LvalueType {
        NET_IDENTIFIER(true),
        VAR_IDENTIFIER(true),
        GENVAR_IDENTIFIER(true),
        NET_CONCATENATION(false),
        VAR_CONCATENATION(false);

        private final boolean identifierForm;

        LvalueType(boolean identifierForm) {
            this.identifierForm = identifierForm;
        }

        public boolean isIdentifierForm() {
            return identifierForm;
        }

        public boolean isConcatenationForm() {
            return !identifierForm;
        }
    }
}
