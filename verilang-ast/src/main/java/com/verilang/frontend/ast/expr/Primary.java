package com.verilang.frontend.ast.expr;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.NumberLiteral;

/**
 * 表达式树的叶子
 *
 * <p>primaryType 只由对应的工厂方法决定：常量 primary 只能来自常量构造，
 * 模块路径 primary 只能来自模块路径构造。value 的具体类型由 valueType 决定。</p>
 */
public class Primary extends AstNode {
    private final PrimaryType primaryType;
    private final PrimaryValueType valueType;
    private final AstNode value;

    public Primary(PrimaryType primaryType, PrimaryValueType valueType, AstNode value) {
        this.primaryType = primaryType;
        this.valueType = valueType;
        this.value = value;
    }

    public PrimaryType getPrimaryType() {
        return primaryType;
    }

    public PrimaryValueType getValueType() {
        return valueType;
    }

    public AstNode getValue() {
        return value;
    }

    public NumberLiteral getNumber() {
        return valueType == PrimaryValueType.NUMBER ? (NumberLiteral) value : null;
    }

    public Identifier getIdentifier() {
        return valueType == PrimaryValueType.IDENTIFIER || valueType == PrimaryValueType.MACRO_USAGE
                ? (Identifier) value : null;
    }

    public Concatenation getConcatenation() {
        return valueType == PrimaryValueType.CONCATENATION ? (Concatenation) value : null;
    }

    public FunctionCall getFunctionCall() {
        return valueType == PrimaryValueType.FUNCTION_CALL ? (FunctionCall) value : null;
    }

    public Expression getMinTypMax() {
        return valueType == PrimaryValueType.MINTYPMAX ? (Expression) value : null;
    }

    public StringExpression getString() {
        return valueType == PrimaryValueType.STRING ? (StringExpression) value : null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPrimary(this, context);
    }

    /**
     * primary 所在的表达式树类别
     */
    public enum PrimaryType {
        CONSTANT_PRIMARY,
        PRIMARY,
        MODULE_PATH_PRIMARY
    }

    /**
     * primary 的值类别，每种类别对应固定的载荷类型
     */
    public enum PrimaryValueType {
        NUMBER(NumberLiteral.class),
        IDENTIFIER(Identifier.class),
        CONCATENATION(Concatenation.class),
        FUNCTION_CALL(FunctionCall.class),
        MINTYPMAX(Expression.class),
        MACRO_USAGE(Identifier.class),
        STRING(StringExpression.class);

        private final Class<? extends AstNode> payloadType;

        PrimaryValueType(Class<? extends AstNode> payloadType) {
            this.payloadType = payloadType;
        }

        public Class<? extends AstNode> getPayloadType() {
            return payloadType;
        }

        public boolean accepts(AstNode value) {
            return payloadType.isInstance(value);
        }
    }
}
