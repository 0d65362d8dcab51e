package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.Attribute;
import com.verilang.frontend.ast.AttributeList;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.NumberLiteral;
import com.verilang.frontend.ast.Range;
import com.verilang.frontend.ast.expr.*;

/**
 * 表达式 / primary / lvalue / 拼接的构造辅助类
 */
class ExprFactory {

    final AstFactory factory;

    ExprFactory(AstFactory factory) {
        this.factory = factory;
    }

    // ============ 叶子 ============

    Identifier newIdentifier(String name) {
        factory.check(name != null && !name.isEmpty(), AstViolation.MISSING_CHILD, "identifier", "empty name");
        return factory.register(new Identifier(name));
    }

    NumberLiteral newNumber(NumberLiteral.NumberBase base, String digits, int width, boolean signed) {
        factory.requireChild(base, "number", "base");
        factory.check(digits != null && !digits.isEmpty(), AstViolation.MISSING_CHILD, "number", "no digits");
        return factory.register(new NumberLiteral(base, digits, width, signed));
    }

    Range newRange(Expression upper, Expression lower) {
        factory.requireChild(upper, "range", "upper bound");
        factory.requireChild(lower, "range", "lower bound");
        return factory.register(new Range(upper, lower));
    }

    Attribute newAttribute(Identifier name, Expression value) {
        factory.requireChild(name, "attribute", "name");
        return factory.register(new Attribute(name, value));
    }

    AttributeList newAttributeList(Attribute first) {
        factory.requireChild(first, "attribute list", "first attribute");
        AstList<Attribute> attributes = new AstList<>();
        attributes.append(first);
        return factory.register(new AttributeList(attributes), attributes);
    }

    void appendAttribute(AttributeList list, Attribute attribute) {
        factory.requireChild(list, "attribute list", "list");
        factory.requireChild(attribute, "attribute list", "attribute");
        list.getAttributes().append(attribute);
    }

    // ============ Primary ============

    Primary newPrimary(Primary.PrimaryType primaryType, Primary.PrimaryValueType valueType, AstNode value) {
        factory.requireChild(valueType, "primary", "value type");
        factory.requireChild(value, "primary", "value");
        factory.check(valueType.accepts(value), AstViolation.PRIMARY_VALUE_MISMATCH, "primary",
                valueType + " cannot hold " + value.getClass().getSimpleName());
        return factory.register(new Primary(primaryType, valueType, value));
    }

    // ============ 表达式 ============

    PrimaryExpression newPrimaryExpression(Primary primary) {
        factory.requireChild(primary, "primary expression", "primary");
        return factory.register(new PrimaryExpression(primary));
    }

    UnaryExpression newUnaryExpression(Expression operand, Operator operator, AttributeList attributes,
                                       boolean constant) {
        factory.requireChild(operand, "unary expression", "operand");
        factory.requireChild(operator, "unary expression", "operator");
        factory.check(operator.isUnary(), AstViolation.INVALID_OPERATOR, "unary expression",
                "'" + operator.toSourceString() + "' is not a unary operator");
        return factory.register(new UnaryExpression(operand, operator, attributes, constant));
    }

    BinaryExpression newBinaryExpression(Expression left, Expression right, Operator operator,
                                         AttributeList attributes, boolean constant) {
        factory.requireChild(left, "binary expression", "left operand");
        factory.requireChild(right, "binary expression", "right operand");
        factory.requireChild(operator, "binary expression", "operator");
        factory.check(operator.isBinary(), AstViolation.INVALID_OPERATOR, "binary expression",
                "'" + operator.toSourceString() + "' is not a binary operator");
        return factory.register(new BinaryExpression(left, right, operator, attributes, constant));
    }

    RangeExpression newRangeExpression(Expression left, Expression right, boolean constant) {
        factory.requireChild(left, "range expression", "left bound");
        factory.requireChild(right, "range expression", "right bound");
        return factory.register(new RangeExpression(left, right, constant));
    }

    RangeExpression newIndexExpression(Expression index, boolean constant) {
        factory.requireChild(index, "index expression", "index");
        return factory.register(new RangeExpression(index, null, constant));
    }

    StringExpression newStringExpression(String value) {
        factory.requireChild(value, "string expression", "value");
        return factory.register(new StringExpression(value));
    }

    ConditionalExpression newConditionalExpression(Expression condition, Expression ifTrue, Expression ifFalse,
                                                   AttributeList attributes) {
        factory.requireChild(condition, "conditional expression", "condition");
        factory.requireChild(ifTrue, "conditional expression", "true branch");
        factory.requireChild(ifFalse, "conditional expression", "false branch");
        return factory.register(new ConditionalExpression(condition, ifTrue, ifFalse, attributes));
    }

    MinTypMaxExpression newMinTypMaxExpression(Expression min, Expression typ, Expression max) {
        factory.requireChild(typ, "mintypmax expression", "typical value");
        factory.check((min == null) == (max == null), AstViolation.MINTYPMAX_INCOMPLETE,
                "mintypmax expression", min == null ? "max without min" : "min without max");
        return factory.register(new MinTypMaxExpression(min, typ, max));
    }

    FunctionCall newFunctionCall(Identifier function, boolean constant, boolean system, AttributeList attributes,
                                 AstList<Expression> arguments) {
        factory.requireChild(function, "function call", "function name");
        if (arguments == null) {
            AstList<Expression> empty = new AstList<>();
            return factory.register(new FunctionCall(function, constant, system, attributes, empty), empty);
        }
        return factory.register(new FunctionCall(function, constant, system, attributes, arguments));
    }

    // ============ Lvalue ============

    Lvalue newIdentifierLvalue(Lvalue.LvalueType type, Identifier identifier) {
        factory.requireChild(type, "lvalue", "type");
        factory.requireChild(identifier, "lvalue", "identifier");
        factory.check(type.isIdentifierForm(), AstViolation.LVALUE_TYPE_MISMATCH, "lvalue",
                type + " cannot name a single identifier");
        return factory.register(Lvalue.ofIdentifier(type, identifier));
    }

    Lvalue newConcatenationLvalue(Lvalue.LvalueType type, Concatenation concatenation) {
        factory.requireChild(type, "lvalue", "type");
        factory.requireChild(concatenation, "lvalue", "concatenation");
        factory.check(type.isConcatenationForm(), AstViolation.LVALUE_TYPE_MISMATCH, "lvalue",
                type + " cannot hold a concatenation");
        return factory.register(Lvalue.ofConcatenation(type, concatenation));
    }

    // ============ 拼接 ============

    Concatenation newConcatenation(Concatenation.ConcatenationType type, Expression repeat, AstNode first) {
        factory.requireChild(type, "concatenation", "type");
        checkItem(type, first);
        AstList<AstNode> items = new AstList<>();
        items.append(first);
        return factory.register(new Concatenation(type, repeat, items), items);
    }

    Concatenation newEmptyConcatenation(Concatenation.ConcatenationType type) {
        factory.requireChild(type, "concatenation", "type");
        AstList<AstNode> items = new AstList<>();
        return factory.register(new Concatenation(type, null, items), items);
    }

    /**
     * 文法左递归，后解析到的项在源码中更靠前，因此插入到头部
     */
    void extendConcatenation(Concatenation concatenation, AstNode item) {
        factory.requireChild(concatenation, "concatenation", "concatenation");
        checkItem(concatenation.getType(), item);
        concatenation.getItems().prepend(item);
    }

    private void checkItem(Concatenation.ConcatenationType type, AstNode item) {
        factory.requireChild(item, "concatenation", "item");
        factory.check(type.accepts(item), AstViolation.CONCATENATION_ITEM_MISMATCH, "concatenation",
                type + " cannot hold " + item.getClass().getSimpleName());
    }
}
