package com.verilang.frontend.ast;

import com.verilang.frontend.ast.expr.BinaryExpression;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Operator;
import com.verilang.frontend.ast.expr.Primary;
import com.verilang.frontend.ast.expr.PrimaryExpression;
import com.verilang.frontend.ast.stmt.Statement;
import com.verilang.frontend.ast.stmt.StatementKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AstVisitor 测试")
class AstVisitorTest {

    private static PrimaryExpression identifierExpression(String name) {
        return new PrimaryExpression(new Primary(Primary.PrimaryType.PRIMARY,
                Primary.PrimaryValueType.IDENTIFIER, new Identifier(name)));
    }

    /** 收集表达式树中出现的标识符 */
    static class IdentifierCollector implements AstVisitor<Void, List<String>> {

        @Override
        public Void visitBinaryExpression(BinaryExpression node, List<String> ctx) {
            node.getLeft().accept(this, ctx);
            node.getRight().accept(this, ctx);
            return null;
        }

        @Override
        public Void visitPrimaryExpression(PrimaryExpression node, List<String> ctx) {
            return node.getPrimary().accept(this, ctx);
        }

        @Override
        public Void visitPrimary(Primary node, List<String> ctx) {
            if (node.getIdentifier() != null) {
                node.getIdentifier().accept(this, ctx);
            }
            return null;
        }

        @Override
        public Void visitIdentifier(Identifier node, List<String> ctx) {
            ctx.add(node.getName());
            return null;
        }
    }

    @Test
    @DisplayName("accept 分派到对应的 visit 方法")
    void testDispatch() {
        Expression expr = new BinaryExpression(identifierExpression("a"), identifierExpression("b"),
                Operator.PLUS, null, false);
        List<String> names = new ArrayList<>();

        expr.accept(new IdentifierCollector(), names);

        assertThat(names).containsExactly("a", "b");
    }

    @Test
    @DisplayName("未覆盖的节点返回默认值 null")
    void testDefaultReturnsNull() {
        Statement stmt = new Statement(StatementKind.NULL, null, false, false, null);

        Object result = stmt.accept(new AstVisitor<Object, Void>() { }, null);

        assertThat(result).isNull();
    }

    @Test
    @DisplayName("访问者可以返回值")
    void testReturnValue() {
        Identifier id = new Identifier("$display");

        String result = id.accept(new AstVisitor<String, Void>() {
            @Override
            public String visitIdentifier(Identifier node, Void ctx) {
                return node.isSystem() ? "system:" + node.getName() : node.getName();
            }
        }, null);

        assertThat(result).isEqualTo("system:$display");
    }
}
