package com.verilang.frontend.ast.stmt;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;

/**
 * begin ... end / fork ... join 语句块
 */
public class StatementBlock extends AstNode {
    private final BlockType type;
    private final Identifier identifier;
    private final AstList<Statement> declarations;
    private final AstList<Statement> statements;

    public StatementBlock(BlockType type, Identifier identifier,
                          AstList<Statement> declarations, AstList<Statement> statements) {
        this.type = type;
        this.identifier = identifier;
        this.declarations = declarations;
        this.statements = statements;
    }

    public BlockType getType() {
        return type;
    }

    /** 块名（begin : name），匿名块为 null */
    public Identifier getIdentifier() {
        return identifier;
    }

    public AstList<Statement> getDeclarations() {
        return declarations;
    }

    public AstList<Statement> getStatements() {
        return statements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStatementBlock(this, context);
    }

    /**
     * 语句块类别
     */
    public enum BlockType {
        SEQUENTIAL,
        SEQUENTIAL_INITIAL,
        SEQUENTIAL_ALWAYS,
        FUNCTION_SEQUENTIAL,
        PARALLEL
    }
}
