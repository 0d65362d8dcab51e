package com.verilang.frontend.ast.inst;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.stmt.Statement;

/**
 * generate 块，所有项都是带 generate 标记的语句
 */
public class GenerateBlock extends AstNode {
    private final Identifier identifier;
    private final AstList<Statement> generateItems;

    public GenerateBlock(Identifier identifier, AstList<Statement> generateItems) {
        this.identifier = identifier;
        this.generateItems = generateItems;
    }

    /** 块名，匿名块为 null */
    public Identifier getIdentifier() {
        return identifier;
    }

    public AstList<Statement> getGenerateItems() {
        return generateItems;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGenerateBlock(this, context);
    }
}
