package com.verilang.frontend.ast.udp;

import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;

/**
 * 边沿指示：(01) 这样的电平对，或 r / f / p / n / * 边沿符号
 */
public class EdgeIndicator extends AstNode implements UdpInputSymbol {
    private final LevelSymbol from;
    private final LevelSymbol to;
    private final EdgeSymbol symbol;

    private EdgeIndicator(LevelSymbol from, LevelSymbol to, EdgeSymbol symbol) {
        this.from = from;
        this.to = to;
        this.symbol = symbol;
    }

    public static EdgeIndicator ofLevels(LevelSymbol from, LevelSymbol to) {
        return new EdgeIndicator(from, to, null);
    }

    public static EdgeIndicator ofSymbol(EdgeSymbol symbol) {
        return new EdgeIndicator(null, null, symbol);
    }

    public LevelSymbol getFrom() {
        return from;
    }

    public LevelSymbol getTo() {
        return to;
    }

    public EdgeSymbol getSymbol() {
        return symbol;
    }

    @Override
    public String toTableString() {
        if (symbol != null) {
            return symbol.toTableString();
        }
        return "(" + from.toTableString() + to.toTableString() + ")";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEdgeIndicator(this, context);
    }

    /**
     * 边沿符号
     */
    public enum EdgeSymbol {
        RISING("r"),
        FALLING("f"),
        POSITIVE("p"),
        NEGATIVE("n"),
        ANY("*");

        private final String symbol;

        EdgeSymbol(String symbol) {
            this.symbol = symbol;
        }

        public String toTableString() {
            return symbol;
        }
    }
}
