package com.verilang.frontend.ast.udp;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;

/**
 * 时序 UDP 真值表的一行：inputs : current : next;
 *
 * <p>前缀标签决定输入列是纯电平（levels）还是含边沿（edges），另一项为 null。</p>
 */
public class UdpSequentialEntry extends AstNode {
    private final EntryPrefix prefix;
    private final AstList<LevelSymbol> levels;
    private final AstList<UdpInputSymbol> edges;
    private final LevelSymbol currentState;
    private final NextState output;

    public UdpSequentialEntry(EntryPrefix prefix, AstList<LevelSymbol> levels, AstList<UdpInputSymbol> edges,
                              LevelSymbol currentState, NextState output) {
        this.prefix = prefix;
        this.levels = levels;
        this.edges = edges;
        this.currentState = currentState;
        this.output = output;
    }

    public EntryPrefix getPrefix() {
        return prefix;
    }

    public AstList<LevelSymbol> getLevels() {
        return levels;
    }

    public AstList<UdpInputSymbol> getEdges() {
        return edges;
    }

    public LevelSymbol getCurrentState() {
        return currentState;
    }

    public NextState getOutput() {
        return output;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUdpSequentialEntry(this, context);
    }

    /**
     * 输入列形状
     */
    public enum EntryPrefix {
        LEVELS,
        EDGES
    }
}
