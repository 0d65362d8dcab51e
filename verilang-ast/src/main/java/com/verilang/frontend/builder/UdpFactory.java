package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AttributeList;
import com.verilang.frontend.ast.Delay2;
import com.verilang.frontend.ast.DriveStrength;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.NumberLiteral;
import com.verilang.frontend.ast.Range;
import com.verilang.frontend.ast.decl.PortDirection;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.expr.Lvalue;
import com.verilang.frontend.ast.udp.*;

/**
 * UDP（用户自定义原语）的构造辅助类
 */
class UdpFactory {

    final AstFactory factory;

    UdpFactory(AstFactory factory) {
        this.factory = factory;
    }

    // ============ 端口 ============

    /**
     * 单个 output / inout 端口
     */
    UdpPort newUdpPort(PortDirection direction, Identifier identifier, AttributeList attributes, boolean reg,
                       Expression defaultValue) {
        factory.requireChild(direction, "udp port", "direction");
        factory.check(direction != PortDirection.INPUT, AstViolation.UDP_PORT_DIRECTION, "udp port",
                "input ports are declared as an identifier list");
        factory.requireChild(identifier, "udp port", "identifier");
        return factory.register(new UdpPort(direction, identifier, null, attributes, reg, defaultValue));
    }

    /**
     * 输入端口列表：强制非 reg、无默认值
     */
    UdpPort newUdpInputPort(AstList<Identifier> identifiers, AttributeList attributes) {
        factory.requireChild(identifiers, "udp input port", "identifiers");
        return factory.register(new UdpPort(PortDirection.INPUT, null, identifiers, attributes, false, null));
    }

    // ============ 声明与实例 ============

    UdpDeclaration newUdpDeclaration(AttributeList attributes, Identifier identifier, AstList<UdpPort> ports,
                                     UdpBody body) {
        factory.requireChild(identifier, "udp declaration", "identifier");
        factory.requireChild(ports, "udp declaration", "ports");
        factory.requireChild(body, "udp declaration", "body");
        return factory.register(new UdpDeclaration(attributes, identifier, ports, body));
    }

    UdpInstance newUdpInstance(Identifier identifier, Range range, Lvalue output, AstList<Expression> inputs) {
        factory.requireChild(output, "udp instance", "output terminal");
        factory.requireChild(inputs, "udp instance", "input terminals");
        return factory.register(new UdpInstance(identifier, range, output, inputs));
    }

    UdpInstantiation newUdpInstantiation(AstList<UdpInstance> instances, Identifier identifier,
                                         DriveStrength driveStrength, Delay2 delay) {
        factory.requireChild(instances, "udp instantiation", "instances");
        factory.requireChild(identifier, "udp instantiation", "udp identifier");
        return factory.register(new UdpInstantiation(instances, identifier, driveStrength, delay));
    }

    // ============ 主体 ============

    UdpInitialStatement newUdpInitialStatement(Identifier outputPort, NumberLiteral initialValue) {
        factory.requireChild(outputPort, "udp initial statement", "output port");
        factory.requireChild(initialValue, "udp initial statement", "initial value");
        return factory.register(new UdpInitialStatement(outputPort, initialValue));
    }

    SequentialUdpBody newSequentialBody(UdpInitialStatement initial, AstList<UdpSequentialEntry> entries) {
        factory.requireChild(entries, "sequential udp body", "entries");
        return factory.register(new SequentialUdpBody(initial, entries));
    }

    CombinatorialUdpBody newCombinatorialBody(AstList<UdpCombinatorialEntry> entries) {
        factory.requireChild(entries, "combinatorial udp body", "entries");
        return factory.register(new CombinatorialUdpBody(entries));
    }

    // ============ 真值表 ============

    UdpCombinatorialEntry newCombinatorialEntry(AstList<LevelSymbol> inputLevels, NextState output) {
        factory.requireChild(inputLevels, "combinatorial entry", "input levels");
        factory.requireChild(output, "combinatorial entry", "output");
        factory.check(output != NextState.UNCHANGED, AstViolation.UDP_ENTRY_MISMATCH, "combinatorial entry",
                "'-' is only valid in sequential tables");
        return factory.register(new UdpCombinatorialEntry(inputLevels, output));
    }

    EdgeIndicator newEdgeIndicator(LevelSymbol from, LevelSymbol to) {
        factory.requireChild(from, "edge indicator", "from level");
        factory.requireChild(to, "edge indicator", "to level");
        return factory.register(EdgeIndicator.ofLevels(from, to));
    }

    EdgeIndicator newEdgeIndicator(EdgeIndicator.EdgeSymbol symbol) {
        factory.requireChild(symbol, "edge indicator", "symbol");
        return factory.register(EdgeIndicator.ofSymbol(symbol));
    }

    /**
     * 时序表的一行。LEVELS 前缀只能包含电平符号，EDGES 前缀必须恰好包含一个沿。
     */
    @SuppressWarnings("unchecked")
    UdpSequentialEntry newSequentialEntry(UdpSequentialEntry.EntryPrefix prefix,
                                          AstList<UdpInputSymbol> levelsOrEdges, LevelSymbol currentState,
                                          NextState output) {
        factory.requireChild(prefix, "sequential entry", "prefix");
        factory.requireChild(levelsOrEdges, "sequential entry", "inputs");
        factory.requireChild(currentState, "sequential entry", "current state");
        factory.requireChild(output, "sequential entry", "output");

        int edges = 0;
        for (UdpInputSymbol symbol : levelsOrEdges) {
            if (symbol instanceof EdgeIndicator) {
                edges++;
            } else {
                factory.check(symbol instanceof LevelSymbol, AstViolation.UDP_ENTRY_MISMATCH, "sequential entry",
                        "unknown input symbol");
            }
        }
        if (prefix == UdpSequentialEntry.EntryPrefix.LEVELS) {
            factory.check(edges == 0, AstViolation.UDP_ENTRY_MISMATCH, "sequential entry",
                    "level row contains an edge");
            AstList<?> levels = levelsOrEdges;
            return factory.register(new UdpSequentialEntry(prefix, (AstList<LevelSymbol>) levels, null,
                    currentState, output));
        }
        factory.check(edges == 1, AstViolation.UDP_ENTRY_MISMATCH, "sequential entry",
                "edge row must contain exactly one edge, found " + edges);
        return factory.register(new UdpSequentialEntry(prefix, null, levelsOrEdges, currentState, output));
    }
}
