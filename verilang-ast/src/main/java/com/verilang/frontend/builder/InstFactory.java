package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AttributeList;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.decl.ParameterDeclarations;
import com.verilang.frontend.ast.expr.Expression;
import com.verilang.frontend.ast.inst.*;
import com.verilang.frontend.ast.stmt.Statement;

/**
 * 模块声明、模块实例化与 generate 块的构造辅助类
 */
class InstFactory {

    final AstFactory factory;

    InstFactory(AstFactory factory) {
        this.factory = factory;
    }

    ModuleDeclaration newModuleDeclaration(AttributeList attributes, Identifier identifier,
                                           AstList<ParameterDeclarations> parameters, AstList<AstNode> ports,
                                           AstList<Statement> items) {
        factory.requireChild(identifier, "module declaration", "identifier");
        factory.requireChild(items, "module declaration", "module items");
        return factory.register(new ModuleDeclaration(attributes, identifier, parameters, ports, items));
    }

    ModuleInstantiation newModuleInstantiation(Identifier moduleIdentifier, AstList<PortConnection> parameters,
                                               AstList<ModuleInstance> instances) {
        factory.requireChild(moduleIdentifier, "module instantiation", "module identifier");
        factory.requireChild(instances, "module instantiation", "instances");
        return factory.register(new ModuleInstantiation(moduleIdentifier, parameters, instances));
    }

    ModuleInstance newModuleInstance(Identifier instanceIdentifier, AstList<PortConnection> connections) {
        factory.requireChild(instanceIdentifier, "module instance", "instance identifier");
        return factory.register(new ModuleInstance(instanceIdentifier, connections));
    }

    PortConnection newNamedPortConnection(Identifier portName, Expression expression) {
        factory.requireChild(portName, "port connection", "port name");
        return factory.register(new PortConnection(portName, expression));
    }

    PortConnection newOrderedPortConnection(Expression expression) {
        return factory.register(new PortConnection(null, expression));
    }

    GenerateBlock newGenerateBlock(Identifier identifier, AstList<Statement> items) {
        factory.requireChild(items, "generate block", "items");
        for (Statement item : items) {
            factory.check(item != null && item.isGenerateStatement(), AstViolation.GENERATE_ITEM_MISMATCH,
                    "generate block", "item was built as a plain statement");
        }
        return factory.register(new GenerateBlock(identifier, items));
    }
}
