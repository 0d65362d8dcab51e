package com.verilang.frontend.ast.inst;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.AstVisitor;
import com.verilang.frontend.ast.Identifier;

/**
 * 共享参数的一组模块实例 mod #(params) u0 (...), u1 (...);
 */
public class ModuleInstantiation extends AstNode {
    private final Identifier moduleIdentifier;
    private final AstList<PortConnection> moduleParameters;
    private final AstList<ModuleInstance> moduleInstances;

    public ModuleInstantiation(Identifier moduleIdentifier, AstList<PortConnection> moduleParameters,
                               AstList<ModuleInstance> moduleInstances) {
        this.moduleIdentifier = moduleIdentifier;
        this.moduleParameters = moduleParameters;
        this.moduleInstances = moduleInstances;
    }

    public Identifier getModuleIdentifier() {
        return moduleIdentifier;
    }

    /** #( ... ) 参数赋值，按名或按位置 */
    public AstList<PortConnection> getModuleParameters() {
        return moduleParameters;
    }

    public AstList<ModuleInstance> getModuleInstances() {
        return moduleInstances;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleInstantiation(this, context);
    }
}
