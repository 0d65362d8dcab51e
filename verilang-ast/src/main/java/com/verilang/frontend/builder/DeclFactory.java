package com.verilang.frontend.builder;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.DriveStrength;
import com.verilang.frontend.ast.Identifier;
import com.verilang.frontend.ast.PrimitiveStrength;
import com.verilang.frontend.ast.Range;
import com.verilang.frontend.ast.decl.*;
import com.verilang.frontend.ast.stmt.SingleAssignment;

/**
 * 声明的构造辅助类
 */
class DeclFactory {

    final AstFactory factory;

    DeclFactory(AstFactory factory) {
        this.factory = factory;
    }

    DriveStrength newDriveStrength(PrimitiveStrength strength0, PrimitiveStrength strength1) {
        factory.requireChild(strength0, "drive strength", "strength0");
        factory.requireChild(strength1, "drive strength", "strength1");
        return factory.register(new DriveStrength(strength0, strength1));
    }

    ParameterDeclarations newParameterDeclarations(AstList<SingleAssignment> assignments, boolean signedValues,
                                                   boolean local, Range range,
                                                   ParameterDeclarations.ParameterType type) {
        factory.requireChild(assignments, "parameter declarations", "assignments");
        factory.requireChild(type, "parameter declarations", "type");
        Range effectiveRange = range;
        boolean effectiveSigned = signedValues;
        if (type != ParameterDeclarations.ParameterType.GENERIC) {
            // integer / real / realtime / time 参数的位宽和符号由类型固定
            effectiveRange = null;
            effectiveSigned = false;
        }
        return factory.register(new ParameterDeclarations(assignments, effectiveSigned, local, effectiveRange, type));
    }

    PortDeclaration newPortDeclaration(PortDirection direction, NetType netType, boolean netSigned, boolean reg,
                                       boolean variable, Range range, AstList<Identifier> portNames) {
        factory.requireChild(direction, "port declaration", "direction");
        factory.requireChild(portNames, "port declaration", "port names");
        NetType effectiveNetType = netType == null ? NetType.NONE : netType;
        return factory.register(new PortDeclaration(direction, effectiveNetType, netSigned, reg, variable, range,
                portNames));
    }

    /**
     * 返回的声明只带类型，其余字段由调用方在解析过程中逐步填写
     */
    TypeDeclaration newTypeDeclaration(TypeDeclaration.DeclarationType type) {
        factory.requireChild(type, "type declaration", "type");
        return factory.register(new TypeDeclaration(type));
    }
}
