package com.verilang.frontend.ast.gate;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.DriveStrength;

/**
 * 同类型逻辑门的一组实例
 *
 * @param <K> 门类型枚举
 * @param <D> 延迟形式（Delay2 或 Delay3）
 * @param <I> 单个实例的节点类型
 */
public abstract class GateInstances<K extends Enum<K>, D extends AstNode, I extends AstNode> extends AstNode {
    private final K type;
    private final D delay;
    private final DriveStrength driveStrength;
    private final AstList<I> instances;

    protected GateInstances(K type, D delay, DriveStrength driveStrength, AstList<I> instances) {
        this.type = type;
        this.delay = delay;
        this.driveStrength = driveStrength;
        this.instances = instances;
    }

    public K getType() {
        return type;
    }

    public D getDelay() {
        return delay;
    }

    public DriveStrength getDriveStrength() {
        return driveStrength;
    }

    public AstList<I> getInstances() {
        return instances;
    }
}
