package com.verilang.frontend.builder;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 解析会话级的批量分配器
 *
 * <p>会话中创建的每个节点和列表都在此登记，{@link #releaseAll()} 一次性释放全部，
 * 不支持单个释放。释放后旧节点视为已失效，不应再被引用。
 * 非线程安全：并行解析时每个解析单元持有独立的 arena。</p>
 */
public final class AstArena {
    private static final Logger LOG = Logger.getLogger(AstArena.class.getName());

    private final int maxNodes;
    private final List<Object> allocations = new ArrayList<>();
    private int generation;

    public AstArena() {
        this(0);
    }

    /**
     * @param maxNodes 分配上限，0 表示不限
     */
    public AstArena(int maxNodes) {
        if (maxNodes < 0) {
            throw new IllegalArgumentException("maxNodes must not be negative: " + maxNodes);
        }
        this.maxNodes = maxNodes;
    }

    /**
     * 登记一次分配并原样返回
     *
     * @throws AstAllocationException 超过分配上限
     */
    public <T> T register(T allocation) {
        if (allocation == null) {
            throw new IllegalArgumentException("Cannot register a null allocation");
        }
        reserve(1);
        allocations.add(allocation);
        return allocation;
    }

    /**
     * 检查还能否再登记 count 个分配，不足时直接失败且不登记任何对象
     *
     * @throws AstAllocationException 剩余额度不足
     */
    public void reserve(int count) {
        if (maxNodes > 0 && allocations.size() + count > maxNodes) {
            LOG.warning("AST arena 已达到分配上限 " + maxNodes);
            throw new AstAllocationException(maxNodes);
        }
    }

    /**
     * 释放本会话的全部分配并重置状态，之后可开始新的会话。未分配过时为空操作。
     */
    public void releaseAll() {
        if (allocations.isEmpty()) {
            return;
        }
        int released = allocations.size();
        allocations.clear();
        generation++;
        LOG.fine("AST arena 已释放 " + released + " 个分配，进入第 " + generation + " 代");
    }

    /** 是否登记过该对象（按引用比较） */
    public boolean owns(Object allocation) {
        for (Object o : allocations) {
            if (o == allocation) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return allocations.size();
    }

    public boolean isEmpty() {
        return allocations.isEmpty();
    }

    /** 已完成的释放次数 */
    public int getGeneration() {
        return generation;
    }

    public int getMaxNodes() {
        return maxNodes;
    }
}
