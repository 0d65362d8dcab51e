package com.verilang.frontend.builder;

import java.util.logging.Logger;

/**
 * 一次解析会话：持有 arena 与绑定其上的工厂
 *
 * <pre>
 * try (AstSession session = AstSession.begin()) {
 *     AstFactory f = session.getFactory();
 *     ...
 * }
 * </pre>
 */
public final class AstSession implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(AstSession.class.getName());

    private final AstArena arena;
    private final AstFactory factory;
    private boolean ended;

    private AstSession(AstConfig config) {
        this.arena = new AstArena(config.getMaxNodes());
        this.factory = new AstFactory(arena, config);
    }

    /** 使用 classpath 配置开始会话 */
    public static AstSession begin() {
        return begin(AstConfig.load());
    }

    public static AstSession begin(AstConfig config) {
        LOG.fine("AST 会话开始");
        return new AstSession(config);
    }

    public AstArena getArena() {
        return arena;
    }

    /**
     * @throws IllegalStateException 会话已结束
     */
    public AstFactory getFactory() {
        if (ended) {
            throw new IllegalStateException("AST session has ended");
        }
        return factory;
    }

    public boolean isEnded() {
        return ended;
    }

    /**
     * 结束会话并释放全部节点，重复调用无效果
     */
    public void end() {
        if (ended) {
            return;
        }
        int allocated = arena.size();
        arena.releaseAll();
        ended = true;
        LOG.fine("AST 会话结束，释放 " + allocated + " 个分配");
    }

    @Override
    public void close() {
        end();
    }
}
