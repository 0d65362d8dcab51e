package com.verilang.frontend.builder;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.logging.Logger;

/**
 * AST 构造配置
 *
 * <p>可从 classpath 资源 {@value #RESOURCE_NAME} 加载，缺省时使用默认值。</p>
 */
public class AstConfig {
    private static final Logger LOG = Logger.getLogger(AstConfig.class.getName());

    public static final String RESOURCE_NAME = "verilang-ast.json";

    private static final Gson GSON = new Gson();

    private static final String POLICY_KEY = "duplicateDefaultPolicy";

    /** arena 节点上限，0 表示不限 */
    private int maxNodes = 0;
    private DuplicateDefaultPolicy duplicateDefaultPolicy = DuplicateDefaultPolicy.FIRST_WINS;

    public AstConfig() {
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public void setMaxNodes(int maxNodes) {
        if (maxNodes < 0) {
            throw new IllegalArgumentException("maxNodes must not be negative: " + maxNodes);
        }
        this.maxNodes = maxNodes;
    }

    public DuplicateDefaultPolicy getDuplicateDefaultPolicy() {
        return duplicateDefaultPolicy;
    }

    public void setDuplicateDefaultPolicy(DuplicateDefaultPolicy duplicateDefaultPolicy) {
        this.duplicateDefaultPolicy = duplicateDefaultPolicy;
    }

    /**
     * 从 JSON 文本解析配置，未出现的字段保持默认值
     */
    public static AstConfig fromJson(String json) {
        if (json == null || json.trim().isEmpty()) {
            return new AstConfig();
        }
        try {
            return fromTree(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid AST configuration: " + e.getMessage(), e);
        }
    }

    /**
     * 从 classpath 加载配置，资源不存在时返回默认配置
     */
    public static AstConfig load() {
        ClassLoader loader = AstConfig.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                LOG.fine("未找到 " + RESOURCE_NAME + "，使用默认配置");
                return new AstConfig();
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                return fromTree(JsonParser.parseReader(reader));
            } catch (JsonParseException e) {
                throw new IllegalArgumentException("Invalid AST configuration in " + RESOURCE_NAME + ": "
                        + e.getMessage(), e);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
    }

    private static AstConfig fromTree(JsonElement tree) {
        if (tree == null || tree.isJsonNull()) {
            return new AstConfig();
        }
        AstConfig config = GSON.fromJson(tree, AstConfig.class);
        if (config.duplicateDefaultPolicy == null) {
            // Gson 把无法识别的枚举值读成 null，只有缺省的键才回落到默认策略
            JsonElement policy = tree.getAsJsonObject().get(POLICY_KEY);
            if (policy != null && !policy.isJsonNull()) {
                throw new IllegalArgumentException("Unknown " + POLICY_KEY + ": " + policy
                        + ", expected one of " + Arrays.toString(DuplicateDefaultPolicy.values()));
            }
            config.duplicateDefaultPolicy = DuplicateDefaultPolicy.FIRST_WINS;
        }
        config.setMaxNodes(config.maxNodes);
        return config;
    }

    /**
     * 多个 default 分支的处理策略
     */
    public enum DuplicateDefaultPolicy {
        /** 缓存第一个 default，其余保留在分支列表中但不缓存 */
        FIRST_WINS,
        /** 直接拒绝，抛出构造异常 */
        REJECT
    }
}
