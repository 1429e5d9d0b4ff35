package org.lupenghan.holodsm.backend.conf;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.UUID;

/**
 * 节点配置，在构造时注入到各个组件
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class DSMConfig {
    // 默认页面大小 64KB，集群内必须一致
    public static final int DEFAULT_PAGE_SIZE = 64 * 1024;

    public static final String KEY_NODE_ID = "dsm.node.id";
    public static final String KEY_PAGE_SIZE = "dsm.page.size";
    public static final String KEY_CACHE_CAPACITY = "dsm.cache.capacity";
    public static final String KEY_CACHE_SIZE_MB = "dsm.cache.size.mb";
    public static final String KEY_LEASE_TTL = "dsm.lease.ttl.ms";
    public static final String KEY_LEASE_SWEEP_INTERVAL = "dsm.lease.sweep.interval.ms";
    public static final String KEY_REQUEST_TIMEOUT = "dsm.request.timeout.ms";

    // 节点ID
    @Builder.Default
    private final String nodeId = "node-" + UUID.randomUUID();

    // 页面大小（字节）
    @Builder.Default
    private final int pageSize = DEFAULT_PAGE_SIZE;

    // 页面缓存容量（页数）
    @Builder.Default
    private final int cacheCapacity = 1024;

    // 租约有效期（毫秒）
    @Builder.Default
    private final long leaseTtlMillis = 30_000;

    // 过期租约清理周期（毫秒）
    @Builder.Default
    private final long leaseSweepIntervalMillis = 1_000;

    // 远程请求超时（毫秒）
    @Builder.Default
    private final long requestTimeoutMillis = 5_000;

    /**
     * 使用默认值创建配置
     * @return 默认配置
     */
    public static DSMConfig defaults() {
        return DSMConfig.builder().build();
    }

    /**
     * 从属性集合解析配置，缺失的键使用默认值
     * 同时设置 dsm.cache.capacity 和 dsm.cache.size.mb 时以前者为准
     * @param props 属性集合
     * @return 配置
     */
    public static DSMConfig fromProperties(Properties props) {
        DSMConfigBuilder builder = DSMConfig.builder();

        String nodeId = props.getProperty(KEY_NODE_ID);
        if (nodeId != null && !nodeId.isBlank()) {
            builder.nodeId(nodeId.trim());
        }

        int pageSize = parseInt(props, KEY_PAGE_SIZE, DEFAULT_PAGE_SIZE);
        if (pageSize <= 0 || pageSize % Long.BYTES != 0) {
            throw new IllegalArgumentException(KEY_PAGE_SIZE + " 必须是8的正整数倍: " + pageSize);
        }
        builder.pageSize(pageSize);

        if (props.getProperty(KEY_CACHE_CAPACITY) != null) {
            builder.cacheCapacity(parseInt(props, KEY_CACHE_CAPACITY, 0));
        } else if (props.getProperty(KEY_CACHE_SIZE_MB) != null) {
            long bytes = parseLong(props, KEY_CACHE_SIZE_MB, 0) * 1024L * 1024L;
            builder.cacheCapacity((int) Math.max(1, bytes / pageSize));
        }

        if (props.getProperty(KEY_LEASE_TTL) != null) {
            builder.leaseTtlMillis(parseLong(props, KEY_LEASE_TTL, 0));
        }
        if (props.getProperty(KEY_LEASE_SWEEP_INTERVAL) != null) {
            builder.leaseSweepIntervalMillis(parseLong(props, KEY_LEASE_SWEEP_INTERVAL, 0));
        }
        if (props.getProperty(KEY_REQUEST_TIMEOUT) != null) {
            builder.requestTimeoutMillis(parseLong(props, KEY_REQUEST_TIMEOUT, 0));
        }

        DSMConfig config = builder.build();
        config.validate();
        return config;
    }

    /**
     * 从类路径资源加载配置
     * @param resource 资源名，例如 "dsm.properties"
     * @return 配置
     * @throws IOException 如果资源不存在或读取失败
     */
    public static DSMConfig load(String resource) throws IOException {
        Properties props = new Properties();
        try (InputStream in = DSMConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("配置资源不存在: " + resource);
            }
            props.load(in);
        }
        return fromProperties(props);
    }

    /**
     * 检查配置取值
     */
    public void validate() {
        if (pageSize <= 0 || pageSize % Long.BYTES != 0) {
            throw new IllegalArgumentException("页面大小必须是8的正整数倍: " + pageSize);
        }
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("缓存容量必须大于0: " + cacheCapacity);
        }
        if (leaseTtlMillis <= 0) {
            throw new IllegalArgumentException("租约有效期必须大于0: " + leaseTtlMillis);
        }
        if (leaseSweepIntervalMillis <= 0) {
            throw new IllegalArgumentException("租约清理周期必须大于0: " + leaseSweepIntervalMillis);
        }
        if (requestTimeoutMillis <= 0) {
            throw new IllegalArgumentException("请求超时必须大于0: " + requestTimeoutMillis);
        }
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项 " + key + " 不是整数: " + value, e);
        }
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项 " + key + " 不是整数: " + value, e);
        }
    }
}
