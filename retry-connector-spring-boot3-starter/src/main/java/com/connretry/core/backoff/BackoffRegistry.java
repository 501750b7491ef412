package com.connretry.core.backoff;

import com.connretry.config.RetryConnectorProperties;
import com.connretry.core.spi.BackoffPolicy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 fixed / exponential / none
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy（name() 返回的名字）
 * - 线程安全
 */
public class BackoffRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT = "exponential";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    private final RetryConnectorProperties props;

    public BackoffRegistry(RetryConnectorProperties props, @Nullable List<BackoffPolicy> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent("exponential", new ExponentialJitterBackoffPolicy());
        policies.putIfAbsent("none", new NoBackoffPolicy());
    }

    public BackoffRegistry(RetryConnectorProperties props) {
        this(props, null);
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(String name, BackoffPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略, 支持 spi:{name} 前缀, 不存在则采用默认 exponential 策略
     */
    public BackoffPolicy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get(DEFAULT);
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return policies.getOrDefault(normalize(s), policies.get(DEFAULT));
    }

    /**
     * 按配置的策略计算等待时长
     */
    public long delayMillis(int attempt) {
        return resolve(props.getTransientRetry().getBackoff().getStrategy()).delayMillis(attempt, props);
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    @Override
    public void afterPropertiesSet() {
        long min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        if (max < min) {
            throw new IllegalArgumentException("retry.connector.transient-retry.backoff.max must be >= min");
        }
    }
}
