package com.connretry.config;

import com.connretry.model.enums.ConnectionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 连接重试配置（绑定前缀：retry.connector）
 *
 * YAML 示例：
 * retry:
 *   connector:
 *     max-attempts: 10
 *     mode: checked
 *     debug: false
 *     probe-timeout: 5s
 *     tx:
 *       isolation: DEFAULT
 *       read-only: false
 *     transient-retry:
 *       enabled: true
 *       max-duration: 30s
 *       transient-error-codes: [1205, 1213]
 *       connection-error-codes: [2006, 2013]
 *       backoff:
 *         strategy: exponential
 *         base: 100ms
 *         min: 0ms
 *         max: 5s
 *         jitter-ratio: 0.2
 */
@Validated
@ConfigurationProperties(prefix = "retry.connector")
public class RetryConnectorProperties {

    /** 最大尝试次数（含首次） */
    private int maxAttempts = 10;

    /** 默认连接模式 */
    private ConnectionMode mode = ConnectionMode.CHECKED;

    /** 每次重试打印 WARN 诊断 */
    private boolean debug = false;

    /** 探活超时 */
    private Duration probeTimeout = Duration.ofSeconds(5);

    private Tx tx = new Tx();

    private TransientRetry transientRetry = new TransientRetry();

    // ----------------- 嵌套配置对象 -----------------

    public static class Tx {
        /** 事务隔离级别（DEFAULT 表示沿用连接设置） */
        private Isolation isolation = Isolation.DEFAULT;

        /** 只读事务 */
        private boolean readOnly = false;

        public Isolation getIsolation() { return isolation; }
        public void setIsolation(Isolation isolation) { this.isolation = isolation; }
        public boolean isReadOnly() { return readOnly; }
        public void setReadOnly(boolean readOnly) { this.readOnly = readOnly; }
    }

    public static class TransientRetry {
        /** 启用后默认判定器只重试瞬时失败, 并在重试间退避 */
        private boolean enabled = false;

        /** 总耗时上限, 0 表示不限 */
        private Duration maxDuration = Duration.ZERO;

        /** 视为瞬时失败的厂商错误码（MySQL: 1205 锁等待超时, 1213 死锁） */
        private List<Integer> transientErrorCodes = new ArrayList<>(List.of(1205, 1213));

        /** 视为连接丢失的厂商错误码（MySQL: 2006 server gone away, 2013 lost connection） */
        private List<Integer> connectionErrorCodes = new ArrayList<>(List.of(2006, 2013));

        private Backoff backoff = new Backoff();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getMaxDuration() { return maxDuration; }
        public void setMaxDuration(Duration maxDuration) { this.maxDuration = maxDuration; }
        public List<Integer> getTransientErrorCodes() { return transientErrorCodes; }
        public void setTransientErrorCodes(List<Integer> transientErrorCodes) { this.transientErrorCodes = transientErrorCodes; }
        public List<Integer> getConnectionErrorCodes() { return connectionErrorCodes; }
        public void setConnectionErrorCodes(List<Integer> connectionErrorCodes) { this.connectionErrorCodes = connectionErrorCodes; }
        public Backoff getBackoff() { return backoff; }
        public void setBackoff(Backoff backoff) { this.backoff = backoff; }
    }

    public static class Backoff {
        /** 策略：fixed | exponential | none | spi:{name} */
        private String strategy = "exponential";

        /** 基础间隔 */
        private Duration base = Duration.ofMillis(100);

        /** 最小间隔 */
        private Duration min = Duration.ZERO;

        /** 最大间隔 */
        private Duration max = Duration.ofSeconds(5);

        /** 抖动比例（0~1），例如 0.2 表示 ±20% */
        private double jitterRatio = 0.2;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }
        public Duration getMin() { return min; }
        public void setMin(Duration min) { this.min = min; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("retry.connector.max-attempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
    }

    public ConnectionMode getMode() { return mode; }
    public void setMode(ConnectionMode mode) { this.mode = mode; }

    public boolean isDebug() { return debug; }
    public void setDebug(boolean debug) { this.debug = debug; }

    public Duration getProbeTimeout() { return probeTimeout; }
    public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }

    public Tx getTx() { return tx; }
    public void setTx(Tx tx) { this.tx = tx; }

    public TransientRetry getTransientRetry() { return transientRetry; }
    public void setTransientRetry(TransientRetry transientRetry) { this.transientRetry = transientRetry; }

    // ----------------- 便捷换算 -----------------

    /** 探活超时秒数, Connection.isValid 使用, 至少 1 秒 */
    public int probeTimeoutSeconds() { return (int) Math.max(1, probeTimeout.toSeconds()); }

    /** 退避：基础/最小/最大毫秒 */
    public long backoffBaseMillis() { return transientRetry.getBackoff().getBase().toMillis(); }
    public long backoffMinMillis() { return transientRetry.getBackoff().getMin().toMillis(); }
    public long backoffMaxMillis() { return transientRetry.getBackoff().getMax().toMillis(); }
}
