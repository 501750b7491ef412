package com.connretry.core;

import com.connretry.config.RetryConnectorProperties;
import com.connretry.core.engine.RetryLoopExecutor;
import com.connretry.core.failure.FailureClassifier;
import com.connretry.core.metric.RetryMetrics;
import com.connretry.core.mode.ConnectionModeController;
import com.connretry.core.predicate.RetryPredicates;
import com.connretry.core.spi.ConnectionManager;
import com.connretry.core.spi.ConnectorCallback;
import com.connretry.core.spi.RetryPredicate;
import com.connretry.core.tx.TransactionBoundary;
import com.connretry.model.ExecutionRequest;
import com.connretry.model.ctx.RetryContext;
import com.connretry.model.enums.ConnectionMode;

import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * 连接重试执行入口
 * <p>
 * run/txn 按连接模式执行工作单元, 失败后由重试循环决定是否整体重来。
 * 已处于外层调用或未结束事务中的嵌套调用只执行一次, 失败交给外层的 txn 整体重试。
 * <p>
 * 实例持有单个连接句柄, 非线程安全: 每个工作线程使用独立实例, 或由调用方串行化。
 *
 * <pre>{@code
 * RetryConnector connector = new RetryConnector(new DataSourceConnectionManager(dataSource));
 * int rows = connector.txn(conn -> {
 *     try (PreparedStatement ps = conn.prepareStatement("update account set balance = balance - ? where id = ?")) {
 *         ps.setLong(1, 100);
 *         ps.setLong(2, accountId);
 *         return ps.executeUpdate();
 *     }
 * });
 * }</pre>
 */
public class RetryConnector {

    private final ConnectionManager connections;

    private final TransactionBoundary boundary;

    private final ConnectionModeController controller;

    private final RetryLoopExecutor executor;

    private final RetryMetrics meter;

    private final Clock clock;

    /** resetRetryPredicate 恢复的判定器 */
    private final RetryPredicate defaultPredicate;

    private RetryPredicate retryPredicate;

    private int maxAttempts;

    /** 当前生效模式, 只在单次调用内被局部覆盖 */
    private ConnectionMode mode;

    private boolean debugLogging;

    /** 最近一次外层调用的上下文 */
    private RetryContext lastContext;

    /** 调用嵌套深度 */
    private int depth;

    public RetryConnector(ConnectionManager connections) {
        this(connections, new RetryConnectorProperties());
    }

    public RetryConnector(ConnectionManager connections, RetryConnectorProperties props) {
        this(connections, props, RetryMetrics.standalone(), new FailureClassifier(),
                RetryPredicates.always(), Clock.systemUTC());
    }

    public RetryConnector(ConnectionManager connections,
                          RetryConnectorProperties props,
                          RetryMetrics meter,
                          FailureClassifier classifier,
                          RetryPredicate defaultPredicate,
                          Clock clock) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.meter = Objects.requireNonNull(meter, "meter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultPredicate = Objects.requireNonNull(defaultPredicate, "defaultPredicate");
        this.retryPredicate = defaultPredicate;
        setMaxAttempts(props.getMaxAttempts());
        this.mode = Objects.requireNonNull(props.getMode(), "mode");
        this.debugLogging = props.isDebug();
        this.boundary = new TransactionBoundary(props.getTx());
        this.controller = new ConnectionModeController(connections, meter);
        this.executor = new RetryLoopExecutor(controller, boundary, classifier, meter, this::isDebugLogging);
    }

    // ----------------- 执行 -----------------

    public <T> T run(ConnectorCallback<T> callback) throws SQLException {
        return execute(null, false, callback);
    }

    public <T> T run(ConnectionMode mode, ConnectorCallback<T> callback) throws SQLException {
        return execute(mode, false, callback);
    }

    public <T> T txn(ConnectorCallback<T> callback) throws SQLException {
        return execute(null, true, callback);
    }

    public <T> T txn(ConnectionMode mode, ConnectorCallback<T> callback) throws SQLException {
        return execute(mode, true, callback);
    }

    /**
     * @param mode 为 null 时使用实例默认模式
     * @return 回调结果; 失败时抛出最后一次的原始异常
     */
    public <T> T execute(ConnectionMode mode, boolean transactional, ConnectorCallback<T> callback) throws SQLException {
        return execute(ExecutionRequest.<T>builder()
                .mode(mode)
                .transactional(transactional)
                .callback(callback)
                .build());
    }

    public <T> T execute(ExecutionRequest<T> request) throws SQLException {
        if (depth > 0 || connections.isInTransaction()) {
            return executeNested(request);
        }
        meter.incCalls();
        ConnectionMode prior = this.mode;
        ConnectionMode effective = request.getMode() != null ? request.getMode() : prior;
        RetryPredicate predicate = request.getRetryPredicate() != null ? request.getRetryPredicate() : retryPredicate;
        RetryContext ctx = new RetryContext(maxAttempts, effective, request.isTransactional(), clock);
        this.lastContext = ctx;
        this.mode = effective;
        depth++;
        long startNanos = System.nanoTime();
        try {
            return executor.execute(ctx, request.isTransactional(), request.getCallback(), predicate);
        } finally {
            depth--;
            this.mode = prior;
            meter.recordExecNanos(System.nanoTime() - startNanos);
        }
    }

    /**
     * 保存点: 事务内设置保存点执行一次; 不在事务内时按单次 txn 执行。均不重试。
     */
    public <T> T svp(ConnectorCallback<T> callback) throws SQLException {
        return svp(null, callback);
    }

    public <T> T svp(ConnectionMode mode, ConnectorCallback<T> callback) throws SQLException {
        Objects.requireNonNull(callback, "callback");
        if (connections.isInTransaction()) {
            return boundary.svp(connections.handle(), callback);
        }
        ConnectionMode prior = this.mode;
        this.mode = mode != null ? mode : prior;
        depth++;
        try {
            return controller.invoke(this.mode, boundary.wrap(true, callback));
        } finally {
            depth--;
            this.mode = prior;
        }
    }

    /**
     * 嵌套调用不进入重试循环, 不改动外层上下文
     */
    private <T> T executeNested(ExecutionRequest<T> request) throws SQLException {
        if (connections.isInTransaction()) {
            return request.getCallback().doInConnection(connections.handle());
        }
        depth++;
        try {
            return boundary.wrap(request.isTransactional(), request.getCallback())
                    .doInConnection(connections.handle());
        } finally {
            depth--;
        }
    }

    // ----------------- 判定器 -----------------

    public void setRetryPredicate(RetryPredicate retryPredicate) {
        this.retryPredicate = Objects.requireNonNull(retryPredicate, "retryPredicate");
    }

    /** 恢复为构造时的默认判定器 */
    public void resetRetryPredicate() {
        this.retryPredicate = defaultPredicate;
    }

    public RetryPredicate getRetryPredicate() {
        return retryPredicate;
    }

    // ----------------- 最近一次调用状态 -----------------

    public int getAttemptCount() {
        return lastContext == null ? 0 : lastContext.getAttemptCount();
    }

    /** 最近一次外层调用的失败记录快照 */
    public List<Throwable> getExceptionStack() {
        return lastContext == null ? List.of() : lastContext.getExceptions();
    }

    public Throwable getLastException() {
        return lastContext == null ? null : lastContext.getLastException();
    }

    public RetryContext getLastContext() {
        return lastContext;
    }

    // ----------------- 配置 -----------------

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    public ConnectionMode getMode() {
        return mode;
    }

    public void setMode(ConnectionMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public boolean isDebugLogging() {
        return debugLogging;
    }

    public void setDebugLogging(boolean debugLogging) {
        this.debugLogging = debugLogging;
    }

    public ConnectionManager getConnections() {
        return connections;
    }

    /** 关闭当前句柄, 下次调用时重新获取 */
    public void disconnect() {
        connections.disconnect();
    }
}
