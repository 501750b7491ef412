package com.connretry.core.mode;

import com.connretry.core.metric.RetryMetrics;
import com.connretry.core.spi.ConnectionManager;
import com.connretry.core.spi.ConnectorCallback;
import com.connretry.model.enums.ConnectionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * 按连接模式执行一次回调
 * <p>
 * 无论哪种模式, 每次调用最多对外产生一个失败: fixup 模式下第一次失败若触发了重连重试,
 * 只有第二次的结果会被外层看到, 外层重试循环因此只计一次尝试。
 * 可能替换连接管理器持有的句柄, 但从不关闭旧句柄。
 */
public class ConnectionModeController {

    private static final Logger log = LoggerFactory.getLogger(ConnectionModeController.class);

    private final ConnectionManager connections;

    private final RetryMetrics meter;

    public ConnectionModeController(ConnectionManager connections, RetryMetrics meter) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.meter = Objects.requireNonNull(meter, "meter");
    }

    public <T> T invoke(ConnectionMode mode, ConnectorCallback<T> callback) throws SQLException {
        return switch (mode) {
            case UNCHECKED -> callback.doInConnection(connections.handle());
            case CHECKED -> callback.doInConnection(checkedHandle());
            case FIXUP -> fixup(callback);
        };
    }

    /**
     * 执行前探活, 断开则先换新句柄; 首次打开句柄不计为重连; 探活本身的异常直接抛出
     */
    private Connection checkedHandle() throws SQLException {
        if (connections.probe()) {
            return connections.handle();
        }
        if (connections.hasHandle()) {
            meter.incReconnect();
            log.debug("[Mode-Checked] handle not connected, acquiring a fresh one");
        }
        return connections.acquire();
    }

    /**
     * 先直接执行; 失败后探活, 已断开则换新句柄再执行一次, 仍连通则抛出原失败
     */
    private <T> T fixup(ConnectorCallback<T> callback) throws SQLException {
        try {
            return callback.doInConnection(connections.handle());
        } catch (SQLException | RuntimeException first) {
            boolean connected;
            try {
                connected = connections.probe();
            } catch (SQLException | RuntimeException probeErr) {
                first.addSuppressed(probeErr);
                throw first;
            }
            if (connected) {
                throw first;
            }
            meter.incReconnect();
            log.debug("[Mode-Fixup] handle lost after failure, re-running once on a fresh handle, first error={}",
                    first.toString());
            return callback.doInConnection(connections.acquire());
        }
    }
}
