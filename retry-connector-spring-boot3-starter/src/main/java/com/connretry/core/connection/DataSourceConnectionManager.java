package com.connretry.core.connection;

import com.connretry.core.spi.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.support.JdbcUtils;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;

/**
 * 基于 DataSource 的连接管理
 * 持有单个长连接, 断开时关闭旧连接并重新获取。非线程安全, 每个工作线程一个实例。
 */
public class DataSourceConnectionManager implements ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConnectionManager.class);

    private final DataSource dataSource;

    /** Connection.isValid 超时秒数 */
    private final int probeTimeoutSeconds;

    private Connection connection;

    /** 替换句柄次数 */
    private long reconnects;

    public DataSourceConnectionManager(DataSource dataSource, Duration probeTimeout) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.probeTimeoutSeconds = (int) Math.max(1, probeTimeout == null ? 5 : probeTimeout.toSeconds());
    }

    public DataSourceConnectionManager(DataSource dataSource) {
        this(dataSource, Duration.ofSeconds(5));
    }

    @Override
    public Connection handle() throws SQLException {
        if (connection == null) {
            connection = open();
        }
        return connection;
    }

    @Override
    public boolean hasHandle() {
        return connection != null;
    }

    @Override
    public boolean probe() throws SQLException {
        if (connection == null || connection.isClosed()) {
            return false;
        }
        return connection.isValid(probeTimeoutSeconds);
    }

    @Override
    public Connection acquire() throws SQLException {
        if (probe()) {
            return connection;
        }
        if (connection != null) {
            // 旧句柄由此处释放, 调用方不关闭
            JdbcUtils.closeConnection(connection);
            connection = null;
            reconnects++;
            log.info("[Connection] stale handle discarded, reconnecting (reconnects={})", reconnects);
        }
        connection = open();
        return connection;
    }

    @Override
    public boolean isInTransaction() throws SQLException {
        return connection != null && !connection.isClosed() && !connection.getAutoCommit();
    }

    @Override
    public void disconnect() {
        if (connection != null) {
            JdbcUtils.closeConnection(connection);
            connection = null;
            log.debug("[Connection] disconnected");
        }
    }

    public long getReconnects() {
        return reconnects;
    }

    private Connection open() throws SQLException {
        Connection c = dataSource.getConnection();
        if (c == null) {
            throw new SQLException("DataSource returned null connection: " + dataSource);
        }
        // 连接池可能默认关闭自动提交, 统一打开: 事务边界只由 txn/svp 开启
        try {
            if (!c.getAutoCommit()) {
                c.setAutoCommit(true);
            }
        } catch (SQLException | RuntimeException e) {
            JdbcUtils.closeConnection(c);
            throw e;
        }
        return c;
    }
}
