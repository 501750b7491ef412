package com.connretry.core.tx;

import com.connretry.config.RetryConnectorProperties;
import com.connretry.core.spi.ConnectorCallback;
import com.connretry.exception.ConnectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Isolation;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.Objects;

/**
 * 事务边界
 * <p>
 * run 不做提交/回滚; txn 成功提交、失败先回滚再把失败交还给重试循环, 所以每次重试都从干净的事务状态开始;
 * svp 在已开启的事务内设置保存点, 只执行一次。
 */
public class TransactionBoundary {

    private static final Logger log = LoggerFactory.getLogger(TransactionBoundary.class);

    private final RetryConnectorProperties.Tx tx;

    private int savepointSeq;

    public TransactionBoundary(RetryConnectorProperties.Tx tx) {
        this.tx = Objects.requireNonNull(tx, "tx");
    }

    /**
     * 包装成交给模式控制器的回调, fixup 的第二次执行会重新开启事务
     */
    public <T> ConnectorCallback<T> wrap(boolean transactional, ConnectorCallback<T> callback) {
        if (!transactional) {
            return callback;
        }
        return conn -> txn(conn, callback);
    }

    /**
     * 事务内执行: 关闭自动提交, 成功提交, 失败回滚; 结束后恢复连接原有设置
     */
    public <T> T txn(Connection conn, ConnectorCallback<T> callback) throws SQLException {
        TxSettings previous = begin(conn);
        T result;
        try {
            result = callback.doInConnection(conn);
        } catch (SQLException | RuntimeException e) {
            SQLException rollbackFailure = rollback(conn, e);
            restoreAfterFailure(conn, previous, rollbackFailure != null ? rollbackFailure : e);
            if (rollbackFailure != null) {
                throw rollbackFailure;
            }
            throw e;
        }
        try {
            conn.commit();
        } catch (SQLException commitErr) {
            SQLException rollbackFailure = rollback(conn, commitErr);
            restoreAfterFailure(conn, previous, rollbackFailure != null ? rollbackFailure : commitErr);
            throw rollbackFailure != null ? rollbackFailure : commitErr;
        }
        restoreAfterCommit(conn, previous);
        return result;
    }

    /**
     * 保存点内执行一次: 成功释放保存点, 失败回滚到保存点后抛出原失败
     */
    public <T> T svp(Connection conn, ConnectorCallback<T> callback) throws SQLException {
        Savepoint sp = conn.setSavepoint("svp_" + (++savepointSeq));
        T result;
        try {
            result = callback.doInConnection(conn);
        } catch (SQLException | RuntimeException e) {
            try {
                conn.rollback(sp);
            } catch (SQLException rbErr) {
                throw ConnectorException.svpRollback(e, rbErr);
            }
            throw e;
        }
        conn.releaseSavepoint(sp);
        return result;
    }

    private TxSettings begin(Connection conn) throws SQLException {
        TxSettings previous = new TxSettings(conn.getAutoCommit(), conn.isReadOnly(), conn.getTransactionIsolation());
        if (tx.getIsolation() != null && tx.getIsolation() != Isolation.DEFAULT) {
            conn.setTransactionIsolation(tx.getIsolation().value());
        }
        if (tx.isReadOnly()) {
            conn.setReadOnly(true);
        }
        if (previous.autoCommit()) {
            conn.setAutoCommit(false);
        }
        return previous;
    }

    /**
     * 回滚失败时返回带标签的异常, 否则返回 null
     */
    private SQLException rollback(Connection conn, Throwable cause) {
        try {
            conn.rollback();
            return null;
        } catch (SQLException | RuntimeException rbErr) {
            log.debug("[Txn] rollback failed after {}: {}", cause.toString(), rbErr.toString());
            return ConnectorException.txnRollback(cause, rbErr);
        }
    }

    private void restoreAfterFailure(Connection conn, TxSettings previous, Throwable pending) {
        try {
            restore(conn, previous);
        } catch (SQLException | RuntimeException e) {
            pending.addSuppressed(e);
        }
    }

    /**
     * 已提交的单元不能因恢复设置失败而被当作失败重试, 只记录日志
     */
    private void restoreAfterCommit(Connection conn, TxSettings previous) {
        try {
            restore(conn, previous);
        } catch (SQLException | RuntimeException e) {
            log.warn("[Txn] committed, but failed to restore connection settings: {}", e.toString());
        }
    }

    private void restore(Connection conn, TxSettings previous) throws SQLException {
        if (conn.isClosed()) {
            return;
        }
        if (previous.autoCommit()) {
            conn.setAutoCommit(true);
        }
        if (tx.isReadOnly() && !previous.readOnly()) {
            conn.setReadOnly(false);
        }
        if (tx.getIsolation() != null && tx.getIsolation() != Isolation.DEFAULT) {
            conn.setTransactionIsolation(previous.isolation());
        }
    }

    private record TxSettings(boolean autoCommit, boolean readOnly, int isolation) {
    }
}
