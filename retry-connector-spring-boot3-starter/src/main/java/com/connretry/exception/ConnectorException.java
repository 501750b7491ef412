package com.connretry.exception;

import com.connretry.model.enums.FailureKind;

import java.sql.SQLException;

/**
 * 带类型标签的结构性失败
 * 事务/保存点回滚本身失败时抛出, 同时保留原始失败与回滚失败
 */
public class ConnectorException extends SQLException {

    private final FailureKind kind;

    /** 原始失败 */
    private final Throwable error;

    /** 回滚时发生的失败 */
    private final Throwable rollbackError;

    public ConnectorException(FailureKind kind, Throwable error, Throwable rollbackError) {
        super(kind.getDesc() + ": " + error + " (rollback failed: " + rollbackError + ")",
                sqlState(error), vendorCode(error), error);
        if (!kind.isStructural()) {
            throw new IllegalArgumentException("not a rollback failure kind: " + kind);
        }
        this.kind = kind;
        this.error = error;
        this.rollbackError = rollbackError;
        addSuppressed(rollbackError);
    }

    public static ConnectorException txnRollback(Throwable error, Throwable rollbackError) {
        return new ConnectorException(FailureKind.TXN_ROLLBACK, error, rollbackError);
    }

    public static ConnectorException svpRollback(Throwable error, Throwable rollbackError) {
        return new ConnectorException(FailureKind.SVP_ROLLBACK, error, rollbackError);
    }

    public FailureKind getKind() { return kind; }

    public Throwable getError() { return error; }

    public Throwable getRollbackError() { return rollbackError; }

    private static String sqlState(Throwable t) {
        return t instanceof SQLException se ? se.getSQLState() : null;
    }

    private static int vendorCode(Throwable t) {
        return t instanceof SQLException se ? se.getErrorCode() : 0;
    }
}
