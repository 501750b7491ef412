package com.connretry.core.failure;

import com.connretry.exception.ConnectorException;
import com.connretry.model.enums.FailureKind;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.support.SQLExceptionSubclassTranslator;
import org.springframework.jdbc.support.SQLExceptionTranslator;

import java.sql.SQLException;
import java.util.Collection;
import java.util.Set;

/**
 * 失败分类器
 * 展开 cause 链, 先本体再逐级 cause, 命中即返回; 都不命中视为业务失败
 */
public class FailureClassifier {

    private final SQLExceptionTranslator translator = new SQLExceptionSubclassTranslator();

    private final Set<Integer> transientErrorCodes;

    private final Set<Integer> connectionErrorCodes;

    public FailureClassifier() {
        this(Set.of(), Set.of());
    }

    public FailureClassifier(Collection<Integer> transientErrorCodes, Collection<Integer> connectionErrorCodes) {
        this.transientErrorCodes = transientErrorCodes == null ? Set.of() : Set.copyOf(transientErrorCodes);
        this.connectionErrorCodes = connectionErrorCodes == null ? Set.of() : Set.copyOf(connectionErrorCodes);
    }

    public FailureKind classify(Throwable t) {
        for (Throwable e = t; e != null; e = e.getCause()) {
            FailureKind kind = classifyOne(e);
            if (kind != null) {
                return kind;
            }
            if (e.getCause() == e) {
                break;
            }
        }
        return FailureKind.OPERATION;
    }

    private FailureKind classifyOne(Throwable e) {
        if (e instanceof ConnectorException ce) {
            return ce.getKind();
        }
        if (e instanceof DataAccessException dae) {
            return classifyDataAccess(dae);
        }
        if (e instanceof SQLException se) {
            // 厂商错误码优先
            if (connectionErrorCodes.contains(se.getErrorCode())) {
                return FailureKind.CONNECTION;
            }
            if (transientErrorCodes.contains(se.getErrorCode())) {
                return FailureKind.TRANSIENT;
            }
            DataAccessException translated = translator.translate("retry-connector", null, se);
            return translated == null ? null : classifyDataAccess(translated);
        }
        return null;
    }

    private static FailureKind classifyDataAccess(DataAccessException dae) {
        if (dae instanceof RecoverableDataAccessException
                || dae instanceof DataAccessResourceFailureException
                || dae instanceof TransientDataAccessResourceException) {
            return FailureKind.CONNECTION;
        }
        if (dae instanceof ConcurrencyFailureException
                || dae instanceof TransientDataAccessException) {
            return FailureKind.TRANSIENT;
        }
        return null;
    }
}
