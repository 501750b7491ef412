package com.connretry.exception;

import com.connretry.model.enums.FailureKind;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectorExceptionTest {

    @Test
    void keepsOriginalAndRollbackFailure() {
        IllegalStateException error = new IllegalStateException("business");
        SQLException rbErr = new SQLException("rollback lost");

        ConnectorException e = ConnectorException.txnRollback(error, rbErr);

        assertThat(e.getKind()).isEqualTo(FailureKind.TXN_ROLLBACK);
        assertThat(e.getCause()).isSameAs(error);
        assertThat(e.getSuppressed()).containsExactly(rbErr);
        assertThat(e.getSQLState()).isNull();
        assertThat(e.getErrorCode()).isZero();
        assertThat(e.getMessage()).contains("business").contains("rollback lost");
    }

    @Test
    void onlyRollbackKindsAreAccepted() {
        assertThatThrownBy(() -> new ConnectorException(FailureKind.TRANSIENT,
                new SQLException("a"), new SQLException("b")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
