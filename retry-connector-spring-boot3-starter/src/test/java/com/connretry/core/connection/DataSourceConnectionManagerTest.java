package com.connretry.core.connection;

import com.connretry.support.H2Databases;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class DataSourceConnectionManagerTest {

    private DataSourceConnectionManager connections;

    @BeforeEach
    void setUp() {
        JdbcDataSource ds = H2Databases.newDataSource();
        connections = new DataSourceConnectionManager(ds);
    }

    @AfterEach
    void tearDown() {
        connections.disconnect();
    }

    @Test
    void handleIsOpenedLazilyAndReused() throws SQLException {
        assertThat(connections.probe()).isFalse();

        Connection first = connections.handle();

        assertThat(connections.handle()).isSameAs(first);
        assertThat(connections.probe()).isTrue();
    }

    @Test
    void acquireKeepsLiveHandle() throws SQLException {
        Connection live = connections.handle();

        assertThat(connections.acquire()).isSameAs(live);
        assertThat(connections.getReconnects()).isZero();
    }

    @Test
    void acquireReplacesClosedHandle() throws SQLException {
        Connection stale = connections.handle();
        stale.close();
        assertThat(connections.probe()).isFalse();

        Connection fresh = connections.acquire();

        assertThat(fresh).isNotSameAs(stale);
        assertThat(fresh.isClosed()).isFalse();
        assertThat(connections.handle()).isSameAs(fresh);
        assertThat(connections.getReconnects()).isEqualTo(1);
    }

    @Test
    void inTransactionFollowsAutoCommit() throws SQLException {
        assertThat(connections.isInTransaction()).isFalse();

        connections.handle().setAutoCommit(false);
        assertThat(connections.isInTransaction()).isTrue();

        connections.handle().setAutoCommit(true);
        assertThat(connections.isInTransaction()).isFalse();
    }

    @Test
    void disconnectClosesHandle() throws SQLException {
        Connection c = connections.handle();

        connections.disconnect();
        connections.disconnect();

        assertThat(c.isClosed()).isTrue();
        assertThat(connections.probe()).isFalse();
        assertThat(connections.handle()).isNotSameAs(c);
    }

    @Test
    void handlesFromAutoCommitOffPoolAreNormalized() throws SQLException {
        DataSourceConnectionManager pooled =
                new DataSourceConnectionManager(H2Databases.autoCommitOff(H2Databases.newDataSource()));
        try {
            assertThat(pooled.handle().getAutoCommit()).isTrue();
            assertThat(pooled.isInTransaction()).isFalse();

            pooled.handle().close();
            assertThat(pooled.acquire().getAutoCommit()).isTrue();
            assertThat(pooled.isInTransaction()).isFalse();
        } finally {
            pooled.disconnect();
        }
    }

    @Test
    void hasHandleTracksOpenAndDisconnect() throws SQLException {
        assertThat(connections.hasHandle()).isFalse();

        connections.handle();
        assertThat(connections.hasHandle()).isTrue();

        connections.disconnect();
        assertThat(connections.hasHandle()).isFalse();
    }

    @Test
    void nullConnectionFromDataSourceIsRejected() {
        DataSourceConnectionManager broken = new DataSourceConnectionManager(mock(DataSource.class));

        assertThatThrownBy(broken::handle)
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("null connection");
    }
}
