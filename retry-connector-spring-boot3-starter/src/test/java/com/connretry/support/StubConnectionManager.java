package com.connretry.support;

import com.connretry.core.spi.ConnectionManager;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.mockito.Mockito.mock;

/**
 * 可控的连接管理器, 句柄为 Mockito mock
 */
public class StubConnectionManager implements ConnectionManager {

    private final List<Connection> issued = new ArrayList<>();

    private Connection current;

    private boolean connected = true;

    private boolean inTransaction;

    private SQLException probeFailure;

    private int handleCalls;
    private int probeCalls;
    private int acquireCalls;
    private int disconnectCalls;

    @Override
    public Connection handle() {
        handleCalls++;
        if (current == null) {
            current = newHandle();
        }
        return current;
    }

    @Override
    public boolean hasHandle() {
        return current != null;
    }

    @Override
    public boolean probe() throws SQLException {
        probeCalls++;
        if (probeFailure != null) {
            throw probeFailure;
        }
        return current != null && connected;
    }

    @Override
    public Connection acquire() {
        acquireCalls++;
        if (current != null && connected) {
            return current;
        }
        current = newHandle();
        connected = true;
        return current;
    }

    @Override
    public boolean isInTransaction() {
        return inTransaction;
    }

    @Override
    public void disconnect() {
        disconnectCalls++;
        current = null;
    }

    private Connection newHandle() {
        Connection c = mock(Connection.class);
        issued.add(c);
        return c;
    }

    /** 模拟连接断开, 下次探活返回 false */
    public void drop() {
        connected = false;
    }

    public void setInTransaction(boolean inTransaction) { this.inTransaction = inTransaction; }
    public void setProbeFailure(SQLException probeFailure) { this.probeFailure = probeFailure; }

    public Connection current() { return current; }
    public List<Connection> issued() { return issued; }
    public int handleCalls() { return handleCalls; }
    public int probeCalls() { return probeCalls; }
    public int acquireCalls() { return acquireCalls; }
    public int disconnectCalls() { return disconnectCalls; }
}
