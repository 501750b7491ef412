package com.connretry.core.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 使用连接句柄的一次工作单元
 */
@FunctionalInterface
public interface ConnectorCallback<T> {

    /** 重试时整个回调会被重新执行, 回调需幂等或由事务保证原子性 */
    T doInConnection(Connection conn) throws SQLException;
}
