package com.connretry.core.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 连接管理 SPI
 * 负责句柄的打开、探活、替换与关闭; 重试核心只通过此接口观察连接
 */
public interface ConnectionManager {

    /**
     * 当前句柄, 不存在时打开一个, 不做校验
     */
    Connection handle() throws SQLException;

    /**
     * 是否已持有句柄（不论是否连通）
     */
    boolean hasHandle();

    /**
     * 非破坏性探活, 无句柄或已关闭时返回 false
     */
    boolean probe() throws SQLException;

    /**
     * 返回可用句柄, 断开时替换为新句柄（旧句柄由实现负责释放）, 已连通时幂等
     */
    Connection acquire() throws SQLException;

    /**
     * 当前句柄是否处于未结束的事务中
     */
    boolean isInTransaction() throws SQLException;

    /** 关闭并丢弃当前句柄 */
    void disconnect();
}
