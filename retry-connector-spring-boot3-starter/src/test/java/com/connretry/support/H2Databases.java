package com.connretry.support;

import org.h2.jdbcx.JdbcDataSource;
import org.springframework.jdbc.datasource.DelegatingDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * 内存 H2 数据库, 每个测试独立命名
 */
public final class H2Databases {

    private H2Databases() {
    }

    public static JdbcDataSource newDataSource() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:retry_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        ds.setPassword("");
        return ds;
    }

    /** 建表 account(id, balance) 并插入两行, 余额各 100 */
    public static JdbcDataSource newAccountDatabase() throws SQLException {
        JdbcDataSource ds = newDataSource();
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute("create table account(id int primary key, balance int not null)");
            st.execute("insert into account values (1, 100), (2, 100)");
        }
        return ds;
    }

    /** 模拟 auto-commit=false 的连接池: 每个新连接都关闭自动提交 */
    public static DataSource autoCommitOff(DataSource target) {
        return new DelegatingDataSource(target) {
            @Override
            public Connection getConnection() throws SQLException {
                Connection c = super.getConnection();
                c.setAutoCommit(false);
                return c;
            }
        };
    }

    public static int balance(JdbcDataSource ds, int id) throws SQLException {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("select balance from account where id = " + id)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    public static int update(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            return st.executeUpdate(sql);
        }
    }
}
