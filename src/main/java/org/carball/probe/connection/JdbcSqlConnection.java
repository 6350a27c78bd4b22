package org.carball.probe.connection;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.carball.probe.config.ConnectionSettings;
import org.carball.probe.model.RawRow;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SqlConnection} backed by a small HikariCP pool over the Microsoft SQL Server JDBC driver.
 */
@Slf4j
public class JdbcSqlConnection implements SqlConnection {

    private static final int MAXIMUM_POOL_SIZE = 4;

    private final HikariDataSource dataSource;
    private final String host;
    private final int queryTimeoutSeconds;

    JdbcSqlConnection(HikariDataSource dataSource, String host, int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.host = host;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Opens the pool and verifies one connection can be established.
     */
    public static JdbcSqlConnection open(ConnectionSettings settings) throws SQLException {
        HikariConfig config = buildHikariConfig(settings);
        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new SQLException("Unable to connect to SQL Server at " + settings.getDisplayAddress() + ": " + e.getMessage(), e);
        }

        try (Connection conn = dataSource.getConnection()) {
            if (!conn.isValid(settings.getTimeoutSeconds())) {
                throw new SQLException("Connection is not valid");
            }
        } catch (SQLException e) {
            dataSource.close();
            throw e;
        }

        log.info("Connected to SQL Server at {}", settings.getDisplayAddress());
        return new JdbcSqlConnection(dataSource, settings.getHostname(), settings.getQueryTimeoutSeconds());
    }

    static HikariConfig buildHikariConfig(ConnectionSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("query-probe");
        config.setJdbcUrl(settings.buildJdbcUrl());
        config.setUsername(settings.getUsername());
        config.setPassword(settings.getPassword());
        config.setMaximumPoolSize(MAXIMUM_POOL_SIZE);
        config.setMinimumIdle(0);
        config.setConnectionTimeout(settings.getTimeoutSeconds() * 1000L);
        config.setReadOnly(true);
        config.setAutoCommit(true);
        return config;
    }

    @Override
    public List<RawRow> query(String sql) throws SQLException {
        log.debug("Running query: {}", sql);
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            if (queryTimeoutSeconds > 0) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
            }

            // Diagnostic batches may DECLARE variables first; skip update counts until the first result set.
            boolean isResultSet = stmt.execute(sql);
            while (true) {
                if (isResultSet) {
                    try (ResultSet rs = stmt.getResultSet()) {
                        return readRows(rs);
                    }
                }
                if (stmt.getUpdateCount() == -1) {
                    return List.of();
                }
                isResultSet = stmt.getMoreResults();
            }
        }
    }

    private static List<RawRow> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<RawRow> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> values = new HashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                values.put(metaData.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(new RawRow(values));
        }
        return rows;
    }

    @Override
    public String getHost() {
        return host;
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
        }
    }
}
