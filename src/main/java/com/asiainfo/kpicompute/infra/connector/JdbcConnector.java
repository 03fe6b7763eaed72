package com.asiainfo.kpicompute.infra.connector;

import com.asiainfo.kpicompute.common.exception.ConnectorUnavailableException;
import com.asiainfo.kpicompute.common.exception.QueryExecutionException;
import com.asiainfo.kpicompute.common.exception.TableNotFoundException;
import com.asiainfo.kpicompute.core.model.ColumnType;
import com.asiainfo.kpicompute.core.model.CompiledQuery;
import com.asiainfo.kpicompute.core.model.TableHandle;
import org.duckdb.DuckDBConnection;
import org.duckdb.DuckDBDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.Driver;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * 基于 JDBC 的连接器，支持 DuckDB 与 SQLite
 * DuckDB 每次查询使用 duplicate() 出的连接，多个计划可并发；SQLite 共用一个连接并串行执行
 */
public class JdbcConnector implements Connector {

    private static final Logger log = LoggerFactory.getLogger(JdbcConnector.class);

    public static final Set<String> SUPPORTED_BACKENDS = Set.of("duckdb", "sqlite");
    public static final String MEMORY_DATABASE = ":memory:";

    private final String backendType;
    private final Driver driver;
    private final String jdbcUrl;
    private final Properties properties;
    private final Object lock = new Object();
    // 执行中的查询，超时后可取消
    private final Map<CompiledQuery, Statement> running = Collections.synchronizedMap(new IdentityHashMap<>());

    private volatile Connection connection;

    public JdbcConnector(String backendType, Driver driver, String jdbcUrl, Properties properties) {
        this.backendType = backendType;
        this.driver = driver;
        this.jdbcUrl = jdbcUrl;
        this.properties = properties;
    }

    public static JdbcConnector duckdb(String path, boolean readOnly) {
        String target = path == null || MEMORY_DATABASE.equals(path) ? "" : path;
        Properties props = new Properties();
        if (readOnly) {
            props.setProperty("duckdb.read_only", "true");
        }
        return new JdbcConnector("duckdb", new DuckDBDriver(), "jdbc:duckdb:" + target, props);
    }

    public static JdbcConnector sqlite(String path) {
        String target = path == null ? MEMORY_DATABASE : path;
        return new JdbcConnector("sqlite", new org.sqlite.JDBC(), "jdbc:sqlite:" + target, new Properties());
    }

    @Override
    public String backendType() {
        return backendType;
    }

    public void connect() {
        synchronized (lock) {
            if (connection != null) {
                return;
            }
            try {
                Connection conn = driver.connect(jdbcUrl, properties);
                if (conn == null) {
                    throw new ConnectorUnavailableException("Driver rejected URL " + jdbcUrl + " for " + backendType);
                }
                connection = conn;
                log.info("Connected to {} ({})", backendType, jdbcUrl);
            } catch (SQLException e) {
                throw new ConnectorUnavailableException(
                        String.format("%s connection failed for '%s': %s", backendType, jdbcUrl, e.getMessage()), e);
            }
        }
    }

    public boolean isConnected() {
        return connection != null;
    }

    @Override
    public TableHandle resolveTable(SourceUri source) {
        TableHandle unresolved = TableHandle.unverified(source.uri(), backendType, source.table());
        String sql = "SELECT * FROM " + unresolved.sqlReference() + " LIMIT 0";
        try {
            Map<String, ColumnType> columns = withConnection(conn -> {
                try (Statement stmt = conn.createStatement();
                     ResultSet rs = stmt.executeQuery(sql)) {
                    ResultSetMetaData meta = rs.getMetaData();
                    Map<String, ColumnType> types = new LinkedHashMap<>();
                    for (int i = 1; i <= meta.getColumnCount(); i++) {
                        types.put(meta.getColumnLabel(i), ColumnType.of(meta.getColumnType(i), meta.getColumnTypeName(i)));
                    }
                    return types;
                }
            });
            log.debug("Resolved {} table {} with columns {}", backendType, source.table(), columns);
            return new TableHandle(source.uri(), backendType, source.table(), columns, true);
        } catch (SQLException e) {
            if (isMissingTable(e)) {
                throw new TableNotFoundException(
                        String.format("Table '%s' not found in %s backend", source.table(), backendType), e);
            }
            throw new QueryExecutionException(
                    String.format("Failed to resolve table '%s' on %s: %s", source.table(), backendType, e.getMessage()), e);
        }
    }

    @Override
    public List<Map<String, Object>> runQuery(CompiledQuery query) {
        try {
            return withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(query.sql())) {
                    List<Object> params = query.params();
                    for (int i = 0; i < params.size(); i++) {
                        ps.setObject(i + 1, params.get(i));
                    }
                    running.put(query, ps);
                    try {
                        // 登记前（如等锁期间）已被放弃的查询不再执行
                        if (Thread.currentThread().isInterrupted()) {
                            throw new QueryExecutionException(
                                    "Query on " + backendType + " was cancelled before it started", null);
                        }
                        try (ResultSet rs = ps.executeQuery()) {
                            return resultSetToList(rs);
                        }
                    } finally {
                        running.remove(query);
                    }
                }
            });
        } catch (SQLException e) {
            log.error("{} query failed: {}", backendType, query.sql(), e);
            throw new QueryExecutionException(
                    String.format("Query execution failed on %s: %s", backendType, e.getMessage()), e);
        }
    }

    @Override
    public boolean isAvailable() {
        Connection current = connection;
        if (current == null) {
            return false;
        }
        try {
            if (current.isClosed()) {
                return false;
            }
            return withConnection(conn -> {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("SELECT 1");
                    return true;
                }
            });
        } catch (SQLException | ConnectorUnavailableException e) {
            log.warn("Health check failed for {}: {}", backendType, e.getMessage());
            return false;
        }
    }

    @Override
    public void cancel(CompiledQuery query) {
        Statement statement = running.get(query);
        if (statement == null) {
            return;
        }
        try {
            statement.cancel();
            log.info("Cancelled {} query", backendType);
        } catch (SQLException e) {
            log.warn("Failed to cancel {} query: {}", backendType, e.getMessage());
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (connection == null) {
                return;
            }
            try {
                connection.close();
                log.info("Closed {} connection", backendType);
            } catch (SQLException e) {
                log.warn("Failed to close {} connection", backendType, e);
            } finally {
                connection = null;
            }
        }
    }

    private <T> T withConnection(SqlWork<T> work) throws SQLException {
        Connection current = connection;
        if (current == null) {
            throw new ConnectorUnavailableException("Not connected to " + backendType + ". Call connect() first.");
        }
        if (current instanceof DuckDBConnection duck) {
            try (Connection dup = duck.duplicate()) {
                return work.apply(dup);
            }
        }
        synchronized (lock) {
            return work.apply(current);
        }
    }

    private static boolean isMissingTable(SQLException e) {
        String message = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
        return message.contains("does not exist") || message.contains("no such table") || message.contains("not found");
    }

    private static List<Map<String, Object>> resultSetToList(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columns = md.getColumnCount();
        List<Map<String, Object>> list = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columns; ++i) {
                row.put(md.getColumnLabel(i), rs.getObject(i));
            }
            list.add(row);
        }
        return list;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    @Override
    public String toString() {
        return "JdbcConnector(backend='" + backendType + "', status='" + (isConnected() ? "connected" : "disconnected") + "')";
    }
}
