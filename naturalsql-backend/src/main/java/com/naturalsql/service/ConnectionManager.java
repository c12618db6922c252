package com.naturalsql.service;

import com.naturalsql.config.BusyPolicy;
import com.naturalsql.config.PipelineSettings;
import com.naturalsql.exception.BusyException;
import com.naturalsql.exception.ConnectionException;
import com.naturalsql.exception.ConnectionInactiveException;
import com.naturalsql.exception.EngineRejectedException;
import com.naturalsql.exception.ErrorKind;
import com.naturalsql.exception.NaturalSqlException;
import com.naturalsql.exception.QueryTimeoutException;
import com.naturalsql.exception.RequestCancelledException;
import com.naturalsql.model.ColumnInfo;
import com.naturalsql.model.ConnectionDescriptor;
import com.naturalsql.model.ConnectionHandle;
import com.naturalsql.model.ConnectionStatus;
import com.naturalsql.model.EngineKind;
import com.naturalsql.model.KeyRole;
import com.naturalsql.model.SchemaSnapshot;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single live database connection of one session.
 *
 * <p>Each connection is a one-connection HikariCP pool. Statements are serialized by a fair lock; what a second
 * caller does while one statement runs is decided by the configured {@link BusyPolicy}.
 */
@Slf4j
public class ConnectionManager implements AutoCloseable {

    private static final String CANCELLED_SQL_STATE = "57014";
    private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "naturalsql-statement-watchdog");
        t.setDaemon(true);
        return t;
    });

    private final String sessionId;
    private final PipelineSettings settings;
    private final ReentrantLock statementLock = new ReentrantLock(true);
    private final Object stateLock = new Object();
    private final AtomicReference<Statement> inFlight = new AtomicReference<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicBoolean timedOut = new AtomicBoolean();

    private volatile HikariDataSource dataSource;
    private volatile ConnectionDescriptor descriptor;
    private volatile ConnectionHandle handle;
    private long generation;

    public ConnectionManager(String sessionId, PipelineSettings settings) {
        this.sessionId = sessionId;
        this.settings = settings;
    }

    /**
     * Work executed against a prepared statement whose parameters are already bound.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface StatementWork<T> {
        T apply(PreparedStatement statement) throws SQLException;
    }

    /**
     * Open a connection, replacing any live one.
     *
     * @param target connection descriptor
     * @return handle of the new connection
     * @throws ConnectionException when the database is unreachable or rejects the credentials
     */
    public ConnectionHandle connect(ConnectionDescriptor target) {
        synchronized (stateLock) {
            if (dataSource != null) {
                log.info("Replacing connection (session_id={}, previous={})", sessionId, descriptor);
                closePool();
            }

            HikariDataSource ds = null;
            try {
                ds = new HikariDataSource(buildHikariConfig(target));
                try (Connection conn = ds.getConnection()) {
                    if (!conn.isValid(5)) {
                        throw new SQLException("Connection is not valid");
                    }
                }
            } catch (SQLException | RuntimeException e) {
                if (ds != null) {
                    ds.close();
                }
                String message = rootMessage(e);
                log.error("Connection failed (session_id={}, target={}): {}", sessionId, target, message);
                throw new ConnectionException("Failed to connect to " + target + ": " + message, e);
            }

            dataSource = ds;
            descriptor = target;
            generation++;
            handle = new ConnectionHandle(target.identity(), generation, OffsetDateTime.now());
            log.info("Connected (session_id={}, target={}, connection_id={})", sessionId, target, handle.connectionId());
            return handle;
        }
    }

    /**
     * Close the live connection, if any. Safe to call repeatedly.
     */
    public void disconnect() {
        synchronized (stateLock) {
            if (dataSource == null) {
                return;
            }
            log.info("Disconnecting (session_id={}, target={})", sessionId, descriptor);
            closePool();
            descriptor = null;
            handle = null;
        }
    }

    public ConnectionStatus status() {
        synchronized (stateLock) {
            if (dataSource == null) {
                return ConnectionStatus.disconnected();
            }
            return new ConnectionStatus(true, descriptor, handle);
        }
    }

    /**
     * The live handle.
     *
     * @return handle
     * @throws ConnectionInactiveException when not connected
     */
    public ConnectionHandle requireHandle() {
        ConnectionHandle h = handle;
        if (h == null) {
            throw new ConnectionInactiveException("No active connection; call connect first");
        }
        return h;
    }

    /**
     * Run one statement with bound parameters and a query timeout.
     *
     * @param h handle the caller obtained at connect time
     * @param sql statement text with {@code ?} placeholders
     * @param params values for the placeholders
     * @param timeoutMs statement timeout; rounded up to whole seconds
     * @param work what to do with the prepared statement
     * @param <T> result type
     * @return result of {@code work}
     */
    public <T> T execute(ConnectionHandle h, String sql, List<Object> params, long timeoutMs, StatementWork<T> work) {
        checkCurrent(h);
        acquire(timeoutMs);
        try {
            HikariDataSource ds = checkCurrent(h);
            cancelRequested.set(false);
            timedOut.set(false);
            ScheduledFuture<?> watchdog = null;
            try (Connection conn = ds.getConnection();
                 PreparedStatement ps = conn.prepareStatement(sql)) {
                if (timeoutMs > 0) {
                    ps.setQueryTimeout(toTimeoutSeconds(timeoutMs));
                    // SQLite applies the query timeout to lock waits only
                    watchdog = WATCHDOG.schedule(() -> abortOnTimeout(ps, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS);
                }
                bind(ps, params);
                inFlight.set(ps);
                if (cancelRequested.get()) {
                    throw new RequestCancelledException("Request cancelled before execution", null);
                }
                return work.apply(ps);
            } catch (SQLException e) {
                throw translate(e, timeoutMs);
            } finally {
                if (watchdog != null) {
                    watchdog.cancel(false);
                }
                inFlight.set(null);
            }
        } finally {
            statementLock.unlock();
        }
    }

    private void abortOnTimeout(PreparedStatement ps, long timeoutMs) {
        if (inFlight.get() != ps) {
            return;
        }
        timedOut.set(true);
        try {
            ps.cancel();
            log.warn("Statement exceeded {} ms and was cancelled (session_id={})", timeoutMs, sessionId);
        } catch (SQLException e) {
            log.warn("Statement cancel after timeout failed (session_id={}): {}", sessionId, e.getMessage());
        }
    }

    /**
     * Abort the statement currently running on this connection.
     *
     * @return true if a statement was running
     */
    public boolean cancel() {
        cancelRequested.set(true);
        Statement running = inFlight.get();
        if (running == null) {
            return false;
        }
        try {
            running.cancel();
            log.info("Cancelled in-flight statement (session_id={})", sessionId);
        } catch (SQLException e) {
            log.warn("Statement cancel failed (session_id={}): {}", sessionId, e.getMessage());
        }
        return true;
    }

    /**
     * Read tables, columns and keys of the connected database.
     *
     * @return fresh schema snapshot
     */
    public SchemaSnapshot introspect() {
        ConnectionHandle h = requireHandle();
        acquire(settings.executionTimeoutMs());
        try {
            HikariDataSource ds = checkCurrent(h);
            EngineKind engine = descriptor.getEngine();
            long start = System.currentTimeMillis();
            try (Connection conn = ds.getConnection()) {
                DatabaseMetaData md = conn.getMetaData();
                // SQLite has one unnamed schema per file
                String catalog = engine.isFileBased() ? null : conn.getCatalog();
                String schema = engine.isFileBased() ? null : currentSchema(conn);

                List<String> tableNames = new ArrayList<>();
                try (ResultSet rs = md.getTables(catalog, schema, "%", new String[]{"TABLE", "VIEW"})) {
                    while (rs.next()) {
                        String name = rs.getString("TABLE_NAME");
                        if (name != null && !(engine == EngineKind.SQLITE && name.toLowerCase(Locale.ROOT).startsWith("sqlite_"))) {
                            tableNames.add(name);
                        }
                    }
                }

                Map<String, List<ColumnInfo>> tables = new LinkedHashMap<>();
                for (String table : tableNames) {
                    tables.put(table, readColumns(md, catalog, schema, table));
                }
                log.info("Schema introspected (session_id={}, tables={}, duration_ms={})",
                        sessionId, tables.size(), System.currentTimeMillis() - start);
                return new SchemaSnapshot(h.connectionId(), tables, OffsetDateTime.now());
            } catch (SQLException e) {
                throw new EngineRejectedException("Schema introspection failed: " + e.getMessage(), e.getSQLState(), e);
            }
        } finally {
            statementLock.unlock();
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    private List<ColumnInfo> readColumns(DatabaseMetaData md, String catalog, String schema, String table)
            throws SQLException {
        Set<String> primaryKeys = new HashSet<>();
        try (ResultSet rs = md.getPrimaryKeys(catalog, schema, table)) {
            while (rs.next()) {
                primaryKeys.add(rs.getString("COLUMN_NAME"));
            }
        }
        Set<String> foreignKeys = new HashSet<>();
        try (ResultSet rs = md.getImportedKeys(catalog, schema, table)) {
            while (rs.next()) {
                foreignKeys.add(rs.getString("FKCOLUMN_NAME"));
            }
        }

        List<OrderedColumn> columns = new ArrayList<>();
        // The table name is a LIKE pattern here; '_' may match other tables, so filter by exact name.
        try (ResultSet rs = md.getColumns(catalog, schema, table, "%")) {
            while (rs.next()) {
                if (!table.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                String name = rs.getString("COLUMN_NAME");
                KeyRole role = primaryKeys.contains(name) ? KeyRole.PRIMARY
                        : foreignKeys.contains(name) ? KeyRole.FOREIGN : KeyRole.NONE;
                boolean nullable = rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
                columns.add(new OrderedColumn(rs.getInt("ORDINAL_POSITION"),
                        new ColumnInfo(name, rs.getString("TYPE_NAME"), nullable, role)));
            }
        }
        columns.sort(Comparator.comparingInt(OrderedColumn::position));
        return columns.stream().map(OrderedColumn::column).toList();
    }

    private static String currentSchema(Connection conn) {
        try {
            return conn.getSchema();
        } catch (SQLFeatureNotSupportedException e) {
            return null;
        } catch (SQLException e) {
            log.debug("Could not read current schema: {}", e.getMessage());
            return null;
        }
    }

    private HikariConfig buildHikariConfig(ConnectionDescriptor target) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setDriverClassName(target.getEngine().getDriverClassName());
        config.setJdbcUrl(target.jdbcUrl());
        if (!target.getEngine().isFileBased()) {
            config.setUsername(target.getUsername());
            config.setPassword(target.getPassword());
        }
        if (target.getEngine() == EngineKind.POSTGRES) {
            // Shows up as pg_stat_activity.application_name
            config.addDataSourceProperty("ApplicationName", "naturalsql");
        }
        config.setConnectionTimeout(Math.max(250, settings.connectionTimeoutMs()));
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        config.setPoolName("naturalsql-" + sessionId);
        return config;
    }

    private void acquire(long timeoutMs) {
        if (settings.busyPolicy() == BusyPolicy.FAIL || timeoutMs <= 0) {
            if (!statementLock.tryLock()) {
                throw new BusyException("Another statement is running on this connection");
            }
            return;
        }
        try {
            if (!statementLock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new BusyException("Connection stayed busy for " + timeoutMs + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("Interrupted while waiting for the connection", e);
        }
    }

    private HikariDataSource checkCurrent(ConnectionHandle h) {
        synchronized (stateLock) {
            if (dataSource == null || handle == null) {
                throw new ConnectionInactiveException("No active connection; call connect first");
            }
            if (!handle.equals(h)) {
                throw new ConnectionInactiveException("Connection handle is stale; the connection was replaced");
            }
            return dataSource;
        }
    }

    private NaturalSqlException translate(SQLException e, long timeoutMs) {
        if (cancelRequested.get()) {
            return new RequestCancelledException("Statement cancelled", e);
        }
        if (timedOut.get() || e instanceof SQLTimeoutException || CANCELLED_SQL_STATE.equals(e.getSQLState())) {
            return new QueryTimeoutException(QueryTimeoutException.Phase.EXECUTION, timeoutMs, e);
        }
        if (isConnectionFailure(e)) {
            log.error("Connection failed during execution (session_id={}, sql_state={}): {}",
                    sessionId, e.getSQLState(), e.getMessage());
            return new NaturalSqlException(ErrorKind.EXECUTION_ERROR, "Connection failed during execution: " + e.getMessage(), e);
        }
        log.warn("Statement rejected by engine (session_id={}, sql_state={}, error_code={}): {}",
                sessionId, e.getSQLState(), e.getErrorCode(), e.getMessage());
        return new EngineRejectedException(e.getMessage(), e.getSQLState(), e);
    }

    private static boolean isConnectionFailure(SQLException e) {
        if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException) {
            return true;
        }
        return e.getSQLState() != null && e.getSQLState().startsWith("08");
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    static int toTimeoutSeconds(long timeoutMs) {
        return (int) Math.max(1, (timeoutMs + 999) / 1000);
    }

    private void closePool() {
        HikariDataSource ds = dataSource;
        dataSource = null;
        if (ds != null) {
            ds.close();
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() != null ? t.getMessage() : e.getMessage();
    }

    private record OrderedColumn(int position, ColumnInfo column) {
    }
}
