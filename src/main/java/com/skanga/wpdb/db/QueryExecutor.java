package com.skanga.wpdb.db;

import com.skanga.wpdb.config.ResourceManager;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs read queries on pooled connections under a dual timeout.
 * <p>
 * The server is told to kill the statement after the query timeout (session ceiling plus the JDBC
 * statement timeout), and the caller stops waiting after the query timeout plus a grace period.
 * A connection whose statement was abandoned is evicted from the pool instead of being reused.
 * <p>
 * At most {@code limit + 1} rows are fetched; the extra row only sets {@code hasMore}.
 * Every failure is returned as an {@link ExecutionError}; nothing is thrown across this boundary.
 * This class is thread-safe.
 */
public class QueryExecutor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);
    static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(5);

    // MySQL ER_QUERY_TIMEOUT, MariaDB ER_STATEMENT_TIMEOUT
    private static final int MYSQL_QUERY_INTERRUPTED = 3024;
    private static final int MARIADB_STATEMENT_TIMEOUT = 1969;

    private final ConnectionPoolManager poolManager;
    private final Duration queryTimeout;
    private final Duration gracePeriod;
    private final int serverTimeoutSeconds;
    private final ExecutorService workers;

    public QueryExecutor(ConnectionPoolManager poolManager) {
        this(poolManager, Duration.ofSeconds(poolManager.configParams().queryTimeoutSeconds()), DEFAULT_GRACE_PERIOD);
    }

    /**
     * @param poolManager Source of the database context
     * @param queryTimeout Server-side execution ceiling, rounded up to whole seconds for the server
     * @param gracePeriod Extra client-side wait beyond the query timeout
     */
    public QueryExecutor(ConnectionPoolManager poolManager, Duration queryTimeout, Duration gracePeriod) {
        this.poolManager = poolManager;
        this.queryTimeout = queryTimeout;
        this.gracePeriod = gracePeriod;
        this.serverTimeoutSeconds = (int) Math.max(1, (queryTimeout.toMillis() + 999) / 1000);
        this.workers = Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    /**
     * Executes a read statement with positional parameters.
     * The statement must already have been approved by {@link SqlValidator} or be built internally.
     *
     * @param sql Statement text with {@code ?} placeholders
     * @param params Values bound in order, may be null or empty
     * @param limit Maximum rows to return, at least 1
     * @return The rows with a truncation flag, or the classified failure
     */
    public ExecutionOutcome execute(String sql, List<?> params, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }

        DatabaseContext databaseContext;
        try {
            databaseContext = poolManager.context();
        } catch (DatabaseNotInitializedException e) {
            return failure(ErrorCode.NOT_INITIALIZED, e.getMessage(), e.getMessage());
        }

        long startTime = System.currentTimeMillis();
        HikariDataSource dataSource = databaseContext.dataSource();
        Connection dbConn;
        try {
            dbConn = dataSource.getConnection();
        } catch (SQLException e) {
            return acquireFailure(dataSource, e);
        }

        boolean evict = false;
        AtomicReference<PreparedStatement> runningStatement = new AtomicReference<>();
        Future<QueryResult> pendingResult = null;
        try {
            ServerFlavor flavor = databaseContext.flavor();
            pendingResult = workers.submit(() -> {
                applySessionTimeout(dbConn, flavor, runningStatement);
                return runQuery(dbConn, sql, params, limit, runningStatement, startTime);
            });
            QueryResult queryResult = pendingResult.get(queryTimeout.plus(gracePeriod).toMillis(), TimeUnit.MILLISECONDS);
            logger.debug("Query returned {} rows (has more: {}) in {}ms",
                    queryResult.rowCount(), queryResult.hasMore(), queryResult.executionTimeMs());
            return ExecutionOutcome.success(queryResult);
        } catch (TimeoutException e) {
            evict = true;
            abandon(pendingResult, runningStatement.get());
            logger.warn("Query exceeded {}ms, connection evicted: {}",
                    queryTimeout.plus(gracePeriod).toMillis(), SqlValidator.abbreviate(sql));
            return timeoutFailure("client wait of " + queryTimeout.plus(gracePeriod).toMillis() + "ms elapsed");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SQLException) {
                SQLException sqlException = (SQLException) cause;
                evict = isConnectionError(sqlException);
                return classify(sqlException, sql);
            }
            logger.error("Unexpected error executing query: {}", SqlValidator.abbreviate(sql), cause);
            return failure(ErrorCode.INTERNAL_ERROR, ResourceManager.getErrorMessage("execution.unexpected"),
                    String.valueOf(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            evict = true;
            abandon(pendingResult, runningStatement.get());
            logger.warn("Interrupted while waiting for query: {}", SqlValidator.abbreviate(sql));
            return failure(ErrorCode.INTERNAL_ERROR, ResourceManager.getErrorMessage("execution.unexpected"),
                    "interrupted");
        } catch (RuntimeException e) {
            logger.error("Unexpected error executing query: {}", SqlValidator.abbreviate(sql), e);
            return failure(ErrorCode.INTERNAL_ERROR, ResourceManager.getErrorMessage("execution.unexpected"),
                    e.toString());
        } finally {
            release(dataSource, dbConn, evict);
        }
    }

    private void applySessionTimeout(Connection dbConn, ServerFlavor flavor,
                                     AtomicReference<PreparedStatement> runningStatement) throws SQLException {
        if (!flavor.hasSessionTimeout()) {
            return;
        }
        try (PreparedStatement timeoutStmt = dbConn.prepareStatement(flavor.sessionTimeoutSql())) {
            runningStatement.set(timeoutStmt);
            timeoutStmt.setLong(1, flavor.sessionTimeoutValue(serverTimeoutSeconds));
            timeoutStmt.execute();
        }
    }

    private QueryResult runQuery(Connection dbConn, String sql, List<?> params, int limit,
                                 AtomicReference<PreparedStatement> runningStatement, long startTime) throws SQLException {
        try (PreparedStatement prepStmt = dbConn.prepareStatement(sql)) {
            runningStatement.set(prepStmt);
            prepStmt.setQueryTimeout(serverTimeoutSeconds);
            prepStmt.setMaxRows((int) Math.min((long) limit + 1, Integer.MAX_VALUE));

            if (params != null) {
                for (int i = 0; i < params.size(); i++) {
                    setParameterValue(prepStmt, i + 1, params.get(i));
                }
            }

            List<String> columns = new ArrayList<>();
            List<Map<String, Object>> rows = new ArrayList<>();
            if (prepStmt.execute()) {
                try (ResultSet resultSet = prepStmt.getResultSet()) {
                    columns = RowValues.columnLabels(resultSet.getMetaData());
                    while (rows.size() <= limit && resultSet.next()) {
                        rows.add(RowValues.readRow(resultSet, columns));
                    }
                }
            }

            boolean hasMore = rows.size() > limit;
            if (hasMore) {
                rows = rows.subList(0, limit);
            }
            return new QueryResult(columns, rows, hasMore, System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Binds a parameter with the closest JDBC setter.
     */
    static void setParameterValue(PreparedStatement prepStmt, int paramIndex, Object paramValue) throws SQLException {
        if (paramValue == null) {
            prepStmt.setNull(paramIndex, java.sql.Types.NULL);
        } else if (paramValue instanceof String) {
            prepStmt.setString(paramIndex, (String) paramValue);
        } else if (paramValue instanceof Integer) {
            prepStmt.setInt(paramIndex, (Integer) paramValue);
        } else if (paramValue instanceof Long) {
            prepStmt.setLong(paramIndex, (Long) paramValue);
        } else if (paramValue instanceof Double) {
            prepStmt.setDouble(paramIndex, (Double) paramValue);
        } else if (paramValue instanceof Boolean) {
            prepStmt.setBoolean(paramIndex, (Boolean) paramValue);
        } else if (paramValue instanceof BigDecimal) {
            prepStmt.setBigDecimal(paramIndex, (BigDecimal) paramValue);
        } else {
            prepStmt.setString(paramIndex, paramValue.toString());
        }
    }

    private ExecutionOutcome acquireFailure(HikariDataSource dataSource, SQLException e) {
        if (dataSource.isClosed()) {
            String message = ResourceManager.getErrorMessage("database.not.initialized");
            return failure(ErrorCode.NOT_INITIALIZED, message, e.getMessage());
        }
        if (e.getCause() instanceof SQLException && isConnectionError((SQLException) e.getCause())) {
            logger.error("Cannot reach database: {}", e.getCause().getMessage());
            return failure(ErrorCode.CONNECTION_ERROR,
                    ResourceManager.getErrorMessage("execution.connection.error"), e.getCause().getMessage());
        }
        if (e instanceof SQLTransientConnectionException) {
            logger.error("Connection pool exhausted: {}", e.getMessage());
            return failure(ErrorCode.POOL_EXHAUSTED,
                    ResourceManager.getErrorMessage("execution.pool.exhausted"), e.getMessage());
        }
        logger.error("Failed to acquire connection: {}", e.getMessage());
        return failure(ErrorCode.CONNECTION_ERROR,
                ResourceManager.getErrorMessage("execution.connection.error"), e.getMessage());
    }

    private ExecutionOutcome classify(SQLException e, String sql) {
        String diagnostic = describe(e);
        if (isTimeout(e)) {
            logger.warn("Query killed by timeout ({}): {}", diagnostic, SqlValidator.abbreviate(sql));
            return timeoutFailure(diagnostic);
        }
        if (isConnectionError(e)) {
            logger.error("Connection error ({}): {}", diagnostic, SqlValidator.abbreviate(sql));
            return failure(ErrorCode.CONNECTION_ERROR,
                    ResourceManager.getErrorMessage("execution.connection.error"), diagnostic);
        }
        logger.warn("Query failed ({}): {}", diagnostic, SqlValidator.abbreviate(sql));
        String userMessage = e.getSQLState() != null
                ? ResourceManager.getErrorMessage("execution.query.error.state", e.getSQLState())
                : ResourceManager.getErrorMessage("execution.query.error");
        return failure(ErrorCode.QUERY_ERROR, userMessage, diagnostic);
    }

    private ExecutionOutcome timeoutFailure(String diagnostic) {
        return failure(ErrorCode.TIMEOUT,
                ResourceManager.getErrorMessage("execution.timeout", queryTimeout.toSeconds()), diagnostic);
    }

    private static ExecutionOutcome failure(ErrorCode errorCode, String userMessage, String diagnostic) {
        return ExecutionOutcome.failure(new ExecutionError(errorCode, userMessage, diagnostic));
    }

    static boolean isTimeout(SQLException e) {
        return e instanceof SQLTimeoutException
                || "70100".equals(e.getSQLState())
                || "57014".equals(e.getSQLState())
                || e.getErrorCode() == MYSQL_QUERY_INTERRUPTED
                || e.getErrorCode() == MARIADB_STATEMENT_TIMEOUT;
    }

    /**
     * Connection exception class (SQL state 08xxx).
     */
    static boolean isConnectionError(SQLException e) {
        String sqlState = e.getSQLState();
        return sqlState != null && sqlState.startsWith("08");
    }

    private static String describe(SQLException e) {
        return "SQLState " + e.getSQLState() + ", error " + e.getErrorCode() + ": " + e.getMessage();
    }

    private static void abandon(Future<?> pendingResult, PreparedStatement runningStatement) {
        if (pendingResult != null) {
            pendingResult.cancel(true);
        }
        if (runningStatement != null) {
            try {
                runningStatement.cancel();
            } catch (SQLException e) {
                logger.warn("Error cancelling statement: {}", e.getMessage());
            }
        }
    }

    private static void release(HikariDataSource dataSource, Connection dbConn, boolean evict) {
        if (evict) {
            try {
                dataSource.evictConnection(dbConn);
                return;
            } catch (RuntimeException e) {
                logger.warn("Error evicting connection: {}", e.getMessage());
            }
        }
        try {
            dbConn.close();
        } catch (SQLException e) {
            logger.warn("Error closing database connection: {}", e.getMessage());
        }
    }

    /**
     * Stops the worker threads. The pool itself belongs to {@link ConnectionPoolManager}.
     */
    @Override
    public void close() {
        workers.shutdownNow();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger threadCount = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread worker = new Thread(runnable, "wpdb-query-" + threadCount.incrementAndGet());
            worker.setDaemon(true);
            return worker;
        }
    }
}
