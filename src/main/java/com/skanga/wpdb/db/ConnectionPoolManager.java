package com.skanga.wpdb.db;

import com.skanga.wpdb.config.ConfigParams;
import com.skanga.wpdb.config.ResourceManager;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Owns the single HikariCP pool of the process.
 * <p>
 * {@link #start()} creates the pool, detects the server flavor and, unless a prefix is configured, the
 * WordPress table prefix. Only then is the {@link DatabaseContext} published; a failed start leaves
 * nothing behind. The context is immutable and shared by every request until {@link #shutdown()}.
 */
public class ConnectionPoolManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionPoolManager.class);
    private static final String OPTIONS_SUFFIX = "options";

    private final ConfigParams configParams;
    private volatile DatabaseContext databaseContext;
    private boolean started;

    public ConnectionPoolManager(ConfigParams configParams) {
        this.configParams = configParams;
    }

    /**
     * Creates the pool and publishes the database context. May be called once.
     *
     * @return The published context
     * @throws DatabaseStartupException if the pool cannot be created or the database cannot be inspected
     */
    public synchronized DatabaseContext start() throws DatabaseStartupException {
        if (started) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("database.already.started"));
        }
        started = true;

        HikariConfig poolConfig = buildPoolConfig();
        logger.info("Initializing connection pool for {} (min idle: {}, max: {}, connect timeout: {}s)",
                configParams.describeTransport(), configParams.poolMinSize(), configParams.poolMaxSize(),
                configParams.connectTimeoutSeconds());

        HikariDataSource dataSource;
        try {
            dataSource = createDataSource(poolConfig);
        } catch (RuntimeException e) {
            // Hikari reports fail-fast initialization problems as PoolInitializationException
            String detail = configParams.maskSensitive(rootMessage(e));
            logger.error("Failed to create connection pool for {}: {}", configParams.describeTransport(), detail);
            throw new DatabaseStartupException(
                    ResourceManager.getErrorMessage("database.pool.init.failed", configParams.describeTransport(), detail), e);
        }

        try (Connection dbConn = dataSource.getConnection()) {
            DatabaseMetaData metaData = dbConn.getMetaData();
            ServerFlavor flavor = ServerFlavor.detect(metaData.getDatabaseProductName(),
                    metaData.getDatabaseProductVersion());

            String basePrefix;
            if (configParams.hasFixedPrefix()) {
                basePrefix = configParams.tablePrefix();
                logger.info("Using configured table prefix: '{}'", basePrefix);
            } else {
                basePrefix = detectPrefix(dbConn);
                logger.info("Auto-detected table prefix: '{}'", basePrefix);
            }

            databaseContext = new DatabaseContext(dataSource, basePrefix, configParams.dbName(), flavor);
            logger.info("Connected to {} ({} {}, flavor {})", configParams.describeTransport(),
                    metaData.getDatabaseProductName(), metaData.getDatabaseProductVersion(), flavor);
            return databaseContext;
        } catch (SQLException e) {
            String detail = configParams.maskSensitive(e.getMessage());
            logger.error("Failed to inspect database {}: {}", configParams.describeTransport(), detail);
            closeQuietly(dataSource);
            throw new DatabaseStartupException(
                    ResourceManager.getErrorMessage("database.pool.init.failed", configParams.describeTransport(), detail), e);
        }
    }

    HikariConfig buildPoolConfig() {
        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setJdbcUrl(configParams.jdbcUrl());
        poolConfig.setUsername(configParams.dbUser());
        poolConfig.setPassword(configParams.dbPass());
        poolConfig.setMinimumIdle(configParams.poolMinSize());
        poolConfig.setMaximumPoolSize(configParams.poolMaxSize());
        poolConfig.setConnectionTimeout(configParams.connectTimeoutMs());
        poolConfig.setValidationTimeout(Math.min(5000L, configParams.connectTimeoutMs()));
        // Fail fast: the first connection must succeed within the connect timeout
        poolConfig.setInitializationFailTimeout(configParams.connectTimeoutMs());
        poolConfig.setAutoCommit(true);
        // Read-only sessions on the server too, so a write the validator misses is still refused
        poolConfig.setReadOnly(true);
        poolConfig.addDataSourceProperty("assureReadOnly", "true");
        poolConfig.setPoolName("wpdb-pool");
        return poolConfig;
    }

    /**
     * Creates the data source. Overridable so tests can point the pool at an embedded database.
     */
    protected HikariDataSource createDataSource(HikariConfig poolConfig) {
        return new HikariDataSource(poolConfig);
    }

    /**
     * Finds the base prefix from the {@code <prefix>options} table. When several sites exist
     * ({@code wp_options}, {@code wp_2_options}) the shortest prefix, the main site's, wins.
     * Falls back to {@code wp_} when no options table exists.
     */
    String detectPrefix(Connection dbConn) throws SQLException {
        DatabaseMetaData metaData = dbConn.getMetaData();
        String detectedPrefix = null;
        try (ResultSet tables = metaData.getTables(dbConn.getCatalog(), null, "%" + OPTIONS_SUFFIX, null)) {
            while (tables.next()) {
                String tableName = tables.getString("TABLE_NAME");
                if (tableName == null || !tableName.toLowerCase().endsWith(OPTIONS_SUFFIX)) {
                    continue;
                }
                String candidate = tableName.substring(0, tableName.length() - OPTIONS_SUFFIX.length());
                if (detectedPrefix == null || candidate.length() < detectedPrefix.length()) {
                    detectedPrefix = candidate;
                }
            }
        }
        if (detectedPrefix == null) {
            logger.warn("No options table found in {}, falling back to prefix '{}'",
                    configParams.dbName(), SitePrefixes.DEFAULT_PREFIX);
            return SitePrefixes.DEFAULT_PREFIX;
        }
        return detectedPrefix;
    }

    /**
     * Returns the published context.
     *
     * @throws DatabaseNotInitializedException before {@link #start()} succeeded or after {@link #shutdown()}
     */
    public DatabaseContext context() {
        DatabaseContext currentContext = databaseContext;
        if (currentContext == null) {
            throw new DatabaseNotInitializedException();
        }
        return currentContext;
    }

    public boolean isInitialized() {
        return databaseContext != null;
    }

    public ConfigParams configParams() {
        return configParams;
    }

    /**
     * Withdraws the context and closes the pool. Idle connections close at once, connections in use
     * are closed as they are returned. Safe to call more than once.
     */
    public synchronized void shutdown() {
        DatabaseContext currentContext = databaseContext;
        databaseContext = null;
        if (currentContext != null) {
            closeQuietly(currentContext.dataSource());
            logger.info("Connection pool closed");
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private static void closeQuietly(HikariDataSource dataSource) {
        try {
            dataSource.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing connection pool: {}", e.getMessage());
        }
    }

    private static String rootMessage(Throwable throwable) {
        Throwable rootCause = throwable;
        while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
            rootCause = rootCause.getCause();
        }
        return rootCause.getMessage() != null ? rootCause.getMessage() : rootCause.getClass().getSimpleName();
    }
}
