package com.skanga.wpdb.config;

/**
 * Immutable server configuration, read once at startup.
 * Exactly one database transport is in effect: the unix socket when {@code dbSocket} is set, otherwise host and port.
 *
 * @param dbHost TCP host, ignored when a socket path is configured
 * @param dbPort TCP port, ignored when a socket path is configured
 * @param dbSocket Unix socket path, empty for TCP
 * @param dbUser Database user
 * @param dbPass Database password
 * @param dbName Target database (schema) name
 * @param tablePrefix Fixed base table prefix, empty to auto-detect at startup
 * @param maxRows Ceiling for any requested row limit
 * @param queryTimeoutSeconds Per-query execution time ceiling
 * @param poolMinSize Minimum idle pooled connections
 * @param poolMaxSize Maximum pooled connections
 * @param connectTimeoutSeconds Timeout for opening or acquiring a connection
 * @param maxSqlLength Maximum accepted length of caller-supplied SQL
 */
public record ConfigParams(String dbHost, int dbPort, String dbSocket, String dbUser, String dbPass, String dbName,
                           String tablePrefix, int maxRows, int queryTimeoutSeconds, int poolMinSize,
                           int poolMaxSize, int connectTimeoutSeconds, int maxSqlLength) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 3306;
    public static final String DEFAULT_USER = "root";
    public static final String DEFAULT_DB_NAME = "wordpress";
    public static final int DEFAULT_MAX_ROWS = 1000;
    public static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_POOL_MIN_SIZE = 1;
    public static final int DEFAULT_POOL_MAX_SIZE = 5;
    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_MAX_SQL_LENGTH = 5000;

    public ConfigParams {
        dbSocket = dbSocket == null ? "" : dbSocket.trim();
        dbPass = dbPass == null ? "" : dbPass;
        tablePrefix = tablePrefix == null ? "" : tablePrefix.trim();

        if (dbSocket.isEmpty() && (dbHost == null || dbHost.isBlank())) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.host.missing"));
        }
        if (dbSocket.isEmpty() && (dbPort < 1 || dbPort > 65535)) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.port.invalid", dbPort));
        }
        if (dbUser == null || dbUser.isBlank()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.user.missing"));
        }
        if (dbName == null || dbName.isBlank()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.dbname.missing"));
        }
        requirePositive("MAX_ROWS", maxRows);
        requirePositive("QUERY_TIMEOUT", queryTimeoutSeconds);
        requirePositive("POOL_MAX_SIZE", poolMaxSize);
        requirePositive("CONNECT_TIMEOUT", connectTimeoutSeconds);
        requirePositive("MAX_SQL_LENGTH", maxSqlLength);
        if (poolMinSize < 0 || poolMinSize > poolMaxSize) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.pool.size.invalid", poolMinSize, poolMaxSize));
        }
    }

    /**
     * Creates a TCP configuration with default limits. Mostly useful in tests.
     */
    public static ConfigParams defaultConfig(String dbHost, int dbPort, String dbUser, String dbPass, String dbName) {
        return new ConfigParams(dbHost, dbPort, "", dbUser, dbPass, dbName, "",
                DEFAULT_MAX_ROWS, DEFAULT_QUERY_TIMEOUT_SECONDS, DEFAULT_POOL_MIN_SIZE, DEFAULT_POOL_MAX_SIZE,
                DEFAULT_CONNECT_TIMEOUT_SECONDS, DEFAULT_MAX_SQL_LENGTH);
    }

    private static void requirePositive(String paramName, int paramValue) {
        if (paramValue < 1) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.value.not.positive", paramName, paramValue));
        }
    }

    public boolean usesSocket() {
        return !dbSocket.isEmpty();
    }

    public boolean hasFixedPrefix() {
        return !tablePrefix.isEmpty();
    }

    public long connectTimeoutMs() {
        return connectTimeoutSeconds * 1000L;
    }

    /**
     * Builds the JDBC URL for whichever transport is configured.
     */
    public String jdbcUrl() {
        if (usesSocket()) {
            return "jdbc:mariadb://localhost/" + dbName + "?localSocket=" + dbSocket
                    + "&connectTimeout=" + connectTimeoutMs();
        }
        return "jdbc:mariadb://" + dbHost + ":" + dbPort + "/" + dbName
                + "?connectTimeout=" + connectTimeoutMs();
    }

    /**
     * Human-readable transport description for log lines, never containing credentials.
     */
    public String describeTransport() {
        if (usesSocket()) {
            return dbUser + "@" + dbSocket + " (socket) db=" + dbName;
        }
        return dbUser + "@" + dbHost + ":" + dbPort + "/" + dbName;
    }

    /**
     * Replaces any occurrence of the password in the given text.
     */
    public String maskSensitive(String text) {
        if (text == null || dbPass.isEmpty()) {
            return text;
        }
        return text.replace(dbPass, "***");
    }

    @Override
    public String toString() {
        return "ConfigParams[" + describeTransport() + ", tablePrefix=" + (hasFixedPrefix() ? tablePrefix : "<auto>")
                + ", maxRows=" + maxRows + ", queryTimeoutSeconds=" + queryTimeoutSeconds
                + ", pool=" + poolMinSize + ".." + poolMaxSize + "]";
    }
}
