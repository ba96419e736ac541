package com.skanga.wpdb.db;

import java.util.Locale;

/**
 * The database engine behind the pool, detected once at startup.
 * Decides how the per-session execution time ceiling is expressed.
 */
public enum ServerFlavor {
    MYSQL("SET SESSION MAX_EXECUTION_TIME = ?") {
        @Override
        public long sessionTimeoutValue(int timeoutSeconds) {
            return timeoutSeconds * 1000L;
        }
    },
    MARIADB("SET SESSION max_statement_time = ?") {
        @Override
        public long sessionTimeoutValue(int timeoutSeconds) {
            return timeoutSeconds;
        }
    },
    GENERIC(null) {
        @Override
        public long sessionTimeoutValue(int timeoutSeconds) {
            return timeoutSeconds;
        }
    };

    private final String sessionTimeoutSql;

    ServerFlavor(String sessionTimeoutSql) {
        this.sessionTimeoutSql = sessionTimeoutSql;
    }

    /**
     * Parameterized statement that sets the session execution ceiling, null when the engine has none.
     */
    public String sessionTimeoutSql() {
        return sessionTimeoutSql;
    }

    public boolean hasSessionTimeout() {
        return sessionTimeoutSql != null;
    }

    /**
     * Value to bind to {@link #sessionTimeoutSql()} for the given timeout.
     */
    public abstract long sessionTimeoutValue(int timeoutSeconds);

    /**
     * Classifies an engine from JDBC metadata.
     *
     * @param productName {@code DatabaseMetaData.getDatabaseProductName()}
     * @param productVersion {@code DatabaseMetaData.getDatabaseProductVersion()}
     */
    public static ServerFlavor detect(String productName, String productVersion) {
        String name = productName == null ? "" : productName.toLowerCase(Locale.ROOT);
        String version = productVersion == null ? "" : productVersion.toLowerCase(Locale.ROOT);
        // MariaDB servers commonly report themselves as "MySQL" with a "-MariaDB" version suffix
        if (name.contains("mariadb") || version.contains("mariadb")) {
            return MARIADB;
        }
        if (name.contains("mysql")) {
            return MYSQL;
        }
        return GENERIC;
    }
}
