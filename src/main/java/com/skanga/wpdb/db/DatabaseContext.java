package com.skanga.wpdb.db;

import com.zaxxer.hikari.HikariDataSource;

/**
 * Process-wide database state fixed at startup and read-only afterwards.
 *
 * @param dataSource The shared connection pool
 * @param basePrefix Base table prefix, configured or auto-detected
 * @param dbName Name of the target database
 * @param flavor Engine behind the pool
 */
public record DatabaseContext(HikariDataSource dataSource, String basePrefix, String dbName, ServerFlavor flavor) {
}
