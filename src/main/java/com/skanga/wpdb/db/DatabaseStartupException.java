package com.skanga.wpdb.db;

/**
 * Startup could not produce a usable connection pool.
 */
public class DatabaseStartupException extends Exception {
    public DatabaseStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
