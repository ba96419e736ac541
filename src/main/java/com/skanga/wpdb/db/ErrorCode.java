package com.skanga.wpdb.db;

/**
 * Stable, caller-facing classification of execution failures.
 */
public enum ErrorCode {
    TIMEOUT("timeout"),
    POOL_EXHAUSTED("pool_exhausted"),
    CONNECTION_ERROR("connection_error"),
    QUERY_ERROR("query_error"),
    NOT_INITIALIZED("not_initialized"),
    INTERNAL_ERROR("internal_error");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
