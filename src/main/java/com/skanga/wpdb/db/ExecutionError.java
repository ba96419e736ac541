package com.skanga.wpdb.db;

/**
 * A failed execution.
 *
 * @param code Failure class
 * @param userMessage Sanitized message safe to return to callers
 * @param diagnostic Driver or server detail, for logs only
 */
public record ExecutionError(ErrorCode code, String userMessage, String diagnostic) {
}
