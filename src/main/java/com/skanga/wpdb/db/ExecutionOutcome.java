package com.skanga.wpdb.db;

import java.util.Objects;

/**
 * Either a complete {@link QueryResult} or an {@link ExecutionError}, never both and never a partial row set.
 */
public final class ExecutionOutcome {
    private final QueryResult result;
    private final ExecutionError error;

    private ExecutionOutcome(QueryResult result, ExecutionError error) {
        this.result = result;
        this.error = error;
    }

    public static ExecutionOutcome success(QueryResult result) {
        return new ExecutionOutcome(Objects.requireNonNull(result, "result"), null);
    }

    public static ExecutionOutcome failure(ExecutionError error) {
        return new ExecutionOutcome(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return result != null;
    }

    /**
     * @throws IllegalStateException if this outcome is a failure
     */
    public QueryResult result() {
        if (result == null) {
            throw new IllegalStateException("Execution failed: " + error.code());
        }
        return result;
    }

    /**
     * @throws IllegalStateException if this outcome is a success
     */
    public ExecutionError error() {
        if (error == null) {
            throw new IllegalStateException("Execution succeeded");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ExecutionOutcome[success, rows=" + result.rowCount() + "]"
                : "ExecutionOutcome[failure, " + error.code() + "]";
    }
}
