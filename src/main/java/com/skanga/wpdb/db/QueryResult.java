package com.skanga.wpdb.db;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by a read query.
 *
 * @param columns Column labels in select order
 * @param rows Rows as ordered label-to-value maps holding only JSON-safe values
 * @param hasMore true when the source had rows beyond the requested limit
 * @param executionTimeMs Wall time of the execution
 */
public record QueryResult(List<String> columns, List<Map<String, Object>> rows, boolean hasMore, long executionTimeMs) {
    public QueryResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
