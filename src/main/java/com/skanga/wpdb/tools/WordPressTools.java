package com.skanga.wpdb.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.wpdb.config.ConfigParams;
import com.skanga.wpdb.db.ConnectionPoolManager;
import com.skanga.wpdb.db.DatabaseContext;
import com.skanga.wpdb.db.DatabaseNotInitializedException;
import com.skanga.wpdb.db.ErrorCode;
import com.skanga.wpdb.db.ExecutionError;
import com.skanga.wpdb.db.ExecutionOutcome;
import com.skanga.wpdb.db.QueryExecutor;
import com.skanga.wpdb.db.QueryResult;
import com.skanga.wpdb.db.SitePrefixes;

import java.util.List;
import java.util.Map;

/**
 * Base class of the tool groups. Holds the collaborators every tool needs and runs tool bodies
 * against the current {@link DatabaseContext}, turning failures into error documents.
 */
public abstract class WordPressTools {
    static final String TABLE_NOT_FOUND = "table_not_found";

    protected final ConnectionPoolManager poolManager;
    protected final QueryExecutor queryExecutor;
    protected final ConfigParams configParams;

    protected WordPressTools(ConnectionPoolManager poolManager, QueryExecutor queryExecutor) {
        this.poolManager = poolManager;
        this.queryExecutor = queryExecutor;
        this.configParams = poolManager.configParams();
    }

    /**
     * Definitions of the tools in this group, in {@code tools/list} order.
     */
    public abstract List<ObjectNode> definitions();

    @FunctionalInterface
    protected interface ToolBody {
        ToolOutput run(DatabaseContext databaseContext) throws ToolQueryException;
    }

    /**
     * Runs a tool body. A missing context becomes {@code not_initialized}, a failed query its execution error.
     */
    protected ToolOutput withContext(ToolBody toolBody) {
        DatabaseContext databaseContext;
        try {
            databaseContext = poolManager.context();
        } catch (DatabaseNotInitializedException e) {
            return ResultFormatter.error(e.getMessage(), ErrorCode.NOT_INITIALIZED.code());
        }
        try {
            return toolBody.run(databaseContext);
        } catch (ToolQueryException e) {
            return ResultFormatter.executionError(e.executionError());
        }
    }

    /**
     * Runs an internally built query, failing the tool body when it does not succeed.
     */
    protected QueryResult query(String sql, List<?> params, int limit) throws ToolQueryException {
        ExecutionOutcome outcome = queryExecutor.execute(sql, params, limit);
        if (!outcome.isSuccess()) {
            throw new ToolQueryException(outcome.error());
        }
        return outcome.result();
    }

    protected QueryResult query(String sql, List<?> params) throws ToolQueryException {
        return query(sql, params, configParams.maxRows());
    }

    protected static String sitePrefix(DatabaseContext databaseContext, Integer siteId) {
        return SitePrefixes.resolvePrefix(databaseContext.basePrefix(), siteId);
    }

    /**
     * Back-quoted physical name of a core table, e.g. {@code `wp_2_posts`}.
     */
    protected static String table(String prefix, String suffix) {
        return SitePrefixes.quoteIdentifier(prefix + suffix);
    }

    /**
     * Reads a column by label ignoring case; catalog labels differ in case between servers.
     */
    protected static Object columnValue(Map<String, Object> row, String columnLabel) {
        if (row.containsKey(columnLabel)) {
            return row.get(columnLabel);
        }
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(columnLabel)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * A query issued by a tool failed.
     */
    protected static final class ToolQueryException extends Exception {
        private final transient ExecutionError executionError;

        ToolQueryException(ExecutionError executionError) {
            super(executionError.userMessage());
            this.executionError = executionError;
        }

        ExecutionError executionError() {
            return executionError;
        }
    }
}
