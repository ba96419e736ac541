package com.skanga.wpdb.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.wpdb.db.ConnectionPoolManager;
import com.skanga.wpdb.db.QueryExecutor;
import com.skanga.wpdb.db.QueryResult;
import com.skanga.wpdb.db.SqlValidator;
import com.skanga.wpdb.db.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw read-only SQL ({@code wp_query}) and post search ({@code wp_search_posts}).
 */
public class QueryTools extends WordPressTools {
    private static final Logger logger = LoggerFactory.getLogger(QueryTools.class);

    public static final String WP_QUERY = "wp_query";
    public static final String WP_SEARCH_POSTS = "wp_search_posts";

    static final int MAX_SEARCH_LENGTH = 200;
    static final String DEFAULT_POST_STATUS = "publish";

    public QueryTools(ConnectionPoolManager poolManager, QueryExecutor queryExecutor) {
        super(poolManager, queryExecutor);
    }

    @Override
    public List<ObjectNode> definitions() {
        return List.of(
                ToolSupport.tool(WP_QUERY, "Execute Read-Only SQL Query",
                                "Execute a read-only SQL query against the WordPress database. Only SELECT, SHOW, "
                                        + "DESCRIBE and EXPLAIN statements are allowed; write and DDL keywords and the "
                                        + "system schemas are rejected. Results are limited to " + configParams.maxRows()
                                        + " rows and queries time out after " + configParams.queryTimeoutSeconds() + "s.")
                        .string("sql", "SQL SELECT query to execute.", 1, configParams.maxSqlLength(), true)
                        .limit(configParams.maxRows())
                        .format()
                        .build(),
                ToolSupport.tool(WP_SEARCH_POSTS, "Search WordPress Posts",
                                "Search posts by title or content (LIKE match), newest first. "
                                        + "Optionally filter by post type and post status.")
                        .string("search", "Search term to find in post title or content.", 1, MAX_SEARCH_LENGTH, true)
                        .string("post_type", "Filter by post type (e.g. 'post', 'page', 'product').", null, 100)
                        .string("post_status", "Filter by post status; null for any status.", DEFAULT_POST_STATUS, 50)
                        .siteId()
                        .limit(configParams.maxRows())
                        .format()
                        .build());
    }

    /**
     * Validates and runs caller-supplied SQL. Rejected statements never reach the database.
     */
    public ToolOutput query(JsonNode argsNode) {
        String sqlText = ToolSupport.requiredRawString(argsNode, "sql", configParams.maxSqlLength());
        int limit = ToolSupport.limit(argsNode, configParams.maxRows());
        OutputFormat outputFormat = ToolSupport.format(argsNode);

        ValidationOutcome validationOutcome = SqlValidator.validate(sqlText);
        if (!validationOutcome.approved()) {
            return ResultFormatter.validationError(validationOutcome);
        }

        logger.info("Executing wp_query (limit {}): {}", limit, SqlValidator.abbreviate(sqlText));
        return withContext(databaseContext -> {
            QueryResult queryResult = query(sqlText, List.of(), limit);

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("row_count", queryResult.rowCount());
            envelope.put("has_more", queryResult.hasMore());
            envelope.put("limit", limit);
            envelope.put("rows", queryResult.rows());
            return ResultFormatter.format(outputFormat, queryResult.rows(), envelope);
        });
    }

    public ToolOutput searchPosts(JsonNode argsNode) {
        String searchText = ToolSupport.requiredString(argsNode, "search", MAX_SEARCH_LENGTH);
        String postType = ToolSupport.optionalString(argsNode, "post_type", 100);
        // Absent means the default status; an explicit null or blank means any status
        String postStatus = argsNode.has("post_status")
                ? ToolSupport.optionalString(argsNode, "post_status", 50) : DEFAULT_POST_STATUS;
        Integer siteId = ToolSupport.optionalSiteId(argsNode);
        int limit = ToolSupport.limit(argsNode, configParams.maxRows());
        OutputFormat outputFormat = ToolSupport.format(argsNode);

        return withContext(databaseContext -> {
            String prefix = sitePrefix(databaseContext, siteId);
            String searchPattern = "%" + escapeLike(searchText) + "%";

            StringBuilder sqlBuilder = new StringBuilder()
                    .append("SELECT ID, post_title, post_type, post_status, post_date, post_author, ")
                    .append("SUBSTRING(post_content, 1, 200) AS content_preview ")
                    .append("FROM ").append(table(prefix, "posts")).append(' ')
                    .append("WHERE (post_title LIKE ? OR post_content LIKE ?)");
            List<Object> sqlParams = new ArrayList<>(List.of(searchPattern, searchPattern));
            if (postType != null) {
                sqlBuilder.append(" AND post_type = ?");
                sqlParams.add(postType);
            }
            if (postStatus != null) {
                sqlBuilder.append(" AND post_status = ?");
                sqlParams.add(postStatus);
            }
            sqlBuilder.append(" ORDER BY post_date DESC");

            QueryResult queryResult = query(sqlBuilder.toString(), sqlParams, limit);

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("search", searchText);
            envelope.put("posts", queryResult.rows());
            envelope.put("has_more", queryResult.hasMore());
            return ResultFormatter.format(outputFormat, queryResult.rows(), envelope);
        });
    }

    /**
     * Escapes the LIKE wildcards and the escape character itself so user text matches literally.
     */
    static String escapeLike(String searchText) {
        return searchText.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
