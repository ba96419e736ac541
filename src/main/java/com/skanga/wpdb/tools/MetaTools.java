package com.skanga.wpdb.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.wpdb.db.ConnectionPoolManager;
import com.skanga.wpdb.db.QueryExecutor;
import com.skanga.wpdb.db.QueryResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key-value meta lookups for posts, users and comments.
 */
public class MetaTools extends WordPressTools {
    public static final String WP_GET_POST_META = "wp_get_post_meta";
    public static final String WP_GET_USER_META = "wp_get_user_meta";
    public static final String WP_GET_COMMENT_META = "wp_get_comment_meta";

    static final int MAX_META_KEY_LENGTH = 255;
    private static final String META_KEY_DESCRIPTION =
            "Filter by meta_key: exact match, or a LIKE pattern when it contains '%'.";

    public MetaTools(ConnectionPoolManager poolManager, QueryExecutor queryExecutor) {
        super(poolManager, queryExecutor);
    }

    @Override
    public List<ObjectNode> definitions() {
        return List.of(
                ToolSupport.tool(WP_GET_POST_META, "Get Meta for a Post",
                                "Get the postmeta key-value pairs of a post. Optionally filter by meta_key.")
                        .id("post_id", "Post ID.")
                        .string("meta_key", META_KEY_DESCRIPTION, null, MAX_META_KEY_LENGTH)
                        .siteId()
                        .format()
                        .build(),
                ToolSupport.tool(WP_GET_USER_META, "Get Meta for a User",
                                "Get the usermeta key-value pairs of a user (roles, capabilities, preferences). "
                                        + "User tables are shared by all sites of a multisite network.")
                        .id("user_id", "User ID.")
                        .string("meta_key", META_KEY_DESCRIPTION, null, MAX_META_KEY_LENGTH)
                        .format()
                        .build(),
                ToolSupport.tool(WP_GET_COMMENT_META, "Get Meta for a Comment",
                                "Get the commentmeta key-value pairs of a comment. Optionally filter by meta_key.")
                        .id("comment_id", "Comment ID.")
                        .string("meta_key", META_KEY_DESCRIPTION, null, MAX_META_KEY_LENGTH)
                        .siteId()
                        .format()
                        .build());
    }

    public ToolOutput getPostMeta(JsonNode argsNode) {
        long postId = ToolSupport.requiredId(argsNode, "post_id");
        Integer siteId = ToolSupport.optionalSiteId(argsNode);
        return getMeta(argsNode, siteId, false, "postmeta", "post_id", postId);
    }

    public ToolOutput getUserMeta(JsonNode argsNode) {
        long userId = ToolSupport.requiredId(argsNode, "user_id");
        return getMeta(argsNode, null, true, "usermeta", "user_id", userId);
    }

    public ToolOutput getCommentMeta(JsonNode argsNode) {
        long commentId = ToolSupport.requiredId(argsNode, "comment_id");
        Integer siteId = ToolSupport.optionalSiteId(argsNode);
        return getMeta(argsNode, siteId, false, "commentmeta", "comment_id", commentId);
    }

    private ToolOutput getMeta(JsonNode argsNode, Integer siteId, boolean basePrefixOnly,
                               String tableSuffix, String idColumn, long entityId) {
        String metaKey = ToolSupport.optionalString(argsNode, "meta_key", MAX_META_KEY_LENGTH);
        OutputFormat outputFormat = ToolSupport.format(argsNode);

        return withContext(databaseContext -> {
            String prefix = basePrefixOnly ? databaseContext.basePrefix() : sitePrefix(databaseContext, siteId);
            StringBuilder sqlBuilder = new StringBuilder()
                    .append("SELECT * FROM ").append(table(prefix, tableSuffix))
                    .append(" WHERE ").append(idColumn).append(" = ?");
            List<Object> sqlParams = new ArrayList<>(List.of(entityId));
            if (metaKey != null) {
                sqlBuilder.append(metaKey.contains("%") ? " AND meta_key LIKE ?" : " AND meta_key = ?");
                sqlParams.add(metaKey);
            }
            sqlBuilder.append(" ORDER BY meta_key");

            QueryResult queryResult = query(sqlBuilder.toString(), sqlParams);

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put(idColumn, entityId);
            envelope.put("meta", queryResult.rows());
            return ResultFormatter.format(outputFormat, queryResult.rows(), envelope);
        });
    }
}
