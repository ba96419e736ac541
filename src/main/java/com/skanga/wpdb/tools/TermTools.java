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
 * Taxonomy traversal: post to terms, term to posts, and the taxonomy summary.
 */
public class TermTools extends WordPressTools {
    public static final String WP_GET_POST_TERMS = "wp_get_post_terms";
    public static final String WP_GET_TERM_POSTS = "wp_get_term_posts";
    public static final String WP_LIST_TAXONOMIES = "wp_list_taxonomies";

    public TermTools(ConnectionPoolManager poolManager, QueryExecutor queryExecutor) {
        super(poolManager, queryExecutor);
    }

    @Override
    public List<ObjectNode> definitions() {
        return List.of(
                ToolSupport.tool(WP_GET_POST_TERMS, "Get Terms for a Post",
                                "Get the categories, tags and custom taxonomy terms assigned to a post.")
                        .id("post_id", "Post ID.")
                        .string("taxonomy", "Filter by taxonomy (e.g. 'category', 'post_tag').", null, 100)
                        .siteId()
                        .format()
                        .build(),
                ToolSupport.tool(WP_GET_TERM_POSTS, "Get Posts for a Term",
                                "Get the posts assigned to a term, newest first.")
                        .id("term_id", "Term ID.")
                        .string("post_type", "Filter by post type.", null, 100)
                        .string("post_status", "Filter by post status; null for any status.",
                                QueryTools.DEFAULT_POST_STATUS, 50)
                        .siteId()
                        .limit(configParams.maxRows())
                        .format()
                        .build(),
                ToolSupport.tool(WP_LIST_TAXONOMIES, "List WordPress Taxonomies",
                                "List the registered taxonomies with their term counts and total usage.")
                        .siteId()
                        .format()
                        .build());
    }

    public ToolOutput getPostTerms(JsonNode argsNode) {
        long postId = ToolSupport.requiredId(argsNode, "post_id");
        String taxonomy = ToolSupport.optionalString(argsNode, "taxonomy", 100);
        Integer siteId = ToolSupport.optionalSiteId(argsNode);
        OutputFormat outputFormat = ToolSupport.format(argsNode);

        return withContext(databaseContext -> {
            String prefix = sitePrefix(databaseContext, siteId);
            StringBuilder sqlBuilder = new StringBuilder()
                    .append("SELECT t.term_id, t.name, t.slug, tt.taxonomy, tt.description, tt.count, tt.parent ")
                    .append("FROM ").append(table(prefix, "term_relationships")).append(" tr ")
                    .append("JOIN ").append(table(prefix, "term_taxonomy"))
                    .append(" tt ON tr.term_taxonomy_id = tt.term_taxonomy_id ")
                    .append("JOIN ").append(table(prefix, "terms")).append(" t ON tt.term_id = t.term_id ")
                    .append("WHERE tr.object_id = ?");
            List<Object> sqlParams = new ArrayList<>(List.of(postId));
            if (taxonomy != null) {
                sqlBuilder.append(" AND tt.taxonomy = ?");
                sqlParams.add(taxonomy);
            }
            sqlBuilder.append(" ORDER BY tt.taxonomy, t.name");

            QueryResult queryResult = query(sqlBuilder.toString(), sqlParams);

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("post_id", postId);
            envelope.put("terms", queryResult.rows());
            return ResultFormatter.format(outputFormat, queryResult.rows(), envelope);
        });
    }

    public ToolOutput getTermPosts(JsonNode argsNode) {
        long termId = ToolSupport.requiredId(argsNode, "term_id");
        String postType = ToolSupport.optionalString(argsNode, "post_type", 100);
        String postStatus = argsNode.has("post_status")
                ? ToolSupport.optionalString(argsNode, "post_status", 50) : QueryTools.DEFAULT_POST_STATUS;
        Integer siteId = ToolSupport.optionalSiteId(argsNode);
        int limit = ToolSupport.limit(argsNode, configParams.maxRows());
        OutputFormat outputFormat = ToolSupport.format(argsNode);

        return withContext(databaseContext -> {
            String prefix = sitePrefix(databaseContext, siteId);
            StringBuilder sqlBuilder = new StringBuilder()
                    .append("SELECT p.ID, p.post_title, p.post_type, p.post_status, p.post_date, p.post_author, ")
                    .append("tt.taxonomy ")
                    .append("FROM ").append(table(prefix, "terms")).append(" t ")
                    .append("JOIN ").append(table(prefix, "term_taxonomy")).append(" tt ON t.term_id = tt.term_id ")
                    .append("JOIN ").append(table(prefix, "term_relationships"))
                    .append(" tr ON tt.term_taxonomy_id = tr.term_taxonomy_id ")
                    .append("JOIN ").append(table(prefix, "posts")).append(" p ON tr.object_id = p.ID ")
                    .append("WHERE t.term_id = ?");
            List<Object> sqlParams = new ArrayList<>(List.of(termId));
            if (postType != null) {
                sqlBuilder.append(" AND p.post_type = ?");
                sqlParams.add(postType);
            }
            if (postStatus != null) {
                sqlBuilder.append(" AND p.post_status = ?");
                sqlParams.add(postStatus);
            }
            sqlBuilder.append(" ORDER BY p.post_date DESC");

            QueryResult queryResult = query(sqlBuilder.toString(), sqlParams, limit);

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("term_id", termId);
            envelope.put("posts", queryResult.rows());
            envelope.put("has_more", queryResult.hasMore());
            return ResultFormatter.format(outputFormat, queryResult.rows(), envelope);
        });
    }

    public ToolOutput listTaxonomies(JsonNode argsNode) {
        Integer siteId = ToolSupport.optionalSiteId(argsNode);
        OutputFormat outputFormat = ToolSupport.format(argsNode);

        return withContext(databaseContext -> {
            String sql = "SELECT taxonomy, COUNT(*) AS term_count, SUM(count) AS total_usage "
                    + "FROM " + table(sitePrefix(databaseContext, siteId), "term_taxonomy") + " "
                    + "GROUP BY taxonomy ORDER BY term_count DESC";
            QueryResult queryResult = query(sql, List.of());

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("taxonomies", queryResult.rows());
            return ResultFormatter.format(outputFormat, queryResult.rows(), envelope);
        });
    }
}
