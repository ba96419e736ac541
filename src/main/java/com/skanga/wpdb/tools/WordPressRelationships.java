package com.skanga.wpdb.tools;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The known relationships between WordPress core tables, limited to the tables that exist for a prefix.
 */
public final class WordPressRelationships {
    public static final List<String> CORE_TABLE_SUFFIXES = List.of(
            "posts", "postmeta", "comments", "commentmeta", "terms", "termmeta",
            "term_taxonomy", "term_relationships", "options", "users", "usermeta", "links");

    private final String prefix;
    private final Set<String> tableNames;
    private final List<Map<String, Object>> relationships = new ArrayList<>();

    private WordPressRelationships(String prefix, Collection<String> tableNames) {
        this.prefix = prefix;
        this.tableNames = new HashSet<>(tableNames);
    }

    /**
     * Lists the relationships whose tables are all present.
     *
     * @param prefix Site prefix, e.g. {@code wp_} or {@code wp_2_}
     * @param tableNames Physical table names found in the catalog
     * @return Relationship descriptions in a stable order
     */
    public static List<Map<String, Object>> build(String prefix, Collection<String> tableNames) {
        WordPressRelationships builder = new WordPressRelationships(prefix, tableNames);
        builder.collect();
        return builder.relationships;
    }

    private void collect() {
        if (has("posts") && has("postmeta")) {
            link("post_meta", "one_to_many", "posts", "ID", "postmeta", "post_id",
                    "Each post has zero or more meta key-value pairs.");
        }
        if (has("posts") && has("term_relationships")) {
            Map<String, Object> relationship = named("post_term_relationships", "many_to_many");
            relationship.put("from", endpoint("posts", "ID"));
            Map<String, Object> through = new LinkedHashMap<>();
            through.put("table", prefix + "term_relationships");
            through.put("columns", List.of("object_id", "term_taxonomy_id"));
            relationship.put("through", through);
            relationship.put("to", endpoint("term_taxonomy", "term_taxonomy_id"));
            relationship.put("description", "Posts are linked to term_taxonomy entries via term_relationships. "
                    + "object_id = post ID.");
            relationships.add(relationship);
        }
        if (has("term_taxonomy") && has("terms")) {
            link("taxonomy_term", "many_to_one", "term_taxonomy", "term_id", "terms", "term_id",
                    "Each term_taxonomy row references a term. term_taxonomy adds taxonomy type and hierarchy.");
        }
        if (has("term_taxonomy")) {
            selfReference("taxonomy_hierarchy", "term_taxonomy", "parent", "term_taxonomy_id (via term_id lookup)",
                    "Hierarchical taxonomies use parent field to reference parent term_taxonomy_id.");
        }
        if (has("terms") && has("termmeta")) {
            link("term_meta", "one_to_many", "terms", "term_id", "termmeta", "term_id",
                    "Each term can have meta key-value pairs.");
        }
        if (has("posts") && has("comments")) {
            link("post_comments", "one_to_many", "posts", "ID", "comments", "comment_post_ID",
                    "Each post has zero or more comments.");
        }
        if (has("comments") && has("commentmeta")) {
            link("comment_meta", "one_to_many", "comments", "comment_ID", "commentmeta", "comment_id",
                    "Each comment can have meta key-value pairs.");
        }
        if (has("comments")) {
            selfReference("comment_hierarchy", "comments", "comment_parent", "comment_ID",
                    "Threaded comments reference parent via comment_parent.");
        }
        if (has("users") && has("usermeta")) {
            link("user_meta", "one_to_many", "users", "ID", "usermeta", "user_id",
                    "Each user has meta key-value pairs (roles, capabilities, etc.).");
        }
        if (has("users") && has("posts")) {
            link("post_author", "many_to_one", "posts", "post_author", "users", "ID",
                    "Each post has one author (user).");
        }
        if (has("posts")) {
            selfReference("post_hierarchy", "posts", "post_parent", "ID",
                    "Pages and revisions reference parent posts via post_parent.");
        }
    }

    private boolean has(String suffix) {
        return tableNames.contains(prefix + suffix);
    }

    private void link(String name, String type, String fromSuffix, String fromColumn,
                      String toSuffix, String toColumn, String description) {
        Map<String, Object> relationship = named(name, type);
        relationship.put("from", endpoint(fromSuffix, fromColumn));
        relationship.put("to", endpoint(toSuffix, toColumn));
        relationship.put("description", description);
        relationships.add(relationship);
    }

    private void selfReference(String name, String suffix, String column, String references, String description) {
        Map<String, Object> relationship = named(name, "self_referential");
        relationship.put("table", prefix + suffix);
        relationship.put("column", column);
        relationship.put("references", references);
        relationship.put("description", description);
        relationships.add(relationship);
    }

    private static Map<String, Object> named(String name, String type) {
        Map<String, Object> relationship = new LinkedHashMap<>();
        relationship.put("name", name);
        relationship.put("type", type);
        return relationship;
    }

    private Map<String, Object> endpoint(String suffix, String column) {
        Map<String, Object> endpoint = new LinkedHashMap<>();
        endpoint.put("table", prefix + suffix);
        endpoint.put("column", column);
        return endpoint;
    }
}
