package com.skanga.wpdb.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.wpdb.config.ResourceManager;
import com.skanga.wpdb.db.ConnectionPoolManager;
import com.skanga.wpdb.db.QueryExecutor;
import com.skanga.wpdb.db.QueryResult;
import com.skanga.wpdb.db.SitePrefixes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Catalog tools: table listing, table description, whole-schema dump and the relationship map.
 * All of them read {@code information_schema} with the database name bound as a parameter.
 */
public class SchemaTools extends WordPressTools {
    public static final String WP_LIST_TABLES = "wp_list_tables";
    public static final String WP_DESCRIBE_TABLE = "wp_describe_table";
    public static final String WP_GET_SCHEMA = "wp_get_schema";
    public static final String WP_GET_RELATIONSHIPS = "wp_get_relationships";

    static final int MAX_TABLE_NAME_LENGTH = 64;
    static final int SITE_TABLE_LIMIT = 500;
    static final int ALL_TABLE_LIMIT = 2000;
    static final int CATALOG_ROW_LIMIT = 10000;

    static final String TABLE_NAMES_SQL = "SELECT TABLE_NAME FROM information_schema.TABLES "
            + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME LIKE ? ORDER BY TABLE_NAME";
    static final String ALL_TABLE_NAMES_SQL = "SELECT TABLE_NAME FROM information_schema.TABLES "
            + "WHERE TABLE_SCHEMA = ?";

    public SchemaTools(ConnectionPoolManager poolManager, QueryExecutor queryExecutor) {
        super(poolManager, queryExecutor);
    }

    @Override
    public List<ObjectNode> definitions() {
        return List.of(
                ToolSupport.tool(WP_LIST_TABLES, "List WordPress Database Tables",
                                "List the tables of the WordPress database with engine, row count and size. "
                                        + "Defaults to the tables of the selected site prefix.")
                        .siteId()
                        .string("filter", "LIKE pattern on the table name, e.g. 'wp_woocommerce%'.", null, 100)
                        .build(),
                ToolSupport.tool(WP_DESCRIBE_TABLE, "Describe a WordPress Table",
                                "Show column definitions, keys and indexes for a table. Accepts a full table name "
                                        + "(e.g. 'wp_posts') or a suffix (e.g. 'posts') resolved with the site prefix.")
                        .string("table", "Table name or suffix.", 1, MAX_TABLE_NAME_LENGTH, true)
                        .siteId()
                        .format()
                        .build(),
                ToolSupport.tool(WP_GET_SCHEMA, "Generate Full WordPress Database Schema",
                                "Generate the schema of the site's tables: columns, indexes and known relationships. "
                                        + "Core tables only unless include_plugins is true.")
                        .siteId()
                        .bool("include_plugins", "Include plugin tables sharing the site prefix.", false)
                        .format()
                        .build(),
                ToolSupport.tool(WP_GET_RELATIONSHIPS, "Map WordPress Table Relationships",
                                "Map how WordPress posts, terms, users, comments and meta tables are related, "
                                        + "and list the multisite prefixes present in the database.")
                        .siteId()
                        .build());
    }

    public ToolOutput listTables(JsonNode argsNode) {
        Integer siteId = ToolSupport.optionalSiteId(argsNode);
        String tableFilter = ToolSupport.optionalString(argsNode, "filter", 100);

        return withContext(databaseContext -> {
            String prefix = sitePrefix(databaseContext, siteId);
            String sql = "SELECT TABLE_NAME, ENGINE, TABLE_ROWS, "
                    + "ROUND(DATA_LENGTH / 1024, 2) AS data_kb, "
                    + "ROUND(INDEX_LENGTH / 1024, 2) AS index_kb "
                    + "FROM information_schema.TABLES "
                    + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME LIKE ? "
                    + "ORDER BY TABLE_NAME";
            String namePattern = tableFilter != null ? tableFilter : prefix + "%";
            QueryResult queryResult = query(sql, List.of(databaseContext.dbName(), namePattern));
            return ToolOutput.ok(ResultFormatter.toJson(queryResult.rows()));
        });
    }

    public ToolOutput describeTable(JsonNode argsNode) {
        String tableArg = ToolSupport.requiredString(argsNode, "table", MAX_TABLE_NAME_LENGTH);
        Integer siteId = ToolSupport.optionalSiteId(argsNode);
        OutputFormat outputFormat = ToolSupport.format(argsNode);

        return withContext(databaseContext -> {
            String tableName = SitePrefixes.resolveTable(sitePrefix(databaseContext, siteId), tableArg);
            List<Object> sqlParams = List.of(databaseContext.dbName(), tableName);

            QueryResult columns = query("SELECT COLUMN_NAME, COLUMN_TYPE, IS_NULLABLE, COLUMN_KEY, "
                    + "COLUMN_DEFAULT, EXTRA FROM information_schema.COLUMNS "
                    + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? ORDER BY ORDINAL_POSITION", sqlParams);
            if (columns.isEmpty()) {
                return ResultFormatter.error(ResourceManager.getErrorMessage("tool.table.not.found", tableName),
                        TABLE_NOT_FOUND);
            }
            QueryResult indexes = query("SELECT INDEX_NAME, COLUMN_NAME, NON_UNIQUE, SEQ_IN_INDEX "
                    + "FROM information_schema.STATISTICS "
                    + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? ORDER BY INDEX_NAME, SEQ_IN_INDEX", sqlParams);

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("table", tableName);
            envelope.put("columns", columns.rows());
            envelope.put("indexes", indexes.rows());
            return ResultFormatter.format(outputFormat, columns.rows(), envelope);
        });
    }

    /**
     * Dumps columns and indexes of the site's tables with two batched catalog queries.
     */
    public ToolOutput getSchema(JsonNode argsNode) {
        Integer siteId = ToolSupport.optionalSiteId(argsNode);
        boolean includePlugins = ToolSupport.optionalBoolean(argsNode, "include_plugins", false);
        OutputFormat outputFormat = ToolSupport.format(argsNode);

        return withContext(databaseContext -> {
            String prefix = sitePrefix(databaseContext, siteId);
            List<String> tableNames = tableNames(query(TABLE_NAMES_SQL,
                    List.of(databaseContext.dbName(), prefix + "%"), SITE_TABLE_LIMIT));
            if (!includePlugins) {
                Set<String> coreTables = new HashSet<>();
                for (String suffix : WordPressRelationships.CORE_TABLE_SUFFIXES) {
                    coreTables.add(prefix + suffix);
                }
                tableNames.retainAll(coreTables);
            }

            Map<String, Map<String, List<Map<String, Object>>>> tables = new LinkedHashMap<>();
            for (String tableName : tableNames) {
                Map<String, List<Map<String, Object>>> tableEntry = new LinkedHashMap<>();
                tableEntry.put("columns", new ArrayList<>());
                tableEntry.put("indexes", new ArrayList<>());
                tables.put(tableName, tableEntry);
            }

            if (!tableNames.isEmpty()) {
                String placeholders = String.join(", ", Collections.nCopies(tableNames.size(), "?"));
                List<Object> sqlParams = new ArrayList<>();
                sqlParams.add(databaseContext.dbName());
                sqlParams.addAll(tableNames);

                QueryResult columns = query("SELECT TABLE_NAME, COLUMN_NAME, COLUMN_TYPE, IS_NULLABLE, COLUMN_KEY, "
                        + "COLUMN_DEFAULT, EXTRA FROM information_schema.COLUMNS "
                        + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME IN (" + placeholders + ") "
                        + "ORDER BY TABLE_NAME, ORDINAL_POSITION", sqlParams, CATALOG_ROW_LIMIT);
                QueryResult indexes = query("SELECT TABLE_NAME, INDEX_NAME, COLUMN_NAME, NON_UNIQUE "
                        + "FROM information_schema.STATISTICS "
                        + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME IN (" + placeholders + ") "
                        + "ORDER BY TABLE_NAME, INDEX_NAME, SEQ_IN_INDEX", sqlParams, CATALOG_ROW_LIMIT);
                groupByTable(columns.rows(), tables, "columns");
                groupByTable(indexes.rows(), tables, "indexes");
            }

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("database", databaseContext.dbName());
            envelope.put("prefix", prefix);
            envelope.put("table_count", tables.size());
            envelope.put("tables", tables);
            envelope.put("relationships", WordPressRelationships.build(prefix, tables.keySet()));

            if (outputFormat == OutputFormat.CSV) {
                List<Map<String, Object>> flatRows = new ArrayList<>();
                tables.forEach((tableName, tableEntry) -> {
                    for (Map<String, Object> column : tableEntry.get("columns")) {
                        Map<String, Object> flatRow = new LinkedHashMap<>();
                        flatRow.put("table", tableName);
                        flatRow.putAll(column);
                        flatRows.add(flatRow);
                    }
                });
                return ToolOutput.ok(ResultFormatter.toCsv(flatRows));
            }
            return ToolOutput.ok(ResultFormatter.toJson(envelope));
        });
    }

    public ToolOutput getRelationships(JsonNode argsNode) {
        Integer siteId = ToolSupport.optionalSiteId(argsNode);

        return withContext(databaseContext -> {
            String prefix = sitePrefix(databaseContext, siteId);
            List<String> siteTables = tableNames(query(TABLE_NAMES_SQL,
                    List.of(databaseContext.dbName(), prefix + "%"), SITE_TABLE_LIMIT));
            List<String> allTables = tableNames(query(ALL_TABLE_NAMES_SQL,
                    List.of(databaseContext.dbName()), ALL_TABLE_LIMIT));
            List<String> sitePrefixes = SitePrefixes.detectSitePrefixes(databaseContext.basePrefix(), allTables);

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("prefix", prefix);
            envelope.put("is_multisite", sitePrefixes.size() > 1);
            envelope.put("site_prefixes", sitePrefixes);
            envelope.put("relationships", WordPressRelationships.build(prefix, siteTables));
            return ToolOutput.ok(ResultFormatter.toJson(envelope));
        });
    }

    private static List<String> tableNames(QueryResult queryResult) {
        List<String> tableNames = new ArrayList<>(queryResult.rowCount());
        for (Map<String, Object> row : queryResult.rows()) {
            Object tableName = columnValue(row, "TABLE_NAME");
            if (tableName != null) {
                tableNames.add(tableName.toString());
            }
        }
        return tableNames;
    }

    /**
     * Appends catalog rows to their table's entry, dropping the {@code TABLE_NAME} column itself.
     */
    private static void groupByTable(List<Map<String, Object>> rows,
                                     Map<String, Map<String, List<Map<String, Object>>>> tables, String section) {
        for (Map<String, Object> row : rows) {
            Object tableName = columnValue(row, "TABLE_NAME");
            Map<String, List<Map<String, Object>>> tableEntry =
                    tableName == null ? null : tables.get(tableName.toString());
            if (tableEntry == null) {
                continue;
            }
            Map<String, Object> entryRow = new LinkedHashMap<>(row);
            entryRow.keySet().removeIf(key -> key.equalsIgnoreCase("TABLE_NAME"));
            tableEntry.get(section).add(entryRow);
        }
    }
}
