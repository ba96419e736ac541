package com.skanga.wpdb.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.wpdb.TestUtils;
import com.skanga.wpdb.db.ConnectionPoolManager;
import com.skanga.wpdb.db.DatabaseContext;
import com.skanga.wpdb.db.DatabaseNotInitializedException;
import com.skanga.wpdb.db.ErrorCode;
import com.skanga.wpdb.db.ExecutionError;
import com.skanga.wpdb.db.ExecutionOutcome;
import com.skanga.wpdb.db.QueryExecutor;
import com.skanga.wpdb.db.QueryResult;
import com.skanga.wpdb.db.ServerFlavor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Catalog tools against a mocked executor; the embedded test database has no MySQL catalog columns.
 */
@ExtendWith(MockitoExtension.class)
class SchemaToolsTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    ConnectionPoolManager poolManager;

    @Mock
    QueryExecutor queryExecutor;

    SchemaTools schemaTools;

    @BeforeEach
    void setUp() {
        lenient().when(poolManager.configParams()).thenReturn(TestUtils.testConfig(""));
        lenient().when(poolManager.context())
                .thenReturn(new DatabaseContext(null, "wp_", "wordpress", ServerFlavor.MYSQL));
        schemaTools = new SchemaTools(poolManager, queryExecutor);
    }

    private ObjectNode args() {
        return objectMapper.createObjectNode();
    }

    private JsonNode parse(ToolOutput toolOutput) throws Exception {
        assertFalse(toolOutput.isError(), toolOutput.text());
        return objectMapper.readTree(toolOutput.text());
    }

    private static Map<String, Object> row(Object... keysAndValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            row.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return row;
    }

    private static ExecutionOutcome rows(List<Map<String, Object>> rows) {
        List<String> columns = rows.isEmpty() ? List.of() : new ArrayList<>(rows.get(0).keySet());
        return ExecutionOutcome.success(new QueryResult(columns, rows, false, 1));
    }

    private static ExecutionOutcome tableNames(String... names) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String name : names) {
            rows.add(row("TABLE_NAME", name));
        }
        return rows(rows);
    }

    private void stubCatalog(String catalogTable, ExecutionOutcome outcome) {
        when(queryExecutor.execute(argThat(sql -> sql != null && sql.contains("information_schema." + catalogTable)
                && !sql.startsWith("SELECT TABLE_NAME FROM")), anyList(), anyInt())).thenReturn(outcome);
    }

    @Test
    void testListTables_DefaultsToSitePrefix() throws Exception {
        when(queryExecutor.execute(argThat(sql -> sql.contains("ENGINE")), eq(List.of("wordpress", "wp_2_%")),
                eq(TestUtils.TEST_MAX_ROWS)))
                .thenReturn(rows(List.of(row("TABLE_NAME", "wp_2_posts", "ENGINE", "InnoDB", "TABLE_ROWS", 12))));

        JsonNode tables = parse(schemaTools.listTables(args().put("site_id", 2)));

        assertTrue(tables.isArray());
        assertEquals("wp_2_posts", tables.get(0).get("TABLE_NAME").asText());
        assertEquals("InnoDB", tables.get(0).get("ENGINE").asText());
    }

    @Test
    void testListTables_FilterReplacesPrefixPattern() throws Exception {
        when(queryExecutor.execute(argThat(sql -> sql.contains("ENGINE")), eq(List.of("wordpress", "wp_wc_%")),
                anyInt())).thenReturn(rows(List.of()));

        JsonNode tables = parse(schemaTools.listTables(args().put("filter", "wp_wc_%")));

        assertEquals(0, tables.size());
    }

    @Test
    void testDescribeTable_SuffixResolvedWithPrefix() throws Exception {
        stubCatalog("COLUMNS", rows(List.of(
                row("COLUMN_NAME", "ID", "COLUMN_TYPE", "bigint(20) unsigned", "COLUMN_KEY", "PRI"),
                row("COLUMN_NAME", "post_title", "COLUMN_TYPE", "text", "COLUMN_KEY", ""))));
        stubCatalog("STATISTICS", rows(List.of(row("INDEX_NAME", "PRIMARY", "COLUMN_NAME", "ID", "NON_UNIQUE", 0))));

        JsonNode result = parse(schemaTools.describeTable(args().put("table", "posts")));

        assertEquals("wp_posts", result.get("table").asText());
        assertEquals(2, result.get("columns").size());
        assertEquals("PRIMARY", result.get("indexes").get(0).get("INDEX_NAME").asText());
        verify(queryExecutor).execute(argThat(sql -> sql.contains("information_schema.COLUMNS")),
                eq(List.of("wordpress", "wp_posts")), eq(TestUtils.TEST_MAX_ROWS));
    }

    @Test
    void testDescribeTable_FullNameKeptAndCsvIsColumns() {
        stubCatalog("COLUMNS", rows(List.of(row("COLUMN_NAME", "option_id", "COLUMN_TYPE", "bigint"))));
        stubCatalog("STATISTICS", rows(List.of()));

        ToolOutput toolOutput = schemaTools.describeTable(args().put("table", "wp_options").put("format", "csv"));

        assertEquals("COLUMN_NAME,COLUMN_TYPE\r\noption_id,bigint\r\n", toolOutput.text());
    }

    @Test
    void testDescribeTable_NotFound() throws Exception {
        stubCatalog("COLUMNS", rows(List.of()));

        ToolOutput toolOutput = schemaTools.describeTable(args().put("table", "nope").put("site_id", 4));

        assertTrue(toolOutput.isError());
        JsonNode error = objectMapper.readTree(toolOutput.text());
        assertEquals("table_not_found", error.get("code").asText());
        assertEquals("Table 'wp_4_nope' not found.", error.get("error").asText());
        verify(queryExecutor, never()).execute(argThat(sql -> sql.contains("STATISTICS")), anyList(), anyInt());
    }

    @Test
    void testDescribeTable_TableArgumentRequired() {
        assertThrows(IllegalArgumentException.class, () -> schemaTools.describeTable(args()));
        assertThrows(IllegalArgumentException.class,
                () -> schemaTools.describeTable(args().put("table", "t".repeat(65))));
    }

    @Test
    void testGetSchema_CoreTablesOnly() throws Exception {
        when(queryExecutor.execute(eq(SchemaTools.TABLE_NAMES_SQL), eq(List.of("wordpress", "wp_%")),
                eq(SchemaTools.SITE_TABLE_LIMIT)))
                .thenReturn(tableNames("wp_postmeta", "wp_posts", "wp_wc_orders"));
        stubCatalog("COLUMNS", rows(List.of(
                row("TABLE_NAME", "wp_postmeta", "COLUMN_NAME", "meta_id"),
                row("TABLE_NAME", "wp_posts", "COLUMN_NAME", "ID"),
                row("TABLE_NAME", "wp_posts", "COLUMN_NAME", "post_title"))));
        stubCatalog("STATISTICS", rows(List.of(row("TABLE_NAME", "wp_posts", "INDEX_NAME", "PRIMARY"))));

        JsonNode schema = parse(schemaTools.getSchema(args()));

        assertEquals("wordpress", schema.get("database").asText());
        assertEquals("wp_", schema.get("prefix").asText());
        assertEquals(2, schema.get("table_count").asInt());
        JsonNode posts = schema.get("tables").get("wp_posts");
        assertEquals(2, posts.get("columns").size());
        assertFalse(posts.get("columns").get(0).has("TABLE_NAME"));
        assertEquals("PRIMARY", posts.get("indexes").get(0).get("INDEX_NAME").asText());
        assertEquals(0, schema.get("tables").get("wp_postmeta").get("indexes").size());
        assertFalse(schema.get("tables").has("wp_wc_orders"));
        assertEquals("post_meta", schema.get("relationships").get(0).get("name").asText());

        verify(queryExecutor).execute(argThat(sql -> sql.contains("information_schema.COLUMNS")),
                eq(List.of("wordpress", "wp_postmeta", "wp_posts")), eq(SchemaTools.CATALOG_ROW_LIMIT));
    }

    @Test
    void testGetSchema_IncludePlugins() throws Exception {
        when(queryExecutor.execute(eq(SchemaTools.TABLE_NAMES_SQL), anyList(), anyInt()))
                .thenReturn(tableNames("wp_posts", "wp_wc_orders"));
        stubCatalog("COLUMNS", rows(List.of(row("TABLE_NAME", "wp_wc_orders", "COLUMN_NAME", "id"))));
        stubCatalog("STATISTICS", rows(List.of()));

        JsonNode schema = parse(schemaTools.getSchema(args().put("include_plugins", true)));

        assertEquals(2, schema.get("table_count").asInt());
        assertEquals(1, schema.get("tables").get("wp_wc_orders").get("columns").size());
    }

    @Test
    void testGetSchema_NoTablesSkipsCatalogQueries() throws Exception {
        when(queryExecutor.execute(eq(SchemaTools.TABLE_NAMES_SQL), eq(List.of("wordpress", "wp_5_%")), anyInt()))
                .thenReturn(tableNames());

        JsonNode schema = parse(schemaTools.getSchema(args().put("site_id", 5)));

        assertEquals(0, schema.get("table_count").asInt());
        assertEquals(0, schema.get("relationships").size());
        verify(queryExecutor, never()).execute(argThat(sql -> sql.contains("COLUMNS")), anyList(), anyInt());
    }

    @Test
    void testGetSchema_CsvFlattensColumns() {
        when(queryExecutor.execute(eq(SchemaTools.TABLE_NAMES_SQL), anyList(), anyInt()))
                .thenReturn(tableNames("wp_options", "wp_posts"));
        stubCatalog("COLUMNS", rows(List.of(
                row("TABLE_NAME", "wp_options", "COLUMN_NAME", "option_id"),
                row("TABLE_NAME", "wp_posts", "COLUMN_NAME", "ID"))));
        stubCatalog("STATISTICS", rows(List.of()));

        ToolOutput toolOutput = schemaTools.getSchema(args().put("format", "csv"));

        assertEquals("table,COLUMN_NAME\r\nwp_options,option_id\r\nwp_posts,ID\r\n", toolOutput.text());
    }

    @Test
    void testGetRelationships_Multisite() throws Exception {
        when(queryExecutor.execute(eq(SchemaTools.TABLE_NAMES_SQL), eq(List.of("wordpress", "wp_%")), anyInt()))
                .thenReturn(tableNames("wp_posts", "wp_postmeta"));
        when(queryExecutor.execute(eq(SchemaTools.ALL_TABLE_NAMES_SQL), eq(List.of("wordpress")),
                eq(SchemaTools.ALL_TABLE_LIMIT)))
                .thenReturn(tableNames("wp_posts", "wp_postmeta", "wp_3_posts", "wp_2_options", "wp_2_posts"));

        JsonNode result = parse(schemaTools.getRelationships(args()));

        assertEquals("wp_", result.get("prefix").asText());
        assertTrue(result.get("is_multisite").asBoolean());
        assertEquals("[\"wp_\",\"wp_2_\",\"wp_3_\"]", result.get("site_prefixes").toString());
        assertEquals(2, result.get("relationships").size());
    }

    @Test
    void testGetRelationships_SingleSite() throws Exception {
        when(queryExecutor.execute(eq(SchemaTools.TABLE_NAMES_SQL), anyList(), anyInt()))
                .thenReturn(tableNames("wp_posts"));
        when(queryExecutor.execute(eq(SchemaTools.ALL_TABLE_NAMES_SQL), anyList(), anyInt()))
                .thenReturn(tableNames("wp_posts", "other_table"));

        JsonNode result = parse(schemaTools.getRelationships(args()));

        assertFalse(result.get("is_multisite").asBoolean());
        assertEquals("[\"wp_\"]", result.get("site_prefixes").toString());
    }

    @Test
    void testCatalogFailureIsToolError() throws Exception {
        when(queryExecutor.execute(eq(SchemaTools.TABLE_NAMES_SQL), anyList(), anyInt()))
                .thenReturn(ExecutionOutcome.failure(new ExecutionError(ErrorCode.TIMEOUT,
                        "Query timed out after 5s.", "server detail")));

        ToolOutput toolOutput = schemaTools.getRelationships(args());

        assertTrue(toolOutput.isError());
        assertEquals("timeout", objectMapper.readTree(toolOutput.text()).get("code").asText());
    }

    @Test
    void testNotInitialized() throws Exception {
        when(poolManager.context()).thenThrow(new DatabaseNotInitializedException());

        ToolOutput toolOutput = schemaTools.getSchema(args());

        assertTrue(toolOutput.isError());
        assertEquals("not_initialized", objectMapper.readTree(toolOutput.text()).get("code").asText());
        verify(queryExecutor, never()).execute(argThat(sql -> true), anyList(), anyInt());
    }

    @Test
    void testDefinitions() {
        List<ObjectNode> definitions = schemaTools.definitions();

        assertEquals(4, definitions.size());
        assertFalse(definitions.get(0).at("/inputSchema/properties").has("format"));
        assertEquals("[\"table\"]", definitions.get(1).at("/inputSchema/required").toString());
        assertFalse(definitions.get(2).at("/inputSchema/properties/include_plugins/default").asBoolean());
    }
}
