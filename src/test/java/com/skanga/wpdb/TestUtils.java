package com.skanga.wpdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.wpdb.config.ConfigParams;
import com.skanga.wpdb.db.ConnectionPoolManager;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test utilities: H2 databases in MySQL mode holding a small WordPress installation.
 */
public class TestUtils {
    private static final AtomicInteger dbCounter = new AtomicInteger(0);

    public static final int TEST_MAX_ROWS = 50;

    /**
     * A unique in-memory H2 URL. Identifiers fold to lower case and text compares case-insensitively,
     * as with MySQL defaults.
     */
    public static String uniqueH2Url() {
        return "jdbc:h2:mem:wpdb" + dbCounter.incrementAndGet()
                + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;IGNORECASE=TRUE;DB_CLOSE_DELAY=-1";
    }

    /**
     * Configuration with small limits. An empty prefix means auto-detect.
     */
    public static ConfigParams testConfig(String tablePrefix) {
        return new ConfigParams("localhost", 3306, "", "sa", "", "wordpress", tablePrefix,
                TEST_MAX_ROWS, 5, 0, 4, 5, 5000);
    }

    /**
     * Pool manager that builds its pool against an H2 URL instead of MariaDB.
     */
    public static class H2PoolManager extends ConnectionPoolManager {
        private final String h2Url;

        public H2PoolManager(ConfigParams configParams, String h2Url) {
            super(configParams);
            this.h2Url = h2Url;
        }

        @Override
        protected HikariDataSource createDataSource(HikariConfig poolConfig) {
            poolConfig.setJdbcUrl(h2Url);
            poolConfig.setUsername("sa");
            poolConfig.setPassword("");
            // MariaDB driver properties mean nothing to H2
            poolConfig.setDataSourceProperties(new Properties());
            return new HikariDataSource(poolConfig);
        }
    }

    public static void execute(String h2Url, String... sqlStatements) throws SQLException {
        try (Connection conn = DriverManager.getConnection(h2Url, "sa", "");
             Statement stmt = conn.createStatement()) {
            for (String sql : sqlStatements) {
                stmt.execute(sql);
            }
        }
    }

    /**
     * Creates the core WordPress tables for one site prefix. Column types are simplified for H2.
     */
    public static void createWordPressTables(String h2Url, String prefix) throws SQLException {
        execute(h2Url,
                "CREATE TABLE " + prefix + "options (option_id BIGINT PRIMARY KEY, option_name VARCHAR(191), "
                        + "option_value VARCHAR(2000), autoload VARCHAR(20))",
                "CREATE TABLE " + prefix + "posts (ID BIGINT PRIMARY KEY, post_author BIGINT, post_date DATETIME, "
                        + "post_content VARCHAR(4000), post_title VARCHAR(500), post_status VARCHAR(20), "
                        + "post_parent BIGINT DEFAULT 0, post_type VARCHAR(20))",
                "CREATE TABLE " + prefix + "postmeta (meta_id BIGINT PRIMARY KEY, post_id BIGINT, "
                        + "meta_key VARCHAR(255), meta_value VARCHAR(2000))",
                "CREATE TABLE " + prefix + "comments (comment_ID BIGINT PRIMARY KEY, comment_post_ID BIGINT, "
                        + "comment_content VARCHAR(2000), comment_parent BIGINT DEFAULT 0)",
                "CREATE TABLE " + prefix + "commentmeta (meta_id BIGINT PRIMARY KEY, comment_id BIGINT, "
                        + "meta_key VARCHAR(255), meta_value VARCHAR(2000))",
                "CREATE TABLE " + prefix + "terms (term_id BIGINT PRIMARY KEY, name VARCHAR(200), slug VARCHAR(200))",
                "CREATE TABLE " + prefix + "term_taxonomy (term_taxonomy_id BIGINT PRIMARY KEY, term_id BIGINT, "
                        + "taxonomy VARCHAR(32), description VARCHAR(2000), parent BIGINT DEFAULT 0, "
                        + "count BIGINT DEFAULT 0)",
                "CREATE TABLE " + prefix + "term_relationships (object_id BIGINT, term_taxonomy_id BIGINT, "
                        + "PRIMARY KEY (object_id, term_taxonomy_id))");
    }

    /**
     * Creates the network-wide user tables, which only exist under the base prefix.
     */
    public static void createUserTables(String h2Url, String prefix) throws SQLException {
        execute(h2Url,
                "CREATE TABLE " + prefix + "users (ID BIGINT PRIMARY KEY, user_login VARCHAR(60))",
                "CREATE TABLE " + prefix + "usermeta (umeta_id BIGINT PRIMARY KEY, user_id BIGINT, "
                        + "meta_key VARCHAR(255), meta_value VARCHAR(2000))");
    }

    /**
     * A single-site installation with posts, a page, terms, meta and a comment.
     */
    public static void seedWordPress(String h2Url, String prefix) throws SQLException {
        createWordPressTables(h2Url, prefix);
        createUserTables(h2Url, prefix);
        execute(h2Url,
                "INSERT INTO " + prefix + "options VALUES (1, 'siteurl', 'https://example.test', 'yes')",
                "INSERT INTO " + prefix + "users VALUES (1, 'admin')",
                "INSERT INTO " + prefix + "usermeta VALUES (1, 1, 'wp_capabilities', 'a:1:{s:13:\"administrator\";b:1;}')",
                "INSERT INTO " + prefix + "usermeta VALUES (2, 1, 'nickname', 'admin')",
                "INSERT INTO " + prefix + "usermeta VALUES (3, 1, 'wp_user_level', '10')",
                "INSERT INTO " + prefix + "posts VALUES (1, 1, '2024-01-05 10:00:00', 'Welcome to WordPress.', "
                        + "'Hello world!', 'publish', 0, 'post')",
                "INSERT INTO " + prefix + "posts VALUES (2, 1, '2024-02-10 09:30:00', 'Sale: 100% off_today', "
                        + "'Big sale', 'publish', 0, 'post')",
                "INSERT INTO " + prefix + "posts VALUES (3, 1, '2024-03-01 08:00:00', 'About this site', "
                        + "'About', 'publish', 0, 'page')",
                "INSERT INTO " + prefix + "posts VALUES (4, 1, '2024-03-15 12:00:00', 'Unfinished hello', "
                        + "'Draft hello', 'draft', 0, 'post')",
                "INSERT INTO " + prefix + "postmeta VALUES (1, 1, '_edit_lock', '1704448800:1')",
                "INSERT INTO " + prefix + "postmeta VALUES (2, 1, '_thumbnail_id', '42')",
                "INSERT INTO " + prefix + "postmeta VALUES (3, 2, '_price', '0')",
                "INSERT INTO " + prefix + "comments VALUES (1, 1, 'Nice post', 0)",
                "INSERT INTO " + prefix + "commentmeta VALUES (1, 1, 'rating', '5')",
                "INSERT INTO " + prefix + "terms VALUES (1, 'Uncategorized', 'uncategorized')",
                "INSERT INTO " + prefix + "terms VALUES (2, 'News', 'news')",
                "INSERT INTO " + prefix + "terms VALUES (3, 'featured', 'featured')",
                "INSERT INTO " + prefix + "term_taxonomy VALUES (1, 1, 'category', '', 0, 1)",
                "INSERT INTO " + prefix + "term_taxonomy VALUES (2, 2, 'category', 'Company news', 0, 2)",
                "INSERT INTO " + prefix + "term_taxonomy VALUES (3, 3, 'post_tag', '', 0, 1)",
                "INSERT INTO " + prefix + "term_relationships VALUES (1, 2)",
                "INSERT INTO " + prefix + "term_relationships VALUES (1, 3)",
                "INSERT INTO " + prefix + "term_relationships VALUES (2, 2)",
                "INSERT INTO " + prefix + "term_relationships VALUES (4, 2)",
                "INSERT INTO " + prefix + "term_relationships VALUES (3, 1)");
    }

    /**
     * Runs the initialize handshake so tool calls are accepted.
     */
    public static void initializeServer(McpServer mcpServer, ObjectMapper objectMapper) {
        ObjectNode initRequest = objectMapper.createObjectNode();
        initRequest.put("jsonrpc", "2.0");
        initRequest.put("id", 1);
        initRequest.put("method", "initialize");
        ObjectNode initParams = initRequest.putObject("params");
        initParams.put("protocolVersion", McpServer.DEFAULT_PROTOCOL_VERSION);
        initParams.putObject("capabilities");
        initParams.putObject("clientInfo").put("name", "test-client");

        JsonNode initResponse = mcpServer.handleRequest(initRequest);
        assertNotNull(initResponse);
        assertTrue(initResponse.has("result"), () -> "initialize failed: " + initResponse);

        ObjectNode initializedNotification = objectMapper.createObjectNode();
        initializedNotification.put("jsonrpc", "2.0");
        initializedNotification.put("method", "notifications/initialized");
        assertNull(mcpServer.handleRequest(initializedNotification));
    }

    public static ObjectNode createToolCallRequest(String toolName, ObjectNode arguments, ObjectMapper objectMapper) {
        ObjectNode callRequest = objectMapper.createObjectNode();
        callRequest.put("jsonrpc", "2.0");
        callRequest.put("id", 2);
        callRequest.put("method", "tools/call");
        ObjectNode callParams = callRequest.putObject("params");
        callParams.put("name", toolName);
        callParams.set("arguments", arguments);
        return callRequest;
    }
}
