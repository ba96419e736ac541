package com.skanga.wpdb.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliUtilsTest {
    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperties() {
        System.clearProperty("wp.max.rows");
        System.clearProperty("wp.db.name");
    }

    @Test
    void testParseArgs_LongAndShortForms() {
        Map<String, String> parsed = CliUtils.parseArgs(new String[]{
                "--db_host=db.example", "-u", "reader", "--max_rows", "50", "-x", "blog_", "stray"});

        assertEquals("db.example", parsed.get("DB_HOST"));
        assertEquals("reader", parsed.get("DB_USER"));
        assertEquals("50", parsed.get("MAX_ROWS"));
        assertEquals("blog_", parsed.get("TABLE_PREFIX"));
        assertEquals(4, parsed.size());
    }

    @Test
    void testParseArgs_FlagWithoutValue() {
        Map<String, String> parsed = CliUtils.parseArgs(new String[]{"--verbose", "--db_port=3307"});

        assertEquals("true", parsed.get("VERBOSE"));
        assertEquals("3307", parsed.get("DB_PORT"));
    }

    @Test
    void testParseArgs_UnknownShortOptionIgnored() {
        Map<String, String> parsed = CliUtils.parseArgs(new String[]{"-Z", "value"});

        assertTrue(parsed.isEmpty());
    }

    @Test
    void testGetConfigValue_Priority() {
        Map<String, String> cliArgs = new HashMap<>();
        Map<String, String> fileConfig = new HashMap<>();
        System.setProperty("wp.db.name", "from_property");

        assertEquals("from_property", CliUtils.getConfigValue("DB_NAME", "fallback", cliArgs, fileConfig));

        fileConfig.put("DB_NAME", "from_file");
        assertEquals("from_file", CliUtils.getConfigValue("DB_NAME", "fallback", cliArgs, fileConfig));

        cliArgs.put("DB_NAME", "from_cli");
        assertEquals("from_cli", CliUtils.getConfigValue("DB_NAME", "fallback", cliArgs, fileConfig));

        assertEquals("fallback", CliUtils.getConfigValue("NOT_A_REAL_KEY", "fallback", cliArgs, fileConfig));
    }

    @Test
    void testLoadConfigFile_CommentsQuotesAndBadLines() throws IOException {
        Path configFile = tempDir.resolve("wpdb.conf");
        Files.writeString(configFile, String.join("\n",
                "# WordPress database",
                "",
                "db_host = db.internal",
                "DB_PASSWORD=\"p@ss=word\"",
                "TABLE_PREFIX='blog_'",
                "not a setting",
                "=orphan"), StandardCharsets.UTF_8);

        Map<String, String> loaded = CliUtils.loadConfigFile(configFile.toString());

        assertEquals(3, loaded.size());
        assertEquals("db.internal", loaded.get("DB_HOST"));
        assertEquals("p@ss=word", loaded.get("DB_PASSWORD"));
        assertEquals("blog_", loaded.get("TABLE_PREFIX"));
    }

    @Test
    void testLoadConfiguration_FromFileAndCli() throws IOException {
        Path configFile = tempDir.resolve("wpdb.conf");
        Files.writeString(configFile, "DB_NAME=blog\nMAX_ROWS=200\nQUERY_TIMEOUT=15\n", StandardCharsets.UTF_8);

        ConfigParams config = CliUtils.loadConfiguration(new String[]{
                "--config_file=" + configFile, "--max_rows=75", "-u", "reader"});

        assertEquals("blog", config.dbName());
        assertEquals("reader", config.dbUser());
        assertEquals(75, config.maxRows());
        assertEquals(15, config.queryTimeoutSeconds());
        assertEquals(ConfigParams.DEFAULT_POOL_MAX_SIZE, config.poolMaxSize());
    }

    @Test
    void testLoadConfiguration_SystemPropertyUsedWhenNothingElseSet() throws IOException {
        System.setProperty("wp.max.rows", "33");

        ConfigParams config = CliUtils.loadConfiguration(new String[]{"--db_name=blog"});

        assertEquals(33, config.maxRows());
    }

    @Test
    void testLoadConfiguration_MissingFile() {
        IOException e = assertThrows(IOException.class, () -> CliUtils.loadConfiguration(
                new String[]{"--config_file=" + tempDir.resolve("missing.conf")}));
        assertTrue(e.getMessage().startsWith("Failed to load configuration file:"));
    }

    @Test
    void testLoadConfiguration_NonNumericValue() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CliUtils.loadConfiguration(new String[]{"--max_rows=lots"}));
        assertTrue(e.getMessage().contains("MAX_ROWS must be an integer, got 'lots'"));
    }

    @Test
    void testLoadConfiguration_InvalidRange() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CliUtils.loadConfiguration(new String[]{"--pool_min_size=9", "--pool_max_size=3"}));
        assertTrue(e.getMessage().startsWith("Invalid configuration:"));
    }

    @Test
    void testHandleHelpAndVersion() {
        assertTrue(CliUtils.handleHelpAndVersion(new String[]{"--version"}));
        assertTrue(CliUtils.handleHelpAndVersion(new String[]{"-h"}));
        assertFalse(CliUtils.handleHelpAndVersion(new String[]{"--db_host=localhost"}));
    }
}
