package com.skanga.wpdb.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skanga.wpdb.db.ErrorCode;
import com.skanga.wpdb.db.ExecutionError;
import com.skanga.wpdb.db.SqlValidator;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultFormatterTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static Map<String, Object> row(Object id, Object title) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("ID", id);
        row.put("post_title", title);
        return row;
    }

    @Test
    void testToCsv_HeaderFromFirstRowAndQuoting() {
        String csv = ResultFormatter.toCsv(List.of(row(1, "Hello, world"), row(2, "Say \"hi\""), row(3, null)));

        assertEquals("ID,post_title\r\n"
                + "1,\"Hello, world\"\r\n"
                + "2,\"Say \"\"hi\"\"\"\r\n"
                + "3,\r\n", csv);
    }

    @Test
    void testToCsv_NoRows() {
        assertEquals("", ResultFormatter.toCsv(List.of()));
        assertEquals("", ResultFormatter.toCsv(null));
    }

    @Test
    void testFormat_JsonUsesEnvelope() throws Exception {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("row_count", 1);
        envelope.put("rows", List.of(row(7, "Post")));

        ToolOutput toolOutput = ResultFormatter.format(OutputFormat.JSON, List.of(row(7, "Post")), envelope);

        assertFalse(toolOutput.isError());
        JsonNode parsed = objectMapper.readTree(toolOutput.text());
        assertEquals(1, parsed.get("row_count").asInt());
        assertEquals("Post", parsed.get("rows").get(0).get("post_title").asText());
        assertTrue(toolOutput.text().contains("\n"), "JSON output is pretty printed");
    }

    @Test
    void testFormat_CsvUsesRowsOnly() {
        ToolOutput toolOutput = ResultFormatter.format(OutputFormat.CSV, List.of(row(7, "Post")), Map.of("x", 1));

        assertEquals("ID,post_title\r\n7,Post\r\n", toolOutput.text());
    }

    @Test
    void testExecutionError() throws Exception {
        ToolOutput toolOutput = ResultFormatter.executionError(
                new ExecutionError(ErrorCode.TIMEOUT, "Query timed out after 30s.", "driver detail"));

        assertTrue(toolOutput.isError());
        JsonNode parsed = objectMapper.readTree(toolOutput.text());
        assertEquals("Query timed out after 30s.", parsed.get("error").asText());
        assertEquals("timeout", parsed.get("code").asText());
        assertFalse(toolOutput.text().contains("driver detail"));
    }

    @Test
    void testValidationError() throws Exception {
        ToolOutput toolOutput = ResultFormatter.validationError(SqlValidator.validate("DELETE FROM wp_posts"));

        assertTrue(toolOutput.isError());
        JsonNode parsed = objectMapper.readTree(toolOutput.text());
        assertEquals("validation_rejected", parsed.get("code").asText());
        assertEquals("disallowed-verb", parsed.get("reason").asText());
    }
}
