package com.skanga.wpdb.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.wpdb.db.ExecutionError;
import com.skanga.wpdb.db.ValidationOutcome;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders tool results as pretty-printed JSON or CSV, and failures as {@code {"error", "code"}} documents.
 */
public final class ResultFormatter {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    static final String VALIDATION_REJECTED = "validation_rejected";

    private ResultFormatter() {
    }

    /**
     * Returns {@code rows} as CSV, or the JSON {@code envelope} when JSON was requested.
     */
    public static ToolOutput format(OutputFormat outputFormat, List<Map<String, Object>> rows, Object envelope) {
        if (outputFormat == OutputFormat.CSV) {
            return ToolOutput.ok(toCsv(rows));
        }
        return ToolOutput.ok(toJson(envelope));
    }

    public static String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * CSV with a header row taken from the first row's keys. No rows render as an empty string.
     */
    public static String toCsv(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return "";
        }
        List<String> header = new ArrayList<>(rows.get(0).keySet());
        StringWriter csvText = new StringWriter();
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(new String[0]))
                .build();
        try (CSVPrinter csvPrinter = new CSVPrinter(csvText, csvFormat)) {
            for (Map<String, Object> row : rows) {
                List<Object> values = new ArrayList<>(header.size());
                for (String column : header) {
                    values.add(row.get(column));
                }
                csvPrinter.printRecord(values);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return csvText.toString();
    }

    public static ToolOutput error(String message, String code) {
        ObjectNode errorNode = objectMapper.createObjectNode();
        errorNode.put("error", message);
        errorNode.put("code", code);
        return ToolOutput.error(errorNode.toString());
    }

    public static ToolOutput executionError(ExecutionError executionError) {
        return error(executionError.userMessage(), executionError.code().code());
    }

    public static ToolOutput validationError(ValidationOutcome outcome) {
        ObjectNode errorNode = objectMapper.createObjectNode();
        errorNode.put("error", outcome.message());
        errorNode.put("code", VALIDATION_REJECTED);
        errorNode.put("reason", outcome.reason().code());
        return ToolOutput.error(errorNode.toString());
    }
}
