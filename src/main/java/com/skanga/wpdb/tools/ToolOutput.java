package com.skanga.wpdb.tools;

/**
 * Text produced by a tool call, flagged when it describes a failure.
 *
 * @param text JSON or CSV body returned to the client
 * @param isError true when {@code text} is an error document
 */
public record ToolOutput(String text, boolean isError) {
    public static ToolOutput ok(String text) {
        return new ToolOutput(text, false);
    }

    public static ToolOutput error(String text) {
        return new ToolOutput(text, true);
    }
}
