package com.skanga.wpdb.tools;

import com.skanga.wpdb.config.ResourceManager;

import java.util.Locale;

public enum OutputFormat {
    JSON,
    CSV;

    /**
     * Parses a {@code format} argument; null means JSON.
     *
     * @throws IllegalArgumentException for anything other than json or csv
     */
    public static OutputFormat fromArgument(String formatText) {
        if (formatText == null || formatText.isBlank()) {
            return JSON;
        }
        return switch (formatText.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "csv" -> CSV;
            default -> throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.format.invalid", formatText));
        };
    }
}
