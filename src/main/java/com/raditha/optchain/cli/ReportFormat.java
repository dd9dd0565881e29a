package com.raditha.optchain.cli;

import java.util.Locale;

/**
 * Output formats of the optchain CLI.
 */
public enum ReportFormat {
    /**
     * Human readable report, one block per diagnostic.
     */
    TEXT,

    /**
     * One JSON document covering every input file.
     */
    JSON;

    /**
     * Convert a string value to ReportFormat enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding ReportFormat
     * @throws IllegalArgumentException if the value is not a valid format
     */
    public static ReportFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ReportFormat value cannot be null");
        }

        return switch (value.toLowerCase(Locale.ROOT)) {
            case "text" -> TEXT;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException(
                    "Invalid report format: " + value + ". Must be: text or json");
        };
    }

    public String toCliString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
