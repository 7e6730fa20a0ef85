package com.jreinhal.insight.tools;

import java.util.Optional;

/**
 * The closed set of analytics tools. The wire name is what the interpreter emits and what
 * traces record.
 */
public enum ToolName {
    METRICS_TOP_CATEGORIES("metrics_top_categories"),
    RATING_DISTRIBUTION("rating_distribution"),
    SENTIMENT_SUMMARY("sentiment_summary"),
    COMPARE_CATEGORIES("compare_categories"),
    GENERAL_QUERY("general_query");

    private final String wireName;

    private ToolName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return this.wireName;
    }

    public static Optional<ToolName> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        for (ToolName tool : values()) {
            if (tool.wireName.equalsIgnoreCase(trimmed)) {
                return Optional.of(tool);
            }
        }
        return Optional.empty();
    }
}
