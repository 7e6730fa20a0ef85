package com.jreinhal.insight.execution;

import java.util.Map;

/**
 * Typed outcome of one tool execution. Implementations are fully populated or not produced at all.
 */
public interface ToolResult {

    String kind();

    /**
     * Compact, trace-friendly view of the result. Aggregates only, never review text.
     */
    Map<String, Object> summary();
}
