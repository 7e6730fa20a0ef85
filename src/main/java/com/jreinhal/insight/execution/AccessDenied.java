package com.jreinhal.insight.execution;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Marker for a call that referenced a category outside the caller's scope at execution time,
 * for example after a grant was narrowed between validation and execution.
 */
public record AccessDenied(String category) implements ToolResult {

    @Override
    public String kind() {
        return "access_denied";
    }

    @Override
    public Map<String, Object> summary() {
        LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("kind", this.kind());
        map.put("category", this.category);
        return map;
    }
}
