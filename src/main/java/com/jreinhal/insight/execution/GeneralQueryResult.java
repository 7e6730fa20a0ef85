package com.jreinhal.insight.execution;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answer to a {@code general_query}. Which fields are meaningful depends on the query type:
 * {@code categories} for list_categories, {@code aggregate} for summary_stats (no category)
 * and category_info (one category).
 */
public record GeneralQueryResult(String queryType, int categoryCount, List<String> categories,
                                 CategoryMetric aggregate) implements ToolResult {

    public GeneralQueryResult {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    @Override
    public String kind() {
        return "general_query";
    }

    @Override
    public Map<String, Object> summary() {
        LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("kind", this.kind());
        map.put("queryType", this.queryType);
        map.put("categoryCount", this.categoryCount);
        if (!this.categories.isEmpty()) {
            map.put("categories", this.categories);
        }
        if (this.aggregate != null) {
            map.put("aggregate", this.aggregate.toMap());
        }
        return map;
    }
}
