package com.jreinhal.insight.execution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CategoryMetricsResult(String metric, String order, int topN, List<CategoryMetric> rows) implements ToolResult {

    public CategoryMetricsResult {
        rows = List.copyOf(rows);
    }

    @Override
    public String kind() {
        return "category_metrics";
    }

    @Override
    public Map<String, Object> summary() {
        LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("kind", this.kind());
        map.put("metric", this.metric);
        map.put("order", this.order);
        map.put("topN", this.topN);
        ArrayList<Map<String, Object>> ranked = new ArrayList<Map<String, Object>>();
        for (CategoryMetric row : this.rows) {
            ranked.add(row.toMap());
        }
        map.put("rows", ranked);
        return map;
    }
}
