package com.jreinhal.insight.execution;

import java.util.LinkedHashMap;
import java.util.Map;

public record ComparisonResult(CategoryMetric first, CategoryMetric second,
                               RatingDistributionResult firstDistribution,
                               RatingDistributionResult secondDistribution) implements ToolResult {

    @Override
    public String kind() {
        return "comparison";
    }

    @Override
    public Map<String, Object> summary() {
        LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("kind", this.kind());
        map.put("first", this.first.toMap());
        map.put("second", this.second.toMap());
        map.put("firstCounts", new LinkedHashMap<Integer, Long>(this.firstDistribution.counts()));
        map.put("secondCounts", new LinkedHashMap<Integer, Long>(this.secondDistribution.counts()));
        return map;
    }
}
