package com.jreinhal.insight.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Star counts for one category. {@code counts} always has keys 1 through 5.
 */
public record RatingDistributionResult(String category, Map<Integer, Long> counts, long total, double avgRating) implements ToolResult {

    public RatingDistributionResult {
        counts = Collections.unmodifiableMap(new TreeMap<Integer, Long>(counts));
    }

    @Override
    public String kind() {
        return "rating_distribution";
    }

    @Override
    public Map<String, Object> summary() {
        LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("kind", this.kind());
        map.put("category", this.category);
        map.put("counts", new LinkedHashMap<Integer, Long>(this.counts));
        map.put("total", this.total);
        map.put("avgRating", this.avgRating);
        return map;
    }
}
