package com.jreinhal.insight.execution;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregates for one category. Values are unrounded; rounding happens at display time.
 */
public record CategoryMetric(String category, long reviewCount, double avgRating, double nps) {

    public double valueOf(String metric) {
        return switch (metric) {
            case "avg_rating" -> this.avgRating;
            case "nps" -> this.nps;
            default -> (double) this.reviewCount;
        };
    }

    Map<String, Object> toMap() {
        LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
        if (this.category != null) {
            map.put("category", this.category);
        }
        map.put("reviewCount", this.reviewCount);
        map.put("avgRating", this.avgRating);
        map.put("nps", this.nps);
        return map;
    }
}
