package com.jreinhal.insight.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentiment split over a bounded sample of one category's reviews. Reviews without a cached
 * label are counted under {@code unlabeled}.
 */
public record SentimentSummaryResult(String category, int reviewsConsidered, Map<String, Long> sentimentCounts,
                                     List<ReasonCount> topReasons) implements ToolResult {

    public static final String UNLABELED = "unlabeled";

    public SentimentSummaryResult {
        sentimentCounts = Collections.unmodifiableMap(new LinkedHashMap<String, Long>(sentimentCounts));
        topReasons = List.copyOf(topReasons);
    }

    public long labelledCount() {
        return this.reviewsConsidered - this.sentimentCounts.getOrDefault(UNLABELED, 0L);
    }

    @Override
    public String kind() {
        return "sentiment_summary";
    }

    @Override
    public Map<String, Object> summary() {
        LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("kind", this.kind());
        map.put("category", this.category);
        map.put("reviewsConsidered", this.reviewsConsidered);
        map.put("sentimentCounts", new LinkedHashMap<String, Long>(this.sentimentCounts));
        ArrayList<Map<String, Object>> reasons = new ArrayList<Map<String, Object>>();
        for (ReasonCount reason : this.topReasons) {
            reasons.add(Map.of("reason", reason.reason(), "count", reason.count()));
        }
        map.put("topReasons", reasons);
        return map;
    }

    public record ReasonCount(String reason, long count) {
    }
}
