package com.jreinhal.insight.execution;

import com.jreinhal.insight.tools.ToolParameters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pure aggregate math over star histograms.
 *
 * <p>NPS is the share of promoters (4-5 stars) minus the share of detractors (1-2 stars),
 * times 100. Nothing is rounded here.</p>
 */
public final class MetricsCalculator {

    private MetricsCalculator() {
    }

    public static CategoryMetric fromCounts(String category, Map<Integer, Long> counts) {
        long total = 0L;
        long starSum = 0L;
        long promoters = 0L;
        long detractors = 0L;
        for (Map.Entry<Integer, Long> entry : counts.entrySet()) {
            int stars = entry.getKey();
            long count = entry.getValue() == null ? 0L : entry.getValue();
            total += count;
            starSum += stars * count;
            if (stars >= 4) {
                promoters += count;
            } else if (stars <= 2) {
                detractors += count;
            }
        }
        if (total == 0L) {
            return new CategoryMetric(category, 0L, 0.0, 0.0);
        }
        double avg = (double) starSum / (double) total;
        double nps = ((double) promoters - (double) detractors) / (double) total * 100.0;
        return new CategoryMetric(category, total, avg, nps);
    }

    /**
     * Merges several histograms into one aggregate with no category name.
     */
    public static CategoryMetric aggregate(Collection<Map<Integer, Long>> histograms) {
        return fromCounts(null, merge(histograms));
    }

    public static Map<Integer, Long> merge(Collection<Map<Integer, Long>> histograms) {
        TreeMap<Integer, Long> merged = new TreeMap<Integer, Long>();
        for (Map<Integer, Long> histogram : histograms) {
            for (Map.Entry<Integer, Long> entry : histogram.entrySet()) {
                merged.merge(entry.getKey(), entry.getValue(), Long::sum);
            }
        }
        return merged;
    }

    /**
     * Histogram with every star value 1-5 present.
     */
    public static Map<Integer, Long> fullHistogram(Map<Integer, Long> counts) {
        TreeMap<Integer, Long> full = new TreeMap<Integer, Long>();
        for (int stars = 1; stars <= 5; ++stars) {
            full.put(stars, counts == null ? 0L : counts.getOrDefault(stars, 0L));
        }
        return full;
    }

    /**
     * Orders by the metric (descending for top, ascending for bottom), ties by category name
     * ascending, and keeps the first {@code topN}.
     */
    public static List<CategoryMetric> rank(Collection<CategoryMetric> metrics, String metric, String order, int topN) {
        Comparator<CategoryMetric> byMetric = Comparator.comparingDouble(m -> m.valueOf(metric));
        if (!ToolParameters.ORDER_BOTTOM.equals(order)) {
            byMetric = byMetric.reversed();
        }
        Comparator<CategoryMetric> ordering = byMetric.thenComparing(CategoryMetric::category, Comparator.nullsLast(Comparator.naturalOrder()));
        ArrayList<CategoryMetric> sorted = new ArrayList<CategoryMetric>(metrics);
        sorted.sort(ordering);
        return sorted.size() > topN ? new ArrayList<CategoryMetric>(sorted.subList(0, Math.max(0, topN))) : sorted;
    }
}
