package com.jreinhal.insight.synthesis;

import com.jreinhal.insight.execution.AccessDenied;
import com.jreinhal.insight.execution.CategoryMetric;
import com.jreinhal.insight.execution.CategoryMetricsResult;
import com.jreinhal.insight.execution.ComparisonResult;
import com.jreinhal.insight.execution.GeneralQueryResult;
import com.jreinhal.insight.execution.NoData;
import com.jreinhal.insight.execution.RatingDistributionResult;
import com.jreinhal.insight.execution.SentimentSummaryResult;
import com.jreinhal.insight.execution.ToolResult;
import com.jreinhal.insight.tools.ToolCall;
import com.jreinhal.insight.tools.ToolParameters;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Deterministic, template-based replies. Rounding happens here and nowhere else.
 */
@Component
public class TemplateResponseSynthesizer
implements ResponseSynthesizer {

    @Override
    public String synthesize(SynthesisRequest request) {
        StringBuilder sb = new StringBuilder();
        ToolCall call = request.call();
        if (call != null && call.fallback()) {
            sb.append("Note: ");
            sb.append(call.rationale() != null ? call.rationale() : "Your request was answered with a substitute analysis.");
            if (call.rejectionReason() != null) {
                sb.append(" (reason: ").append(call.rejectionReason().code()).append(")");
            }
            sb.append("\n\n");
        }
        ToolResult result = request.result();
        if (result instanceof CategoryMetricsResult metrics) {
            this.renderMetrics(sb, metrics);
        } else if (result instanceof RatingDistributionResult distribution) {
            this.renderDistribution(sb, distribution);
        } else if (result instanceof ComparisonResult comparison) {
            this.renderComparison(sb, comparison);
        } else if (result instanceof SentimentSummaryResult sentiment) {
            this.renderSentiment(sb, sentiment);
        } else if (result instanceof GeneralQueryResult general) {
            this.renderGeneral(sb, general);
        } else if (result instanceof NoData noData) {
            sb.append("No data available: ").append(noData.detail()).append('.');
        } else if (result instanceof AccessDenied) {
            sb.append("You do not have access to that category.");
        } else {
            sb.append("No result.");
        }
        return sb.toString().trim();
    }

    private void renderMetrics(StringBuilder sb, CategoryMetricsResult result) {
        String direction = ToolParameters.ORDER_BOTTOM.equals(result.order()) ? "Bottom" : "Top";
        sb.append(direction).append(' ').append(result.rows().size()).append(result.rows().size() == 1 ? " category" : " categories")
                .append(" by ").append(metricLabel(result.metric())).append(":\n");
        int rank = 1;
        for (CategoryMetric row : result.rows()) {
            sb.append(rank++).append(". ").append(row.category()).append(": ").append(describe(row)).append('\n');
        }
    }

    private void renderDistribution(StringBuilder sb, RatingDistributionResult result) {
        sb.append("Rating distribution for ").append(result.category()).append(" (").append(result.total()).append(" reviews, average ")
                .append(formatRating(result.avgRating())).append("):\n");
        for (int stars = 5; stars >= 1; --stars) {
            long count = result.counts().getOrDefault(stars, 0L);
            sb.append(stars).append(stars == 1 ? " star: " : " stars: ").append(count)
                    .append(" (").append(formatPercent(count, result.total())).append(")\n");
        }
    }

    private void renderComparison(StringBuilder sb, ComparisonResult result) {
        sb.append("Comparison of ").append(result.first().category()).append(" and ").append(result.second().category()).append(":\n");
        sb.append("- ").append(result.first().category()).append(": ").append(describe(result.first())).append('\n');
        sb.append("- ").append(result.second().category()).append(": ").append(describe(result.second())).append('\n');
        double ratingGap = result.first().avgRating() - result.second().avgRating();
        String gap = formatRating(Math.abs(ratingGap));
        if (gap.equals(formatRating(0.0))) {
            sb.append("Both categories have the same average rating of ").append(formatRating(result.first().avgRating())).append(" stars.");
            return;
        }
        String leader = ratingGap > 0.0 ? result.first().category() : result.second().category();
        sb.append(leader).append(" has the higher average rating by ").append(gap).append(" stars.");
    }

    private void renderSentiment(StringBuilder sb, SentimentSummaryResult result) {
        Map<String, Long> counts = result.sentimentCounts();
        sb.append("Sentiment for ").append(result.category()).append(" across ").append(result.reviewsConsidered()).append(" reviews: ");
        sb.append("positive ").append(counts.getOrDefault("positive", 0L))
                .append(", negative ").append(counts.getOrDefault("negative", 0L))
                .append(", neutral ").append(counts.getOrDefault("neutral", 0L));
        long unlabeled = counts.getOrDefault(SentimentSummaryResult.UNLABELED, 0L);
        if (unlabeled > 0L) {
            sb.append(", not yet labelled ").append(unlabeled);
        }
        sb.append(".\n");
        if (result.labelledCount() == 0L) {
            sb.append("No sentiment labels exist for these reviews yet; an administrator can run the sentiment backfill.");
            return;
        }
        if (!result.topReasons().isEmpty()) {
            sb.append("Most mentioned reasons:\n");
            for (SentimentSummaryResult.ReasonCount reason : result.topReasons()) {
                sb.append("- ").append(reason.reason()).append(" (").append(reason.count()).append(")\n");
            }
        }
    }

    private void renderGeneral(StringBuilder sb, GeneralQueryResult result) {
        switch (result.queryType()) {
            case ToolParameters.QUERY_COUNT_CATEGORIES -> sb.append("You can view ").append(result.categoryCount())
                    .append(result.categoryCount() == 1 ? " category." : " categories.");
            case ToolParameters.QUERY_LIST_CATEGORIES -> sb.append("Categories you can view (").append(result.categoryCount()).append("): ")
                    .append(String.join(", ", result.categories())).append('.');
            case ToolParameters.QUERY_CATEGORY_INFO -> sb.append(result.aggregate().category()).append(": ").append(describe(result.aggregate())).append('.');
            default -> sb.append("Across ").append(result.categoryCount()).append(result.categoryCount() == 1 ? " category: " : " categories: ")
                    .append(describe(result.aggregate())).append('.');
        }
    }

    private static String describe(CategoryMetric metric) {
        return metric.reviewCount() + " reviews, average rating " + formatRating(metric.avgRating()) + ", NPS " + formatNps(metric.nps());
    }

    private static String metricLabel(String metric) {
        return switch (metric) {
            case ToolParameters.METRIC_AVG_RATING -> "average rating";
            case ToolParameters.METRIC_NPS -> "NPS";
            default -> "review count";
        };
    }

    static String formatRating(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    static String formatNps(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String formatPercent(long count, long total) {
        if (total <= 0L) {
            return "0.0%";
        }
        return String.format(Locale.ROOT, "%.1f%%", (double) count * 100.0 / (double) total);
    }
}
