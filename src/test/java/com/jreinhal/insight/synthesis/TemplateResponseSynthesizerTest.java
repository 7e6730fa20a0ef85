package com.jreinhal.insight.synthesis;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.insight.execution.AccessDenied;
import com.jreinhal.insight.execution.CategoryMetric;
import com.jreinhal.insight.execution.CategoryMetricsResult;
import com.jreinhal.insight.execution.ComparisonResult;
import com.jreinhal.insight.execution.GeneralQueryResult;
import com.jreinhal.insight.execution.NoData;
import com.jreinhal.insight.execution.RatingDistributionResult;
import com.jreinhal.insight.execution.SentimentSummaryResult;
import com.jreinhal.insight.tools.ToolCall;
import com.jreinhal.insight.tools.ToolName;
import com.jreinhal.insight.validation.RejectionReason;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TemplateResponseSynthesizerTest {

    private final TemplateResponseSynthesizer synthesizer = new TemplateResponseSynthesizer();
    private final ToolCall direct = ToolCall.of(ToolName.GENERAL_QUERY, Map.of("query_type", "summary_stats"));

    @Test
    @DisplayName("Ranking lists rows with rounded figures")
    void ranking() {
        CategoryMetricsResult result = new CategoryMetricsResult("nps", "top", 2, List.of(
                new CategoryMetric("Kitchen", 12L, 4.3333333, 41.66666),
                new CategoryMetric("Toys", 3L, 2.0, -33.3333)));
        String reply = synthesizer.synthesize(new SynthesisRequest("best nps", direct, result));
        assertThat(reply).startsWith("Top 2 categories by NPS:")
                .contains("1. Kitchen: 12 reviews, average rating 4.33, NPS 41.7")
                .contains("2. Toys: 3 reviews, average rating 2.00, NPS -33.3");
    }

    @Test
    @DisplayName("Fallback replies disclose the substitution and reason")
    void fallbackDisclosed() {
        ToolCall fallback = direct.asFallback(RejectionReason.ACCESS_DENIED, "Showing your own categories instead.");
        String reply = synthesizer.synthesize(new SynthesisRequest("q", fallback, new NoData("general_query", "No visible categories")));
        assertThat(reply).startsWith("Note: Showing your own categories instead. (reason: access_denied)")
                .endsWith("No data available: No visible categories.");
    }

    @Test
    @DisplayName("Distribution shows every star with its share")
    void distribution() {
        LinkedHashMap<Integer, Long> counts = new LinkedHashMap<Integer, Long>();
        counts.put(1, 1L);
        counts.put(2, 0L);
        counts.put(3, 0L);
        counts.put(4, 1L);
        counts.put(5, 2L);
        String reply = synthesizer.synthesize(new SynthesisRequest("q", direct, new RatingDistributionResult("Kitchen", counts, 4L, 3.75)));
        assertThat(reply).contains("Rating distribution for Kitchen (4 reviews, average 3.75)")
                .contains("5 stars: 2 (50.0%)").contains("1 star: 1 (25.0%)").contains("2 stars: 0 (0.0%)");
    }

    @Test
    @DisplayName("Comparison names the leader")
    void comparison() {
        CategoryMetric kitchen = new CategoryMetric("Kitchen", 10L, 4.5, 60.0);
        CategoryMetric toys = new CategoryMetric("Toys", 10L, 3.25, 0.0);
        String reply = synthesizer.synthesize(new SynthesisRequest("q", direct, new ComparisonResult(kitchen, toys, null, null)));
        assertThat(reply).endsWith("Kitchen has the higher average rating by 1.25 stars.");
    }

    @Test
    @DisplayName("Comparison with equal averages names no leader")
    void comparisonTie() {
        CategoryMetric kitchen = new CategoryMetric("Kitchen", 10L, 4.2, 30.0);
        CategoryMetric toys = new CategoryMetric("Toys", 7L, 4.2001, 10.0);
        String reply = synthesizer.synthesize(new SynthesisRequest("q", direct, new ComparisonResult(kitchen, toys, null, null)));
        assertThat(reply).endsWith("Both categories have the same average rating of 4.20 stars.");
        assertThat(reply).doesNotContain("higher average rating");
    }

    @Test
    @DisplayName("Sentiment without labels points at the backfill")
    void sentimentUnlabelled() {
        SentimentSummaryResult result = new SentimentSummaryResult("Kitchen", 4,
                Map.of("positive", 0L, "negative", 0L, "neutral", 0L, SentimentSummaryResult.UNLABELED, 4L), List.of());
        String reply = synthesizer.synthesize(new SynthesisRequest("q", direct, result));
        assertThat(reply).contains("not yet labelled 4").contains("sentiment backfill");
    }

    @Test
    @DisplayName("Sentiment with labels lists reasons")
    void sentimentLabelled() {
        SentimentSummaryResult result = new SentimentSummaryResult("Kitchen", 3,
                Map.of("positive", 2L, "negative", 1L, "neutral", 0L, SentimentSummaryResult.UNLABELED, 0L),
                List.of(new SentimentSummaryResult.ReasonCount("boils fast", 2L)));
        String reply = synthesizer.synthesize(new SynthesisRequest("q", direct, result));
        assertThat(reply).contains("positive 2, negative 1, neutral 0.").contains("- boils fast (2)").doesNotContain("not yet labelled");
    }

    @Test
    @DisplayName("General queries and denials")
    void generalAndDenied() {
        assertThat(synthesizer.synthesize(new SynthesisRequest("q", direct,
                new GeneralQueryResult("list_categories", 2, List.of("Kitchen", "Toys"), null))))
                .isEqualTo("Categories you can view (2): Kitchen, Toys.");
        assertThat(synthesizer.synthesize(new SynthesisRequest("q", direct,
                new GeneralQueryResult("count_categories", 1, List.of(), null))))
                .isEqualTo("You can view 1 category.");
        assertThat(synthesizer.synthesize(new SynthesisRequest("q", direct, new AccessDenied("Toys"))))
                .isEqualTo("You do not have access to that category.");
    }
}
