package com.jreinhal.insight.execution;

import com.jreinhal.insight.access.AccessDecision;
import com.jreinhal.insight.access.AccessModel;
import com.jreinhal.insight.model.Review;
import com.jreinhal.insight.model.ReviewSentiment;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.tools.ToolCall;
import com.jreinhal.insight.tools.ToolParameters;
import com.jreinhal.insight.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Runs a validated {@link ToolCall} against the review store, scoped to the caller's visible
 * categories at execution time.
 *
 * <p>Results are cached per {@code (userId, accessVersion, fingerprint)}. The access version
 * is read before and after execution and the result is only cached when both reads agree.</p>
 */
@Service
public class ToolExecutor {
    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);
    private static final List<String> SENTIMENT_LABELS = List.of("positive", "negative", "neutral");

    private final AccessModel accessModel;
    private final ReviewDataSource dataSource;
    private final AccessResultCache resultCache;
    @Value(value="${insight.sentiment.top-reasons:10}")
    private int topReasons = 10;

    public ToolExecutor(AccessModel accessModel, ReviewDataSource dataSource, AccessResultCache resultCache) {
        this.accessModel = accessModel;
        this.dataSource = dataSource;
        this.resultCache = resultCache;
    }

    public ToolResult execute(ToolCall call, User user) {
        try {
            return this.executeScoped(call, user);
        }
        catch (DataAccessException e) {
            log.error("Access data unavailable for {}: {}", call.tool().wireName(), e.getClass().getSimpleName());
            throw new DataSourceException("Access data could not be read", e);
        }
    }

    private ToolResult executeScoped(ToolCall call, User user) {
        long versionBefore = this.accessModel.currentAccessVersion(user);
        boolean cacheable = versionBefore != AccessModel.UNRESOLVED_VERSION;
        AccessResultCache.CacheKey key = new AccessResultCache.CacheKey(user != null ? user.getId() : null, versionBefore, call.fingerprint());
        if (cacheable) {
            Optional<ToolResult> hit = this.resultCache.get(key);
            if (hit.isPresent()) {
                log.debug("Result cache hit for {} (user={}, version={})", call.tool().wireName(), key.userId(), versionBefore);
                return hit.get();
            }
        }
        CategoryScope scope = CategoryScope.of(this.accessModel.resolveVisibleCategories(user));
        ToolResult result = switch (call.tool()) {
            case METRICS_TOP_CATEGORIES -> this.topCategories(call, scope, user);
            case RATING_DISTRIBUTION -> this.ratingDistribution(call.stringParam(ToolParameters.CATEGORY), scope, user);
            case SENTIMENT_SUMMARY -> this.sentimentSummary(call, scope, user);
            case COMPARE_CATEGORIES -> this.compare(call, scope, user);
            case GENERAL_QUERY -> this.generalQuery(call, scope, user);
        };
        long versionAfter = this.accessModel.currentAccessVersion(user);
        if (cacheable && versionBefore == versionAfter) {
            this.resultCache.put(key, result);
        } else if (cacheable) {
            log.info("Access version changed during execution ({} -> {}); result not cached", versionBefore, versionAfter);
        }
        return result;
    }

    private ToolResult topCategories(ToolCall call, CategoryScope scope, User user) {
        String metric = Optional.ofNullable(call.stringParam(ToolParameters.METRIC)).orElse(ToolParameters.METRIC_REVIEW_COUNT);
        String order = Optional.ofNullable(call.stringParam(ToolParameters.ORDER)).orElse(ToolParameters.ORDER_TOP);
        int topN = Optional.ofNullable(call.intParam(ToolParameters.TOP_N)).orElse(5);
        List<String> requested = call.listParam(ToolParameters.CATEGORIES);
        CategoryScope effective = scope;
        if (requested != null && !requested.isEmpty()) {
            for (String category : requested) {
                if (!scope.contains(category)) {
                    return this.outsideScope(call.tool().wireName(), category, user);
                }
            }
            effective = scope.narrowTo(requested);
        }
        if (effective.isEmpty()) {
            return new NoData(call.tool().wireName(), "No visible categories");
        }
        Map<String, Map<Integer, Long>> counts = this.dataSource.ratingCounts(effective);
        ArrayList<CategoryMetric> metrics = new ArrayList<CategoryMetric>();
        for (Map.Entry<String, Map<Integer, Long>> entry : counts.entrySet()) {
            CategoryMetric metricRow = MetricsCalculator.fromCounts(entry.getKey(), entry.getValue());
            if (metricRow.reviewCount() > 0L) {
                metrics.add(metricRow);
            }
        }
        if (metrics.isEmpty()) {
            return new NoData(call.tool().wireName(), "No reviews in the selected categories");
        }
        return new CategoryMetricsResult(metric, order, topN, MetricsCalculator.rank(metrics, metric, order, topN));
    }

    private ToolResult ratingDistribution(String category, CategoryScope scope, User user) {
        if (!scope.contains(category)) {
            return this.outsideScope("rating_distribution", category, user);
        }
        Optional<RatingDistributionResult> distribution = this.distributionFor(category, scope);
        if (distribution.isEmpty()) {
            return new NoData("rating_distribution", "No reviews for " + category);
        }
        return distribution.get();
    }

    private ToolResult compare(ToolCall call, CategoryScope scope, User user) {
        String first = call.stringParam(ToolParameters.CATEGORY_A);
        String second = call.stringParam(ToolParameters.CATEGORY_B);
        if (!scope.contains(first)) {
            return this.outsideScope(call.tool().wireName(), first, user);
        }
        if (!scope.contains(second)) {
            return this.outsideScope(call.tool().wireName(), second, user);
        }
        Map<String, Map<Integer, Long>> counts = this.dataSource.ratingCounts(scope.narrowTo(List.of(first, second)));
        Map<Integer, Long> firstCounts = counts.get(first);
        Map<Integer, Long> secondCounts = counts.get(second);
        if (isEmpty(firstCounts)) {
            return new NoData(call.tool().wireName(), "No reviews for " + first);
        }
        if (isEmpty(secondCounts)) {
            return new NoData(call.tool().wireName(), "No reviews for " + second);
        }
        CategoryMetric firstMetric = MetricsCalculator.fromCounts(first, firstCounts);
        CategoryMetric secondMetric = MetricsCalculator.fromCounts(second, secondCounts);
        return new ComparisonResult(firstMetric, secondMetric,
                new RatingDistributionResult(first, MetricsCalculator.fullHistogram(firstCounts), firstMetric.reviewCount(), firstMetric.avgRating()),
                new RatingDistributionResult(second, MetricsCalculator.fullHistogram(secondCounts), secondMetric.reviewCount(), secondMetric.avgRating()));
    }

    private ToolResult sentimentSummary(ToolCall call, CategoryScope scope, User user) {
        String category = call.stringParam(ToolParameters.CATEGORY);
        if (!scope.contains(category)) {
            return this.outsideScope(call.tool().wireName(), category, user);
        }
        int maxReviews = Optional.ofNullable(call.intParam(ToolParameters.MAX_REVIEWS)).orElse(30);
        List<Review> sample = this.dataSource.reviewSample(scope, category, maxReviews);
        if (sample.isEmpty()) {
            return new NoData(call.tool().wireName(), "No review text for " + category);
        }
        ArrayList<String> hashes = new ArrayList<String>(sample.size());
        for (Review review : sample) {
            hashes.add(review.getTextHash() != null ? review.getTextHash() : LogSanitizer.textHash(review.getReviewText()));
        }
        Map<String, ReviewSentiment> labels = this.dataSource.sentimentLabels(new LinkedHashSet<String>(hashes));
        LinkedHashMap<String, Long> sentimentCounts = new LinkedHashMap<String, Long>();
        for (String label : SENTIMENT_LABELS) {
            sentimentCounts.put(label, 0L);
        }
        sentimentCounts.put(SentimentSummaryResult.UNLABELED, 0L);
        HashMap<String, Long> reasonCounts = new HashMap<String, Long>();
        for (String hash : hashes) {
            ReviewSentiment label = labels.get(hash);
            String sentiment = label == null ? null : normalizeLabel(label.getSentiment());
            if (sentiment == null) {
                sentimentCounts.merge(SentimentSummaryResult.UNLABELED, 1L, Long::sum);
                continue;
            }
            sentimentCounts.merge(sentiment, 1L, Long::sum);
            Set<String> distinctReasons = new LinkedHashSet<String>();
            for (String reason : label.getReasons()) {
                if (reason != null && !reason.isBlank()) {
                    distinctReasons.add(reason.trim().toLowerCase(Locale.ROOT));
                }
            }
            for (String reason : distinctReasons) {
                reasonCounts.merge(reason, 1L, Long::sum);
            }
        }
        List<SentimentSummaryResult.ReasonCount> reasons = new ArrayList<SentimentSummaryResult.ReasonCount>();
        for (Map.Entry<String, Long> entry : reasonCounts.entrySet()) {
            reasons.add(new SentimentSummaryResult.ReasonCount(entry.getKey(), entry.getValue()));
        }
        reasons.sort(Comparator.comparingLong(SentimentSummaryResult.ReasonCount::count).reversed().thenComparing(SentimentSummaryResult.ReasonCount::reason));
        if (reasons.size() > this.topReasons) {
            reasons = new ArrayList<SentimentSummaryResult.ReasonCount>(reasons.subList(0, this.topReasons));
        }
        return new SentimentSummaryResult(category, hashes.size(), sentimentCounts, reasons);
    }

    private ToolResult generalQuery(ToolCall call, CategoryScope scope, User user) {
        String queryType = Optional.ofNullable(call.stringParam(ToolParameters.QUERY_TYPE)).orElse(ToolParameters.QUERY_SUMMARY_STATS);
        switch (queryType) {
            case ToolParameters.QUERY_COUNT_CATEGORIES:
                return new GeneralQueryResult(queryType, scope.size(), List.of(), null);
            case ToolParameters.QUERY_LIST_CATEGORIES:
                if (scope.isEmpty()) {
                    return new NoData(call.tool().wireName(), "No visible categories");
                }
                return new GeneralQueryResult(queryType, scope.size(), new ArrayList<String>(scope.categories()), null);
            case ToolParameters.QUERY_CATEGORY_INFO: {
                String category = call.stringParam(ToolParameters.CATEGORY);
                if (!scope.contains(category)) {
                    return this.outsideScope(call.tool().wireName(), category, user);
                }
                Map<Integer, Long> counts = this.dataSource.ratingCounts(scope.narrowTo(List.of(category))).get(category);
                if (isEmpty(counts)) {
                    return new NoData(call.tool().wireName(), "No reviews for " + category);
                }
                return new GeneralQueryResult(queryType, 1, List.of(category), MetricsCalculator.fromCounts(category, counts));
            }
            default: {
                if (scope.isEmpty()) {
                    return new NoData(call.tool().wireName(), "No visible categories");
                }
                Map<String, Map<Integer, Long>> counts = this.dataSource.ratingCounts(scope);
                CategoryMetric aggregate = MetricsCalculator.aggregate(counts.values());
                if (aggregate.reviewCount() == 0L) {
                    return new NoData(call.tool().wireName(), "No reviews in the visible categories");
                }
                return new GeneralQueryResult(ToolParameters.QUERY_SUMMARY_STATS, scope.size(), List.of(), aggregate);
            }
        }
    }

    /**
     * A category outside the scope is either not granted or not in the catalog. Only the first
     * is an access failure.
     */
    private ToolResult outsideScope(String tool, String category, User user) {
        if (category != null && this.accessModel.authorize(user, category) == AccessDecision.ALLOWED) {
            return new NoData(tool, "Unknown category " + category);
        }
        return new AccessDenied(category);
    }

    private Optional<RatingDistributionResult> distributionFor(String category, CategoryScope scope) {
        Map<Integer, Long> counts = this.dataSource.ratingCounts(scope.narrowTo(List.of(category))).get(category);
        if (isEmpty(counts)) {
            return Optional.empty();
        }
        CategoryMetric metric = MetricsCalculator.fromCounts(category, counts);
        return Optional.of(new RatingDistributionResult(category, MetricsCalculator.fullHistogram(counts), metric.reviewCount(), metric.avgRating()));
    }

    private static boolean isEmpty(Map<Integer, Long> counts) {
        if (counts == null) {
            return true;
        }
        for (Long value : counts.values()) {
            if (value != null && value > 0L) {
                return false;
            }
        }
        return true;
    }

    private static String normalizeLabel(String sentiment) {
        if (sentiment == null) {
            return null;
        }
        String label = sentiment.trim().toLowerCase(Locale.ROOT);
        return SENTIMENT_LABELS.contains(label) ? label : null;
    }
}
