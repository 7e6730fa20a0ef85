package com.jreinhal.insight.execution;

import com.jreinhal.insight.model.Review;
import com.jreinhal.insight.model.ReviewSentiment;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read access to the review corpus. Implementations must not return rows for categories
 * outside the given scope and wrap store failures in {@link DataSourceException}.
 */
public interface ReviewDataSource {

    /**
     * Per-category star histogram ({@code rating -> count}) for every category in scope that
     * has at least one review.
     */
    Map<String, Map<Integer, Long>> ratingCounts(CategoryScope scope);

    /**
     * Up to {@code limit} reviews of one category with distinct text, oldest first.
     */
    List<Review> reviewSample(CategoryScope scope, String category, int limit);

    /**
     * Cached sentiment labels keyed by review text hash. Hashes without a label are absent.
     */
    Map<String, ReviewSentiment> sentimentLabels(Collection<String> textHashes);
}
