package com.jreinhal.insight.execution;

import com.jreinhal.insight.model.Review;
import com.jreinhal.insight.model.ReviewSentiment;
import com.jreinhal.insight.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

@Component
public class MongoReviewDataSource
implements ReviewDataSource {
    private static final Logger log = LoggerFactory.getLogger(MongoReviewDataSource.class);
    static final String REVIEWS_COLLECTION = "reviews";
    private static final int SAMPLE_OVERFETCH = 4;
    private static final int SAMPLE_FETCH_CAP = 1000;

    private final MongoTemplate mongoTemplate;

    public MongoReviewDataSource(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Map<String, Map<Integer, Long>> ratingCounts(CategoryScope scope) {
        TreeMap<String, Map<Integer, Long>> histograms = new TreeMap<String, Map<Integer, Long>>();
        if (scope == null || scope.isEmpty()) {
            return histograms;
        }
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(Criteria.where("category").in(scope.categories())),
                Aggregation.group("category", "rating").count().as("count"));
        List<Document> rows;
        try {
            AggregationResults<Document> results = this.mongoTemplate.aggregate(aggregation, REVIEWS_COLLECTION, Document.class);
            rows = results.getMappedResults();
        }
        catch (DataAccessException e) {
            throw new DataSourceException("Rating aggregation failed: " + e.getMessage(), e);
        }
        for (Document row : rows) {
            Object rawId = row.get("_id");
            if (!(rawId instanceof Document id)) {
                continue;
            }
            String category = id.getString("category");
            Object rating = id.get("rating");
            Object count = row.get("count");
            if (!scope.contains(category) || !(rating instanceof Number r) || !(count instanceof Number c)) {
                continue;
            }
            int stars = r.intValue();
            if (stars < 1 || stars > 5) {
                continue;
            }
            histograms.computeIfAbsent(category, k -> new TreeMap<Integer, Long>()).merge(stars, c.longValue(), Long::sum);
        }
        log.debug("Rating histograms for {} of {} scoped categories", histograms.size(), scope.size());
        return histograms;
    }

    @Override
    public List<Review> reviewSample(CategoryScope scope, String category, int limit) {
        if (scope == null || !scope.contains(category) || limit <= 0) {
            return List.of();
        }
        Query query = new Query(Criteria.where("category").is(category));
        query.with(Sort.by(Sort.Direction.ASC, "reviewDate").and(Sort.by(Sort.Direction.ASC, "_id")));
        query.limit(Math.min(SAMPLE_FETCH_CAP, limit * SAMPLE_OVERFETCH));
        List<Review> rows;
        try {
            rows = this.mongoTemplate.find(query, Review.class, REVIEWS_COLLECTION);
        }
        catch (DataAccessException e) {
            throw new DataSourceException("Review sample query failed: " + e.getMessage(), e);
        }
        ArrayList<Review> sample = new ArrayList<Review>();
        Set<String> seen = new LinkedHashSet<String>();
        for (Review review : rows) {
            if (review.getReviewText() == null || review.getReviewText().isBlank()) {
                continue;
            }
            String hash = review.getTextHash() != null ? review.getTextHash() : LogSanitizer.textHash(review.getReviewText());
            if (!seen.add(hash)) {
                continue;
            }
            sample.add(review);
            if (sample.size() >= limit) {
                break;
            }
        }
        return sample;
    }

    @Override
    public Map<String, ReviewSentiment> sentimentLabels(Collection<String> textHashes) {
        HashMap<String, ReviewSentiment> labels = new HashMap<String, ReviewSentiment>();
        if (textHashes == null || textHashes.isEmpty()) {
            return labels;
        }
        List<ReviewSentiment> rows;
        try {
            rows = this.mongoTemplate.find(new Query(Criteria.where("textHash").in(textHashes)), ReviewSentiment.class);
        }
        catch (DataAccessException e) {
            throw new DataSourceException("Sentiment cache lookup failed: " + e.getMessage(), e);
        }
        for (ReviewSentiment row : rows) {
            labels.put(row.getTextHash(), row);
        }
        return labels;
    }
}
