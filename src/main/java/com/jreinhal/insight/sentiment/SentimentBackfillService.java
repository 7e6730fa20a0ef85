package com.jreinhal.insight.sentiment;

import com.jreinhal.insight.access.AccessModel;
import com.jreinhal.insight.execution.CategoryScope;
import com.jreinhal.insight.execution.ReviewDataSource;
import com.jreinhal.insight.model.Review;
import com.jreinhal.insight.model.ReviewSentiment;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.repository.ReviewSentimentRepository;
import com.jreinhal.insight.service.AuditService;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Admin job that fills the sentiment label cache for one category. Turns never call the
 * model; they read whatever this job has stored.
 */
@Service
public class SentimentBackfillService {
    private static final Logger log = LoggerFactory.getLogger(SentimentBackfillService.class);

    private final AccessModel accessModel;
    private final ReviewDataSource dataSource;
    private final ReviewSentimentRepository sentimentRepository;
    private final ReviewSentimentAnalyzer analyzer;
    private final AuditService auditService;
    @Value(value="${insight.sentiment.batch-size:10}")
    private int batchSize = 10;
    @Value(value="${insight.sentiment.max-backfill:200}")
    private int maxBackfill = 200;
    @Value(value="${spring.ai.ollama.chat.options.model:llama3.1}")
    private String modelName = "llama3.1";

    public SentimentBackfillService(AccessModel accessModel, ReviewDataSource dataSource, ReviewSentimentRepository sentimentRepository,
                                    ReviewSentimentAnalyzer analyzer, AuditService auditService) {
        this.accessModel = accessModel;
        this.dataSource = dataSource;
        this.sentimentRepository = sentimentRepository;
        this.analyzer = analyzer;
        this.auditService = auditService;
    }

    public BackfillResult backfill(User admin, String category, int limit) {
        if (admin == null || !admin.hasPermission(UserRole.Permission.RUN_BACKFILL)) {
            throw new SecurityException("Sentiment backfill requires administrator access");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category is required");
        }
        Set<String> visible = this.accessModel.resolveVisibleCategories(admin);
        if (!visible.contains(category)) {
            throw new IllegalArgumentException("Unknown category: " + category);
        }
        int boundedLimit = Math.max(1, Math.min(limit, this.maxBackfill));
        List<Review> reviews = this.dataSource.reviewSample(CategoryScope.of(visible), category, boundedLimit);
        List<String> hashes = new ArrayList<String>();
        Map<String, String> textByHash = new HashMap<String, String>();
        for (Review review : reviews) {
            if (review.getTextHash() != null && review.getReviewText() != null && !textByHash.containsKey(review.getTextHash())) {
                hashes.add(review.getTextHash());
                textByHash.put(review.getTextHash(), review.getReviewText());
            }
        }
        Set<String> cached = this.dataSource.sentimentLabels(hashes).keySet();
        List<String> pending = new ArrayList<String>();
        for (String hash : hashes) {
            if (!cached.contains(hash)) {
                pending.add(hash);
            }
        }
        int labelled = 0;
        int step = Math.max(1, this.batchSize);
        for (int start = 0; start < pending.size(); start += step) {
            List<String> chunk = pending.subList(start, Math.min(pending.size(), start + step));
            List<String> texts = new ArrayList<String>(chunk.size());
            for (String hash : chunk) {
                texts.add(textByHash.get(hash));
            }
            long started = System.currentTimeMillis();
            List<SentimentLabel> labels = this.analyzer.labelBatch(texts);
            long latencyMs = System.currentTimeMillis() - started;
            List<ReviewSentiment> rows = new ArrayList<ReviewSentiment>();
            for (SentimentLabel label : labels) {
                rows.add(new ReviewSentiment(chunk.get(label.index()), this.modelName, label.sentiment(), label.reasons(), latencyMs));
            }
            if (!rows.isEmpty()) {
                this.sentimentRepository.saveAll(rows);
            }
            labelled += rows.size();
            log.debug("Sentiment batch for {}: {}/{} labelled in {}ms", category, rows.size(), chunk.size(), latencyMs);
        }
        int cacheHits = hashes.size() - pending.size();
        BackfillResult result = new BackfillResult(category, hashes.size(), cacheHits, labelled, pending.size() - labelled);
        log.info("Sentiment backfill for {}: {} reviews, {} cached, {} labelled, {} left unlabelled",
                category, result.reviewsConsidered(), cacheHits, labelled, result.unlabelled());
        this.auditService.logSentimentBackfill(admin, category, labelled, cacheHits);
        return result;
    }
}
