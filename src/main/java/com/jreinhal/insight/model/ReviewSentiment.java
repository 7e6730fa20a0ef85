package com.jreinhal.insight.model;

import java.time.Instant;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Cached LLM label for one review text, keyed by the SHA-256 of the normalized text.
 */
@Document(collection = "review_sentiment_cache")
public class ReviewSentiment {

    @Id
    private String id;
    @Indexed(unique = true)
    private String textHash;
    private String model;
    private String sentiment;
    private List<String> reasons;
    private Long latencyMs;
    private Instant createdAt;

    public ReviewSentiment() {}

    public ReviewSentiment(String textHash, String model, String sentiment, List<String> reasons, Long latencyMs) {
        this.textHash = textHash;
        this.model = model;
        this.sentiment = sentiment;
        this.reasons = reasons;
        this.latencyMs = latencyMs;
        this.createdAt = Instant.now();
    }

    public String getId() { return id; }
    public String getTextHash() { return textHash; }
    public String getModel() { return model; }
    public String getSentiment() { return sentiment; }
    public List<String> getReasons() { return reasons == null ? List.of() : reasons; }
    public Long getLatencyMs() { return latencyMs; }
    public Instant getCreatedAt() { return createdAt; }
}
