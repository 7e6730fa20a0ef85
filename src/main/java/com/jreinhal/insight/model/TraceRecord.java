package com.jreinhal.insight.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Audit row for one pipeline pass. Inserted once and never modified, so there are no setters.
 */
@Document(collection = "message_traces")
public class TraceRecord {

    @Id
    private String id;
    @Indexed
    private Instant createdAt;
    @Indexed
    private String conversationId;
    private int turnIndex;
    @Indexed
    private String userId;
    private String username;
    private long accessVersion;
    private String query;
    private Map<String, Object> routerDecision;
    private Map<String, Object> verdict;
    private Map<String, Object> finalCall;
    private Map<String, Object> resultSummary;
    private String fallbackRationale;
    private String failure;
    private Map<String, Long> stageDurationsMs;

    public TraceRecord() {
    }

    private TraceRecord(Builder builder) {
        this.id = builder.id;
        this.createdAt = Instant.now();
        this.conversationId = builder.conversationId;
        this.turnIndex = builder.turnIndex;
        this.userId = builder.userId;
        this.username = builder.username;
        this.accessVersion = builder.accessVersion;
        this.query = builder.query;
        this.routerDecision = builder.routerDecision;
        this.verdict = builder.verdict;
        this.finalCall = builder.finalCall;
        this.resultSummary = builder.resultSummary;
        this.fallbackRationale = builder.fallbackRationale;
        this.failure = builder.failure;
        this.stageDurationsMs = builder.stageDurationsMs;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return this.id;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public String getConversationId() {
        return this.conversationId;
    }

    public int getTurnIndex() {
        return this.turnIndex;
    }

    public String getUserId() {
        return this.userId;
    }

    public String getUsername() {
        return this.username;
    }

    public long getAccessVersion() {
        return this.accessVersion;
    }

    public String getQuery() {
        return this.query;
    }

    public Map<String, Object> getRouterDecision() {
        return this.routerDecision;
    }

    public Map<String, Object> getVerdict() {
        return this.verdict;
    }

    public Map<String, Object> getFinalCall() {
        return this.finalCall;
    }

    public Map<String, Object> getResultSummary() {
        return this.resultSummary;
    }

    public String getFallbackRationale() {
        return this.fallbackRationale;
    }

    public String getFailure() {
        return this.failure;
    }

    public Map<String, Long> getStageDurationsMs() {
        return this.stageDurationsMs;
    }

    public static final class Builder {
        private final String id;
        private String conversationId;
        private int turnIndex;
        private String userId;
        private String username;
        private long accessVersion;
        private String query;
        private Map<String, Object> routerDecision;
        private Map<String, Object> verdict;
        private Map<String, Object> finalCall;
        private Map<String, Object> resultSummary;
        private String fallbackRationale;
        private String failure;
        private Map<String, Long> stageDurationsMs = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder turn(String conversationId, int turnIndex) {
            this.conversationId = conversationId;
            this.turnIndex = turnIndex;
            return this;
        }

        public Builder user(User user, long accessVersion) {
            if (user != null) {
                this.userId = user.getId();
                this.username = user.getUsername();
            }
            this.accessVersion = accessVersion;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder routerDecision(Map<String, Object> routerDecision) {
            this.routerDecision = routerDecision;
            return this;
        }

        public Builder verdict(Map<String, Object> verdict) {
            this.verdict = verdict;
            return this;
        }

        public Builder finalCall(Map<String, Object> finalCall) {
            this.finalCall = finalCall;
            return this;
        }

        public Builder resultSummary(Map<String, Object> resultSummary) {
            this.resultSummary = resultSummary;
            return this;
        }

        public Builder fallbackRationale(String fallbackRationale) {
            this.fallbackRationale = fallbackRationale;
            return this;
        }

        public Builder failure(String failure) {
            this.failure = failure;
            return this;
        }

        public Builder stageDurations(Map<String, Long> stageDurationsMs) {
            if (stageDurationsMs != null) {
                this.stageDurationsMs = new LinkedHashMap<>(stageDurationsMs);
            }
            return this;
        }

        public TraceRecord build() {
            return new TraceRecord(this);
        }
    }
}
