package com.jreinhal.insight.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One user message and the reply it produced. Written once when the turn completes.
 */
@Document(collection = "conversation_turns")
@CompoundIndex(name = "conversation_turn_idx", def = "{'conversationId': 1, 'turnIndex': 1}", unique = true)
public class ConversationTurn {

    @Id
    private String id;
    private String conversationId;
    private int turnIndex;
    private String userId;
    private String utterance;
    private String toolName;
    private Map<String, Object> toolParameters;
    private boolean fallback;
    private String rejectionReason;
    private String reply;
    private String traceId;
    private Instant createdAt;

    public ConversationTurn() {}

    public ConversationTurn(String conversationId, int turnIndex, String userId, String utterance, String toolName,
                            Map<String, Object> toolParameters, boolean fallback, String rejectionReason, String reply, String traceId) {
        this.conversationId = conversationId;
        this.turnIndex = turnIndex;
        this.userId = userId;
        this.utterance = utterance;
        this.toolName = toolName;
        this.toolParameters = toolParameters == null ? null : new LinkedHashMap<>(toolParameters);
        this.fallback = fallback;
        this.rejectionReason = rejectionReason;
        this.reply = reply;
        this.traceId = traceId;
        this.createdAt = Instant.now();
    }

    /**
     * Holds the index of a turn that failed before producing a reply, so the next turn and
     * its trace get a fresh one. Carries no tool call and is skipped as a repeat candidate.
     */
    public static ConversationTurn failed(String conversationId, int turnIndex, String userId, String utterance, String traceId) {
        return new ConversationTurn(conversationId, turnIndex, userId, utterance, null, null, false, null, null, traceId);
    }

    public String getId() { return id; }
    public String getConversationId() { return conversationId; }
    public int getTurnIndex() { return turnIndex; }
    public String getUserId() { return userId; }
    public String getUtterance() { return utterance; }
    public String getToolName() { return toolName; }
    public Map<String, Object> getToolParameters() { return toolParameters == null ? Map.of() : toolParameters; }
    public boolean isFallback() { return fallback; }
    public String getRejectionReason() { return rejectionReason; }
    public String getReply() { return reply; }
    public String getTraceId() { return traceId; }
    public Instant getCreatedAt() { return createdAt; }
}
