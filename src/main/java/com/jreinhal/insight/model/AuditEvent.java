package com.jreinhal.insight.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One entry of the security audit log. Targets are written as {@code TYPE:id}, for example
 * {@code USER:u-17} or {@code CATEGORY:Kitchen}.
 */
@Document(collection="audit_log")
public class AuditEvent {
    @Id
    private String id;
    @Indexed
    private Instant timestamp;
    @Indexed
    private Kind kind;
    @Indexed
    private String actorId;
    private UserRole actorRole;
    private String target;
    private boolean denied;
    private String reason;
    private String clientIp;
    private Map<String, Object> attributes = new LinkedHashMap<String, Object>();

    protected AuditEvent() {
    }

    private AuditEvent(Kind kind, String actorId, UserRole actorRole, String target) {
        this.timestamp = Instant.now();
        this.kind = kind;
        this.actorId = actorId;
        this.actorRole = actorRole;
        this.target = target;
    }

    public static AuditEvent authFailure(String attemptedUser, String reason) {
        AuditEvent event = new AuditEvent(Kind.AUTH_FAILURE, attemptedUser, null, null);
        event.denied = true;
        event.reason = reason;
        return event;
    }

    public static AuditEvent accessDenied(User user, String endpoint, String reason) {
        AuditEvent event = new AuditEvent(Kind.ACCESS_DENIED, user != null ? user.getId() : "ANONYMOUS",
                user != null ? user.getRole() : null, "ENDPOINT:" + endpoint);
        event.denied = true;
        event.reason = reason;
        return event;
    }

    public static AuditEvent grantChanged(User admin, String targetUserId, List<String> categories, long accessVersion) {
        AuditEvent event = new AuditEvent(Kind.GRANT_CHANGED, admin.getId(), admin.getRole(), "USER:" + targetUserId);
        event.attributes.put("categories", categories);
        event.attributes.put("accessVersion", accessVersion);
        return event;
    }

    public static AuditEvent sentimentBackfill(User admin, String category, int labelled, int cacheHits) {
        AuditEvent event = new AuditEvent(Kind.SENTIMENT_BACKFILL, admin.getId(), admin.getRole(), "CATEGORY:" + category);
        event.attributes.put("labelled", labelled);
        event.attributes.put("cacheHits", cacheHits);
        return event;
    }

    public AuditEvent fromClient(String clientIp) {
        this.clientIp = clientIp;
        return this;
    }

    public Kind getKind() {
        return this.kind;
    }

    public String getActorId() {
        return this.actorId;
    }

    public String getTarget() {
        return this.target;
    }

    public boolean isDenied() {
        return this.denied;
    }

    public String getReason() {
        return this.reason;
    }

    public String getClientIp() {
        return this.clientIp;
    }

    public Map<String, Object> getAttributes() {
        return this.attributes;
    }

    public static enum Kind {
        AUTH_FAILURE,
        ACCESS_DENIED,
        GRANT_CHANGED,
        SENTIMENT_BACKFILL;

    }
}
