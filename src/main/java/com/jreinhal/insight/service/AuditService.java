package com.jreinhal.insight.service;

import com.jreinhal.insight.model.AuditEvent;
import com.jreinhal.insight.model.User;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

/**
 * Security audit log: authentication failures, denied admin access and grant changes.
 * Pipeline turns are audited separately by the trace recorder.
 */
@Service
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);
    static final String COLLECTION = "audit_log";
    private final MongoTemplate mongoTemplate;
    @Value(value="${app.audit.fail-closed:false}")
    private boolean failClosed;

    public AuditService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void log(AuditEvent event) {
        try {
            this.mongoTemplate.save(event, COLLECTION);
            log.debug("Audit event logged: {} - {} - {}", event.getKind(), event.getActorId(), event.getTarget());
        }
        catch (RuntimeException e) {
            log.error("CRITICAL: Failed to persist audit event: {} - {}", event.getKind(), e.getMessage());
            if (this.failClosed) {
                throw new AuditFailureException("Audit logging failed - operation halted. Event: " + event.getKind(), e);
            }
        }
    }

    public void logAuthFailure(String attemptedUser, String reason, HttpServletRequest request) {
        AuditEvent event = AuditEvent.authFailure(attemptedUser, reason);
        if (request != null) {
            event.fromClient(clientIp(request));
        }
        this.log(event);
    }

    public void logAccessDenied(User user, String resource, String reason, HttpServletRequest request) {
        AuditEvent event = AuditEvent.accessDenied(user, resource, reason);
        if (request != null) {
            event.fromClient(clientIp(request));
        }
        this.log(event);
    }

    public void logGrantChange(User admin, String targetUserId, Set<String> categories, long newVersion) {
        this.log(AuditEvent.grantChanged(admin, targetUserId, List.copyOf(new TreeSet<String>(categories)), newVersion));
    }

    public void logSentimentBackfill(User admin, String category, int labelled, int cacheHits) {
        this.log(AuditEvent.sentimentBackfill(admin, category, labelled, cacheHits));
    }

    private static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isEmpty()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    public static class AuditFailureException
    extends RuntimeException {
        public AuditFailureException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
