package com.jreinhal.insight.trace;

import com.jreinhal.insight.model.TraceRecord;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.service.AuditService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * Admin read side of the trace log, newest first.
 */
@Service
public class TraceQueryService {
    public static final int MAX_LIMIT = 500;
    static final String RESOURCE = "/api/admin/traces";

    private final MongoTemplate mongoTemplate;
    private final AuditService auditService;

    public TraceQueryService(MongoTemplate mongoTemplate, AuditService auditService) {
        this.mongoTemplate = mongoTemplate;
        this.auditService = auditService;
    }

    public List<TraceRecord> recent(User requester, int limit, String userId, String conversationId, HttpServletRequest request) {
        if (requester == null || !requester.hasPermission(UserRole.Permission.VIEW_TRACES)) {
            this.auditService.logAccessDenied(requester, RESOURCE, "Missing VIEW_TRACES permission", request);
            throw new SecurityException("Trace access requires VIEW_TRACES permission");
        }
        Query query = new Query();
        if (userId != null && !userId.isBlank()) {
            query.addCriteria(Criteria.where("userId").is(userId));
        }
        if (conversationId != null && !conversationId.isBlank()) {
            query.addCriteria(Criteria.where("conversationId").is(conversationId));
        }
        query.with(Sort.by(Sort.Direction.DESC, "createdAt"));
        query.limit(Math.max(1, Math.min(MAX_LIMIT, limit)));
        return this.mongoTemplate.find(query, TraceRecord.class, TraceRecorder.COLLECTION);
    }
}
