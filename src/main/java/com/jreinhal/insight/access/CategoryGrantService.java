package com.jreinhal.insight.access;

import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.service.AuditService;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

/**
 * Admin-side grant mutation. Replacing a grant and bumping {@code accessVersion} happen in a
 * single document update, and the version bump is the only signal the result cache observes.
 */
@Service
public class CategoryGrantService {
    private static final Logger log = LoggerFactory.getLogger(CategoryGrantService.class);

    private final MongoTemplate mongoTemplate;
    private final CategoryCatalog categoryCatalog;
    private final AuditService auditService;

    public CategoryGrantService(MongoTemplate mongoTemplate, CategoryCatalog categoryCatalog, AuditService auditService) {
        this.mongoTemplate = mongoTemplate;
        this.categoryCatalog = categoryCatalog;
        this.auditService = auditService;
    }

    public CategoryGrant replaceGrant(User admin, String targetUserId, Set<String> categories) {
        if (admin == null || !admin.hasPermission(UserRole.Permission.MANAGE_GRANTS)) {
            throw new SecurityException("Grant changes require MANAGE_GRANTS permission");
        }
        if (targetUserId == null || targetUserId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        Set<String> normalized = new LinkedHashSet<String>();
        for (String category : categories == null ? Set.<String>of() : categories) {
            if (category == null || category.isBlank()) {
                continue;
            }
            String name = category.trim();
            if (!this.categoryCatalog.exists(name)) {
                throw new IllegalArgumentException("Unknown category: " + name);
            }
            normalized.add(name);
        }
        TreeSet<String> sorted = new TreeSet<String>(normalized);
        Query query = new Query(Criteria.where("_id").is(targetUserId));
        Update update = new Update().set("allowedCategories", List.copyOf(sorted)).inc("accessVersion", 1);
        User updated = this.mongoTemplate.findAndModify(query, update, FindAndModifyOptions.options().returnNew(true), User.class);
        if (updated == null) {
            throw new IllegalArgumentException("Unknown user: " + targetUserId);
        }
        log.info("Grant for user {} replaced by {}: {} categories, accessVersion={}", targetUserId, admin.getUsername(), sorted.size(), updated.getAccessVersion());
        this.auditService.logGrantChange(admin, targetUserId, sorted, updated.getAccessVersion());
        return new CategoryGrant(updated.getId(), updated.getRole(), sorted, updated.getAccessVersion(), updated.isAdmin());
    }
}
