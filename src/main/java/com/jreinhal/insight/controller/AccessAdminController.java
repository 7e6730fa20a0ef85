package com.jreinhal.insight.controller;

import com.jreinhal.insight.access.CategoryGrant;
import com.jreinhal.insight.access.CategoryGrantService;
import com.jreinhal.insight.filter.SecurityContext;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.repository.UserRepository;
import com.jreinhal.insight.sentiment.BackfillResult;
import com.jreinhal.insight.sentiment.SentimentBackfillService;
import com.jreinhal.insight.service.AuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Grant administration and the sentiment backfill job.
 */
@RestController
@RequestMapping(value={"/api/admin"})
@Tag(name="Admin")
public class AccessAdminController {
    private static final Logger log = LoggerFactory.getLogger(AccessAdminController.class);
    private final CategoryGrantService grantService;
    private final SentimentBackfillService backfillService;
    private final UserRepository userRepository;
    private final AuditService auditService;

    public AccessAdminController(CategoryGrantService grantService, SentimentBackfillService backfillService,
                                 UserRepository userRepository, AuditService auditService) {
        this.grantService = grantService;
        this.backfillService = backfillService;
        this.userRepository = userRepository;
        this.auditService = auditService;
    }

    @PutMapping(value={"/users/{id}/categories"})
    @Operation(summary="Replace a user's category grant")
    public CategoryGrant replaceGrant(@PathVariable("id") String userId, @RequestBody GrantRequest body) {
        if (body == null || body.categories() == null) {
            throw new IllegalArgumentException("categories is required");
        }
        return this.grantService.replaceGrant(SecurityContext.getCurrentUser(), userId, new TreeSet<String>(body.categories()));
    }

    @GetMapping(value={"/users"})
    public List<Map<String, Object>> users(HttpServletRequest request) {
        User admin = SecurityContext.getCurrentUser();
        if (admin == null || !admin.hasPermission(UserRole.Permission.MANAGE_GRANTS)) {
            log.warn("Unauthorized user listing attempt from: {}", admin != null ? admin.getUsername() : "ANONYMOUS");
            this.auditService.logAccessDenied(admin, "/api/admin/users", "Missing MANAGE_GRANTS permission", request);
            throw new SecurityException("User listing requires administrator access");
        }
        List<Map<String, Object>> users = new ArrayList<Map<String, Object>>();
        for (User user : this.userRepository.findByActiveTrue()) {
            LinkedHashMap<String, Object> row = new LinkedHashMap<String, Object>();
            row.put("id", user.getId());
            row.put("username", user.getUsername());
            row.put("role", user.getRole());
            row.put("allowedCategories", user.getAllowedCategories() == null ? Set.of() : new TreeSet<String>(user.getAllowedCategories()));
            row.put("accessVersion", user.getAccessVersion());
            users.add(row);
        }
        return users;
    }

    @PostMapping(value={"/sentiment/backfill"})
    @Operation(summary="Label uncached reviews of one category with the sentiment model")
    public BackfillResult backfill(@RequestParam("category") String category,
                                   @RequestParam(value="limit", defaultValue="50") int limit,
                                   HttpServletRequest request) {
        User admin = SecurityContext.getCurrentUser();
        if (admin == null || !admin.hasPermission(UserRole.Permission.RUN_BACKFILL)) {
            this.auditService.logAccessDenied(admin, "/api/admin/sentiment/backfill", "Missing RUN_BACKFILL permission", request);
        }
        return this.backfillService.backfill(admin, category, limit);
    }

    public record GrantRequest(Set<String> categories) {
    }
}
