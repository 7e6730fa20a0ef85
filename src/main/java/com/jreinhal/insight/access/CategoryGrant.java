package com.jreinhal.insight.access;

import com.jreinhal.insight.model.UserRole;
import java.util.Set;

/**
 * Point-in-time view of what a user may query. {@code universal} is set for admins,
 * whose grant is every catalog category regardless of {@code categories}.
 */
public record CategoryGrant(String userId, UserRole role, Set<String> categories, long accessVersion, boolean universal) {

    public CategoryGrant {
        categories = Set.copyOf(categories);
    }
}
