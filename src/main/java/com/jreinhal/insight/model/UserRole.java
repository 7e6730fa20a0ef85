package com.jreinhal.insight.model;

import java.util.Set;

public enum UserRole {
    ADMIN(Set.of(Permission.QUERY, Permission.VIEW_TRACES, Permission.MANAGE_GRANTS, Permission.RUN_BACKFILL)),
    ANALYST(Set.of(Permission.QUERY));

    private final Set<Permission> permissions;

    private UserRole(Set<Permission> permissions) {
        this.permissions = permissions;
    }

    public Set<Permission> getPermissions() {
        return this.permissions;
    }

    public boolean hasPermission(Permission permission) {
        return this.permissions.contains(permission);
    }

    public static UserRole fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Role is required");
        }
        return valueOf(name.trim().toUpperCase(java.util.Locale.ROOT));
    }

    public static enum Permission {
        QUERY,
        VIEW_TRACES,
        MANAGE_GRANTS,
        RUN_BACKFILL;

    }
}
