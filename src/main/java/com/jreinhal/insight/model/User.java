package com.jreinhal.insight.model;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection="users")
public class User {
    @Id
    private String id;
    @Indexed(unique=true)
    private String username;
    private String displayName;
    private String email;
    private UserRole role = UserRole.ANALYST;
    private Set<String> allowedCategories = new HashSet<String>();
    private long accessVersion;
    private Instant createdAt;
    private boolean active = true;

    public static User of(String id, String username, UserRole role, Set<String> allowedCategories) {
        User user = new User();
        user.id = id;
        user.username = username;
        user.displayName = username;
        user.role = role;
        user.allowedCategories = new HashSet<String>(allowedCategories);
        user.createdAt = Instant.now();
        user.active = true;
        return user;
    }

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUsername() {
        return this.username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getDisplayName() {
        return this.displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getEmail() {
        return this.email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public UserRole getRole() {
        return this.role;
    }

    public void setRole(UserRole role) {
        this.role = role;
    }

    public Set<String> getAllowedCategories() {
        return this.allowedCategories;
    }

    public void setAllowedCategories(Set<String> allowedCategories) {
        this.allowedCategories = allowedCategories;
    }

    public long getAccessVersion() {
        return this.accessVersion;
    }

    public void setAccessVersion(long accessVersion) {
        this.accessVersion = accessVersion;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public boolean isActive() {
        return this.active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isAdmin() {
        return this.role == UserRole.ADMIN;
    }

    public boolean hasPermission(UserRole.Permission permission) {
        return this.role != null && this.role.hasPermission(permission);
    }
}
