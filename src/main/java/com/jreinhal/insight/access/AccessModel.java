package com.jreinhal.insight.access;

import com.jreinhal.insight.model.User;
import com.jreinhal.insight.repository.UserRepository;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves which review categories a user may see.
 *
 * <p>Every method re-reads the user record from the store. The {@link User} passed in
 * only identifies the caller; its role, grant and version fields are never trusted,
 * so a grant change made by an admin is visible to the very next call.</p>
 */
@Service
public class AccessModel {
    private static final Logger log = LoggerFactory.getLogger(AccessModel.class);
    public static final long UNRESOLVED_VERSION = -1L;

    private final UserRepository userRepository;
    private final CategoryCatalog categoryCatalog;

    public AccessModel(UserRepository userRepository, CategoryCatalog categoryCatalog) {
        this.userRepository = userRepository;
        this.categoryCatalog = categoryCatalog;
    }

    public AccessDecision authorize(User user, String category) {
        if (category == null || category.isBlank()) {
            return AccessDecision.DENIED;
        }
        Optional<User> current = this.resolve(user);
        if (current.isEmpty()) {
            return AccessDecision.DENIED;
        }
        User fresh = current.get();
        if (fresh.isAdmin()) {
            return AccessDecision.ALLOWED;
        }
        Set<String> granted = fresh.getAllowedCategories();
        return granted != null && granted.contains(category) ? AccessDecision.ALLOWED : AccessDecision.DENIED;
    }

    public Set<String> resolveVisibleCategories(User user) {
        Optional<User> current = this.resolve(user);
        if (current.isEmpty()) {
            return Set.of();
        }
        User fresh = current.get();
        if (fresh.isAdmin()) {
            return this.categoryCatalog.allCategoryNames();
        }
        Set<String> granted = fresh.getAllowedCategories();
        if (granted == null || granted.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new TreeSet<String>(granted));
    }

    public long currentAccessVersion(User user) {
        return this.resolve(user).map(User::getAccessVersion).orElse(UNRESOLVED_VERSION);
    }

    public CategoryGrant grantFor(User user) {
        Optional<User> current = this.resolve(user);
        if (current.isEmpty()) {
            return new CategoryGrant(user != null ? user.getId() : null, null, Set.of(), UNRESOLVED_VERSION, false);
        }
        User fresh = current.get();
        Set<String> categories = fresh.getAllowedCategories() == null ? Set.of() : fresh.getAllowedCategories();
        return new CategoryGrant(fresh.getId(), fresh.getRole(), categories, fresh.getAccessVersion(), fresh.isAdmin());
    }

    private Optional<User> resolve(User user) {
        if (user == null || user.getId() == null) {
            return Optional.empty();
        }
        Optional<User> found = this.userRepository.findById(user.getId());
        if (found.isEmpty()) {
            log.debug("Access check for unknown user {}", user.getId());
            return Optional.empty();
        }
        if (!found.get().isActive()) {
            log.debug("Access check for deactivated user {}", user.getId());
            return Optional.empty();
        }
        return found;
    }
}
