package com.jreinhal.insight.filter;

import com.jreinhal.insight.model.User;

/**
 * Thread-local holder for the user authenticated by {@link SecurityFilter}.
 */
public class SecurityContext {

    private static final ThreadLocal<User> currentUser = new ThreadLocal<>();

    public static void setCurrentUser(User user) {
        currentUser.set(user);
    }

    /**
     * @return the user, or null outside an authenticated request
     */
    public static User getCurrentUser() {
        return currentUser.get();
    }

    public static String getCurrentUserId() {
        User user = currentUser.get();
        return user != null ? user.getId() : "ANONYMOUS";
    }

    public static void clear() {
        currentUser.remove();
    }
}
