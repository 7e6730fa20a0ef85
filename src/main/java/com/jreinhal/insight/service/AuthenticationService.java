package com.jreinhal.insight.service;

import com.jreinhal.insight.model.User;
import jakarta.servlet.http.HttpServletRequest;

public interface AuthenticationService {
    public static final String OPERATOR_HEADER = "X-Operator-Id";

    /**
     * @return the active user behind the request, or null when it cannot be identified
     */
    public User authenticate(HttpServletRequest request);

    public String getAuthMode();
}
