package com.jreinhal.insight.filter;

import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.service.AuditService;
import com.jreinhal.insight.service.AuthenticationService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(value=2)
public class SecurityFilter
extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(SecurityFilter.class);
    private final AuthenticationService authService;
    private final AuditService auditService;

    // API documentation, readable without credentials via GET/HEAD only.
    private static final String[] PUBLIC_DOC_PATHS = new String[]{
            "/v3/api-docs",
            "/swagger-ui/",
            "/swagger-ui.html"
    };

    public SecurityFilter(AuthenticationService authService, AuditService auditService) {
        this.authService = authService;
        this.auditService = auditService;
        log.info("Security filter initialized with auth mode: {}", authService.getAuthMode());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path != null && this.isIdempotentMethod(request) && this.isPublicDocPath(path);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest httpRequest, HttpServletResponse httpResponse, FilterChain chain) throws IOException, ServletException {
        String path = httpRequest.getRequestURI();
        User user = this.authService.authenticate(httpRequest);
        if (user == null) {
            log.warn("Authentication failed for path: {} from IP: {}", path, httpRequest.getRemoteAddr());
            this.auditService.logAuthFailure(httpRequest.getHeader(AuthenticationService.OPERATOR_HEADER), "No valid credentials", httpRequest);
            httpResponse.setStatus(401);
            httpResponse.setContentType("application/json");
            httpResponse.getWriter().write("{\"error\":\"Authentication required\"}");
            return;
        }
        SecurityContext.setCurrentUser(user);
        httpRequest.setAttribute("authenticatedUser", user);
        this.setSpringSecurityContext(user);
        try {
            chain.doFilter(httpRequest, httpResponse);
        }
        finally {
            SecurityContext.clear();
            SecurityContextHolder.clearContext();
        }
    }

    private boolean isPublicDocPath(String path) {
        for (String docPath : PUBLIC_DOC_PATHS) {
            if (docPath.endsWith("/") ? path.startsWith(docPath) : (path.equals(docPath) || path.startsWith(docPath + "/"))) {
                return true;
            }
        }
        return false;
    }

    private boolean isIdempotentMethod(HttpServletRequest request) {
        String method = request.getMethod();
        if (method == null) {
            return false;
        }
        String m = method.toUpperCase(Locale.ROOT);
        return "GET".equals(m) || "HEAD".equals(m);
    }

    private void setSpringSecurityContext(User user) {
        org.springframework.security.core.context.SecurityContext context = SecurityContextHolder.getContext();
        if (context.getAuthentication() != null && context.getAuthentication().isAuthenticated()) {
            return;
        }
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(user, null, buildAuthorities(user));
        context.setAuthentication(auth);
    }

    static Collection<GrantedAuthority> buildAuthorities(User user) {
        ArrayList<GrantedAuthority> authorities = new ArrayList<GrantedAuthority>();
        UserRole role = user.getRole();
        if (role == null) {
            return authorities;
        }
        authorities.add(new SimpleGrantedAuthority(role.name()));
        authorities.add(new SimpleGrantedAuthority("ROLE_" + role.name()));
        for (UserRole.Permission permission : role.getPermissions()) {
            authorities.add(new SimpleGrantedAuthority("PERM_" + permission.name()));
        }
        return authorities;
    }
}
