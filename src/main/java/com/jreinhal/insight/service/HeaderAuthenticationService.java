package com.jreinhal.insight.service;

import com.jreinhal.insight.model.User;
import com.jreinhal.insight.repository.UserRepository;
import com.jreinhal.insight.util.LogSanitizer;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Trusts the {@code X-Operator-Id} header set by the fronting gateway. The header names the
 * username of a provisioned, active account; no accounts are created here.
 */
@Service
@ConditionalOnProperty(name={"app.auth-mode"}, havingValue="HEADER", matchIfMissing=true)
public class HeaderAuthenticationService
implements AuthenticationService {
    private static final Logger log = LoggerFactory.getLogger(HeaderAuthenticationService.class);
    private final UserRepository userRepository;
    @Value("${app.auth.allow-remote:false}")
    private boolean allowRemote;

    public HeaderAuthenticationService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public User authenticate(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!this.allowRemote && remoteAddr != null && !isLoopback(remoteAddr)) {
            log.error("Header auth blocked for remote address: {}", remoteAddr);
            return null;
        }
        String operatorId = request.getHeader(OPERATOR_HEADER);
        if (operatorId == null || operatorId.isBlank()) {
            return null;
        }
        Optional<User> user = this.userRepository.findByUsername(operatorId.trim());
        if (user.isEmpty() || !user.get().isActive()) {
            log.debug("No active user for operator id {}", LogSanitizer.sanitize(operatorId));
            return null;
        }
        return user.get();
    }

    @Override
    public String getAuthMode() {
        return "HEADER";
    }

    private static boolean isLoopback(String address) {
        return address.equals("127.0.0.1") || address.equals("::1") || address.equals("0:0:0:0:0:0:0:1");
    }
}
