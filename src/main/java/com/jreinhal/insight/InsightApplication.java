package com.jreinhal.insight;

import jakarta.annotation.PostConstruct;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class InsightApplication {
    private static final Logger log = LoggerFactory.getLogger(InsightApplication.class);
    private final Environment environment;

    public InsightApplication(Environment environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(InsightApplication.class, args);
    }

    @PostConstruct
    public void validateSecurityConfiguration() {
        String authMode = this.environment.getProperty("app.auth-mode", "HEADER");
        boolean allowRemote = Boolean.parseBoolean(this.environment.getProperty("app.auth.allow-remote", "false"));
        boolean isDevProfile = Arrays.stream(this.environment.getActiveProfiles()).anyMatch(profile -> "dev".equalsIgnoreCase(profile));
        if (isDevProfile && allowRemote) {
            log.warn("=================================================================");
            log.warn("  WARNING: dev profile with remote header authentication");
            log.warn("=================================================================");
            log.warn("  Any host that can reach this service can act as any user by");
            log.warn("  setting the X-Operator-Id header. Use the standard profile");
            log.warn("  behind an authenticating gateway instead.");
            log.warn("=================================================================");
        }
        log.info("Security configuration validated:");
        log.info("  Auth Mode: {}", authMode);
        log.info("  Profiles: {}", String.join(",", this.environment.getActiveProfiles()));
        log.info("  Remote header auth: {}", allowRemote);
    }
}
