package com.jreinhal.insight.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger UI at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${app.auth-mode:HEADER}")
    private String authMode;

    @Bean
    public OpenAPI insightOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Review Insight API")
                        .description("""
                                Conversational analytics over categorized product reviews.

                                Each message is routed to one analytics tool, validated against the
                                caller's category grant, executed and answered in plain text. Rejected
                                requests are answered by a safe fallback tool and flagged as such.

                                ## Current auth mode: `%s`
                                """.formatted(this.authMode))
                        .version("1.0.0"))
                .components(new Components()
                        .addSecuritySchemes("operatorHeader", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Operator-Id")
                                .description("Username of a provisioned account")))
                .security(List.of(new SecurityRequirement().addList("operatorHeader")))
                .tags(List.of(
                        new Tag().name("Conversations").description("Conversations and analytics messages"),
                        new Tag().name("Categories").description("Categories visible to the caller"),
                        new Tag().name("Admin").description("Traces, grants and sentiment backfill")));
    }
}
