package com.ontheform.shared.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups and the HTTP Basic scheme referenced by admin controllers.
 */
@Configuration
@OpenAPIDefinition(info = @Info(title = "OnTheForm API", version = "v1"))
@SecurityScheme(name = "basicAuth", type = SecuritySchemeType.HTTP, scheme = "basic")
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi formsGroup() {
        return GroupedOpenApi.builder()
                .group("forms")
                .displayName("Forms")
                .pathsToMatch("/api/v1/forms/**", "/api/v1/public/forms/**")
                .build();
    }

    @Bean
    public GroupedOpenApi submissionsGroup() {
        return GroupedOpenApi.builder()
                .group("submissions")
                .displayName("Submissions & Export")
                .pathsToMatch("/api/v1/submissions/**")
                .build();
    }

    @Bean
    public GroupedOpenApi dashboardGroup() {
        return GroupedOpenApi.builder()
                .group("dashboard")
                .displayName("Dashboard")
                .pathsToMatch("/api/v1/dashboard/**")
                .build();
    }
}
