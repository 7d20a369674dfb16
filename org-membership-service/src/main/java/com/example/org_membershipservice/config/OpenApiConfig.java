package com.example.org_membershipservice.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration for the Org Membership Service.
 */
@Configuration
public class OpenApiConfig {

    private static final String SECURITY_SCHEME_NAME = "bearerAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Org Membership Service API")
                        .version("1.0.0")
                        .description("""
                            Organizational hierarchy, invites and memberships.

                            ## Authentication
                            All endpoints require a JWT except health checks.
                            Send it as `Authorization: Bearer <token>`.

                            ## Global roles
                            - **DEV**: may create the root council
                            - **ADMIN**: sees every unit and acts with coordinator authority

                            ## Unit roles (per membership)
                            - **COORDINATOR**: manages the unit, its members and invites
                            - **MEMBER**: regular member
                            """))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("JWT token from identity-service")));
    }
}
