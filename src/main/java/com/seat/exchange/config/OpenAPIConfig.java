package com.seat.exchange.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;


@Configuration
public class OpenAPIConfig {
    /**
     * Documents the caller identity header set by the gateway and the admin shared secret.
     *
     * @return the open api
     */
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info().title("Seat Exchange API").version("v1"))
                .addSecurityItem(new SecurityRequirement()
                        .addList("UserId")
                        .addList("AdminKey"))
                .components(new Components()
                        .addSecuritySchemes("UserId",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.HEADER)
                                        .name("X-User-Id")
                                        .description("Caller identity, set by the upstream gateway"))
                        .addSecuritySchemes("AdminKey",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.HEADER)
                                        .name("X-Admin-Key")
                                        .description("Shared secret for /api/admin endpoints")));
    }
}
