package com.polyhunter.bounty.config;

import com.polyhunter.bounty.access.AdminAccessGuard;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration. Documents the identity headers as API-key schemes so the
 * Swagger UI can send them.
 */
@Configuration
public class OpenApiConfig {

    private static final String ADMIN_ID_SCHEME = "adminId";
    private static final String ADMIN_ROLE_SCHEME = "adminRole";

    @Bean
    public OpenAPI bountyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Horus Bounty Admin API")
                        .description("Bounty request lifecycle, submission review and contributor earnings. "
                                + "Roles: reviewer < admin < super_admin.")
                        .version("1.0.0"))
                .components(new Components()
                        .addSecuritySchemes(ADMIN_ID_SCHEME, headerScheme(AdminAccessGuard.ADMIN_ID_HEADER,
                                "UUID of the acting admin"))
                        .addSecuritySchemes(ADMIN_ROLE_SCHEME, headerScheme(AdminAccessGuard.ADMIN_ROLE_HEADER,
                                "reviewer, admin or super_admin")))
                .addSecurityItem(new SecurityRequirement()
                        .addList(ADMIN_ID_SCHEME)
                        .addList(ADMIN_ROLE_SCHEME));
    }

    private static SecurityScheme headerScheme(String header, String description) {
        return new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name(header)
                .description(description);
    }
}
