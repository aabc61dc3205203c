package com.polyhunter.bounty.config;

import com.polyhunter.bounty.access.AdminAccessGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.Arrays;

/**
 * CORS for the admin dashboard. Origins come from {@code bounty.cors.allowed-origins}; the identity
 * headers must be let through or every admin call fails preflight.
 */
@Configuration
@RequiredArgsConstructor
public class CorsConfig {

    private final BountyProperties properties;

    @Bean
    public CorsFilter adminCorsFilter() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowCredentials(true);
        config.setAllowedOrigins(properties.getCors().getAllowedOrigins());
        config.setAllowedHeaders(Arrays.asList(
                "Content-Type",
                "Accept",
                AdminAccessGuard.ADMIN_ID_HEADER,
                AdminAccessGuard.ADMIN_ROLE_HEADER));
        config.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "OPTIONS"));
        config.setMaxAge(properties.getCors().getMaxAge().getSeconds());

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/admin/**", config);

        return new CorsFilter(source);
    }
}
