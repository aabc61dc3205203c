package com.polyhunter.bounty.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Service settings bound from the {@code bounty.*} keys of application.yml
 */
@Data
@ConfigurationProperties(prefix = "bounty")
public class BountyProperties {

    /**
     * Upper bound on rows returned by list endpoints
     */
    private int listLimit = 200;

    private Compensation compensation = new Compensation();

    private Reconciliation reconciliation = new Reconciliation();

    private Cors cors = new Cors();

    @Data
    public static class Compensation {
        private int maxAttempts = 3;
        private long initialBackoffMs = 100;
        private double multiplier = 2.0;
        private long maxBackoffMs = 1000;
    }

    @Data
    public static class Reconciliation {
        /**
         * Unreferenced earnings younger than this may belong to a review still in flight
         */
        private Duration orphanGracePeriod = Duration.ofMinutes(5);
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
        private Duration maxAge = Duration.ofHours(1);
    }
}
