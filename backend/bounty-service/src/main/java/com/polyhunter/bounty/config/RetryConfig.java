package com.polyhunter.bounty.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for compensating writes
 */
@Configuration
public class RetryConfig {

    @Bean
    public RetryTemplate compensationRetryTemplate(BountyProperties properties) {
        BountyProperties.Compensation compensation = properties.getCompensation();
        return RetryTemplate.builder()
                .maxAttempts(compensation.getMaxAttempts())
                .exponentialBackoff(compensation.getInitialBackoffMs(), compensation.getMultiplier(),
                        compensation.getMaxBackoffMs())
                .retryOn(DataAccessException.class)
                .build();
    }
}
