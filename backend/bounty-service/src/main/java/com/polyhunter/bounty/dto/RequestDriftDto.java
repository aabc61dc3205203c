package com.polyhunter.bounty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.UUID;

/**
 * DTO for a request whose counters disagree with its accepted submissions
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestDriftDto {

    private UUID requestId;
    private long budgetSpentCents;
    private long acceptedPayoutCents;
    private int quantityFulfilled;
    private long acceptedCount;
}
