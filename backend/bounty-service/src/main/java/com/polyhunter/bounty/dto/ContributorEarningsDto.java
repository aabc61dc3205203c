package com.polyhunter.bounty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.UUID;

/**
 * DTO for a contributor's earnings summary
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContributorEarningsDto {

    private UUID contributorId;
    private long totalEarnedCents;
    // pending + processing
    private long pendingCents;
    private long paidCents;
    private long heldCents;
}
