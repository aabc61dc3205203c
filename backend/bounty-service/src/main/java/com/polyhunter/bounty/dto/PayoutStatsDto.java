package com.polyhunter.bounty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for ledger totals by payout status
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayoutStatsDto {

    private long pendingCents;
    private long pendingCount;
    private long processingCents;
    private long paidCents;
    private long heldCents;
}
