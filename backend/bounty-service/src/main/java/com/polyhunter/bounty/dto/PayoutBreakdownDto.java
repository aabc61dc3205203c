package com.polyhunter.bounty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for the amounts of an accepted submission
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayoutBreakdownDto {

    private long earnedAmountCents;
    private long speedBonusCents;
    private long qualityBonusCents;
    private long bonusCents;
    private long totalCents;
}
