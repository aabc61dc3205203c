package com.polyhunter.bounty.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Amounts owed for one accepted submission, in cents. Sums throw {@link ArithmeticException} on overflow.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Payout {

    private long earnedAmountCents;
    private long speedBonusCents;
    private long qualityBonusCents;

    public long getBonusCents() {
        return Math.addExact(speedBonusCents, qualityBonusCents);
    }

    public long getTotalCents() {
        return Math.addExact(earnedAmountCents, getBonusCents());
    }
}
