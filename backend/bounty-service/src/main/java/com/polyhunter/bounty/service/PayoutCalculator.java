package com.polyhunter.bounty.service;

import com.polyhunter.bounty.entity.BountyRequest;
import com.polyhunter.bounty.entity.BountySubmission;
import com.polyhunter.bounty.entity.PayType;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Computes what an accepted submission earns from the request's pay terms. Pure: no I/O, no clock.
 */
@Component
public class PayoutCalculator {

    public Payout computePayout(BountyRequest request, BountySubmission submission, long imageCount,
                                boolean awardQualityBonus) {
        long payAmount = orZero(request.getPayAmountCents());
        long earned = request.getPayType() == PayType.PER_IMAGE
                ? Math.multiplyExact(payAmount, imageCount)
                : payAmount;

        long speedBonus = qualifiesForSpeedBonus(request, submission.getSubmittedAt())
                ? request.getSpeedBonusCents()
                : 0;

        // Never inferred; only an explicit award counts
        long qualityBonus = awardQualityBonus ? orZero(request.getQualityBonusCents()) : 0;

        return Payout.builder()
                .earnedAmountCents(earned)
                .speedBonusCents(speedBonus)
                .qualityBonusCents(qualityBonus)
                .build();
    }

    /**
     * A submission made exactly at the deadline does not qualify
     */
    public boolean qualifiesForSpeedBonus(BountyRequest request, LocalDateTime submittedAt) {
        return orZero(request.getSpeedBonusCents()) > 0
                && request.getSpeedBonusDeadline() != null
                && submittedAt != null
                && submittedAt.isBefore(request.getSpeedBonusDeadline());
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
