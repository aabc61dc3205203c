package com.polyhunter.bounty.service;

import com.polyhunter.bounty.entity.BountySubmission;
import com.polyhunter.bounty.entity.Earning;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a review. {@code earning} and {@code payout} are set only for acceptances.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReviewOutcome {

    private BountySubmission submission;
    private Earning earning;
    private Payout payout;
    private boolean requestFulfilled;
}
