package com.polyhunter.bounty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO returned from a review; earning and payout are present only on acceptance
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReviewResultDto {

    private SubmissionDto submission;
    private EarningDto earning;
    private PayoutBreakdownDto payout;
    private boolean requestFulfilled;
}
