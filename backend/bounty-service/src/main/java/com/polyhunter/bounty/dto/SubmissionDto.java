package com.polyhunter.bounty.dto;

import com.polyhunter.bounty.entity.SubmissionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for submission info
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubmissionDto {

    private UUID id;
    private UUID requestId;
    private UUID contributorId;
    private SubmissionStatus status;
    private UUID reviewedBy;
    private LocalDateTime reviewedAt;
    private String reviewFeedback;
    private long earnedAmountCents;
    private long bonusAmountCents;
    private UUID earningId;
    private LocalDateTime submittedAt;

    // Listings only
    private Long imageCount;
    private String requestTitle;
}
