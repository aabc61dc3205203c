package com.polyhunter.bounty.mappers;

import com.polyhunter.bounty.dto.*;
import com.polyhunter.bounty.entity.ActivityLogEntry;
import com.polyhunter.bounty.entity.BountyRequest;
import com.polyhunter.bounty.entity.BountySubmission;
import com.polyhunter.bounty.entity.Earning;
import com.polyhunter.bounty.entity.SubmissionImage;
import com.polyhunter.bounty.service.Payout;
import com.polyhunter.bounty.service.ReviewOutcome;

/**
 * Utility class for mapping between entities and API DTOs
 */
public class BountyDtoMapper {

    private BountyDtoMapper() {
        // Utility class - prevent instantiation
    }

    /**
     * Maps create/edit input to an unsaved request carrying only the terms
     */
    public static BountyRequest toEntity(BountyTermsRequest terms) {
        return BountyRequest.builder()
                .title(terms.getTitle())
                .description(terms.getDescription())
                .category(terms.getCategory())
                .status(terms.getStatus())
                .payType(terms.getPayType())
                .payAmountCents(terms.getPayAmountCents())
                .speedBonusCents(terms.getSpeedBonusCents())
                .speedBonusDeadline(terms.getSpeedBonusDeadline())
                .qualityBonusCents(terms.getQualityBonusCents())
                .budgetTotalCents(terms.getBudgetTotalCents())
                .quantityNeeded(terms.getQuantityNeeded())
                .build();
    }

    public static BountyRequestDto toDto(BountyRequest r) {
        return BountyRequestDto.builder()
                .id(r.getId())
                .createdBy(r.getCreatedBy())
                .title(r.getTitle())
                .description(r.getDescription())
                .category(r.getCategory())
                .status(r.getStatus())
                .payType(r.getPayType())
                .payAmountCents(r.getPayAmountCents())
                .speedBonusCents(r.getSpeedBonusCents())
                .speedBonusDeadline(r.getSpeedBonusDeadline())
                .qualityBonusCents(r.getQualityBonusCents())
                .budgetTotalCents(r.getBudgetTotalCents())
                .budgetSpentCents(r.getBudgetSpentCents())
                .budgetRemainingCents(r.getBudgetRemainingCents())
                .quantityNeeded(r.getQuantityNeeded())
                .quantityFulfilled(r.getQuantityFulfilled())
                .publishedAt(r.getPublishedAt())
                .reviewedBy(r.getReviewedBy())
                .reviewedAt(r.getReviewedAt())
                .createdAt(r.getCreatedAt())
                .updatedAt(r.getUpdatedAt())
                .build();
    }

    public static SubmissionDto toDto(BountySubmission s) {
        return SubmissionDto.builder()
                .id(s.getId())
                .requestId(s.getRequestId())
                .contributorId(s.getContributorId())
                .status(s.getStatus())
                .reviewedBy(s.getReviewedBy())
                .reviewedAt(s.getReviewedAt())
                .reviewFeedback(s.getReviewFeedback())
                .earnedAmountCents(s.getEarnedAmountCents())
                .bonusAmountCents(s.getBonusAmountCents())
                .earningId(s.getEarningId())
                .submittedAt(s.getSubmittedAt())
                .build();
    }

    /**
     * Listing form, with the image count and the owning request's title
     */
    public static SubmissionDto toDto(BountySubmission s, long imageCount, String requestTitle) {
        SubmissionDto dto = toDto(s);
        dto.setImageCount(imageCount);
        dto.setRequestTitle(requestTitle);
        return dto;
    }

    public static SubmissionImageDto toDto(SubmissionImage image) {
        return SubmissionImageDto.builder()
                .id(image.getId())
                .filePath(image.getFilePath())
                .createdAt(image.getCreatedAt())
                .build();
    }

    public static ActivityEntryDto toDto(ActivityLogEntry entry) {
        return ActivityEntryDto.builder()
                .id(entry.getId())
                .action(entry.getAction())
                .description(entry.getDescription())
                .metadata(entry.getMetadata())
                .createdAt(entry.getCreatedAt())
                .build();
    }

    public static EarningDto toDto(Earning e) {
        return EarningDto.builder()
                .id(e.getId())
                .contributorId(e.getContributorId())
                .amountCents(e.getAmountCents())
                .currency(e.getCurrency())
                .status(e.getStatus())
                .description(e.getDescription())
                .paidAt(e.getPaidAt())
                .createdAt(e.getCreatedAt())
                .build();
    }

    public static PayoutBreakdownDto toDto(Payout p) {
        return PayoutBreakdownDto.builder()
                .earnedAmountCents(p.getEarnedAmountCents())
                .speedBonusCents(p.getSpeedBonusCents())
                .qualityBonusCents(p.getQualityBonusCents())
                .bonusCents(p.getBonusCents())
                .totalCents(p.getTotalCents())
                .build();
    }

    public static ReviewResultDto toDto(ReviewOutcome outcome) {
        return ReviewResultDto.builder()
                .submission(toDto(outcome.getSubmission()))
                .earning(outcome.getEarning() != null ? toDto(outcome.getEarning()) : null)
                .payout(outcome.getPayout() != null ? toDto(outcome.getPayout()) : null)
                .requestFulfilled(outcome.isRequestFulfilled())
                .build();
    }
}
