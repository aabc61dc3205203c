package com.polyhunter.bounty.dto;

import com.polyhunter.bounty.entity.PayType;
import com.polyhunter.bounty.entity.RequestStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for bounty request info
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BountyRequestDto {

    private UUID id;
    private UUID createdBy;
    private String title;
    private String description;
    private String category;
    private RequestStatus status;
    private PayType payType;
    private long payAmountCents;
    private long speedBonusCents;
    private LocalDateTime speedBonusDeadline;
    private long qualityBonusCents;
    private long budgetTotalCents;
    private long budgetSpentCents;
    private long budgetRemainingCents;
    private int quantityNeeded;
    private int quantityFulfilled;
    private LocalDateTime publishedAt;
    private UUID reviewedBy;
    private LocalDateTime reviewedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
