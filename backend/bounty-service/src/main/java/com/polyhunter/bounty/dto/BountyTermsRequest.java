package com.polyhunter.bounty.dto;

import com.polyhunter.bounty.entity.PayType;
import com.polyhunter.bounty.entity.RequestStatus;
import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * Request DTO for creating or editing a bounty request
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BountyTermsRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must be at most 200 characters")
    private String title;

    @NotBlank(message = "Description is required")
    private String description;

    @Size(max = 40, message = "Category must be at most 40 characters")
    private String category;

    // Honoured only on create, and only draft or pending_review
    private RequestStatus status;

    @NotNull(message = "Pay type is required")
    private PayType payType;

    @NotNull(message = "Pay amount is required")
    @Positive(message = "Pay amount must be positive")
    private Long payAmountCents;

    @PositiveOrZero(message = "Speed bonus cannot be negative")
    private Long speedBonusCents;

    private LocalDateTime speedBonusDeadline;

    @PositiveOrZero(message = "Quality bonus cannot be negative")
    private Long qualityBonusCents;

    @NotNull(message = "Budget is required")
    @Positive(message = "Budget must be positive")
    private Long budgetTotalCents;

    @NotNull(message = "Quantity needed is required")
    @Positive(message = "Quantity needed must be positive")
    private Integer quantityNeeded;
}
