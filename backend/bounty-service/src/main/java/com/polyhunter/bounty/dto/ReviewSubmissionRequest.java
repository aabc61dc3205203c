package com.polyhunter.bounty.dto;

import com.polyhunter.bounty.entity.ReviewAction;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for reviewing a submission
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewSubmissionRequest {

    @NotNull(message = "Action is required")
    private ReviewAction action;

    @Size(max = 2000, message = "Feedback must be at most 2000 characters")
    private String feedback;

    private Boolean awardQualityBonus;
}
