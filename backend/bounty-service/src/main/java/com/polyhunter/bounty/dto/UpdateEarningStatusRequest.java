package com.polyhunter.bounty.dto;

import com.polyhunter.bounty.entity.EarningStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for moving an earning through the payout workflow
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateEarningStatusRequest {

    @NotNull(message = "Status is required")
    private EarningStatus status;
}
