package com.polyhunter.bounty.dto;

import com.polyhunter.bounty.entity.EarningStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for earning info
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EarningDto {

    private UUID id;
    private UUID contributorId;
    private long amountCents;
    private String currency;
    private EarningStatus status;
    private String description;
    private LocalDateTime paidAt;
    private LocalDateTime createdAt;
}
