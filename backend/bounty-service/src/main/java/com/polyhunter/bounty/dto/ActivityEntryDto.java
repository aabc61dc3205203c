package com.polyhunter.bounty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for a contributor activity feed entry
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActivityEntryDto {

    private UUID id;
    private String action;
    private String description;
    // JSON object as stored
    private String metadata;
    private LocalDateTime createdAt;
}
