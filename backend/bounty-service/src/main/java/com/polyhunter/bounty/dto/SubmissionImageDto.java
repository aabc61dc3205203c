package com.polyhunter.bounty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for one stored image of a submission
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubmissionImageDto {

    private UUID id;
    private String filePath;
    private LocalDateTime createdAt;
}
