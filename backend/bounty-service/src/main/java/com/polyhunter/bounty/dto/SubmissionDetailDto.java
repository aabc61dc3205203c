package com.polyhunter.bounty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.List;

/**
 * DTO for the review screen: the submission, its request title and its images oldest first
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubmissionDetailDto {

    private SubmissionDto submission;
    private String requestTitle;
    private List<SubmissionImageDto> images;
}
