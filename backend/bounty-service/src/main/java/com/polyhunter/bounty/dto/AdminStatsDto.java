package com.polyhunter.bounty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for admin dashboard stats
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdminStatsDto {

    private long totalRequests;
    private long draftRequests;
    private long publishedRequests;
    private long pausedRequests;
    private long fulfilledRequests;
    private long pendingReviews;
    private long totalSubmissions;
    private long budgetTotalCents;
    private long budgetSpentCents;
}
