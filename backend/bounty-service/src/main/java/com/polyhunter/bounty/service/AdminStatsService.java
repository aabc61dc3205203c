package com.polyhunter.bounty.service;

import com.polyhunter.bounty.dto.AdminStatsDto;
import com.polyhunter.bounty.entity.RequestStatus;
import com.polyhunter.bounty.entity.SubmissionStatus;
import com.polyhunter.bounty.repository.BountyRequestRepository;
import com.polyhunter.bounty.repository.BountySubmissionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Counters for the admin dashboard
 */
@Service
@RequiredArgsConstructor
public class AdminStatsService {

    private final BountyRequestRepository requestRepository;
    private final BountySubmissionRepository submissionRepository;

    @Transactional(readOnly = true)
    public AdminStatsDto getAdminStats() {
        return AdminStatsDto.builder()
                .totalRequests(requestRepository.count())
                .draftRequests(requestRepository.countByStatus(RequestStatus.DRAFT))
                .publishedRequests(requestRepository.countByStatus(RequestStatus.PUBLISHED))
                .pausedRequests(requestRepository.countByStatus(RequestStatus.PAUSED))
                .fulfilledRequests(requestRepository.countByStatus(RequestStatus.FULFILLED))
                .pendingReviews(submissionRepository.countByStatus(SubmissionStatus.SUBMITTED))
                .totalSubmissions(submissionRepository.count())
                .budgetTotalCents(requestRepository.sumBudgetTotalCents())
                .budgetSpentCents(requestRepository.sumBudgetSpentCents())
                .build();
    }
}
