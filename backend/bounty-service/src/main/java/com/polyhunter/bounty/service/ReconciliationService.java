package com.polyhunter.bounty.service;

import com.polyhunter.bounty.config.BountyProperties;
import com.polyhunter.bounty.dto.EarningDto;
import com.polyhunter.bounty.dto.ReconciliationReportDto;
import com.polyhunter.bounty.dto.RequestDriftDto;
import com.polyhunter.bounty.entity.BountyRequest;
import com.polyhunter.bounty.entity.SubmissionStatus;
import com.polyhunter.bounty.mappers.BountyDtoMapper;
import com.polyhunter.bounty.repository.BountyRequestRepository;
import com.polyhunter.bounty.repository.BountySubmissionRepository;
import com.polyhunter.bounty.repository.EarningRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Checks request counters against accepted submissions and looks for earnings no submission
 * references. Reports only; never repairs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final BountyRequestRepository requestRepository;
    private final BountySubmissionRepository submissionRepository;
    private final EarningRepository earningRepository;
    private final BountyProperties properties;

    @Transactional(readOnly = true)
    public ReconciliationReportDto reconcile() {
        LocalDateTime now = LocalDateTime.now();

        Map<UUID, long[]> accepted = new HashMap<>();
        for (Object[] row : submissionRepository.summarizeByRequest(SubmissionStatus.ACCEPTED)) {
            accepted.put((UUID) row[0], new long[] {
                    ((Number) row[1]).longValue(),
                    ((Number) row[2]).longValue()
            });
        }

        List<BountyRequest> requests = requestRepository.findAll();
        List<RequestDriftDto> drifts = new ArrayList<>();
        for (BountyRequest request : requests) {
            long[] totals = accepted.getOrDefault(request.getId(), new long[] { 0, 0 });
            if (totals[0] != request.getQuantityFulfilled() || totals[1] != request.getBudgetSpentCents()) {
                drifts.add(RequestDriftDto.builder()
                        .requestId(request.getId())
                        .quantityFulfilled(request.getQuantityFulfilled())
                        .acceptedCount(totals[0])
                        .budgetSpentCents(request.getBudgetSpentCents())
                        .acceptedPayoutCents(totals[1])
                        .build());
            }
        }

        LocalDateTime cutoff = now.minus(properties.getReconciliation().getOrphanGracePeriod());
        List<EarningDto> orphans = earningRepository.findUnreferencedCreatedBefore(cutoff).stream()
                .map(BountyDtoMapper::toDto)
                .collect(Collectors.toList());

        if (!drifts.isEmpty() || !orphans.isEmpty()) {
            log.warn("Reconciliation found {} drifting requests and {} orphaned earnings",
                    drifts.size(), orphans.size());
        } else {
            log.info("Reconciliation checked {} requests, ledger consistent", requests.size());
        }

        return ReconciliationReportDto.builder()
                .generatedAt(now)
                .requestsChecked(requests.size())
                .drifts(drifts)
                .orphanedEarnings(orphans)
                .build();
    }
}
