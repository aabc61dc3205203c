package com.polyhunter.bounty.service;

import com.polyhunter.bounty.dto.*;
import com.polyhunter.bounty.entity.Earning;
import com.polyhunter.bounty.entity.EarningStatus;
import com.polyhunter.bounty.exception.InvalidTransitionException;
import com.polyhunter.bounty.exception.NotFoundException;
import com.polyhunter.bounty.mappers.BountyDtoMapper;
import com.polyhunter.bounty.repository.EarningRepository;
import com.polyhunter.bounty.store.BountyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Earnings ledger: payout-status workflow and read-only aggregates.
 * <p>
 * Rows are only ever created by an accepted review. Amount and contributor never change here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EarningsLedgerService {

    private final BountyStore store;
    private final EarningRepository earningRepository;

    // ==================== Payout workflow ====================

    public Earning updateEarningStatus(UUID earningId, EarningStatus target) {
        Earning earning = store.findEarning(earningId)
                .orElseThrow(() -> NotFoundException.of("Earning", earningId));

        EarningStatus current = earning.getStatus();
        if (!current.canMoveTo(target)) {
            throw new InvalidTransitionException("Cannot move earning from " + current.getValue()
                    + " to " + target.getValue());
        }

        LocalDateTime paidAt = target == EarningStatus.PAID ? LocalDateTime.now() : null;
        int updated = store.compareAndSetEarningStatus(earningId, current, target, paidAt);
        if (updated == 0) {
            throw new InvalidTransitionException("Earning " + earningId + " changed status concurrently");
        }

        log.info("Earning {} moved {} -> {}", earningId, current.getValue(), target.getValue());
        return store.findEarning(earningId)
                .orElseThrow(() -> NotFoundException.of("Earning", earningId));
    }

    // ==================== Statistics ====================

    /**
     * Ledger totals for the payouts dashboard
     */
    @Transactional(readOnly = true)
    public PayoutStatsDto getPayoutStats() {
        PayoutStatsDto stats = new PayoutStatsDto();
        for (Object[] row : earningRepository.summarizeByStatus()) {
            EarningStatus status = (EarningStatus) row[0];
            long cents = ((Number) row[1]).longValue();
            switch (status) {
                case PENDING -> {
                    stats.setPendingCents(cents);
                    stats.setPendingCount(((Number) row[2]).longValue());
                }
                case PROCESSING -> stats.setProcessingCents(cents);
                case PAID -> stats.setPaidCents(cents);
                case HELD -> stats.setHeldCents(cents);
            }
        }
        return stats;
    }

    @Transactional(readOnly = true)
    public ContributorEarningsDto getContributorEarnings(UUID contributorId) {
        ContributorEarningsDto summary = ContributorEarningsDto.builder()
                .contributorId(contributorId)
                .build();
        for (Object[] row : earningRepository.summarizeByStatusForContributor(contributorId)) {
            EarningStatus status = (EarningStatus) row[0];
            long cents = ((Number) row[1]).longValue();
            summary.setTotalEarnedCents(summary.getTotalEarnedCents() + cents);
            switch (status) {
                case PENDING, PROCESSING -> summary.setPendingCents(summary.getPendingCents() + cents);
                case PAID -> summary.setPaidCents(cents);
                case HELD -> summary.setHeldCents(cents);
            }
        }
        return summary;
    }

    /**
     * Newest first; {@code page} is 1-based
     */
    @Transactional(readOnly = true)
    public EarningPageDto listEarnings(EarningStatus status, int page, int pageSize) {
        PageRequest pageRequest = PageRequest.of(Math.max(page, 1) - 1, pageSize,
                Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<Earning> result = status != null
                ? earningRepository.findByStatus(status, pageRequest)
                : earningRepository.findAll(pageRequest);

        List<EarningDto> earnings = result.getContent().stream()
                .map(BountyDtoMapper::toDto)
                .collect(Collectors.toList());

        return EarningPageDto.builder()
                .earnings(earnings)
                .total(result.getTotalElements())
                .page(Math.max(page, 1))
                .pageSize(pageSize)
                .build();
    }
}
