package com.polyhunter.bounty.store;

import com.polyhunter.bounty.entity.*;
import com.polyhunter.bounty.repository.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link BountyStore} over Spring Data JPA. Each method is one repository call and so runs in
 * its own short transaction.
 */
@Component
@RequiredArgsConstructor
public class JpaBountyStore implements BountyStore {

    private final BountyRequestRepository requestRepository;
    private final BountySubmissionRepository submissionRepository;
    private final SubmissionImageRepository imageRepository;
    private final EarningRepository earningRepository;

    @Override
    public Optional<BountyRequest> findRequest(UUID requestId) {
        return requestRepository.findById(requestId);
    }

    @Override
    public BountyRequest insertRequest(BountyRequest request) {
        return requestRepository.save(request);
    }

    @Override
    public int transitionRequest(UUID requestId, Collection<RequestStatus> allowedFrom, RequestStatus target,
                                 LocalDateTime now) {
        return requestRepository.transitionStatus(requestId, allowedFrom, target, now);
    }

    @Override
    public int publishRequest(UUID requestId, Collection<RequestStatus> allowedFrom, UUID adminId,
                              LocalDateTime now) {
        return requestRepository.publish(requestId, allowedFrom, RequestStatus.PUBLISHED, adminId, now);
    }

    @Override
    public int updateRequestTerms(UUID requestId, BountyRequest terms, Collection<RequestStatus> editable,
                                  LocalDateTime now) {
        return requestRepository.updateTerms(requestId,
                terms.getTitle(),
                terms.getDescription(),
                terms.getCategory(),
                terms.getPayType(),
                terms.getPayAmountCents(),
                terms.getSpeedBonusCents(),
                terms.getSpeedBonusDeadline(),
                terms.getQualityBonusCents(),
                terms.getBudgetTotalCents(),
                terms.getQuantityNeeded(),
                editable,
                now);
    }

    @Override
    public int compareAndSetCounters(BountyRequest expected, long newSpentCents, int newFulfilled,
                                     RequestStatus newStatus, Collection<RequestStatus> reviewable,
                                     LocalDateTime now) {
        return requestRepository.compareAndSetCounters(expected.getId(),
                expected.getVersion(),
                expected.getBudgetSpentCents(),
                expected.getQuantityFulfilled(),
                newSpentCents,
                newFulfilled,
                newStatus,
                reviewable,
                now);
    }

    @Override
    public Optional<BountySubmission> findSubmission(UUID submissionId) {
        return submissionRepository.findById(submissionId);
    }

    @Override
    public long countSubmissionImages(UUID submissionId) {
        return imageRepository.countBySubmissionId(submissionId);
    }

    @Override
    public int closeSubmissionReview(UUID submissionId, SubmissionStatus target, UUID adminId, String feedback,
                                     LocalDateTime now) {
        return submissionRepository.closeReview(submissionId, SubmissionStatus.REVIEWABLE, target, adminId,
                feedback, now);
    }

    @Override
    public int markSubmissionAccepted(UUID submissionId, UUID adminId, String feedback, long earnedCents,
                                      long bonusCents, UUID earningId, LocalDateTime now) {
        return submissionRepository.markAccepted(submissionId, SubmissionStatus.REVIEWABLE,
                SubmissionStatus.ACCEPTED, adminId, feedback, earnedCents, bonusCents, earningId, now);
    }

    @Override
    public Optional<Earning> findEarning(UUID earningId) {
        return earningRepository.findById(earningId);
    }

    @Override
    public Earning insertEarning(Earning earning) {
        return earningRepository.save(earning);
    }

    @Override
    public boolean deleteEarning(UUID earningId) {
        return earningRepository.deleteByIdReturningCount(earningId) > 0;
    }

    @Override
    public int compareAndSetEarningStatus(UUID earningId, EarningStatus expected, EarningStatus target,
                                          LocalDateTime paidAt) {
        return earningRepository.compareAndSetStatus(earningId, expected, target, paidAt);
    }
}
