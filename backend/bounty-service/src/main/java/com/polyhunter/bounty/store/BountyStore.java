package com.polyhunter.bounty.store;

import com.polyhunter.bounty.entity.*;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Row access to requests, submissions and earnings.
 * <p>
 * Every call is atomic on its own; nothing here spans several statements. Conditional updates
 * return the number of rows they changed, so zero means the guard did not match.
 */
public interface BountyStore {

    // ==================== Requests ====================

    Optional<BountyRequest> findRequest(UUID requestId);

    BountyRequest insertRequest(BountyRequest request);

    int transitionRequest(UUID requestId, Collection<RequestStatus> allowedFrom, RequestStatus target,
                          LocalDateTime now);

    int publishRequest(UUID requestId, Collection<RequestStatus> allowedFrom, UUID adminId, LocalDateTime now);

    int updateRequestTerms(UUID requestId, BountyRequest terms, Collection<RequestStatus> editable,
                           LocalDateTime now);

    /**
     * Set new counters and status only if the row still holds the version and counters in
     * {@code expected} and is still in one of {@code reviewable}.
     */
    int compareAndSetCounters(BountyRequest expected, long newSpentCents, int newFulfilled,
                              RequestStatus newStatus, Collection<RequestStatus> reviewable, LocalDateTime now);

    // ==================== Submissions ====================

    Optional<BountySubmission> findSubmission(UUID submissionId);

    long countSubmissionImages(UUID submissionId);

    int closeSubmissionReview(UUID submissionId, SubmissionStatus target, UUID adminId, String feedback,
                              LocalDateTime now);

    int markSubmissionAccepted(UUID submissionId, UUID adminId, String feedback, long earnedCents,
                               long bonusCents, UUID earningId, LocalDateTime now);

    // ==================== Earnings ====================

    Optional<Earning> findEarning(UUID earningId);

    Earning insertEarning(Earning earning);

    /**
     * Delete an earning by id. Deleting a missing row is not an error.
     *
     * @return true if a row was removed
     */
    boolean deleteEarning(UUID earningId);

    int compareAndSetEarningStatus(UUID earningId, EarningStatus expected, EarningStatus target,
                                   LocalDateTime paidAt);
}
