package com.polyhunter.bounty.service;

import com.polyhunter.bounty.entity.*;
import com.polyhunter.bounty.exception.*;
import com.polyhunter.bounty.notification.ActivityNotifier;
import com.polyhunter.bounty.store.BountyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Accepts, rejects or returns submissions for revision.
 * <p>
 * Acceptance touches three rows without a shared transaction. The earning is inserted first and is
 * provisional until the request counters advance through a compare-and-swap; any failure before that
 * deletes it again. The submission is flipped to accepted only after the counters have moved.
 * Not {@code @Transactional}: every store call commits on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionReviewService {

    private final BountyStore store;
    private final PayoutCalculator payoutCalculator;
    private final ActivityNotifier activityNotifier;
    private final RetryTemplate compensationRetryTemplate;

    public ReviewOutcome review(UUID submissionId, ReviewAction action, String feedback, UUID adminId,
                                boolean awardQualityBonus) {
        BountySubmission submission = store.findSubmission(submissionId)
                .orElseThrow(() -> NotFoundException.of("Submission", submissionId));

        if (!SubmissionStatus.REVIEWABLE.contains(submission.getStatus())) {
            throw new NotReviewableException("Submission " + submissionId + " is not reviewable (status: "
                    + submission.getStatus().getValue() + ")");
        }

        BountyRequest request = store.findRequest(submission.getRequestId())
                .orElseThrow(() -> NotFoundException.of("Bounty request", submission.getRequestId()));

        if (!RequestStatus.REVIEWABLE.contains(request.getStatus())) {
            throw new NotReviewableException("Cannot review submissions for a "
                    + request.getStatus().getValue() + " request");
        }

        String reviewFeedback = StringUtils.hasText(feedback) ? feedback.trim() : null;
        LocalDateTime now = LocalDateTime.now();

        if (action == ReviewAction.ACCEPT) {
            return accept(submission, request, reviewFeedback, adminId, awardQualityBonus, now);
        }
        return closeWithoutPayout(submission, action, reviewFeedback, adminId, now);
    }

    // ==================== Accept ====================

    private ReviewOutcome accept(BountySubmission submission, BountyRequest request, String feedback,
                                 UUID adminId, boolean awardQualityBonus, LocalDateTime now) {
        UUID submissionId = submission.getId();

        int newFulfilled = request.getQuantityFulfilled() + 1;
        if (newFulfilled > request.getQuantityNeeded()) {
            throw new NotReviewableException("Request " + request.getId() + " already has all "
                    + request.getQuantityNeeded() + " accepted submissions it needs");
        }

        long imageCount = request.getPayType() == PayType.PER_IMAGE
                ? store.countSubmissionImages(submissionId)
                : 0;
        Payout payout = payoutCalculator.computePayout(request, submission, imageCount, awardQualityBonus);
        // Overflow surfaces here, before anything is written
        long totalCents = payout.getTotalCents();
        long newBudgetSpent = Math.addExact(request.getBudgetSpentCents(), totalCents);

        Earning earning = store.insertEarning(Earning.builder()
                .contributorId(submission.getContributorId())
                .amountCents(totalCents)
                .status(EarningStatus.PENDING)
                .description("Bounty: " + request.getId())
                .periodStart(now.toLocalDate())
                .periodEnd(now.toLocalDate())
                .createdAt(now)
                .build());

        if (newBudgetSpent > request.getBudgetTotalCents()) {
            rollBackEarning(earning.getId(), submissionId);
            log.warn("Rejected acceptance of submission {}: {} cents would exceed budget of {} on request {}",
                    submissionId, newBudgetSpent, request.getBudgetTotalCents(), request.getId());
            throw new BudgetExceededException(newBudgetSpent, request.getBudgetTotalCents());
        }

        boolean fulfills = newFulfilled >= request.getQuantityNeeded();
        RequestStatus newStatus = fulfills ? RequestStatus.FULFILLED : request.getStatus();

        int advanced = store.compareAndSetCounters(request, newBudgetSpent, newFulfilled, newStatus,
                RequestStatus.REVIEWABLE, now);
        if (advanced == 0) {
            rollBackEarning(earning.getId(), submissionId);
            log.warn("Lost counter update race on request {} while accepting submission {}",
                    request.getId(), submissionId);
            throw new ConcurrentReviewException();
        }

        int accepted = store.markSubmissionAccepted(submissionId, adminId, feedback,
                payout.getEarnedAmountCents(), payout.getBonusCents(), earning.getId(), now);
        if (accepted == 0) {
            // Someone finalized this submission between our read and now
            releaseCounters(request, newBudgetSpent, newFulfilled, newStatus, now);
            rollBackEarning(earning.getId(), submissionId);
            log.warn("Submission {} was finalized by another admin during acceptance", submissionId);
            throw new ConcurrentReviewException("Submission " + submissionId
                    + " was reviewed by another admin. Please refresh.");
        }

        log.info("Accepted submission {} on request {}: earned={} bonus={} earning={}{}",
                submissionId, request.getId(), payout.getEarnedAmountCents(), payout.getBonusCents(),
                earning.getId(), fulfills ? " (request fulfilled)" : "");

        Map<String, Object> context = new HashMap<>();
        context.put("submission_id", submissionId);
        context.put("request_id", request.getId());
        context.put("earned", payout.getEarnedAmountCents());
        context.put("bonus", payout.getBonusCents());
        notifyContributor(submission.getContributorId(), ActivityNotifier.SUBMISSION_ACCEPTED,
                String.format(Locale.ROOT, "Your submission was accepted! You earned $%.2f.",
                        payout.getTotalCents() / 100.0),
                context);

        BountySubmission updated = store.findSubmission(submissionId)
                .orElseThrow(() -> NotFoundException.of("Submission", submissionId));

        return ReviewOutcome.builder()
                .submission(updated)
                .earning(earning)
                .payout(payout)
                .requestFulfilled(fulfills)
                .build();
    }

    /**
     * Put the counters back to what they were before this review advanced them. Keyed on the
     * version this review wrote, so it never overwrites a later change.
     */
    private void releaseCounters(BountyRequest original, long advancedSpent, int advancedFulfilled,
                                 RequestStatus advancedStatus, LocalDateTime now) {
        BountyRequest advanced = BountyRequest.builder()
                .id(original.getId())
                .version(original.getVersion() + 1)
                .budgetSpentCents(advancedSpent)
                .quantityFulfilled(advancedFulfilled)
                .status(advancedStatus)
                .build();
        try {
            int released = compensationRetryTemplate.execute(ctx -> store.compareAndSetCounters(advanced,
                    original.getBudgetSpentCents(), original.getQuantityFulfilled(), original.getStatus(),
                    RequestStatus.REVIEWABLE, now));
            if (released == 0) {
                log.error("Could not release counters on request {}: row moved on past version {}; "
                        + "budget_spent_cents is overstated by {}", original.getId(), advanced.getVersion(),
                        advancedSpent - original.getBudgetSpentCents());
            }
        } catch (DataAccessException e) {
            log.error("Could not release counters on request {}; budget_spent_cents is overstated by {}",
                    original.getId(), advancedSpent - original.getBudgetSpentCents(), e);
        }
    }

    /**
     * Delete the provisional earning, retrying transient store failures. If it still fails the
     * caller's own error is raised anyway and the row shows up in the reconciliation report.
     */
    private void rollBackEarning(UUID earningId, UUID submissionId) {
        try {
            boolean removed = compensationRetryTemplate.execute(ctx -> store.deleteEarning(earningId));
            if (!removed) {
                log.warn("Provisional earning {} for submission {} was already gone", earningId, submissionId);
            }
        } catch (DataAccessException e) {
            log.error("Failed to roll back provisional earning {} for submission {}", earningId, submissionId, e);
        }
    }

    // ==================== Reject / revision ====================

    private ReviewOutcome closeWithoutPayout(BountySubmission submission, ReviewAction action, String feedback,
                                             UUID adminId, LocalDateTime now) {
        UUID submissionId = submission.getId();
        int updated = store.closeSubmissionReview(submissionId, action.getResultingStatus(), adminId, feedback, now);
        if (updated == 0) {
            throw new NotReviewableException("Submission " + submissionId + " was already reviewed");
        }

        log.info("Submission {} marked {} by {}", submissionId, action.getResultingStatus().getValue(), adminId);

        Map<String, Object> context = new HashMap<>();
        context.put("submission_id", submissionId);
        context.put("request_id", submission.getRequestId());
        context.put("feedback", feedback);
        if (action == ReviewAction.REJECT) {
            notifyContributor(submission.getContributorId(), ActivityNotifier.SUBMISSION_REJECTED,
                    "Your submission was not accepted. Check the feedback for details.", context);
        } else {
            notifyContributor(submission.getContributorId(), ActivityNotifier.SUBMISSION_REVISION_REQUESTED,
                    "Your submission needs some changes. Check the feedback and resubmit.", context);
        }

        BountySubmission reviewed = store.findSubmission(submissionId)
                .orElseThrow(() -> NotFoundException.of("Submission", submissionId));
        return ReviewOutcome.builder()
                .submission(reviewed)
                .build();
    }

    private void notifyContributor(UUID contributorId, String eventKind, String message,
                                   Map<String, Object> context) {
        try {
            activityNotifier.notify(contributorId, eventKind, message, context);
        } catch (RuntimeException e) {
            log.warn("Could not hand {} notice for contributor {} to the notifier: {}",
                    eventKind, contributorId, e.getMessage());
        }
    }
}
