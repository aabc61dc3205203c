package com.polyhunter.bounty.service;

import com.polyhunter.bounty.BountyFixtures;
import com.polyhunter.bounty.dto.ReconciliationReportDto;
import com.polyhunter.bounty.entity.*;
import com.polyhunter.bounty.exception.BudgetExceededException;
import com.polyhunter.bounty.exception.ConcurrentReviewException;
import com.polyhunter.bounty.exception.NotReviewableException;
import com.polyhunter.bounty.notification.ActivityNotifier;
import com.polyhunter.bounty.repository.ActivityLogRepository;
import com.polyhunter.bounty.repository.BountyRequestRepository;
import com.polyhunter.bounty.repository.BountySubmissionRepository;
import com.polyhunter.bounty.repository.EarningRepository;
import com.polyhunter.bounty.repository.SubmissionImageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@SpringBootTest
@DisplayName("Submission review against the database")
class SubmissionReviewIntegrationTest {

    @Autowired
    private SubmissionReviewService reviewService;

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private BountyRequestRepository requestRepository;

    @Autowired
    private BountySubmissionRepository submissionRepository;

    @Autowired
    private SubmissionImageRepository imageRepository;

    @Autowired
    private EarningRepository earningRepository;

    @Autowired
    private ActivityLogRepository activityLogRepository;

    private final UUID adminId = UUID.randomUUID();

    @BeforeEach
    void cleanUp() {
        imageRepository.deleteAll();
        submissionRepository.deleteAll();
        earningRepository.deleteAll();
        requestRepository.deleteAll();
    }

    private BountyRequest saveRequest(long payCents, long budgetCents, int quantityNeeded) {
        return requestRepository.save(BountyFixtures.flatRequest(payCents, budgetCents, quantityNeeded).build());
    }

    private BountySubmission saveSubmission(BountyRequest request) {
        return submissionRepository.save(BountyFixtures.submission(request.getId()).build());
    }

    @Test
    @DisplayName("Second acceptance over budget is refused and leaves no earning behind")
    void budgetCapIsEnforced() {
        BountyRequest request = saveRequest(600, 1000, 2);
        BountySubmission first = saveSubmission(request);
        BountySubmission second = saveSubmission(request);

        reviewService.review(first.getId(), ReviewAction.ACCEPT, null, adminId, false);

        assertThatThrownBy(() -> reviewService.review(second.getId(), ReviewAction.ACCEPT, null, adminId, false))
                .isInstanceOf(BudgetExceededException.class);

        BountyRequest reloaded = requestRepository.findById(request.getId()).orElseThrow();
        assertThat(reloaded.getBudgetSpentCents()).isEqualTo(600L);
        assertThat(reloaded.getQuantityFulfilled()).isEqualTo(1);
        assertThat(earningRepository.count()).isEqualTo(1);
        assertThat(submissionRepository.findById(second.getId()).orElseThrow().getStatus())
                .isEqualTo(SubmissionStatus.SUBMITTED);
        assertThat(reconciliationService.reconcile().isConsistent()).isTrue();
    }

    @Test
    @DisplayName("The last needed acceptance fulfills the request and later reviews are refused")
    void lastAcceptanceFulfills() {
        BountyRequest request = saveRequest(600, 1200, 2);
        BountySubmission first = saveSubmission(request);
        BountySubmission second = saveSubmission(request);

        reviewService.review(first.getId(), ReviewAction.ACCEPT, null, adminId, false);
        ReviewOutcome outcome = reviewService.review(second.getId(), ReviewAction.ACCEPT, "great", adminId, false);

        assertThat(outcome.isRequestFulfilled()).isTrue();
        BountyRequest reloaded = requestRepository.findById(request.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(RequestStatus.FULFILLED);
        assertThat(reloaded.getBudgetSpentCents()).isEqualTo(1200L);
        assertThat(reloaded.getQuantityFulfilled()).isEqualTo(2);
        assertThat(reloaded.getVersion()).isEqualTo(2L);

        BountySubmission accepted = submissionRepository.findById(second.getId()).orElseThrow();
        assertThat(accepted.getStatus()).isEqualTo(SubmissionStatus.ACCEPTED);
        assertThat(accepted.getEarningId()).isEqualTo(outcome.getEarning().getId());
        assertThat(accepted.getReviewedBy()).isEqualTo(adminId);
        assertThat(accepted.getReviewFeedback()).isEqualTo("great");
    }

    @Test
    @DisplayName("Accepting on a paused request pays both bonuses and fulfills it; the rest can only be closed out")
    void bonusesOnPausedRequest() {
        BountyRequest request = requestRepository.save(BountyFixtures.flatRequest(600, 1000, 1)
                .status(RequestStatus.PAUSED)
                .speedBonusCents(100L)
                .speedBonusDeadline(LocalDateTime.now().plusDays(1))
                .qualityBonusCents(50L)
                .build());
        BountySubmission winner = saveSubmission(request);
        BountySubmission late = saveSubmission(request);
        BountySubmission needsWork = saveSubmission(request);

        ReviewOutcome outcome = reviewService.review(winner.getId(), ReviewAction.ACCEPT, null, adminId, true);

        BountySubmission accepted = submissionRepository.findById(winner.getId()).orElseThrow();
        assertThat(accepted.getEarnedAmountCents()).isEqualTo(600L);
        assertThat(accepted.getBonusAmountCents()).isEqualTo(150L);
        Earning earning = earningRepository.findById(accepted.getEarningId()).orElseThrow();
        assertThat(earning.getAmountCents())
                .isEqualTo(750L)
                .isEqualTo(accepted.getEarnedAmountCents() + accepted.getBonusAmountCents());
        assertThat(outcome.getPayout().getSpeedBonusCents()).isEqualTo(100);
        assertThat(outcome.getPayout().getQualityBonusCents()).isEqualTo(50);

        BountyRequest reloaded = requestRepository.findById(request.getId()).orElseThrow();
        assertThat(reloaded.getBudgetSpentCents()).isEqualTo(750L);
        assertThat(reloaded.getStatus()).isEqualTo(RequestStatus.FULFILLED);

        assertThatThrownBy(() -> reviewService.review(late.getId(), ReviewAction.ACCEPT, null, adminId, false))
                .isInstanceOf(NotReviewableException.class);
        reviewService.review(late.getId(), ReviewAction.REJECT, "Quota filled", adminId, false);
        reviewService.review(needsWork.getId(), ReviewAction.REVISION_REQUESTED, "Too dark", adminId, false);

        assertThat(submissionRepository.findById(late.getId()).orElseThrow().getStatus())
                .isEqualTo(SubmissionStatus.REJECTED);
        assertThat(submissionRepository.findById(needsWork.getId()).orElseThrow().getStatus())
                .isEqualTo(SubmissionStatus.REVISION_REQUESTED);
        assertThat(earningRepository.count()).isEqualTo(1);
        assertThat(requestRepository.findById(request.getId()).orElseThrow().getBudgetSpentCents()).isEqualTo(750L);
        assertThat(reconciliationService.reconcile().isConsistent()).isTrue();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(activityLogRepository.findByContributorIdOrderByCreatedAtDesc(winner.getContributorId(),
                        PageRequest.of(0, 10)))
                        .singleElement()
                        .satisfies(entry -> {
                            assertThat(entry.getAction()).isEqualTo(ActivityNotifier.SUBMISSION_ACCEPTED);
                            assertThat(entry.getDescription()).isEqualTo("Your submission was accepted! You earned $7.50.");
                        }));
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(activityLogRepository.findByContributorIdOrderByCreatedAtDesc(needsWork.getContributorId(),
                        PageRequest.of(0, 10)))
                        .extracting(entry -> entry.getAction())
                        .containsExactly(ActivityNotifier.SUBMISSION_REVISION_REQUESTED));
    }

    @Test
    @DisplayName("Per-image pay counts the stored images")
    void perImagePayout() {
        BountyRequest request = requestRepository.save(BountyFixtures.flatRequest(150, 10_000, 3)
                .payType(PayType.PER_IMAGE)
                .build());
        BountySubmission submission = saveSubmission(request);
        for (int i = 0; i < 3; i++) {
            imageRepository.save(SubmissionImage.builder()
                    .submissionId(submission.getId())
                    .filePath("uploads/" + submission.getId() + "/" + i + ".jpg")
                    .build());
        }

        ReviewOutcome outcome = reviewService.review(submission.getId(), ReviewAction.ACCEPT, null, adminId, false);

        assertThat(outcome.getEarning().getAmountCents()).isEqualTo(450L);
        assertThat(requestRepository.findById(request.getId()).orElseThrow().getBudgetSpentCents()).isEqualTo(450L);
    }

    @Test
    @DisplayName("Two admins accepting at once: exactly one wins and the budget reflects one payout")
    void concurrentAcceptancesOnTightBudget() throws Exception {
        BountyRequest request = saveRequest(600, 1000, 5);
        BountySubmission first = saveSubmission(request);
        BountySubmission second = saveSubmission(request);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ReviewOutcome>> results = new ArrayList<>();
        try {
            for (BountySubmission submission : List.of(first, second)) {
                results.add(executor.submit(() -> {
                    start.await();
                    return reviewService.review(submission.getId(), ReviewAction.ACCEPT, null,
                            UUID.randomUUID(), false);
                }));
            }
            start.countDown();

            int succeeded = 0;
            List<Throwable> failures = new ArrayList<>();
            for (Future<ReviewOutcome> result : results) {
                try {
                    result.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                }
            }

            assertThat(succeeded).isEqualTo(1);
            assertThat(failures).hasSize(1);
            assertThat(failures.get(0)).isInstanceOfAny(ConcurrentReviewException.class,
                    BudgetExceededException.class);
        } finally {
            executor.shutdownNow();
        }

        BountyRequest reloaded = requestRepository.findById(request.getId()).orElseThrow();
        assertThat(reloaded.getBudgetSpentCents()).isEqualTo(600L);
        assertThat(reloaded.getQuantityFulfilled()).isEqualTo(1);
        assertThat(earningRepository.count()).isEqualTo(1);
        assertThat(submissionRepository.countByStatus(SubmissionStatus.ACCEPTED)).isEqualTo(1);
    }

    @Test
    @DisplayName("Reconciliation reports drifting counters and unreferenced earnings")
    void reconciliationFindsDriftAndOrphans() {
        BountyRequest request = saveRequest(600, 5000, 5);
        BountySubmission submission = saveSubmission(request);
        reviewService.review(submission.getId(), ReviewAction.ACCEPT, null, adminId, false);

        // Counters advanced without a matching acceptance
        requestRepository.compareAndSetCounters(request.getId(), 1L, 600L, 1, 1200L, 2,
                RequestStatus.PUBLISHED, RequestStatus.REVIEWABLE, LocalDateTime.now());
        earningRepository.save(Earning.builder()
                .contributorId(UUID.randomUUID())
                .amountCents(600L)
                .periodStart(LocalDate.now())
                .periodEnd(LocalDate.now())
                .createdAt(LocalDateTime.now().minusMinutes(1))
                .build());

        ReconciliationReportDto report = reconciliationService.reconcile();

        assertThat(report.isConsistent()).isFalse();
        assertThat(report.getRequestsChecked()).isEqualTo(1);
        assertThat(report.getDrifts()).singleElement().satisfies(drift -> {
            assertThat(drift.getRequestId()).isEqualTo(request.getId());
            assertThat(drift.getBudgetSpentCents()).isEqualTo(1200L);
            assertThat(drift.getAcceptedPayoutCents()).isEqualTo(600L);
            assertThat(drift.getAcceptedCount()).isEqualTo(1);
        });
        assertThat(report.getOrphanedEarnings()).hasSize(1);

        // Reporting never repairs
        assertThat(requestRepository.findById(request.getId()).orElseThrow().getBudgetSpentCents()).isEqualTo(1200L);
    }
}
