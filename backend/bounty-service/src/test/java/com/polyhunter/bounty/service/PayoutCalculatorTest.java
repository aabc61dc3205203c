package com.polyhunter.bounty.service;

import com.polyhunter.bounty.BountyFixtures;
import com.polyhunter.bounty.entity.BountyRequest;
import com.polyhunter.bounty.entity.BountySubmission;
import com.polyhunter.bounty.entity.PayType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayoutCalculatorTest {

    private static final LocalDateTime DEADLINE = LocalDateTime.of(2026, 3, 1, 12, 0, 0);

    private final PayoutCalculator calculator = new PayoutCalculator();

    @Test
    @DisplayName("Flat pay ignores the image count")
    void flatPayIgnoresImageCount() {
        BountyRequest request = BountyFixtures.flatRequest(600, 1000, 2).build();
        BountySubmission submission = BountyFixtures.submission(UUID.randomUUID()).build();

        Payout payout = calculator.computePayout(request, submission, 7, false);

        assertThat(payout.getEarnedAmountCents()).isEqualTo(600);
        assertThat(payout.getBonusCents()).isZero();
        assertThat(payout.getTotalCents()).isEqualTo(600);
    }

    @Test
    @DisplayName("Per-image pay multiplies by the image count")
    void perImagePayMultiplies() {
        BountyRequest request = BountyFixtures.flatRequest(250, 10_000, 5)
                .payType(PayType.PER_IMAGE)
                .build();
        BountySubmission submission = BountyFixtures.submission(UUID.randomUUID()).build();

        assertThat(calculator.computePayout(request, submission, 4, false).getEarnedAmountCents()).isEqualTo(1000);
        assertThat(calculator.computePayout(request, submission, 0, false).getEarnedAmountCents()).isZero();
    }

    @Test
    @DisplayName("Speed bonus applies one second before the deadline, not one second after")
    void speedBonusAroundDeadline() {
        BountyRequest request = BountyFixtures.flatRequest(500, 10_000, 5)
                .speedBonusCents(100L)
                .speedBonusDeadline(DEADLINE)
                .build();

        BountySubmission early = BountyFixtures.submission(request.getId()).submittedAt(DEADLINE.minusSeconds(1)).build();
        BountySubmission late = BountyFixtures.submission(request.getId()).submittedAt(DEADLINE.plusSeconds(1)).build();

        assertThat(calculator.computePayout(request, early, 1, false).getSpeedBonusCents()).isEqualTo(100);
        assertThat(calculator.computePayout(request, early, 1, false).getTotalCents()).isEqualTo(600);
        assertThat(calculator.computePayout(request, late, 1, false).getSpeedBonusCents()).isZero();
    }

    @Test
    @DisplayName("A submission made exactly at the deadline gets no speed bonus")
    void speedBonusIsStrictlyBeforeDeadline() {
        BountyRequest request = BountyFixtures.flatRequest(500, 10_000, 5)
                .speedBonusCents(100L)
                .speedBonusDeadline(DEADLINE)
                .build();
        BountySubmission onTheDot = BountyFixtures.submission(request.getId()).submittedAt(DEADLINE).build();

        assertThat(calculator.computePayout(request, onTheDot, 1, false).getSpeedBonusCents()).isZero();
    }

    @Test
    @DisplayName("No speed bonus without a deadline or without a submission time")
    void speedBonusNeedsDeadlineAndSubmissionTime() {
        BountyRequest noDeadline = BountyFixtures.flatRequest(500, 10_000, 5).speedBonusCents(100L).build();
        BountyRequest withDeadline = BountyFixtures.flatRequest(500, 10_000, 5)
                .speedBonusCents(100L)
                .speedBonusDeadline(DEADLINE)
                .build();
        BountySubmission unsubmitted = BountyFixtures.submission(UUID.randomUUID()).submittedAt(null).build();

        assertThat(calculator.qualifiesForSpeedBonus(noDeadline, DEADLINE.minusDays(1))).isFalse();
        assertThat(calculator.computePayout(withDeadline, unsubmitted, 1, false).getSpeedBonusCents()).isZero();
    }

    @Test
    @DisplayName("Quality bonus is paid only when explicitly awarded")
    void qualityBonusOnlyWhenAwarded() {
        BountyRequest request = BountyFixtures.flatRequest(500, 10_000, 5).qualityBonusCents(250L).build();
        BountySubmission submission = BountyFixtures.submission(request.getId()).build();

        assertThat(calculator.computePayout(request, submission, 1, false).getQualityBonusCents()).isZero();

        Payout awarded = calculator.computePayout(request, submission, 1, true);
        assertThat(awarded.getQualityBonusCents()).isEqualTo(250);
        assertThat(awarded.getTotalCents()).isEqualTo(750);
    }

    @Test
    @DisplayName("Totals past the range of a long fail instead of wrapping")
    void totalOverflowIsRaised() {
        BountyRequest request = BountyFixtures.flatRequest(Long.MAX_VALUE, Long.MAX_VALUE, 1)
                .qualityBonusCents(50L)
                .build();
        BountySubmission submission = BountyFixtures.submission(request.getId()).build();

        Payout payout = calculator.computePayout(request, submission, 1, true);

        assertThat(payout.getBonusCents()).isEqualTo(50);
        assertThatThrownBy(payout::getTotalCents).isInstanceOf(ArithmeticException.class);

        BountyRequest perImage = BountyFixtures.flatRequest(Long.MAX_VALUE / 2, Long.MAX_VALUE, 1)
                .payType(PayType.PER_IMAGE)
                .build();
        assertThatThrownBy(() -> calculator.computePayout(perImage, submission, 3, false))
                .isInstanceOf(ArithmeticException.class);
    }
}
