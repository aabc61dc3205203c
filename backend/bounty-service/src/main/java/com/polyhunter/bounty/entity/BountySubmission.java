package com.polyhunter.bounty.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * BountySubmission entity - one contributor's delivery against a request
 */
@Entity
@Table(name = "bounty_submissions", uniqueConstraints = {
        @UniqueConstraint(columnNames = { "request_id", "contributor_id" })
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BountySubmission {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "request_id", nullable = false)
    private UUID requestId;

    @Column(name = "contributor_id", nullable = false)
    private UUID contributorId;

    @Column(nullable = false, length = 20)
    @Builder.Default
    private SubmissionStatus status = SubmissionStatus.SUBMITTED;

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;

    @Column(name = "review_feedback", columnDefinition = "TEXT")
    private String reviewFeedback;

    @Column(name = "earned_amount_cents", nullable = false)
    @Builder.Default
    private Long earnedAmountCents = 0L;

    @Column(name = "bonus_amount_cents", nullable = false)
    @Builder.Default
    private Long bonusAmountCents = 0L;

    // Back-reference only; the earning belongs to the payout workflow
    @Column(name = "earning_id")
    private UUID earningId;

    @Column(name = "submitted_at")
    private LocalDateTime submittedAt;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public long getTotalPayoutCents() {
        return earnedAmountCents + bonusAmountCents;
    }
}
