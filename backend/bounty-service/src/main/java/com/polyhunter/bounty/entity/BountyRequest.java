package com.polyhunter.bounty.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * BountyRequest entity - a budget-capped unit of paid work demand
 */
@Entity
@Table(name = "bounty_requests")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BountyRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    @Column(length = 40)
    private String category;

    @Column(nullable = false, length = 20)
    @Builder.Default
    private RequestStatus status = RequestStatus.DRAFT;

    // ---- pay terms ----

    @Column(name = "pay_type", nullable = false, length = 20)
    private PayType payType;

    @Column(name = "pay_amount_cents", nullable = false)
    private Long payAmountCents;

    @Column(name = "speed_bonus_cents", nullable = false)
    @Builder.Default
    private Long speedBonusCents = 0L;

    @Column(name = "speed_bonus_deadline")
    private LocalDateTime speedBonusDeadline;

    @Column(name = "quality_bonus_cents", nullable = false)
    @Builder.Default
    private Long qualityBonusCents = 0L;

    // ---- budget and fulfillment counters ----

    @Column(name = "budget_total_cents", nullable = false)
    private Long budgetTotalCents;

    @Column(name = "budget_spent_cents", nullable = false)
    @Builder.Default
    private Long budgetSpentCents = 0L;

    @Column(name = "quantity_needed", nullable = false)
    private Integer quantityNeeded;

    @Column(name = "quantity_fulfilled", nullable = false)
    @Builder.Default
    private Integer quantityFulfilled = 0;

    /**
     * Bumped by every conditional update; never managed by JPA itself
     */
    @Column(nullable = false)
    @Builder.Default
    private Long version = 0L;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public long getBudgetRemainingCents() {
        return budgetTotalCents - budgetSpentCents;
    }
}
