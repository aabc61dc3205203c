package com.polyhunter.bounty.repository;

import com.polyhunter.bounty.entity.BountyRequest;
import com.polyhunter.bounty.entity.PayType;
import com.polyhunter.bounty.entity.RequestStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface BountyRequestRepository extends JpaRepository<BountyRequest, UUID> {

    List<BountyRequest> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<BountyRequest> findByStatusOrderByCreatedAtDesc(RequestStatus status, Pageable pageable);

    long countByStatus(RequestStatus status);

    @Query("SELECT COALESCE(SUM(r.budgetTotalCents), 0) FROM BountyRequest r")
    long sumBudgetTotalCents();

    @Query("SELECT COALESCE(SUM(r.budgetSpentCents), 0) FROM BountyRequest r")
    long sumBudgetSpentCents();

    /**
     * Move a request to {@code target} only if it is still in one of {@code allowedFrom}.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BountyRequest r SET r.status = :target, r.version = r.version + 1, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.status IN :allowedFrom")
    int transitionStatus(@Param("id") UUID id,
                         @Param("allowedFrom") Collection<RequestStatus> allowedFrom,
                         @Param("target") RequestStatus target,
                         @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BountyRequest r SET r.status = :target, r.publishedAt = :now, r.reviewedBy = :adminId, " +
           "r.reviewedAt = :now, r.version = r.version + 1, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.status IN :allowedFrom")
    int publish(@Param("id") UUID id,
                @Param("allowedFrom") Collection<RequestStatus> allowedFrom,
                @Param("target") RequestStatus target,
                @Param("adminId") UUID adminId,
                @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BountyRequest r SET r.title = :title, r.description = :description, r.category = :category, " +
           "r.payType = :payType, r.payAmountCents = :payAmountCents, r.speedBonusCents = :speedBonusCents, " +
           "r.speedBonusDeadline = :speedBonusDeadline, r.qualityBonusCents = :qualityBonusCents, " +
           "r.budgetTotalCents = :budgetTotalCents, r.quantityNeeded = :quantityNeeded, " +
           "r.version = r.version + 1, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.status IN :editable")
    int updateTerms(@Param("id") UUID id,
                    @Param("title") String title,
                    @Param("description") String description,
                    @Param("category") String category,
                    @Param("payType") PayType payType,
                    @Param("payAmountCents") long payAmountCents,
                    @Param("speedBonusCents") long speedBonusCents,
                    @Param("speedBonusDeadline") LocalDateTime speedBonusDeadline,
                    @Param("qualityBonusCents") long qualityBonusCents,
                    @Param("budgetTotalCents") long budgetTotalCents,
                    @Param("quantityNeeded") int quantityNeeded,
                    @Param("editable") Collection<RequestStatus> editable,
                    @Param("now") LocalDateTime now);

    /**
     * Compare-and-swap on the request counters. Applies only if the version and both counters still
     * hold the values the caller read and the request is still in one of {@code reviewable}.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BountyRequest r SET r.budgetSpentCents = :newSpent, r.quantityFulfilled = :newFulfilled, " +
           "r.status = :newStatus, r.version = r.version + 1, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.version = :expectedVersion " +
           "AND r.budgetSpentCents = :expectedSpent AND r.quantityFulfilled = :expectedFulfilled " +
           "AND r.status IN :reviewable")
    int compareAndSetCounters(@Param("id") UUID id,
                              @Param("expectedVersion") long expectedVersion,
                              @Param("expectedSpent") long expectedSpent,
                              @Param("expectedFulfilled") int expectedFulfilled,
                              @Param("newSpent") long newSpent,
                              @Param("newFulfilled") int newFulfilled,
                              @Param("newStatus") RequestStatus newStatus,
                              @Param("reviewable") Collection<RequestStatus> reviewable,
                              @Param("now") LocalDateTime now);
}
