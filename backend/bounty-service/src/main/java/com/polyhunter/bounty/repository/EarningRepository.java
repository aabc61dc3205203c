package com.polyhunter.bounty.repository;

import com.polyhunter.bounty.entity.Earning;
import com.polyhunter.bounty.entity.EarningStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface EarningRepository extends JpaRepository<Earning, UUID> {

    Page<Earning> findByStatus(EarningStatus status, Pageable pageable);

    /**
     * Rows of [status, sum of amount, count]
     */
    @Query("SELECT e.status, COALESCE(SUM(e.amountCents), 0), COUNT(e) FROM Earning e GROUP BY e.status")
    List<Object[]> summarizeByStatus();

    @Query("SELECT e.status, COALESCE(SUM(e.amountCents), 0), COUNT(e) FROM Earning e " +
           "WHERE e.contributorId = :contributorId GROUP BY e.status")
    List<Object[]> summarizeByStatusForContributor(@Param("contributorId") UUID contributorId);

    /**
     * Earnings no submission points at, older than {@code createdBefore}
     */
    @Query("SELECT e FROM Earning e WHERE e.createdAt < :createdBefore AND e.id NOT IN " +
           "(SELECT s.earningId FROM BountySubmission s WHERE s.earningId IS NOT NULL)")
    List<Earning> findUnreferencedCreatedBefore(@Param("createdBefore") LocalDateTime createdBefore);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Earning e SET e.status = :target, e.paidAt = :paidAt " +
           "WHERE e.id = :id AND e.status = :expected")
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("expected") EarningStatus expected,
                            @Param("target") EarningStatus target,
                            @Param("paidAt") LocalDateTime paidAt);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Earning e WHERE e.id = :id")
    int deleteByIdReturningCount(@Param("id") UUID id);
}
