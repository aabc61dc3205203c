package com.polyhunter.bounty.repository;

import com.polyhunter.bounty.entity.BountySubmission;
import com.polyhunter.bounty.entity.SubmissionStatus;
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
public interface BountySubmissionRepository extends JpaRepository<BountySubmission, UUID> {

    List<BountySubmission> findByStatusOrderBySubmittedAtAsc(SubmissionStatus status, Pageable pageable);

    List<BountySubmission> findByRequestIdOrderBySubmittedAtDesc(UUID requestId, Pageable pageable);

    List<BountySubmission> findByRequestIdAndStatusOrderBySubmittedAtDesc(UUID requestId, SubmissionStatus status,
                                                                         Pageable pageable);

    long countByStatus(SubmissionStatus status);

    /**
     * Per request: [requestId, accepted count, sum of earned + bonus]
     */
    @Query("SELECT s.requestId, COUNT(s), COALESCE(SUM(s.earnedAmountCents + s.bonusAmountCents), 0) " +
           "FROM BountySubmission s WHERE s.status = :status GROUP BY s.requestId")
    List<Object[]> summarizeByRequest(@Param("status") SubmissionStatus status);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BountySubmission s SET s.status = :target, s.reviewedBy = :adminId, s.reviewedAt = :now, " +
           "s.reviewFeedback = :feedback, s.updatedAt = :now " +
           "WHERE s.id = :id AND s.status IN :reviewable")
    int closeReview(@Param("id") UUID id,
                    @Param("reviewable") Collection<SubmissionStatus> reviewable,
                    @Param("target") SubmissionStatus target,
                    @Param("adminId") UUID adminId,
                    @Param("feedback") String feedback,
                    @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BountySubmission s SET s.status = :accepted, s.reviewedBy = :adminId, s.reviewedAt = :now, " +
           "s.reviewFeedback = :feedback, s.earnedAmountCents = :earned, s.bonusAmountCents = :bonus, " +
           "s.earningId = :earningId, s.updatedAt = :now " +
           "WHERE s.id = :id AND s.status IN :reviewable")
    int markAccepted(@Param("id") UUID id,
                     @Param("reviewable") Collection<SubmissionStatus> reviewable,
                     @Param("accepted") SubmissionStatus accepted,
                     @Param("adminId") UUID adminId,
                     @Param("feedback") String feedback,
                     @Param("earned") long earned,
                     @Param("bonus") long bonus,
                     @Param("earningId") UUID earningId,
                     @Param("now") LocalDateTime now);
}
