package com.polyhunter.bounty.repository;

import com.polyhunter.bounty.entity.SubmissionImage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface SubmissionImageRepository extends JpaRepository<SubmissionImage, UUID> {

    long countBySubmissionId(UUID submissionId);

    List<SubmissionImage> findBySubmissionIdOrderByCreatedAtAsc(UUID submissionId);

    /**
     * Rows of [submissionId, image count]; submissions without images are absent
     */
    @Query("SELECT i.submissionId, COUNT(i) FROM SubmissionImage i " +
           "WHERE i.submissionId IN :submissionIds GROUP BY i.submissionId")
    List<Object[]> countBySubmissionIds(@Param("submissionIds") Collection<UUID> submissionIds);
}
