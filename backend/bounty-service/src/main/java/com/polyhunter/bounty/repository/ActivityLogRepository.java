package com.polyhunter.bounty.repository;

import com.polyhunter.bounty.entity.ActivityLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ActivityLogRepository extends JpaRepository<ActivityLogEntry, UUID> {

    List<ActivityLogEntry> findByContributorIdOrderByCreatedAtDesc(UUID contributorId, Pageable pageable);
}
