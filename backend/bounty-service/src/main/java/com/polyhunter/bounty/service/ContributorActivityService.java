package com.polyhunter.bounty.service;

import com.polyhunter.bounty.dto.ActivityEntryDto;
import com.polyhunter.bounty.mappers.BountyDtoMapper;
import com.polyhunter.bounty.repository.ActivityLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reads the activity feed the notifier writes
 */
@Service
@RequiredArgsConstructor
public class ContributorActivityService {

    private final ActivityLogRepository activityLogRepository;

    @Transactional(readOnly = true)
    public List<ActivityEntryDto> getContributorActivity(UUID contributorId, int limit) {
        return activityLogRepository.findByContributorIdOrderByCreatedAtDesc(contributorId,
                        PageRequest.of(0, limit)).stream()
                .map(BountyDtoMapper::toDto)
                .collect(Collectors.toList());
    }
}
