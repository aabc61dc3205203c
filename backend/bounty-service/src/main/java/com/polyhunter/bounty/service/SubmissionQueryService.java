package com.polyhunter.bounty.service;

import com.polyhunter.bounty.config.BountyProperties;
import com.polyhunter.bounty.dto.SubmissionDetailDto;
import com.polyhunter.bounty.dto.SubmissionDto;
import com.polyhunter.bounty.dto.SubmissionImageDto;
import com.polyhunter.bounty.entity.BountyRequest;
import com.polyhunter.bounty.entity.BountySubmission;
import com.polyhunter.bounty.entity.SubmissionStatus;
import com.polyhunter.bounty.exception.NotFoundException;
import com.polyhunter.bounty.mappers.BountyDtoMapper;
import com.polyhunter.bounty.repository.BountyRequestRepository;
import com.polyhunter.bounty.repository.BountySubmissionRepository;
import com.polyhunter.bounty.repository.SubmissionImageRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of the review workflow: the review queue, a request's submissions and one submission
 * with its images
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SubmissionQueryService {

    private static final String UNKNOWN_REQUEST = "Unknown Request";

    private final BountySubmissionRepository submissionRepository;
    private final BountyRequestRepository requestRepository;
    private final SubmissionImageRepository imageRepository;
    private final BountyProperties properties;

    /**
     * Submissions across all requests in {@code status}, oldest submission first
     */
    public List<SubmissionDto> listSubmissionsByStatus(SubmissionStatus status) {
        List<BountySubmission> submissions = submissionRepository.findByStatusOrderBySubmittedAtAsc(status,
                PageRequest.of(0, properties.getListLimit()));

        Set<UUID> requestIds = submissions.stream()
                .map(BountySubmission::getRequestId)
                .collect(Collectors.toSet());
        Map<UUID, String> titles = requestRepository.findAllById(requestIds).stream()
                .collect(Collectors.toMap(BountyRequest::getId, BountyRequest::getTitle));

        return toListing(submissions, titles);
    }

    /**
     * Submissions of one request, newest first, optionally filtered by status
     */
    public List<SubmissionDto> listSubmissionsForRequest(UUID requestId, SubmissionStatus status) {
        BountyRequest request = requestRepository.findById(requestId)
                .orElseThrow(() -> NotFoundException.of("Bounty request", requestId));

        PageRequest page = PageRequest.of(0, properties.getListLimit());
        List<BountySubmission> submissions = status != null
                ? submissionRepository.findByRequestIdAndStatusOrderBySubmittedAtDesc(requestId, status, page)
                : submissionRepository.findByRequestIdOrderBySubmittedAtDesc(requestId, page);

        return toListing(submissions, Map.of(requestId, request.getTitle()));
    }

    public SubmissionDetailDto getSubmission(UUID submissionId) {
        BountySubmission submission = submissionRepository.findById(submissionId)
                .orElseThrow(() -> NotFoundException.of("Submission", submissionId));

        String title = requestRepository.findById(submission.getRequestId())
                .map(BountyRequest::getTitle)
                .orElse(UNKNOWN_REQUEST);

        List<SubmissionImageDto> images =
                imageRepository.findBySubmissionIdOrderByCreatedAtAsc(submissionId).stream()
                        .map(BountyDtoMapper::toDto)
                        .collect(Collectors.toList());

        return SubmissionDetailDto.builder()
                .submission(BountyDtoMapper.toDto(submission, images.size(), title))
                .requestTitle(title)
                .images(images)
                .build();
    }

    private List<SubmissionDto> toListing(List<BountySubmission> submissions, Map<UUID, String> titles) {
        Map<UUID, Long> imageCounts = new HashMap<>();
        if (!submissions.isEmpty()) {
            List<UUID> ids = submissions.stream().map(BountySubmission::getId).collect(Collectors.toList());
            for (Object[] row : imageRepository.countBySubmissionIds(ids)) {
                imageCounts.put((UUID) row[0], ((Number) row[1]).longValue());
            }
        }

        return submissions.stream()
                .map(s -> BountyDtoMapper.toDto(s, imageCounts.getOrDefault(s.getId(), 0L),
                        titles.getOrDefault(s.getRequestId(), UNKNOWN_REQUEST)))
                .collect(Collectors.toList());
    }
}
