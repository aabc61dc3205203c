package com.polyhunter.bounty.service;

import com.polyhunter.bounty.config.BountyProperties;
import com.polyhunter.bounty.entity.BountyRequest;
import com.polyhunter.bounty.entity.RequestAction;
import com.polyhunter.bounty.entity.RequestStatus;
import com.polyhunter.bounty.exception.InvalidTransitionException;
import com.polyhunter.bounty.exception.NotFoundException;
import com.polyhunter.bounty.repository.BountyRequestRepository;
import com.polyhunter.bounty.store.BountyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Creates bounty requests and moves them through their lifecycle
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestLifecycleService {

    private final BountyStore store;
    private final BountyRequestRepository requestRepository;
    private final BountyProperties properties;

    // ==================== Drafting ====================

    /**
     * Create a new request. Only draft and pending_review may be requested; anything else starts as draft.
     */
    public BountyRequest createRequest(UUID adminId, BountyRequest draft) {
        RequestStatus initial = draft.getStatus() == RequestStatus.PENDING_REVIEW
                ? RequestStatus.PENDING_REVIEW
                : RequestStatus.DRAFT;

        BountyRequest request = BountyRequest.builder()
                .createdBy(adminId)
                .title(draft.getTitle())
                .description(draft.getDescription())
                .category(draft.getCategory())
                .status(initial)
                .payType(draft.getPayType())
                .payAmountCents(draft.getPayAmountCents())
                .speedBonusCents(orZero(draft.getSpeedBonusCents()))
                .speedBonusDeadline(draft.getSpeedBonusDeadline())
                .qualityBonusCents(orZero(draft.getQualityBonusCents()))
                .budgetTotalCents(draft.getBudgetTotalCents())
                .quantityNeeded(draft.getQuantityNeeded())
                .build();

        request = store.insertRequest(request);
        log.info("Admin {} created bounty request {} ({})", adminId, request.getId(), initial.getValue());
        return request;
    }

    /**
     * Replace the terms of a request that has not been published yet
     */
    public BountyRequest updateRequest(UUID requestId, BountyRequest terms) {
        terms.setSpeedBonusCents(orZero(terms.getSpeedBonusCents()));
        terms.setQualityBonusCents(orZero(terms.getQualityBonusCents()));

        int updated = store.updateRequestTerms(requestId, terms, RequestStatus.EDITABLE, LocalDateTime.now());
        if (updated == 0) {
            BountyRequest current = getRequest(requestId);
            throw new InvalidTransitionException("Cannot edit a " + current.getStatus().getValue() + " request");
        }
        log.info("Updated terms of bounty request {}", requestId);
        return getRequest(requestId);
    }

    // ==================== Lifecycle ====================

    public BountyRequest publishRequest(UUID requestId, UUID adminId) {
        return apply(requestId, RequestAction.PUBLISH, adminId);
    }

    public BountyRequest pauseRequest(UUID requestId) {
        return apply(requestId, RequestAction.PAUSE, null);
    }

    public BountyRequest unpauseRequest(UUID requestId) {
        return apply(requestId, RequestAction.UNPAUSE, null);
    }

    public BountyRequest closeRequest(UUID requestId) {
        return apply(requestId, RequestAction.CLOSE, null);
    }

    public BountyRequest cancelRequest(UUID requestId) {
        return apply(requestId, RequestAction.CANCEL, null);
    }

    /**
     * One conditional update guarded by the action's allowed source statuses. Matching no row means
     * the request is missing or not in a state the action may start from; nothing is changed then.
     */
    private BountyRequest apply(UUID requestId, RequestAction action, UUID adminId) {
        LocalDateTime now = LocalDateTime.now();
        int updated = action == RequestAction.PUBLISH
                ? store.publishRequest(requestId, action.getAllowedFrom(), adminId, now)
                : store.transitionRequest(requestId, action.getAllowedFrom(), action.getTarget(), now);

        if (updated == 0) {
            BountyRequest current = getRequest(requestId);
            log.warn("Refused to {} request {} in status {}", action.getValue(), requestId,
                    current.getStatus().getValue());
            throw new InvalidTransitionException("Cannot " + action.getValue() + " a "
                    + current.getStatus().getValue() + " request");
        }

        BountyRequest result = getRequest(requestId);
        log.info("Request {} is now {} ({})", requestId, result.getStatus().getValue(), action.getValue());
        return result;
    }

    // ==================== Lookups ====================

    public BountyRequest getRequest(UUID requestId) {
        return store.findRequest(requestId)
                .orElseThrow(() -> NotFoundException.of("Bounty request", requestId));
    }

    /**
     * Newest first, optionally filtered by status
     */
    @Transactional(readOnly = true)
    public List<BountyRequest> listRequests(RequestStatus status) {
        PageRequest page = PageRequest.of(0, properties.getListLimit());
        return status != null
                ? requestRepository.findByStatusOrderByCreatedAtDesc(status, page)
                : requestRepository.findAllByOrderByCreatedAtDesc(page);
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
