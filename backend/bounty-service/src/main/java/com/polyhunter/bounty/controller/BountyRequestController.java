package com.polyhunter.bounty.controller;

import com.polyhunter.bounty.access.AdminAccessGuard;
import com.polyhunter.bounty.access.AdminPrincipal;
import com.polyhunter.bounty.dto.BountyRequestDto;
import com.polyhunter.bounty.dto.BountyTermsRequest;
import com.polyhunter.bounty.dto.SubmissionDto;
import com.polyhunter.bounty.entity.AdminRole;
import com.polyhunter.bounty.entity.BountyRequest;
import com.polyhunter.bounty.entity.RequestStatus;
import com.polyhunter.bounty.entity.SubmissionStatus;
import com.polyhunter.bounty.mappers.BountyDtoMapper;
import com.polyhunter.bounty.service.RequestLifecycleService;
import com.polyhunter.bounty.service.SubmissionQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.polyhunter.bounty.access.AdminAccessGuard.ADMIN_ID_HEADER;
import static com.polyhunter.bounty.access.AdminAccessGuard.ADMIN_ROLE_HEADER;

/**
 * REST API for bounty request drafting and lifecycle
 */
@RestController
@RequestMapping("/api/admin/requests")
@RequiredArgsConstructor
@Tag(name = "Bounty Requests", description = "Bounty request drafting and lifecycle APIs")
public class BountyRequestController {

    private final RequestLifecycleService lifecycleService;
    private final SubmissionQueryService submissionQueryService;
    private final AdminAccessGuard accessGuard;

    // ==================== Drafting ====================

    @PostMapping
    @Operation(summary = "Create a request", description = "Create a bounty request; it always starts unpublished")
    public ResponseEntity<BountyRequestDto> create(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role,
            @Valid @RequestBody BountyTermsRequest body) {
        AdminPrincipal admin = accessGuard.require(adminId, role, AdminRole.ADMIN);
        BountyRequest created = lifecycleService.createRequest(admin.getId(), BountyDtoMapper.toEntity(body));
        return ResponseEntity.status(HttpStatus.CREATED).body(BountyDtoMapper.toDto(created));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Edit a request", description = "Replace the terms of a draft or pending_review request")
    public ResponseEntity<BountyRequestDto> update(
            @PathVariable UUID id,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role,
            @Valid @RequestBody BountyTermsRequest body) {
        accessGuard.require(adminId, role, AdminRole.ADMIN);
        BountyRequest updated = lifecycleService.updateRequest(id, BountyDtoMapper.toEntity(body));
        return ResponseEntity.ok(BountyDtoMapper.toDto(updated));
    }

    // ==================== Lookups ====================

    @GetMapping
    @Operation(summary = "List requests", description = "Newest first, optionally filtered by status")
    public ResponseEntity<List<BountyRequestDto>> list(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role,
            @RequestParam(required = false) String status) {
        accessGuard.require(adminId, role, AdminRole.REVIEWER);
        RequestStatus filter = status != null ? RequestStatus.fromValue(status) : null;
        return ResponseEntity.ok(lifecycleService.listRequests(filter).stream()
                .map(BountyDtoMapper::toDto)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a request")
    public ResponseEntity<BountyRequestDto> get(
            @PathVariable UUID id,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role) {
        accessGuard.require(adminId, role, AdminRole.REVIEWER);
        return ResponseEntity.ok(BountyDtoMapper.toDto(lifecycleService.getRequest(id)));
    }

    @GetMapping("/{id}/submissions")
    @Operation(summary = "List a request's submissions", description = "Newest first, optionally filtered by status")
    public ResponseEntity<List<SubmissionDto>> submissions(
            @PathVariable UUID id,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role,
            @RequestParam(required = false) String status) {
        accessGuard.require(adminId, role, AdminRole.REVIEWER);
        SubmissionStatus filter = status != null && !"all".equalsIgnoreCase(status)
                ? SubmissionStatus.fromValue(status)
                : null;
        return ResponseEntity.ok(submissionQueryService.listSubmissionsForRequest(id, filter));
    }

    // ==================== Lifecycle ====================

    @PostMapping("/{id}/publish")
    @Operation(summary = "Publish a request", description = "draft or pending_review -> published")
    public ResponseEntity<BountyRequestDto> publish(
            @PathVariable UUID id,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role) {
        AdminPrincipal admin = accessGuard.require(adminId, role, AdminRole.ADMIN);
        return ResponseEntity.ok(BountyDtoMapper.toDto(lifecycleService.publishRequest(id, admin.getId())));
    }

    @PostMapping("/{id}/pause")
    @Operation(summary = "Pause a request", description = "published -> paused")
    public ResponseEntity<BountyRequestDto> pause(
            @PathVariable UUID id,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role) {
        accessGuard.require(adminId, role, AdminRole.ADMIN);
        return ResponseEntity.ok(BountyDtoMapper.toDto(lifecycleService.pauseRequest(id)));
    }

    @PostMapping("/{id}/unpause")
    @Operation(summary = "Unpause a request", description = "paused -> published")
    public ResponseEntity<BountyRequestDto> unpause(
            @PathVariable UUID id,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role) {
        accessGuard.require(adminId, role, AdminRole.ADMIN);
        return ResponseEntity.ok(BountyDtoMapper.toDto(lifecycleService.unpauseRequest(id)));
    }

    @PostMapping("/{id}/close")
    @Operation(summary = "Close a request", description = "published or paused -> closed")
    public ResponseEntity<BountyRequestDto> close(
            @PathVariable UUID id,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role) {
        accessGuard.require(adminId, role, AdminRole.ADMIN);
        return ResponseEntity.ok(BountyDtoMapper.toDto(lifecycleService.closeRequest(id)));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel a request", description = "any non-terminal, non-fulfilled status -> cancelled")
    public ResponseEntity<BountyRequestDto> cancel(
            @PathVariable UUID id,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role) {
        accessGuard.require(adminId, role, AdminRole.ADMIN);
        return ResponseEntity.ok(BountyDtoMapper.toDto(lifecycleService.cancelRequest(id)));
    }
}
