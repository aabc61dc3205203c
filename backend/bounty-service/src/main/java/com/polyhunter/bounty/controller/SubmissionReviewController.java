package com.polyhunter.bounty.controller;

import com.polyhunter.bounty.access.AdminAccessGuard;
import com.polyhunter.bounty.access.AdminPrincipal;
import com.polyhunter.bounty.dto.ReviewResultDto;
import com.polyhunter.bounty.dto.ReviewSubmissionRequest;
import com.polyhunter.bounty.dto.SubmissionDetailDto;
import com.polyhunter.bounty.dto.SubmissionDto;
import com.polyhunter.bounty.entity.AdminRole;
import com.polyhunter.bounty.entity.SubmissionStatus;
import com.polyhunter.bounty.mappers.BountyDtoMapper;
import com.polyhunter.bounty.service.ReviewOutcome;
import com.polyhunter.bounty.service.SubmissionQueryService;
import com.polyhunter.bounty.service.SubmissionReviewService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

import static com.polyhunter.bounty.access.AdminAccessGuard.ADMIN_ID_HEADER;
import static com.polyhunter.bounty.access.AdminAccessGuard.ADMIN_ROLE_HEADER;

/**
 * REST API for reviewing contributor submissions
 */
@RestController
@RequestMapping("/api/admin/submissions")
@RequiredArgsConstructor
@Tag(name = "Submission Review", description = "Accept, reject or return submissions for revision")
public class SubmissionReviewController {

    private final SubmissionReviewService reviewService;
    private final SubmissionQueryService queryService;
    private final AdminAccessGuard accessGuard;

    @GetMapping
    @Operation(summary = "Review queue", description = "Submissions in a status across all requests, oldest first")
    public ResponseEntity<List<SubmissionDto>> queue(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role,
            @RequestParam(defaultValue = "submitted") String status) {
        accessGuard.require(adminId, role, AdminRole.REVIEWER);
        return ResponseEntity.ok(queryService.listSubmissionsByStatus(SubmissionStatus.fromValue(status)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a submission", description = "The submission with its request title and images")
    public ResponseEntity<SubmissionDetailDto> get(
            @PathVariable UUID id,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role) {
        accessGuard.require(adminId, role, AdminRole.REVIEWER);
        return ResponseEntity.ok(queryService.getSubmission(id));
    }

    @PostMapping("/{id}/review")
    @Operation(summary = "Review a submission",
            description = "Accepting requires the admin role and creates an earning; reviewers may reject or request a revision")
    public ResponseEntity<ReviewResultDto> review(
            @PathVariable UUID id,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role,
            @Valid @RequestBody ReviewSubmissionRequest body) {
        AdminPrincipal admin = accessGuard.require(adminId, role, body.getAction().getRequiredRole());
        ReviewOutcome outcome = reviewService.review(id, body.getAction(), body.getFeedback(), admin.getId(),
                Boolean.TRUE.equals(body.getAwardQualityBonus()));
        return ResponseEntity.ok(BountyDtoMapper.toDto(outcome));
    }
}
