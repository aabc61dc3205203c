package com.polyhunter.bounty.controller;

import com.polyhunter.bounty.access.AdminAccessGuard;
import com.polyhunter.bounty.dto.ActivityEntryDto;
import com.polyhunter.bounty.dto.AdminStatsDto;
import com.polyhunter.bounty.dto.ReconciliationReportDto;
import com.polyhunter.bounty.entity.AdminRole;
import com.polyhunter.bounty.service.AdminStatsService;
import com.polyhunter.bounty.service.ContributorActivityService;
import com.polyhunter.bounty.service.ReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

import static com.polyhunter.bounty.access.AdminAccessGuard.ADMIN_ID_HEADER;
import static com.polyhunter.bounty.access.AdminAccessGuard.ADMIN_ROLE_HEADER;

/**
 * REST API for dashboard statistics and ledger checks
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Admin Dashboard", description = "Dashboard statistics and consistency report")
public class AdminDashboardController {

    private final AdminStatsService statsService;
    private final ReconciliationService reconciliationService;
    private final ContributorActivityService activityService;
    private final AdminAccessGuard accessGuard;

    @GetMapping("/stats")
    @Operation(summary = "Dashboard stats", description = "Request and submission counts with budget totals")
    public ResponseEntity<AdminStatsDto> stats(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role) {
        accessGuard.require(adminId, role, AdminRole.REVIEWER);
        return ResponseEntity.ok(statsService.getAdminStats());
    }

    @GetMapping("/reconciliation")
    @Operation(summary = "Ledger consistency report",
            description = "Requests whose counters disagree with accepted submissions, and unreferenced earnings")
    public ResponseEntity<ReconciliationReportDto> reconciliation(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role) {
        accessGuard.require(adminId, role, AdminRole.SUPER_ADMIN);
        return ResponseEntity.ok(reconciliationService.reconcile());
    }

    @GetMapping("/contributors/{contributorId}/activity")
    @Operation(summary = "Contributor activity", description = "Most recent notices sent to a contributor")
    public ResponseEntity<List<ActivityEntryDto>> activity(
            @PathVariable UUID contributorId,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role,
            @RequestParam(defaultValue = "20") int limit) {
        accessGuard.require(adminId, role, AdminRole.REVIEWER);
        return ResponseEntity.ok(activityService.getContributorActivity(contributorId,
                Math.min(Math.max(limit, 1), 100)));
    }
}
