package com.polyhunter.bounty.controller;

import com.polyhunter.bounty.access.AdminAccessGuard;
import com.polyhunter.bounty.dto.*;
import com.polyhunter.bounty.entity.AdminRole;
import com.polyhunter.bounty.entity.EarningStatus;
import com.polyhunter.bounty.mappers.BountyDtoMapper;
import com.polyhunter.bounty.service.EarningsLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

import static com.polyhunter.bounty.access.AdminAccessGuard.ADMIN_ID_HEADER;
import static com.polyhunter.bounty.access.AdminAccessGuard.ADMIN_ROLE_HEADER;

/**
 * REST API for the earnings ledger
 */
@RestController
@RequestMapping("/api/admin/earnings")
@RequiredArgsConstructor
@Tag(name = "Earnings", description = "Contributor earnings ledger and payout status APIs")
public class EarningsController {

    private final EarningsLedgerService ledgerService;
    private final AdminAccessGuard accessGuard;

    @GetMapping
    @Operation(summary = "List earnings", description = "Newest first, optionally filtered by payout status")
    public ResponseEntity<EarningPageDto> list(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int pageSize) {
        accessGuard.require(adminId, role, AdminRole.ADMIN);
        EarningStatus filter = status != null ? EarningStatus.fromValue(status) : null;
        return ResponseEntity.ok(ledgerService.listEarnings(filter, page, Math.min(Math.max(pageSize, 1), 100)));
    }

    @GetMapping("/stats")
    @Operation(summary = "Payout stats", description = "Ledger totals grouped by payout status")
    public ResponseEntity<PayoutStatsDto> stats(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role) {
        accessGuard.require(adminId, role, AdminRole.ADMIN);
        return ResponseEntity.ok(ledgerService.getPayoutStats());
    }

    @GetMapping("/contributors/{contributorId}")
    @Operation(summary = "Contributor earnings", description = "Total, pending and paid earnings of one contributor")
    public ResponseEntity<ContributorEarningsDto> contributor(
            @PathVariable UUID contributorId,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role) {
        accessGuard.require(adminId, role, AdminRole.REVIEWER);
        return ResponseEntity.ok(ledgerService.getContributorEarnings(contributorId));
    }

    @PostMapping("/{id}/status")
    @Operation(summary = "Update payout status", description = "pending -> processing -> paid, or held")
    public ResponseEntity<EarningDto> updateStatus(
            @PathVariable UUID id,
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestHeader(value = ADMIN_ROLE_HEADER, required = false) String role,
            @Valid @RequestBody UpdateEarningStatusRequest body) {
        accessGuard.require(adminId, role, AdminRole.ADMIN);
        return ResponseEntity.ok(BountyDtoMapper.toDto(ledgerService.updateEarningStatus(id, body.getStatus())));
    }
}
