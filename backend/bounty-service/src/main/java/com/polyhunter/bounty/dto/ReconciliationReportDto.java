package com.polyhunter.bounty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.List;

/**
 * DTO for the ledger consistency report
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReconciliationReportDto {

    private LocalDateTime generatedAt;
    private long requestsChecked;
    private List<RequestDriftDto> drifts;
    private List<EarningDto> orphanedEarnings;

    public boolean isConsistent() {
        return (drifts == null || drifts.isEmpty()) && (orphanedEarnings == null || orphanedEarnings.isEmpty());
    }
}
