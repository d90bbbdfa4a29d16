package com.chainpulse.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/v1/contracts/{userId}/continuous-sync response.
 *
 * @param loopActive whether a sync loop for the analysis is currently executing
 * @param recentLogs last log lines of the analysis, oldest first
 */
public record ContinuousSyncStatusResponse(
        String analysisId,
        String contractAddress,
        String chain,
        String status,
        Integer progress,
        Integer syncCycle,
        Long lastProcessedBlock,
        boolean continuous,
        boolean loopActive,
        String autoStoppedReason,
        Long totalTransactions,
        Instant updatedAt,
        List<String> recentLogs
) {
}
