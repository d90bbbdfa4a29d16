package com.chainpulse.api.controller;

import com.chainpulse.api.dto.ContinuousSyncStartedResponse;
import com.chainpulse.api.dto.ContinuousSyncStatusResponse;
import com.chainpulse.api.dto.ContinuousSyncStoppedResponse;
import com.chainpulse.api.dto.ErrorBody;
import com.chainpulse.api.dto.StartContinuousSyncRequest;
import com.chainpulse.domain.AnalysisResults;
import com.chainpulse.domain.ContractAnalysis;
import com.chainpulse.domain.SyncMetadata;
import com.chainpulse.ingestion.contract.command.ContinuousSyncCommandException;
import com.chainpulse.ingestion.contract.command.ContinuousSyncCommandService;
import com.chainpulse.ingestion.contract.command.ContinuousSyncStarted;
import com.chainpulse.ingestion.contract.command.ContinuousSyncStopped;
import com.chainpulse.ingestion.contract.query.ContinuousSyncStatusService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * POST /contracts/{userId}/continuous-sync, POST .../stop, GET .../continuous-sync.
 */
@RestController
@RequestMapping("/api/v1/contracts/{userId}/continuous-sync")
@RequiredArgsConstructor
public class ContinuousSyncController {

    static final int RECENT_LOG_LINES = 20;

    private final ContinuousSyncCommandService commandService;
    private final ContinuousSyncStatusService statusService;

    @PostMapping
    public ResponseEntity<ContinuousSyncStartedResponse> start(@PathVariable String userId,
                                                               @Valid @RequestBody(required = false) StartContinuousSyncRequest request) {
        String strategy = request != null && request.searchStrategy() != null ? request.searchStrategy().trim() : null;
        Long blockRange = request != null ? request.blockRange() : null;
        ContinuousSyncStarted started = commandService.start(userId, strategy, blockRange);
        return ResponseEntity.accepted().body(new ContinuousSyncStartedResponse(
                started.analysisId(), started.syncCycle(), started.resumed(), "Continuous sync started"));
    }

    @PostMapping("/stop")
    public ResponseEntity<ContinuousSyncStoppedResponse> stop(@PathVariable String userId) {
        ContinuousSyncStopped stopped = commandService.stop(userId);
        return ResponseEntity.ok(new ContinuousSyncStoppedResponse(
                stopped.analysisId(), stopped.cyclesCompleted(), stopped.totalDurationMs(),
                "Continuous sync stopped successfully"));
    }

    @GetMapping
    public ResponseEntity<?> status(@PathVariable String userId) {
        return statusService.findLatestAnalysis(userId)
                .<ResponseEntity<?>>map(a -> ResponseEntity.ok(toStatusResponse(a, statusService.isLoopActive(a.getId()))))
                .orElse(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("ANALYSIS_NOT_FOUND", "No analysis found for user " + userId)));
    }

    @ExceptionHandler(ContinuousSyncCommandException.class)
    public ResponseEntity<ErrorBody> handleCommandError(ContinuousSyncCommandException ex) {
        HttpStatus status = ContinuousSyncCommandException.SYNC_ALREADY_RUNNING.equals(ex.getErrorCode())
                ? HttpStatus.CONFLICT
                : HttpStatus.NOT_FOUND;
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    private static ContinuousSyncStatusResponse toStatusResponse(ContractAnalysis a, boolean loopActive) {
        SyncMetadata m = a.getMetadata() != null ? a.getMetadata() : new SyncMetadata();
        AnalysisResults.TargetResults target = a.getResults() != null ? a.getResults().target() : null;
        List<String> logs = a.getLogs() != null ? a.getLogs() : List.of();
        return new ContinuousSyncStatusResponse(
                a.getId(),
                a.getContractAddress(),
                a.getChain(),
                a.getStatus() != null ? a.getStatus().name() : null,
                a.getProgress(),
                m.getSyncCycle(),
                m.getLastProcessedBlock(),
                Boolean.TRUE.equals(m.getContinuous()),
                loopActive,
                m.getAutoStoppedReason(),
                target != null ? target.transactions() : null,
                a.getUpdatedAt(),
                List.copyOf(logs.subList(Math.max(0, logs.size() - RECENT_LOG_LINES), logs.size())));
    }
}
