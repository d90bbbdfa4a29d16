package com.chainpulse.ingestion.sync;

import com.chainpulse.common.SyncConfigurationException;
import com.chainpulse.domain.ContinuousCompletionReason;
import com.chainpulse.domain.ContractAnalysis;
import com.chainpulse.domain.ContractAnalysis.AnalysisStatus;
import com.chainpulse.domain.DefaultContractUpdate;
import com.chainpulse.domain.SyncMetadata;
import com.chainpulse.ingestion.config.ContinuousSyncProperties;
import com.chainpulse.ingestion.sync.cycle.CycleReport;
import com.chainpulse.ingestion.sync.cycle.SyncCycleExecutor;
import com.chainpulse.ingestion.sync.progress.SyncRecordBridge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Drives a continuous sync loop until it reaches a terminal state. Cycles run strictly one after another on the
 * calling thread. A failed cycle, including a failed read of the analysis record, is logged against the analysis
 * and the loop moves on; stop requests are observed at the top of each cycle by re-reading the analysis record.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContinuousSyncRunner {

    static final String NO_NEW_DATA_REASON = "No new data detected";
    static final String MAX_CYCLES_REASON = "Maximum cycles reached";

    private final SyncCycleExecutor cycleExecutor;
    private final SyncRecordBridge recordBridge;
    private final ContinuousSyncProperties properties;

    /**
     * Blocks until the loop ends. The user's default contract is updated with the outcome.
     *
     * @throws RuntimeException when the loop itself (not a single cycle) fails; the user record is annotated first
     */
    public SyncTerminalState performContinuousContractSync(String analysisId, SyncTarget target, String userId) {
        SyncRun run = new SyncRun(analysisId, userId, target);
        log.info("Starting continuous sync loop for analysis {} ({} on {})", analysisId, target.contractAddress(), target.chain());
        try {
            SyncTerminalState state = loop(run);
            finishUser(run, state);
            log.info("Continuous sync for analysis {} ended: {} after {} cycle(s), {} txs accumulated",
                    analysisId, state, run.getCycleNumber() - 1, run.getDataset().transactionCount());
            return state;
        } catch (RuntimeException e) {
            log.error("Continuous sync for analysis {} failed: {}", analysisId, e.getMessage(), e);
            try {
                recordBridge.writeUserOnboarding(userId, DefaultContractUpdate.failed(e.getMessage()));
            } catch (RuntimeException userError) {
                log.error("Failed to record sync error on user {}: {}", userId, userError.getMessage());
            }
            throw e;
        }
    }

    private SyncTerminalState loop(SyncRun run) {
        while (true) {
            int cycle = run.getCycleNumber();
            try {
                Optional<SyncTerminalState> stop = evaluatePreCycle(run);
                if (stop.isPresent()) {
                    return stop.get();
                }
                CycleReport report = cycleExecutor.execute(run);
                if (report.isEmpty()) {
                    int streak = run.recordEmptyCycle();
                    log.debug("Analysis {} cycle {}: no new data ({}/{})", run.getAnalysisId(), cycle, streak,
                            properties.getEmptyCycleThreshold());
                    if (streak >= properties.getEmptyCycleThreshold()) {
                        run.advanceTo(report.window().toBlock());
                        completeExhausted(run, cycle, streak);
                        return SyncTerminalState.COMPLETED_EXHAUSTED;
                    }
                } else {
                    run.resetEmptyCycles();
                }
                run.advanceTo(report.window().toBlock());
            } catch (SyncConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Sync cycle {} for analysis {} failed: {}", cycle, run.getAnalysisId(), e.getMessage());
                logCycleError(run, cycle, e);
            }

            run.nextCycle();
            if (run.getCycleNumber() > properties.getMaxCycles()) {
                completeCeiling(run);
                return SyncTerminalState.COMPLETED_CEILING;
            }
            if (!pause()) {
                return SyncTerminalState.COMPLETED_STOPPED;
            }
        }
    }

    /**
     * Decides whether the next cycle may run, from a fresh read of the analysis record.
     *
     * @return the terminal state to end with, or empty to run the cycle
     */
    Optional<SyncTerminalState> evaluatePreCycle(SyncRun run) {
        Optional<ContractAnalysis> current = recordBridge.read(run.getAnalysisId());
        if (current.isEmpty()) {
            log.warn("Analysis {} no longer exists; stopping continuous sync", run.getAnalysisId());
            return Optional.of(SyncTerminalState.FAILED_TERMINAL);
        }
        ContractAnalysis analysis = current.get();
        if (analysis.getStatus() == AnalysisStatus.FAILED) {
            log.info("Analysis {} is marked failed; stopping continuous sync", run.getAnalysisId());
            return Optional.of(SyncTerminalState.FAILED_TERMINAL);
        }
        Boolean continuous = analysis.getMetadata() != null ? analysis.getMetadata().getContinuous() : null;
        if (Boolean.FALSE.equals(continuous)
                || (analysis.getStatus() != AnalysisStatus.RUNNING && !Boolean.TRUE.equals(continuous))) {
            log.info("Continuous sync for analysis {} stopped by request before cycle {}", run.getAnalysisId(), run.getCycleNumber());
            return Optional.of(SyncTerminalState.COMPLETED_STOPPED);
        }
        return Optional.empty();
    }

    private void completeExhausted(SyncRun run, int cycle, int streak) {
        log.info("Auto-stopping continuous sync for analysis {} after {} cycles without new data", run.getAnalysisId(), streak);
        recordBridge.markCompleted(run.getAnalysisId(),
                Map.of(SyncMetadata.COMPLETED_AFTER_CYCLES, cycle,
                        SyncMetadata.AUTO_STOPPED_REASON, NO_NEW_DATA_REASON,
                        SyncMetadata.EMPTY_CYCLES, streak),
                "Continuous sync auto-stopped after " + streak + " cycles without new data");
    }

    private void completeCeiling(SyncRun run) {
        int completed = run.getCycleNumber() - 1;
        log.info("Stopping continuous sync for analysis {} after {} cycles", run.getAnalysisId(), completed);
        recordBridge.markCompleted(run.getAnalysisId(),
                Map.of(SyncMetadata.COMPLETED_AFTER_CYCLES, completed,
                        SyncMetadata.AUTO_STOPPED_REASON, MAX_CYCLES_REASON),
                "Continuous sync completed after " + completed + " cycles (auto-stopped)");
    }

    private void logCycleError(SyncRun run, int cycle, RuntimeException error) {
        try {
            recordBridge.appendLog(run.getAnalysisId(),
                    "Cycle " + cycle + ": Error - " + error.getMessage() + " (interaction-based fetch)");
        } catch (RuntimeException logError) {
            log.error("Failed to log cycle error for analysis {}: {}", run.getAnalysisId(), logError.getMessage());
        }
    }

    /** @return false when interrupted */
    private boolean pause() {
        long delay = properties.getInterCycleDelayMs();
        if (delay <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** The analysis record already holds the outcome, so a failed user write is only logged. */
    private void finishUser(SyncRun run, SyncTerminalState state) {
        ContinuousCompletionReason reason = switch (state) {
            case COMPLETED_EXHAUSTED -> ContinuousCompletionReason.AUTO_STOPPED_NO_DATA;
            case COMPLETED_CEILING -> ContinuousCompletionReason.MAX_CYCLES_REACHED;
            case COMPLETED_STOPPED -> ContinuousCompletionReason.USER_REQUESTED;
            case FAILED_TERMINAL -> ContinuousCompletionReason.NORMAL_COMPLETION;
        };
        try {
            recordBridge.writeUserOnboarding(run.getUserId(), DefaultContractUpdate.finished(reason));
        } catch (RuntimeException e) {
            log.error("Failed to record sync completion ({}) on user {}: {}", reason, run.getUserId(), e.getMessage());
        }
    }
}
