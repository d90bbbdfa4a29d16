package com.chainpulse.ingestion.sync.progress;

import com.chainpulse.domain.AnalysisResults;
import com.chainpulse.domain.AnalysisUpdate;
import com.chainpulse.domain.ContractAnalysis;
import com.chainpulse.domain.ContractAnalysis.AnalysisStatus;
import com.chainpulse.domain.ContractAnalysisRepository;
import com.chainpulse.domain.DefaultContractUpdate;
import com.chainpulse.domain.SyncMetadata;
import com.chainpulse.domain.UserAccount;
import com.chainpulse.domain.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and partially updates the analysis record a sync loop runs against, and mirrors loop progress onto the
 * owning user's default contract. Every write is a single Mongo update, so a concurrent stop request that flips
 * {@code metadata.continuous} is never overwritten by a stale document.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncRecordBridge {

    private final ContractAnalysisRepository contractAnalysisRepository;
    private final UserAccountRepository userAccountRepository;

    public Optional<ContractAnalysis> read(String analysisId) {
        return contractAnalysisRepository.findById(analysisId);
    }

    /**
     * Cycle-start bookkeeping: progress, cycle metadata and a start log line.
     */
    public void markCycleStarted(String analysisId, int cycle, int progress, Long lastProcessedBlock,
                                 String fetchMethod, long estimatedCycleDurationMs) {
        Instant now = Instant.now();
        AnalysisUpdate.AnalysisUpdateBuilder update = AnalysisUpdate.builder()
                .progress(progress)
                .metadata(SyncMetadata.SYNC_CYCLE, cycle)
                .metadata(SyncMetadata.LAST_CYCLE_STARTED, now)
                .metadata(SyncMetadata.FETCH_METHOD, fetchMethod)
                .metadata(SyncMetadata.CYCLE_START_TIME, now)
                .metadata(SyncMetadata.ESTIMATED_CYCLE_DURATION_MS, estimatedCycleDurationMs)
                .log("Cycle " + cycle + ": Starting " + fetchMethod + " fetch...");
        if (lastProcessedBlock != null) {
            update.metadata(SyncMetadata.LAST_PROCESSED_BLOCK, lastProcessedBlock);
        }
        apply(analysisId, update.build());
    }

    /**
     * Replaces the results snapshot and appends the cycle summary lines in one write.
     */
    public void recordCycleResults(String analysisId, AnalysisResults results, long lastProcessedBlock, List<String> logs) {
        apply(analysisId, AnalysisUpdate.builder()
                .results(results)
                .metadata(SyncMetadata.LAST_PROCESSED_BLOCK, lastProcessedBlock)
                .logs(logs)
                .build());
    }

    public void appendLog(String analysisId, String... lines) {
        apply(analysisId, AnalysisUpdate.builder().logs(List.of(lines)).build());
    }

    /**
     * Terminal success: status COMPLETED, progress 100, continuous off, plus the given metadata and log line.
     */
    public void markCompleted(String analysisId, Map<String, Object> metadata, String logLine) {
        apply(analysisId, AnalysisUpdate.builder()
                .status(AnalysisStatus.COMPLETED)
                .progress(100)
                .metadata(SyncMetadata.CONTINUOUS, false)
                .metadataFields(metadata)
                .log(logLine)
                .completedAt(Instant.now())
                .build());
    }

    /**
     * Terminal failure: status FAILED with the error message, continuous off.
     */
    public void markFailed(String analysisId, String errorMessage) {
        apply(analysisId, AnalysisUpdate.builder()
                .status(AnalysisStatus.FAILED)
                .errorMessage(errorMessage)
                .metadata(SyncMetadata.CONTINUOUS, false)
                .log("Continuous sync failed: " + errorMessage)
                .completedAt(Instant.now())
                .build());
    }

    public Optional<UserAccount> readUser(String userId) {
        return userAccountRepository.findById(userId);
    }

    /**
     * Applies the update to the user's default contract. No-op when the user has none.
     *
     * @return true when a default contract was updated
     */
    public boolean writeUserOnboarding(String userId, DefaultContractUpdate update) {
        if (userId == null) {
            return false;
        }
        boolean updated = userAccountRepository.updateDefaultContract(userId, update);
        if (!updated) {
            log.debug("User {} has no default contract; onboarding update skipped", userId);
        }
        return updated;
    }

    private void apply(String analysisId, AnalysisUpdate update) {
        if (update.isEmpty()) {
            return;
        }
        if (!contractAnalysisRepository.applyUpdate(analysisId, update)) {
            log.warn("Analysis {} not found; update dropped", analysisId);
        }
    }
}
