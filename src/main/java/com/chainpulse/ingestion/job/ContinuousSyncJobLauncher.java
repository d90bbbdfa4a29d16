package com.chainpulse.ingestion.job;

import com.chainpulse.config.AsyncConfig;
import com.chainpulse.domain.ContinuousSyncRequestedEvent;
import com.chainpulse.ingestion.sync.ActiveSyncRegistry;
import com.chainpulse.ingestion.sync.ContinuousSyncRunner;
import com.chainpulse.ingestion.sync.SyncTarget;
import com.chainpulse.ingestion.sync.progress.SyncRecordBridge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Starts a continuous sync loop on the sync executor for every {@link ContinuousSyncRequestedEvent}.
 * At most one loop runs per analysis; a second request for an analysis already in flight is ignored.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContinuousSyncJobLauncher implements ActiveSyncRegistry {

    private final Set<String> inFlightAnalyses = ConcurrentHashMap.newKeySet();

    private final ContinuousSyncRunner continuousSyncRunner;
    private final SyncRecordBridge recordBridge;
    @Qualifier(AsyncConfig.SYNC_EXECUTOR)
    private final Executor syncExecutor;

    @EventListener
    public void onContinuousSyncRequested(ContinuousSyncRequestedEvent event) {
        launch(event);
    }

    /**
     * @return false when a loop for the analysis is already running or the executor rejected the job
     */
    boolean launch(ContinuousSyncRequestedEvent event) {
        String analysisId = event.analysisId();
        if (!inFlightAnalyses.add(analysisId)) {
            log.debug("Continuous sync for analysis {} already in flight; request ignored", analysisId);
            return false;
        }
        SyncTarget target = new SyncTarget(event.contractAddress(), event.chain(), event.searchStrategy(), event.blockRange());
        try {
            syncExecutor.execute(() -> run(analysisId, target, event.userId()));
            return true;
        } catch (RejectedExecutionException e) {
            inFlightAnalyses.remove(analysisId);
            log.error("Sync executor rejected continuous sync for analysis {}", analysisId);
            recordBridge.markFailed(analysisId, "Sync capacity exhausted, try again later");
            return false;
        }
    }

    @Override
    public boolean isRunning(String analysisId) {
        return inFlightAnalyses.contains(analysisId);
    }

    private void run(String analysisId, SyncTarget target, String userId) {
        try {
            continuousSyncRunner.performContinuousContractSync(analysisId, target, userId);
        } catch (RuntimeException e) {
            try {
                recordBridge.markFailed(analysisId, e.getMessage());
            } catch (RuntimeException markError) {
                log.error("Failed to mark analysis {} as failed: {}", analysisId, markError.getMessage());
            }
        } finally {
            inFlightAnalyses.remove(analysisId);
        }
    }
}
