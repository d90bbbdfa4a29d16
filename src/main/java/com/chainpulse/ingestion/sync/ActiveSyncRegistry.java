package com.chainpulse.ingestion.sync;

/**
 * Knows which analyses have a sync loop alive in this process, including a loop that was asked to stop but has
 * not yet reached the top of its next cycle.
 */
public interface ActiveSyncRegistry {

    boolean isRunning(String analysisId);
}
