package com.chainpulse.ingestion.sync;

/**
 * How a continuous sync loop ended.
 */
public enum SyncTerminalState {
    /** Too many consecutive cycles without new data. */
    COMPLETED_EXHAUSTED,
    /** Cycle ceiling reached. */
    COMPLETED_CEILING,
    /** Stop requested through the analysis record, or the runner thread was interrupted. */
    COMPLETED_STOPPED,
    /** Analysis record missing or marked failed, or the target is misconfigured. */
    FAILED_TERMINAL
}
