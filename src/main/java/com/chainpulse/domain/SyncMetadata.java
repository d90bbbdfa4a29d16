package com.chainpulse.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Loop bookkeeping embedded in {@link ContractAnalysis}. Updated field by field through
 * {@link AnalysisUpdate}; {@code continuous} may be flipped externally to stop a running loop.
 */
@NoArgsConstructor
@Getter
@Setter
public class SyncMetadata {

    public static final String DEFAULT_CONTRACT = "defaultContract";
    public static final String CONTINUOUS = "continuous";
    public static final String SEARCH_STRATEGY = "searchStrategy";
    public static final String BLOCK_RANGE = "blockRange";
    public static final String SYNC_CYCLE = "syncCycle";
    public static final String LAST_PROCESSED_BLOCK = "lastProcessedBlock";
    public static final String FETCH_METHOD = "fetchMethod";
    public static final String LAST_CYCLE_STARTED = "lastCycleStarted";
    public static final String CYCLE_START_TIME = "cycleStartTime";
    public static final String ESTIMATED_CYCLE_DURATION_MS = "estimatedCycleDurationMs";
    public static final String CONTINUOUS_STARTED = "continuousStarted";
    public static final String CONTINUOUS_STOPPED = "continuousStopped";
    public static final String STOPPED_BY_CYCLE = "stoppedByCycle";
    public static final String COMPLETED_AFTER_CYCLES = "completedAfterCycles";
    public static final String AUTO_STOPPED_REASON = "autoStoppedReason";
    public static final String EMPTY_CYCLES = "emptyCycles";

    private boolean defaultContract;
    private Boolean continuous;
    private String searchStrategy;
    private Long blockRange;
    private Integer syncCycle;
    private Long lastProcessedBlock;
    private String fetchMethod;
    private Instant lastCycleStarted;
    private Instant cycleStartTime;
    private Long estimatedCycleDurationMs;
    private Instant continuousStarted;
    private Instant continuousStopped;
    private Integer stoppedByCycle;
    private Integer completedAfterCycles;
    private String autoStoppedReason;
    private Integer emptyCycles;
}
