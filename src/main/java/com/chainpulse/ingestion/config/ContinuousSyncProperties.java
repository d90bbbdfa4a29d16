package com.chainpulse.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Continuous contract sync loop settings.
 */
@ConfigurationProperties(prefix = "chainpulse.sync")
@NoArgsConstructor
@Getter
@Setter
public class ContinuousSyncProperties {

    /** Consecutive cycles without new transactions or events before the loop stops itself. */
    private int emptyCycleThreshold = 10;

    /** Hard cap on cycles per loop. */
    private int maxCycles = 50;

    /** Pause between cycles, also applied after a failed cycle. */
    private long interCycleDelayMs = 30_000;

    /** First-cycle lookback in blocks for the "comprehensive" search strategy. */
    private long comprehensiveBaseRange = 100_000;

    /** First-cycle lookback in blocks for every other strategy. */
    private long standardBaseRange = 50_000;

    /** Fallback window size when the analysis does not configure one. */
    private long defaultBlockRange = 1_000;

    private int reportTransactionLimit = 500;
    private int reportEventLimit = 500;
    private int reportUserLimit = 100;
}
