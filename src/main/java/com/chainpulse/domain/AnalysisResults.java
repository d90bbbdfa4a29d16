package com.chainpulse.domain;

/**
 * Results block of a {@link ContractAnalysis}; replaced wholesale after every sync cycle.
 */
public record AnalysisResults(TargetResults target) {

    /**
     * Accumulated view of the analysed contract.
     *
     * @param transactions total accumulated transaction count
     * @param blockRange   window processed by the cycle that produced this snapshot
     */
    public record TargetResults(
            String contract,
            String chain,
            AccumulatedMetrics metrics,
            long transactions,
            BlockRange blockRange,
            FullReport fullReport
    ) {}

    public record BlockRange(long from, long to) {}
}
