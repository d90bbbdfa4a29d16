package com.chainpulse.domain.report;

import java.time.Instant;
import java.util.Map;

/**
 * Protocol metrics over a trailing 30-day window. ETH amounts are rounded to 6 decimals, percentages to 2.
 */
public record DeFiMetrics(
        Instant calculatedAt,
        Instant windowStart,
        Instant windowEnd,
        int totalTransactions,
        UserLifecycleMetrics userLifecycle,
        ActivityMetrics activity,
        FinancialMetrics financial,
        PerformanceMetrics performance
) {

    public record UserLifecycleMetrics(
            double activationRate,
            double adoptionRate,
            double retentionRate,
            double churnRate,
            Map<String, Integer> lifecycleDistribution
    ) {}

    public record ActivityMetrics(int dau, int wau, int mau, double transactionVolume, double averageTransactionSize) {}

    /**
     * @param whaleActivityRatio share of transactions moving at least 10 ETH, as a percentage
     */
    public record FinancialMetrics(
            double tvl,
            double netInflow,
            double netOutflow,
            double netFlow,
            double revenuePerUser,
            double protocolRevenue,
            double whaleActivityRatio
    ) {}

    /**
     * @param contractUtilizationRate transactions per day over the window
     * @param protocolStickiness      share of users with more than one transaction, as a percentage
     */
    public record PerformanceMetrics(
            double functionSuccessRate,
            double averageGasCost,
            double contractUtilizationRate,
            int crossContractInteractionRate,
            double protocolStickiness
    ) {}
}
