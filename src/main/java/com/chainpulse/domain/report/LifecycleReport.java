package com.chainpulse.domain.report;

import java.util.List;
import java.util.Map;

/**
 * Wallet lifecycle view: stage distribution (new/active/inactive/dormant/churned), wallet types,
 * monthly cohorts, activation and function progression.
 */
public record LifecycleReport(
        int totalWallets,
        Map<String, Integer> lifecycleDistribution,
        Map<String, WalletTypeSummary> walletClassification,
        List<Cohort> cohortAnalysis,
        ActivationMetrics activationMetrics,
        ProgressionAnalysis progressionAnalysis,
        Summary summary
) {

    public record WalletTypeSummary(int count, double percentage, double totalVolume, double averageTransactions) {}

    /**
     * Wallets first seen in the same calendar month.
     *
     * @param retentionRates keyed {@code day1}, {@code day7}, {@code day30}, {@code day90}; percentages
     */
    public record Cohort(
            String cohortPeriod,
            int totalUsers,
            Map<String, Double> retentionRates,
            double totalVolume,
            double averageVolumePerUser
    ) {}

    /**
     * @param activationRate share of wallets with at least one successful transaction, as a percentage
     */
    public record ActivationMetrics(
            int totalWallets,
            int activatedWallets,
            double activationRate,
            double averageActivationTime,
            Map<String, Integer> activationTimeDistribution
    ) {}

    public record FunctionProgression(
            String functionName,
            int totalAdoptions,
            double averageAdoptionOrder,
            int entryPointCount,
            double adoptionRate
    ) {}

    public record ProgressionPath(String path, int userCount, double percentage) {}

    public record ProgressionDepth(int singleFunction, int multiFunction, int powerUsers) {}

    public record ProgressionAnalysis(
            List<FunctionProgression> functionProgression,
            List<ProgressionPath> topProgressionPaths,
            ProgressionDepth progressionDepth
    ) {}

    /**
     * @param retentionRate (active + inactive) / all wallets, as a percentage
     * @param averageLifespan mean days between first and last activity
     */
    public record Summary(int activeUsers, int newUsers, int churnedUsers, double retentionRate, double averageLifespan) {}

    public static LifecycleReport empty() {
        return new LifecycleReport(0, Map.of(), Map.of(), List.of(),
                new ActivationMetrics(0, 0, 0, 0, Map.of()),
                new ProgressionAnalysis(List.of(), List.of(), new ProgressionDepth(0, 0, 0)),
                new Summary(0, 0, 0, 0, 0));
    }
}
