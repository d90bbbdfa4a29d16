package com.chainpulse.domain.report;

import java.util.List;
import java.util.Map;

/**
 * How wallets move through a contract's functions over time.
 *
 * @param journeyDistribution journey length (as a string key, for MongoDB) to number of wallets
 */
public record JourneyReport(
        int totalUsers,
        double averageJourneyLength,
        List<CommonPath> commonPaths,
        List<EntryPoint> entryPoints,
        FeatureAdoption featureAdoption,
        List<DropoffPoint> dropoffPoints,
        Map<String, Integer> journeyDistribution
) {

    /**
     * A contiguous function sequence shared by several wallets.
     *
     * @param averageCompletionTimeMs mean time from the first to the last call of the sequence
     */
    public record CommonPath(
            List<String> sequence,
            int userCount,
            int totalOccurrences,
            double averageCompletionTimeMs,
            double conversionRate
    ) {}

    public record EntryPoint(String functionName, int userCount, double percentage) {}

    public record Transition(String from, String to, int userCount, double adoptionRate, double percentage) {}

    public record FunctionUsage(String functionName, int uniqueUsers) {}

    public record FeatureAdoption(List<Transition> transitions, List<FunctionUsage> functionUsage) {}

    public record DropoffPoint(
            String functionName,
            int dropoffCount,
            int totalAppearances,
            double dropoffRate,
            double dropoffPercentage
    ) {}

    public static JourneyReport empty() {
        return new JourneyReport(0, 0, List.of(), List.of(),
                new FeatureAdoption(List.of(), List.of()), List.of(), Map.of());
    }
}
