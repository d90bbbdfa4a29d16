package com.chainpulse.domain.report;

import java.time.Instant;
import java.util.List;

/**
 * UX funnel analysis over a contract's transactions: sessions per wallet, abandoned function transitions,
 * failure patterns and an overall A-F grade.
 */
public record UxBottleneckReport(
        SessionDurations sessionDurations,
        List<Bottleneck> bottlenecks,
        FailurePatterns failurePatterns,
        TimeToFirstSuccess timeToFirstSuccess,
        UxGrade uxGrade,
        Summary summary
) {

    public record Session(
            String wallet,
            Instant firstTransaction,
            Instant lastTransaction,
            double durationMinutes,
            int transactionCount,
            int successfulTransactions,
            int failedTransactions
    ) {}

    public record SessionDurations(
            List<Session> sessions,
            double averageDuration,
            double medianDuration,
            double minDuration,
            double maxDuration
    ) {
        public static SessionDurations empty() {
            return new SessionDurations(List.of(), 0, 0, 0, 0);
        }
    }

    /** A function-to-function transition that most callers never complete. */
    public record Bottleneck(
            String fromFunction,
            String toFunction,
            double abandonmentRate,
            double completionRate,
            int totalStarted,
            int completed,
            int abandoned,
            int affectedUsers
    ) {}

    public record FunctionFailures(String functionName, int failureCount, int totalAttempts, double failureRate) {}

    public record FailureSequence(
            String wallet,
            int failureCount,
            List<String> functions,
            Instant firstFailure,
            Instant lastFailure
    ) {}

    public record FailurePatterns(
            int totalFailures,
            List<FunctionFailures> failuresByFunction,
            List<FailureSequence> failureSequences
    ) {
        public static FailurePatterns empty() {
            return new FailurePatterns(0, List.of(), List.of());
        }
    }

    public record TimeToFirstSuccess(
            double averageTimeToSuccessMinutes,
            double medianTimeToSuccessMinutes,
            int usersWithSuccess,
            int totalUsers
    ) {}

    public record UxGrade(
            String grade,
            double completionRate,
            double failureRate,
            double averageTransactionTime,
            int bottleneckCount
    ) {}

    public record Summary(
            int totalSessions,
            double averageSessionDuration,
            int bottleneckCount,
            double overallCompletionRate,
            double overallFailureRate
    ) {}

    public static UxBottleneckReport empty() {
        return new UxBottleneckReport(
                SessionDurations.empty(),
                List.of(),
                FailurePatterns.empty(),
                new TimeToFirstSuccess(0, 0, 0, 0),
                new UxGrade("F", 0, 0, 0, 0),
                new Summary(0, 0, 0, 0, 0));
    }
}
