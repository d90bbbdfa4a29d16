package com.chainpulse.analytics.ux;

import com.chainpulse.analytics.TransactionViews;
import com.chainpulse.domain.NormalizedTransaction;
import com.chainpulse.domain.report.UxBottleneckReport;
import com.chainpulse.domain.report.UxBottleneckReport.Bottleneck;
import com.chainpulse.domain.report.UxBottleneckReport.FailurePatterns;
import com.chainpulse.domain.report.UxBottleneckReport.FailureSequence;
import com.chainpulse.domain.report.UxBottleneckReport.FunctionFailures;
import com.chainpulse.domain.report.UxBottleneckReport.Session;
import com.chainpulse.domain.report.UxBottleneckReport.SessionDurations;
import com.chainpulse.domain.report.UxBottleneckReport.TimeToFirstSuccess;
import com.chainpulse.domain.report.UxBottleneckReport.UxGrade;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds where users get stuck: per-wallet sessions, function transitions with high abandonment,
 * repeated failures and an overall A-F grade.
 */
@Component
public class UxBottleneckDetector {

    /** A transition is a bottleneck when more than this share of callers of its source function never make it. */
    static final double BOTTLENECK_THRESHOLD = 0.3;
    private static final double EPSILON = 0.0001;
    private static final int MAX_FAILURE_SEQUENCES = 50;

    private static final List<GradeThreshold> GRADES = List.of(
            new GradeThreshold("A", 0.9, 0.05, 10),
            new GradeThreshold("B", 0.8, 0.1, 20),
            new GradeThreshold("C", 0.7, 0.15, 30),
            new GradeThreshold("D", 0.6, 0.2, 45));

    private record GradeThreshold(String grade, double minCompletionRate, double maxFailureRate, double maxAvgMinutes) {}

    public UxBottleneckReport analyzeUxBottlenecks(Collection<? extends NormalizedTransaction> transactions) {
        if (transactions.isEmpty()) {
            return UxBottleneckReport.empty();
        }
        SessionDurations sessions = calculateSessionDurations(transactions);
        List<Bottleneck> bottlenecks = detectBottlenecks(transactions);
        double completionRate = completionRate(transactions);
        double failureRate = failureRate(transactions);
        UxGrade grade = new UxGrade(grade(completionRate, failureRate, sessions.averageDuration()),
                completionRate, failureRate, sessions.averageDuration(), bottlenecks.size());
        return new UxBottleneckReport(
                sessions,
                bottlenecks,
                failurePatterns(transactions),
                timeToFirstSuccess(transactions),
                grade,
                new UxBottleneckReport.Summary(sessions.sessions().size(), sessions.averageDuration(),
                        bottlenecks.size(), completionRate, failureRate));
    }

    /** One session per wallet, spanning its first to last timestamped transaction. Durations are in minutes. */
    public SessionDurations calculateSessionDurations(Collection<? extends NormalizedTransaction> transactions) {
        List<Session> sessions = new ArrayList<>();
        for (Map.Entry<String, List<NormalizedTransaction>> entry : TransactionViews.byWallet(transactions, true).entrySet()) {
            List<NormalizedTransaction> txs = entry.getValue();
            NormalizedTransaction first = txs.get(0);
            NormalizedTransaction last = txs.get(txs.size() - 1);
            double minutes = Duration.between(first.getBlockTimestamp(), last.getBlockTimestamp()).toMillis() / 60_000.0;
            int successful = (int) txs.stream().filter(NormalizedTransaction::isSuccess).count();
            int failed = (int) txs.stream().filter(NormalizedTransaction::isFailed).count();
            sessions.add(new Session(entry.getKey(), first.getBlockTimestamp(), last.getBlockTimestamp(),
                    minutes, txs.size(), successful, failed));
        }
        if (sessions.isEmpty()) {
            return SessionDurations.empty();
        }
        List<Double> durations = sessions.stream().map(Session::durationMinutes).toList();
        return new SessionDurations(sessions,
                TransactionViews.average(durations),
                TransactionViews.upperMedian(durations),
                durations.stream().mapToDouble(Double::doubleValue).min().orElse(0),
                durations.stream().mapToDouble(Double::doubleValue).max().orElse(0));
    }

    /**
     * Consecutive function pairs per wallet. Completion rate of {@code a -> b} is the number of times {@code b}
     * directly followed {@code a}, over all calls of {@code a}. Sorted by abandonment, highest first.
     */
    public List<Bottleneck> detectBottlenecks(Collection<? extends NormalizedTransaction> transactions) {
        Map<String, Integer> functionStarts = new LinkedHashMap<>();
        for (NormalizedTransaction tx : transactions) {
            functionStarts.merge(TransactionViews.functionName(tx), 1, Integer::sum);
        }

        Map<List<String>, Integer> pairCounts = new LinkedHashMap<>();
        Map<List<String>, Set<String>> pairWallets = new LinkedHashMap<>();
        for (Map.Entry<String, List<NormalizedTransaction>> entry : TransactionViews.byWallet(transactions, true).entrySet()) {
            List<NormalizedTransaction> txs = entry.getValue();
            for (int i = 0; i < txs.size() - 1; i++) {
                List<String> pair = List.of(TransactionViews.functionName(txs.get(i)),
                        TransactionViews.functionName(txs.get(i + 1)));
                pairCounts.merge(pair, 1, Integer::sum);
                pairWallets.computeIfAbsent(pair, p -> new HashSet<>()).add(entry.getKey());
            }
        }

        List<Bottleneck> bottlenecks = new ArrayList<>();
        for (Map.Entry<List<String>, Integer> entry : pairCounts.entrySet()) {
            String from = entry.getKey().get(0);
            int started = functionStarts.getOrDefault(from, 0);
            if (started == 0) {
                continue;
            }
            int completed = entry.getValue();
            double completionRate = (double) completed / started;
            double abandonmentRate = 1 - completionRate;
            if (abandonmentRate > BOTTLENECK_THRESHOLD + EPSILON) {
                bottlenecks.add(new Bottleneck(from, entry.getKey().get(1), abandonmentRate, completionRate,
                        started, completed, started - completed, pairWallets.get(entry.getKey()).size()));
            }
        }
        bottlenecks.sort(Comparator.comparingDouble(Bottleneck::abandonmentRate).reversed());
        return bottlenecks;
    }

    /** Best grade whose completion, failure and average-session thresholds are all met; F otherwise. */
    static String grade(double completionRate, double failureRate, double avgSessionMinutes) {
        for (GradeThreshold threshold : GRADES) {
            if (completionRate >= threshold.minCompletionRate()
                    && failureRate <= threshold.maxFailureRate()
                    && avgSessionMinutes <= threshold.maxAvgMinutes()) {
                return threshold.grade();
            }
        }
        return "F";
    }

    /** Share of wallets with at least one successful transaction. */
    static double completionRate(Collection<? extends NormalizedTransaction> transactions) {
        Map<String, List<NormalizedTransaction>> byWallet = TransactionViews.byWallet(transactions, false);
        if (byWallet.isEmpty()) {
            return 0;
        }
        long completed = byWallet.values().stream()
                .filter(txs -> txs.stream().anyMatch(NormalizedTransaction::isSuccess))
                .count();
        return (double) completed / byWallet.size();
    }

    /** Failed share of the transactions whose receipt status is known. */
    static double failureRate(Collection<? extends NormalizedTransaction> transactions) {
        long known = transactions.stream().filter(NormalizedTransaction::isStatusKnown).count();
        if (known == 0) {
            return 0;
        }
        long failed = transactions.stream().filter(NormalizedTransaction::isFailed).count();
        return (double) failed / known;
    }

    private FailurePatterns failurePatterns(Collection<? extends NormalizedTransaction> transactions) {
        List<NormalizedTransaction> failed = transactions.stream()
                .filter(NormalizedTransaction::isFailed)
                .map(NormalizedTransaction.class::cast)
                .toList();
        if (failed.isEmpty()) {
            return FailurePatterns.empty();
        }
        Map<String, Integer> failures = new LinkedHashMap<>();
        for (NormalizedTransaction tx : failed) {
            failures.merge(TransactionViews.functionName(tx), 1, Integer::sum);
        }
        Map<String, Integer> attempts = new LinkedHashMap<>();
        for (NormalizedTransaction tx : transactions) {
            String fn = TransactionViews.functionName(tx);
            if (tx.isStatusKnown() && failures.containsKey(fn)) {
                attempts.merge(fn, 1, Integer::sum);
            }
        }
        List<FunctionFailures> byFunction = new ArrayList<>();
        failures.forEach((fn, count) -> {
            int total = attempts.getOrDefault(fn, 0);
            byFunction.add(new FunctionFailures(fn, count, total, total > 0 ? (double) count / total : 0));
        });
        byFunction.sort(Comparator.comparingInt(FunctionFailures::failureCount).reversed());

        List<FailureSequence> sequences = new ArrayList<>();
        TransactionViews.byWallet(failed, false).forEach((wallet, txs) -> {
            if (txs.size() >= 2) {
                sequences.add(new FailureSequence(wallet, txs.size(),
                        txs.stream().map(TransactionViews::functionName).toList(),
                        txs.get(0).getBlockTimestamp(), txs.get(txs.size() - 1).getBlockTimestamp()));
            }
        });
        sequences.sort(Comparator.comparingInt(FailureSequence::failureCount).reversed());
        return new FailurePatterns(failed.size(), byFunction,
                List.copyOf(sequences.subList(0, Math.min(MAX_FAILURE_SEQUENCES, sequences.size()))));
    }

    private TimeToFirstSuccess timeToFirstSuccess(Collection<? extends NormalizedTransaction> transactions) {
        Map<String, List<NormalizedTransaction>> byWallet = TransactionViews.byWallet(transactions, true);
        List<Double> minutes = new ArrayList<>();
        for (List<NormalizedTransaction> txs : byWallet.values()) {
            NormalizedTransaction first = txs.get(0);
            txs.stream()
                    .filter(NormalizedTransaction::isSuccess)
                    .findFirst()
                    .ifPresent(success -> minutes.add(
                            Duration.between(first.getBlockTimestamp(), success.getBlockTimestamp()).toMillis() / 60_000.0));
        }
        return new TimeToFirstSuccess(TransactionViews.average(minutes), TransactionViews.upperMedian(minutes),
                minutes.size(), byWallet.size());
    }
}
