package com.chainpulse.analytics.journey;

import com.chainpulse.analytics.TransactionViews;
import com.chainpulse.domain.NormalizedTransaction;
import com.chainpulse.domain.report.JourneyReport;
import com.chainpulse.domain.report.JourneyReport.CommonPath;
import com.chainpulse.domain.report.JourneyReport.DropoffPoint;
import com.chainpulse.domain.report.JourneyReport.EntryPoint;
import com.chainpulse.domain.report.JourneyReport.FeatureAdoption;
import com.chainpulse.domain.report.JourneyReport.FunctionUsage;
import com.chainpulse.domain.report.JourneyReport.Transition;
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
import java.util.TreeMap;

/**
 * Reconstructs each wallet's chronological function sequence (its journey) and summarizes entry points,
 * transitions, drop-offs and common sub-paths.
 */
@Component
public class UserJourneyAnalyzer {

    static final int MIN_PATH_LENGTH = 2;
    static final int MAX_PATH_LENGTH = 5;
    static final int MIN_PATH_USERS = 2;
    static final int MAX_COMMON_PATHS = 20;

    public JourneyReport analyzeJourneys(Collection<? extends NormalizedTransaction> transactions) {
        Map<String, List<String>> journeys = new LinkedHashMap<>();
        Map<String, List<NormalizedTransaction>> byWallet = TransactionViews.byWallet(transactions, true);
        byWallet.forEach((wallet, txs) -> journeys.put(wallet, txs.stream().map(TransactionViews::functionName).toList()));
        if (journeys.isEmpty()) {
            return JourneyReport.empty();
        }

        Map<String, Integer> distribution = new TreeMap<>(Comparator.comparingInt(Integer::parseInt));
        int totalSteps = 0;
        for (List<String> journey : journeys.values()) {
            totalSteps += journey.size();
            distribution.merge(String.valueOf(journey.size()), 1, Integer::sum);
        }
        return new JourneyReport(
                journeys.size(),
                (double) totalSteps / journeys.size(),
                commonPaths(byWallet),
                entryPoints(journeys),
                featureAdoption(journeys),
                dropoffPoints(journeys),
                new LinkedHashMap<>(distribution));
    }

    /** First function per wallet, by number of wallets. */
    List<EntryPoint> entryPoints(Map<String, List<String>> journeys) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        journeys.values().forEach(j -> counts.merge(j.get(0), 1, Integer::sum));
        List<EntryPoint> entryPoints = new ArrayList<>();
        counts.forEach((fn, count) -> entryPoints.add(new EntryPoint(fn, count, count * 100.0 / journeys.size())));
        entryPoints.sort(Comparator.comparingInt(EntryPoint::userCount).reversed());
        return entryPoints;
    }

    /**
     * Adoption rate of {@code a -> b}: wallets that called {@code b} right after {@code a}, over wallets that called {@code a}.
     */
    FeatureAdoption featureAdoption(Map<String, List<String>> journeys) {
        Map<String, Set<String>> functionUsers = new LinkedHashMap<>();
        Map<List<String>, Set<String>> transitionUsers = new LinkedHashMap<>();
        journeys.forEach((wallet, journey) -> {
            for (int i = 0; i < journey.size(); i++) {
                functionUsers.computeIfAbsent(journey.get(i), f -> new HashSet<>()).add(wallet);
                if (i < journey.size() - 1) {
                    transitionUsers.computeIfAbsent(List.of(journey.get(i), journey.get(i + 1)), t -> new HashSet<>()).add(wallet);
                }
            }
        });

        List<Transition> transitions = new ArrayList<>();
        transitionUsers.forEach((pair, wallets) -> {
            int fromUsers = functionUsers.getOrDefault(pair.get(0), Set.of()).size();
            double rate = fromUsers > 0 ? (double) wallets.size() / fromUsers : 0;
            transitions.add(new Transition(pair.get(0), pair.get(1), wallets.size(), rate, rate * 100));
        });
        transitions.sort(Comparator.comparingDouble(Transition::adoptionRate).reversed());

        List<FunctionUsage> usage = new ArrayList<>();
        functionUsers.forEach((fn, wallets) -> usage.add(new FunctionUsage(fn, wallets.size())));
        usage.sort(Comparator.comparingInt(FunctionUsage::uniqueUsers).reversed());
        return new FeatureAdoption(transitions, usage);
    }

    /** How often each function is the last call of a journey, relative to all its calls. */
    List<DropoffPoint> dropoffPoints(Map<String, List<String>> journeys) {
        Map<String, Integer> lastCounts = new LinkedHashMap<>();
        Map<String, Integer> appearances = new LinkedHashMap<>();
        for (List<String> journey : journeys.values()) {
            lastCounts.merge(journey.get(journey.size() - 1), 1, Integer::sum);
            journey.forEach(fn -> appearances.merge(fn, 1, Integer::sum));
        }
        List<DropoffPoint> points = new ArrayList<>();
        lastCounts.forEach((fn, count) -> {
            int total = appearances.getOrDefault(fn, 0);
            double rate = total > 0 ? (double) count / total : 0;
            points.add(new DropoffPoint(fn, count, total, rate, rate * 100));
        });
        points.sort(Comparator.comparingDouble(DropoffPoint::dropoffRate).reversed());
        return points;
    }

    /**
     * Contiguous sub-sequences of length 2..5 used by at least two wallets, top 20 by distinct wallets.
     */
    List<CommonPath> commonPaths(Map<String, List<NormalizedTransaction>> byWallet) {
        Map<List<String>, Integer> occurrences = new LinkedHashMap<>();
        Map<List<String>, Set<String>> wallets = new LinkedHashMap<>();
        Map<List<String>, List<Long>> timings = new LinkedHashMap<>();

        byWallet.forEach((wallet, txs) -> {
            for (int length = MIN_PATH_LENGTH; length <= Math.min(MAX_PATH_LENGTH, txs.size()); length++) {
                for (int i = 0; i + length <= txs.size(); i++) {
                    List<NormalizedTransaction> slice = txs.subList(i, i + length);
                    List<String> path = slice.stream().map(TransactionViews::functionName).toList();
                    occurrences.merge(path, 1, Integer::sum);
                    wallets.computeIfAbsent(path, p -> new HashSet<>()).add(wallet);
                    timings.computeIfAbsent(path, p -> new ArrayList<>()).add(Duration.between(
                            slice.get(0).getBlockTimestamp(), slice.get(length - 1).getBlockTimestamp()).toMillis());
                }
            }
        });

        int totalWallets = byWallet.size();
        return occurrences.entrySet().stream()
                .filter(e -> wallets.get(e.getKey()).size() >= MIN_PATH_USERS)
                .map(e -> {
                    int users = wallets.get(e.getKey()).size();
                    double avg = timings.get(e.getKey()).stream().mapToLong(Long::longValue).average().orElse(0);
                    return new CommonPath(e.getKey(), users, e.getValue(), avg, (double) users / totalWallets);
                })
                .sorted(Comparator.comparingInt(CommonPath::userCount).reversed())
                .limit(MAX_COMMON_PATHS)
                .toList();
    }
}
