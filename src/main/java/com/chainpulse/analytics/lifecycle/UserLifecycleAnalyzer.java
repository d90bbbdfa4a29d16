package com.chainpulse.analytics.lifecycle;

import com.chainpulse.analytics.TransactionViews;
import com.chainpulse.domain.NormalizedTransaction;
import com.chainpulse.domain.report.LifecycleReport;
import com.chainpulse.domain.report.LifecycleReport.ActivationMetrics;
import com.chainpulse.domain.report.LifecycleReport.Cohort;
import com.chainpulse.domain.report.LifecycleReport.FunctionProgression;
import com.chainpulse.domain.report.LifecycleReport.ProgressionAnalysis;
import com.chainpulse.domain.report.LifecycleReport.ProgressionDepth;
import com.chainpulse.domain.report.LifecycleReport.ProgressionPath;
import com.chainpulse.domain.report.LifecycleReport.WalletTypeSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Places every wallet in a lifecycle stage relative to now and derives cohorts, activation and progression.
 * Only transactions with a sender and a block time count.
 */
@Component
@RequiredArgsConstructor
public class UserLifecycleAnalyzer {

    public static final String NEW = "new";
    public static final String ACTIVE = "active";
    public static final String INACTIVE = "inactive";
    public static final String DORMANT = "dormant";
    public static final String CHURNED = "churned";

    private static final List<String> STAGES = List.of(NEW, ACTIVE, INACTIVE, DORMANT, CHURNED);
    private static final List<String> WALLET_TYPES = List.of("whale", "retail", "bot", "arbitrageur", "experimenter");
    private static final int[] RETENTION_PERIODS = {1, 7, 30, 90};
    private static final DateTimeFormatter COHORT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);
    private static final long MILLIS_PER_DAY = 86_400_000L;

    private final Clock clock;

    public LifecycleReport analyzeUserLifecycle(Collection<? extends NormalizedTransaction> transactions) {
        Map<String, WalletActivity> wallets = walletActivity(transactions);
        if (wallets.isEmpty()) {
            return LifecycleReport.empty();
        }
        Map<String, Integer> distribution = new LinkedHashMap<>();
        STAGES.forEach(stage -> distribution.put(stage, 0));
        wallets.values().forEach(w -> distribution.merge(w.stage, 1, Integer::sum));

        double lifespan = wallets.values().stream()
                .mapToDouble(w -> Duration.between(w.firstSeen, w.lastSeen).toMillis() / (double) MILLIS_PER_DAY)
                .average().orElse(0);

        return new LifecycleReport(
                wallets.size(),
                distribution,
                classifyWallets(wallets),
                cohorts(wallets),
                activation(wallets),
                progression(wallets),
                new LifecycleReport.Summary(
                        distribution.get(ACTIVE),
                        distribution.get(NEW),
                        distribution.get(CHURNED),
                        retentionRate(distribution),
                        lifespan));
    }

    /** (active + inactive) / all wallets, as a percentage. */
    static double retentionRate(Map<String, Integer> distribution) {
        int total = distribution.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) {
            return 0;
        }
        return (distribution.getOrDefault(ACTIVE, 0) + distribution.getOrDefault(INACTIVE, 0)) * 100.0 / total;
    }

    static String stage(long daysSinceLastActivity, long daysSinceFirstSeen) {
        if (daysSinceFirstSeen <= 1) {
            return NEW;
        } else if (daysSinceLastActivity <= 7) {
            return ACTIVE;
        } else if (daysSinceLastActivity <= 30) {
            return INACTIVE;
        } else if (daysSinceLastActivity <= 90) {
            return DORMANT;
        }
        return CHURNED;
    }

    private Map<String, WalletActivity> walletActivity(Collection<? extends NormalizedTransaction> transactions) {
        Instant now = clock.instant();
        Map<String, WalletActivity> wallets = new LinkedHashMap<>();
        TransactionViews.byWallet(transactions, true).forEach((wallet, txs) -> {
            WalletActivity activity = new WalletActivity();
            activity.firstSeen = txs.get(0).getBlockTimestamp();
            activity.lastSeen = txs.get(txs.size() - 1).getBlockTimestamp();
            for (NormalizedTransaction tx : txs) {
                activity.transactionCount++;
                if (tx.isSuccess()) {
                    activity.successfulTransactions++;
                }
                if (tx.getValueEth() != null) {
                    activity.totalVolume += tx.getValueEth().doubleValue();
                }
                activity.functionsUsed.add(TransactionViews.functionName(tx));
            }
            activity.daysSinceFirstSeen = daysBetween(activity.firstSeen, now);
            activity.daysSinceLastActivity = daysBetween(activity.lastSeen, now);
            activity.stage = stage(activity.daysSinceLastActivity, activity.daysSinceFirstSeen);
            wallets.put(wallet, activity);
        });
        return wallets;
    }

    private Map<String, WalletTypeSummary> classifyWallets(Map<String, WalletActivity> wallets) {
        Map<String, List<WalletActivity>> byType = new LinkedHashMap<>();
        WALLET_TYPES.forEach(type -> byType.put(type, new ArrayList<>()));
        wallets.values().forEach(w -> byType.get(walletType(w)).add(w));

        Map<String, WalletTypeSummary> summary = new LinkedHashMap<>();
        byType.forEach((type, members) -> summary.put(type, new WalletTypeSummary(
                members.size(),
                members.size() * 100.0 / wallets.size(),
                members.stream().mapToDouble(w -> w.totalVolume).sum(),
                members.stream().mapToInt(w -> w.transactionCount).average().orElse(0))));
        return summary;
    }

    static String walletType(WalletActivity w) {
        if (w.totalVolume > 100_000) {
            return "whale";
        }
        if (w.transactionCount > 100 && w.daysSinceFirstSeen < 7) {
            return "bot";
        }
        if (w.functionsUsed.size() >= 3 && w.totalVolume > 1_000) {
            return "arbitrageur";
        }
        if (w.transactionCount <= 3) {
            return "experimenter";
        }
        return "retail";
    }

    /** Monthly cohorts by first activity; a wallet counts as retained for a period when active in the last 7 days. */
    private List<Cohort> cohorts(Map<String, WalletActivity> wallets) {
        Map<String, List<WalletActivity>> byCohort = new TreeMap<>();
        wallets.values().forEach(w -> byCohort.computeIfAbsent(COHORT_FORMAT.format(w.firstSeen), k -> new ArrayList<>()).add(w));

        List<Cohort> cohorts = new ArrayList<>();
        byCohort.forEach((period, members) -> {
            Map<String, Double> retention = new LinkedHashMap<>();
            for (int days : RETENTION_PERIODS) {
                long retained = members.stream()
                        .filter(w -> w.daysSinceFirstSeen >= days && w.daysSinceLastActivity <= 7)
                        .count();
                if (retained > 0) {
                    retention.put("day" + days, retained * 100.0 / members.size());
                }
            }
            double volume = members.stream().mapToDouble(w -> w.totalVolume).sum();
            cohorts.add(new Cohort(period, members.size(), retention, volume, volume / members.size()));
        });
        return cohorts;
    }

    private ActivationMetrics activation(Map<String, WalletActivity> wallets) {
        int activated = (int) wallets.values().stream().filter(w -> w.successfulTransactions > 0).count();
        Map<String, Integer> timeDistribution = new LinkedHashMap<>();
        List.of("immediate", "sameDay", "sameWeek", "sameMonth", "longTerm").forEach(k -> timeDistribution.put(k, 0));
        for (WalletActivity w : wallets.values()) {
            long days = w.daysSinceFirstSeen;
            String bucket = days == 0 ? "immediate" : days == 1 ? "sameDay" : days <= 7 ? "sameWeek" : days <= 30 ? "sameMonth" : "longTerm";
            timeDistribution.merge(bucket, 1, Integer::sum);
        }
        return new ActivationMetrics(
                wallets.size(),
                activated,
                activated * 100.0 / wallets.size(),
                wallets.values().stream().mapToLong(w -> w.daysSinceFirstSeen).average().orElse(0),
                timeDistribution);
    }

    private ProgressionAnalysis progression(Map<String, WalletActivity> wallets) {
        Map<String, List<Integer>> adoptionOrders = new LinkedHashMap<>();
        Map<String, Integer> pathCounts = new LinkedHashMap<>();
        for (WalletActivity w : wallets.values()) {
            List<String> functions = new ArrayList<>(w.functionsUsed);
            for (int i = 0; i < functions.size(); i++) {
                adoptionOrders.computeIfAbsent(functions.get(i), f -> new ArrayList<>()).add(i + 1);
                if (i < functions.size() - 1) {
                    pathCounts.merge(functions.get(i) + " → " + functions.get(i + 1), 1, Integer::sum);
                }
            }
        }

        List<FunctionProgression> functionProgression = new ArrayList<>();
        adoptionOrders.forEach((fn, orders) -> functionProgression.add(new FunctionProgression(
                fn,
                orders.size(),
                orders.stream().mapToInt(Integer::intValue).average().orElse(0),
                (int) orders.stream().filter(o -> o == 1).count(),
                orders.size() * 100.0 / wallets.size())));
        functionProgression.sort(Comparator.comparingDouble(FunctionProgression::averageAdoptionOrder));

        List<ProgressionPath> topPaths = pathCounts.entrySet().stream()
                .map(e -> new ProgressionPath(e.getKey(), e.getValue(), e.getValue() * 100.0 / wallets.size()))
                .sorted(Comparator.comparingInt(ProgressionPath::userCount).reversed())
                .limit(10)
                .toList();

        ProgressionDepth depth = new ProgressionDepth(
                (int) wallets.values().stream().filter(w -> w.functionsUsed.size() == 1).count(),
                (int) wallets.values().stream().filter(w -> w.functionsUsed.size() > 1).count(),
                (int) wallets.values().stream().filter(w -> w.functionsUsed.size() >= 5).count());
        return new ProgressionAnalysis(functionProgression, topPaths, depth);
    }

    /** Whole days between the instants, rounded up. */
    private static long daysBetween(Instant from, Instant to) {
        long millis = Math.abs(Duration.between(from, to).toMillis());
        return (millis + MILLIS_PER_DAY - 1) / MILLIS_PER_DAY;
    }

    static final class WalletActivity {
        Instant firstSeen;
        Instant lastSeen;
        int transactionCount;
        int successfulTransactions;
        double totalVolume;
        final Set<String> functionsUsed = new LinkedHashSet<>();
        long daysSinceFirstSeen;
        long daysSinceLastActivity;
        String stage;
    }
}
