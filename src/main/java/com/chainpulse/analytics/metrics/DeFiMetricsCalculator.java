package com.chainpulse.analytics.metrics;

import com.chainpulse.domain.NormalizedTransaction;
import com.chainpulse.domain.report.DeFiMetrics;
import com.chainpulse.domain.report.DeFiMetrics.ActivityMetrics;
import com.chainpulse.domain.report.DeFiMetrics.FinancialMetrics;
import com.chainpulse.domain.report.DeFiMetrics.PerformanceMetrics;
import com.chainpulse.domain.report.DeFiMetrics.UserLifecycleMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Protocol-level metrics over the transactions of the trailing 30 days. Transactions without a block time are
 * treated as happening now.
 */
@Component
@RequiredArgsConstructor
public class DeFiMetricsCalculator {

    static final Duration DAY = Duration.ofDays(1);
    static final Duration WEEK = Duration.ofDays(7);
    static final Duration MONTH = Duration.ofDays(30);
    static final BigDecimal WHALE_THRESHOLD_ETH = BigDecimal.TEN;

    private final Clock clock;

    /**
     * Metrics where any well-formed address on either side of a transfer counts as protocol-owned.
     */
    public DeFiMetrics calculateAllMetrics(Collection<? extends NormalizedTransaction> transactions) {
        return calculateAllMetrics(transactions, null);
    }

    /**
     * Metrics where value sent to {@code contractAddress} is inflow and value sent by it is outflow.
     * A null address falls back to {@link #calculateAllMetrics(Collection)}.
     */
    public DeFiMetrics calculateAllMetrics(Collection<? extends NormalizedTransaction> transactions, String contractAddress) {
        Instant end = clock.instant();
        Instant start = end.minus(MONTH);
        List<TimedTx> window = transactions.stream()
                .map(tx -> new TimedTx(tx, tx.getBlockTimestamp() != null ? tx.getBlockTimestamp() : end))
                .filter(t -> !t.at().isBefore(start) && !t.at().isAfter(end))
                .toList();
        return new DeFiMetrics(end, start, end, window.size(),
                userLifecycle(window, start, end),
                activity(window, end),
                financial(window, contractAddress),
                performance(window, start, end));
    }

    private record TimedTx(NormalizedTransaction tx, Instant at) {
        String from() {
            return tx.getFromAddress();
        }

        double valueEth() {
            return tx.getValueEth() != null ? tx.getValueEth().doubleValue() : 0;
        }

        double gasCostEth() {
            return tx.getGasCostEth() != null ? tx.getGasCostEth().doubleValue() : 0;
        }
    }

    private static final class UserStats {
        int txCount;
        Instant firstSeen;
        Instant lastSeen;
    }

    private static Map<String, UserStats> users(List<TimedTx> window) {
        Map<String, UserStats> users = new LinkedHashMap<>();
        for (TimedTx t : window) {
            if (t.from() == null) {
                continue;
            }
            UserStats stats = users.computeIfAbsent(t.from(), a -> new UserStats());
            stats.txCount++;
            if (stats.firstSeen == null || t.at().isBefore(stats.firstSeen)) {
                stats.firstSeen = t.at();
            }
            if (stats.lastSeen == null || t.at().isAfter(stats.lastSeen)) {
                stats.lastSeen = t.at();
            }
        }
        return users;
    }

    private UserLifecycleMetrics userLifecycle(List<TimedTx> window, Instant start, Instant end) {
        Map<String, UserStats> users = users(window);
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (String stage : List.of("new", "active", "established", "veteran", "dormant")) {
            distribution.put(stage, 0);
        }
        if (users.isEmpty()) {
            return new UserLifecycleMetrics(0, 0, 0, 0, distribution);
        }
        long activated = users.values().stream().filter(u -> u.txCount > 1).count();
        long newUsers = users.values().stream().filter(u -> !u.firstSeen.isBefore(start)).count();

        Instant mid = start.plus(Duration.between(start, end).dividedBy(2));
        Set<String> firstHalf = new HashSet<>();
        Set<String> secondHalf = new HashSet<>();
        for (TimedTx t : window) {
            if (t.from() == null) {
                continue;
            }
            (t.at().isBefore(mid) ? firstHalf : secondHalf).add(t.from());
        }
        long retained = firstHalf.stream().filter(secondHalf::contains).count();
        double retention = firstHalf.isEmpty() ? 0 : retained * 100.0 / firstHalf.size();

        for (UserStats u : users.values()) {
            double sinceFirst = days(u.firstSeen, end);
            double sinceLast = days(u.lastSeen, end);
            String stage = sinceLast > 30 ? "dormant"
                    : sinceFirst < 7 ? "new"
                    : sinceFirst < 30 ? "active"
                    : sinceFirst < 90 ? "established"
                    : "veteran";
            distribution.merge(stage, 1, Integer::sum);
        }
        return new UserLifecycleMetrics(
                round2(activated * 100.0 / users.size()),
                round2(newUsers * 100.0 / users.size()),
                round2(retention),
                round2(100 - retention),
                distribution);
    }

    private ActivityMetrics activity(List<TimedTx> window, Instant end) {
        double volume = window.stream().mapToDouble(TimedTx::valueEth).sum();
        return new ActivityMetrics(
                activeUsers(window, end.minus(DAY), end),
                activeUsers(window, end.minus(WEEK), end),
                activeUsers(window, end.minus(MONTH), end),
                round6(volume),
                round6(window.isEmpty() ? 0 : volume / window.size()));
    }

    private FinancialMetrics financial(List<TimedTx> window, String contractAddress) {
        double inflow = 0;
        double outflow = 0;
        for (TimedTx t : window) {
            if (isProtocolAddress(t.tx().getToAddress(), contractAddress)) {
                inflow += t.valueEth();
            }
            if (isProtocolAddress(t.from(), contractAddress)) {
                outflow += t.valueEth();
            }
        }
        int uniqueUsers = users(window).size();
        double revenue = window.stream().mapToDouble(TimedTx::gasCostEth).sum();
        long whales = window.stream()
                .filter(t -> t.tx().getValueEth() != null && t.tx().getValueEth().compareTo(WHALE_THRESHOLD_ETH) >= 0)
                .count();
        return new FinancialMetrics(
                round6(Math.max(0, inflow - outflow)),
                round6(inflow),
                round6(outflow),
                round6(inflow - outflow),
                round6(uniqueUsers > 0 ? revenue / uniqueUsers : 0),
                round6(revenue),
                round2(window.isEmpty() ? 0 : whales * 100.0 / window.size()));
    }

    private PerformanceMetrics performance(List<TimedTx> window, Instant start, Instant end) {
        long successful = window.stream().filter(t -> t.tx().isSuccess()).count();
        long known = window.stream().filter(t -> t.tx().isStatusKnown()).count();
        double gas = window.stream().mapToDouble(TimedTx::gasCostEth).sum();
        double periodDays = days(start, end);
        Set<String> counterparties = new HashSet<>();
        for (TimedTx t : window) {
            if (t.tx().getToAddress() != null) {
                counterparties.add(t.tx().getToAddress());
            }
            if (t.from() != null) {
                counterparties.add(t.from());
            }
        }
        Map<String, UserStats> users = users(window);
        long repeat = users.values().stream().filter(u -> u.txCount > 1).count();
        return new PerformanceMetrics(
                round2(known == 0 ? 0 : successful * 100.0 / known),
                round6(window.isEmpty() ? 0 : gas / window.size()),
                round2(periodDays > 0 ? window.size() / periodDays : 0),
                counterparties.size(),
                round2(users.isEmpty() ? 0 : repeat * 100.0 / users.size()));
    }

    private static int activeUsers(List<TimedTx> window, Instant from, Instant to) {
        Set<String> active = new HashSet<>();
        for (TimedTx t : window) {
            if (t.from() != null && !t.at().isBefore(from) && !t.at().isAfter(to)) {
                active.add(t.from());
            }
        }
        return active.size();
    }

    private static boolean isProtocolAddress(String address, String contractAddress) {
        if (address == null) {
            return false;
        }
        if (contractAddress != null) {
            return address.equalsIgnoreCase(contractAddress);
        }
        return address.length() == 42;
    }

    private static double days(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / (double) DAY.toMillis();
    }

    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }

    static double round6(double value) {
        return Math.round(value * 1_000_000) / 1_000_000.0;
    }
}
