package com.chainpulse.analytics;

import com.chainpulse.domain.NormalizedTransaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared groupings over normalized transactions used by the analyzers.
 */
public final class TransactionViews {

    public static final String UNKNOWN_FUNCTION = "unknown";

    /** Time, then block, then hash: a stable order for transactions of one wallet. */
    public static final Comparator<NormalizedTransaction> CHRONOLOGICAL = Comparator
            .comparing(NormalizedTransaction::getBlockTimestamp, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingLong(NormalizedTransaction::getBlockNumber)
            .thenComparing(NormalizedTransaction::getHash, Comparator.nullsLast(Comparator.naturalOrder()));

    private TransactionViews() {
    }

    public static String functionName(NormalizedTransaction tx) {
        String name = tx.getFunctionName();
        if (name != null && !name.isBlank()) {
            return name;
        }
        return tx.getFunctionSignature() != null ? tx.getFunctionSignature() : UNKNOWN_FUNCTION;
    }

    public static String wallet(NormalizedTransaction tx) {
        return tx.getFromAddress() == null ? null : tx.getFromAddress().toLowerCase(Locale.ROOT);
    }

    /**
     * Groups by sender in first-seen order. Transactions without a sender are dropped; with
     * {@code requireTimestamp} so are those without a block time. Each group is sorted chronologically.
     */
    public static Map<String, List<NormalizedTransaction>> byWallet(Collection<? extends NormalizedTransaction> transactions,
                                                                    boolean requireTimestamp) {
        Map<String, List<NormalizedTransaction>> grouped = new LinkedHashMap<>();
        for (NormalizedTransaction tx : transactions) {
            String wallet = wallet(tx);
            if (wallet == null || (requireTimestamp && tx.getBlockTimestamp() == null)) {
                continue;
            }
            grouped.computeIfAbsent(wallet, w -> new ArrayList<>()).add(tx);
        }
        grouped.values().forEach(list -> list.sort(CHRONOLOGICAL));
        return grouped;
    }

    /** Element at {@code size / 2} of the sorted values, or 0 when empty. */
    public static double upperMedian(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.naturalOrder());
        return sorted.get(sorted.size() / 2);
    }

    public static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }
}
