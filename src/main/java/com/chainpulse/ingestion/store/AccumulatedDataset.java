package com.chainpulse.ingestion.store;

import com.chainpulse.domain.AccumulatedEvent;
import com.chainpulse.domain.AccumulatedTransaction;
import com.chainpulse.domain.AccumulatedUser;
import com.chainpulse.domain.ContractEvent;
import com.chainpulse.domain.NormalizedTransaction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory accumulator of one continuous sync run. Transactions are keyed by hash and events by
 * {@code transactionHash-logIndex}; the first occurrence of a key wins and later duplicates are counted and dropped.
 * Users are derived state and replaced wholesale. Not thread-safe: owned by the single thread running the loop.
 */
public class AccumulatedDataset {

    private final Map<String, AccumulatedTransaction> transactions = new LinkedHashMap<>();
    private final Map<String, AccumulatedEvent> events = new LinkedHashMap<>();
    private final Map<String, AccumulatedUser> users = new LinkedHashMap<>();
    private final Set<String> processedBlockRanges = new LinkedHashSet<>();

    public MergeResult mergeTransactions(Collection<? extends NormalizedTransaction> incoming, int syncCycle, Instant addedAt) {
        int added = 0;
        int skipped = 0;
        for (NormalizedTransaction tx : incoming) {
            if (tx.getHash() == null || transactions.containsKey(tx.getHash())) {
                skipped++;
                continue;
            }
            transactions.put(tx.getHash(), AccumulatedTransaction.of(tx, syncCycle, addedAt));
            added++;
        }
        return new MergeResult(added, skipped);
    }

    public MergeResult mergeEvents(Collection<ContractEvent> incoming, int syncCycle, Instant addedAt) {
        int added = 0;
        int skipped = 0;
        for (ContractEvent event : incoming) {
            String key = AccumulatedEvent.keyOf(event);
            if (events.containsKey(key)) {
                skipped++;
                continue;
            }
            events.put(key, AccumulatedEvent.of(event, syncCycle, addedAt));
            added++;
        }
        return new MergeResult(added, skipped);
    }

    /**
     * Replaces the user map with a freshly derived one.
     *
     * @return number of addresses not present before the replacement
     */
    public int replaceUsers(Collection<AccumulatedUser> derived) {
        int newUsers = 0;
        Map<String, AccumulatedUser> next = new LinkedHashMap<>();
        for (AccumulatedUser user : derived) {
            if (!users.containsKey(user.getAddress())) {
                newUsers++;
            }
            next.put(user.getAddress(), user);
        }
        users.clear();
        users.putAll(next);
        return newUsers;
    }

    public void recordProcessedRange(long fromBlock, long toBlock) {
        processedBlockRanges.add(fromBlock + "-" + toBlock);
    }

    public Collection<AccumulatedTransaction> transactions() {
        return Collections.unmodifiableCollection(transactions.values());
    }

    public Collection<AccumulatedEvent> events() {
        return Collections.unmodifiableCollection(events.values());
    }

    public Collection<AccumulatedUser> users() {
        return Collections.unmodifiableCollection(users.values());
    }

    public boolean containsTransaction(String hash) {
        return transactions.containsKey(hash);
    }

    public int transactionCount() {
        return transactions.size();
    }

    public int eventCount() {
        return events.size();
    }

    public int userCount() {
        return users.size();
    }

    public List<String> processedBlockRanges() {
        return List.copyOf(processedBlockRanges);
    }

    /** The {@code limit} most recently accumulated transactions, oldest first. */
    public List<AccumulatedTransaction> recentTransactions(int limit) {
        return tail(new ArrayList<>(transactions.values()), limit);
    }

    /** The {@code limit} most recently accumulated events, oldest first. */
    public List<AccumulatedEvent> recentEvents(int limit) {
        return tail(new ArrayList<>(events.values()), limit);
    }

    /** Up to {@code limit} users, most recently active first. */
    public List<AccumulatedUser> recentUsers(int limit) {
        return users.values().stream()
                .sorted(Comparator.comparing(AccumulatedUser::getLastSeen, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(Math.max(0, limit))
                .toList();
    }

    private static <T> List<T> tail(List<T> all, int limit) {
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }
}
