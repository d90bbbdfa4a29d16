package com.chainpulse.ingestion.store;

import com.chainpulse.domain.AccumulatedTransaction;
import com.chainpulse.domain.AccumulatedUser;
import com.chainpulse.domain.ContractEvent;
import com.chainpulse.domain.NormalizedTransaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class AccumulatedDatasetTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    @DisplayName("second window overlapping A-E with A-G adds only F and G")
    void overlappingWindowsAddOnlyNewHashes() {
        AccumulatedDataset dataset = new AccumulatedDataset();

        MergeResult first = dataset.mergeTransactions(txs("A", "B", "C", "D", "E"), 1, T0);
        MergeResult second = dataset.mergeTransactions(txs("A", "B", "C", "D", "E", "F", "G"), 2, T0.plusSeconds(30));

        assertThat(first).isEqualTo(new MergeResult(5, 0));
        assertThat(second).isEqualTo(new MergeResult(2, 5));
        assertThat(dataset.transactionCount()).isEqualTo(7);
    }

    @Test
    @DisplayName("merging the same batch twice leaves the store unchanged")
    void mergeIsIdempotent() {
        AccumulatedDataset dataset = new AccumulatedDataset();
        dataset.mergeTransactions(txs("A", "B"), 1, T0);

        MergeResult again = dataset.mergeTransactions(txs("A", "B"), 2, T0);

        assertThat(again.added()).isZero();
        assertThat(again.skipped()).isEqualTo(2);
        assertThat(dataset.transactionCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("first write wins: a duplicate keeps the cycle that first saw it")
    void firstWriteWins() {
        AccumulatedDataset dataset = new AccumulatedDataset();
        dataset.mergeTransactions(txs("A"), 1, T0);
        dataset.mergeTransactions(txs("A"), 3, T0.plusSeconds(60));

        AccumulatedTransaction stored = dataset.transactions().iterator().next();
        assertThat(stored.getSyncCycle()).isEqualTo(1);
        assertThat(stored.getAddedAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("events are keyed by transaction hash and log index, missing index counts as 0")
    void eventsKeyedByHashAndLogIndex() {
        AccumulatedDataset dataset = new AccumulatedDataset();

        MergeResult result = dataset.mergeEvents(List.of(
                event("0xa", 0), event("0xa", 1), event("0xa", null), event("0xb", 0)), 1, T0);

        assertThat(result).isEqualTo(new MergeResult(3, 1));
        assertThat(dataset.eventCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("replaceUsers reports only addresses not seen before")
    void replaceUsersCountsNewAddresses() {
        AccumulatedDataset dataset = new AccumulatedDataset();
        assertThat(dataset.replaceUsers(List.of(user("0x1"), user("0x2")))).isEqualTo(2);
        assertThat(dataset.replaceUsers(List.of(user("0x1"), user("0x2"), user("0x3")))).isEqualTo(1);
        assertThat(dataset.userCount()).isEqualTo(3);
    }

    @Test
    void recentTransactions_returnsTailInInsertionOrder() {
        AccumulatedDataset dataset = new AccumulatedDataset();
        dataset.mergeTransactions(txs("A", "B", "C", "D"), 1, T0);

        assertThat(dataset.recentTransactions(2)).extracting(NormalizedTransaction::getHash).containsExactly("C", "D");
        assertThat(dataset.recentTransactions(10)).hasSize(4);
    }

    @Test
    void processedBlockRanges_areDistinctAndOrdered() {
        AccumulatedDataset dataset = new AccumulatedDataset();
        dataset.recordProcessedRange(0, 100);
        dataset.recordProcessedRange(101, 200);
        dataset.recordProcessedRange(0, 100);

        assertThat(dataset.processedBlockRanges()).containsExactly("0-100", "101-200");
    }

    static List<NormalizedTransaction> txs(String... hashes) {
        return Stream.of(hashes).map(h -> {
            NormalizedTransaction tx = new NormalizedTransaction();
            tx.setHash(h);
            tx.setFromAddress("0xuser");
            tx.setSuccess(true);
            return tx;
        }).toList();
    }

    private static ContractEvent event(String txHash, Integer logIndex) {
        return new ContractEvent("0xcontract", List.of(), "0x", 10L, txHash, 0, "0xblock", logIndex);
    }

    private static AccumulatedUser user(String address) {
        AccumulatedUser user = new AccumulatedUser();
        user.setAddress(address);
        return user;
    }
}
