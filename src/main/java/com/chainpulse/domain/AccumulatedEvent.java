package com.chainpulse.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.List;

/**
 * A contract log held in the accumulator. Identity is {@code transactionHash-logIndex}.
 */
@NoArgsConstructor
@Getter
@Setter
public class AccumulatedEvent {

    private String transactionHash;
    private int logIndex;
    private String address;
    private long blockNumber;
    private List<String> topics;
    private String data;
    private int syncCycle;
    private Instant addedAt;

    public static AccumulatedEvent of(ContractEvent event, int syncCycle, Instant addedAt) {
        AccumulatedEvent accumulated = new AccumulatedEvent();
        accumulated.transactionHash = event.transactionHash();
        accumulated.logIndex = event.logIndex() != null ? event.logIndex() : 0;
        accumulated.address = event.address();
        accumulated.blockNumber = event.blockNumber();
        accumulated.topics = event.topics() != null ? List.copyOf(event.topics()) : List.of();
        accumulated.data = event.data();
        accumulated.syncCycle = syncCycle;
        accumulated.addedAt = addedAt;
        return accumulated;
    }

    /** Dedup key; a missing log index counts as 0. */
    public static String keyOf(ContractEvent event) {
        return event.transactionHash() + "-" + (event.logIndex() != null ? event.logIndex() : 0);
    }

    public String key() {
        return transactionHash + "-" + logIndex;
    }
}
