package com.chainpulse.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A normalized transaction held in the continuous sync accumulator, tagged with the cycle that first saw it.
 */
@NoArgsConstructor
@Getter
@Setter
public class AccumulatedTransaction extends NormalizedTransaction {

    private int syncCycle;
    private Instant addedAt;

    public static AccumulatedTransaction of(NormalizedTransaction tx, int syncCycle, Instant addedAt) {
        AccumulatedTransaction accumulated = new AccumulatedTransaction();
        accumulated.copyFrom(tx);
        accumulated.syncCycle = syncCycle;
        accumulated.addedAt = addedAt;
        return accumulated;
    }
}
