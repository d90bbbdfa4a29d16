package com.chainpulse.ingestion.sync.cycle;

import com.chainpulse.ingestion.sync.window.BlockWindow;

/**
 * Outcome of one successful sync cycle.
 */
public record CycleReport(
        int newTransactionsCount,
        int newEventsCount,
        int newUsersCount,
        int duplicatesSkipped,
        BlockWindow window
) {

    /** True when the cycle brought neither new transactions nor new events. */
    public boolean isEmpty() {
        return newTransactionsCount == 0 && newEventsCount == 0;
    }
}
