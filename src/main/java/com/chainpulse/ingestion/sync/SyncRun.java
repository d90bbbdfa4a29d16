package com.chainpulse.ingestion.sync;

import com.chainpulse.ingestion.store.AccumulatedDataset;
import lombok.Getter;

/**
 * Mutable state of one continuous sync loop. Confined to the thread running the loop.
 */
@Getter
public class SyncRun {

    private final String analysisId;
    private final String userId;
    private final SyncTarget target;
    private final AccumulatedDataset dataset = new AccumulatedDataset();
    private int cycleNumber = 1;
    private Long lastProcessedBlock;
    private int emptyCycleStreak;

    public SyncRun(String analysisId, String userId, SyncTarget target) {
        this.analysisId = analysisId;
        this.userId = userId;
        this.target = target;
    }

    /** Moves the processed-block cursor forward; never moves it back. */
    public void advanceTo(long toBlock) {
        if (lastProcessedBlock == null || toBlock > lastProcessedBlock) {
            lastProcessedBlock = toBlock;
        }
    }

    /** The cursor value after a window ending at {@code toBlock}, without moving it. */
    public long cursorAfter(long toBlock) {
        return lastProcessedBlock == null ? toBlock : Math.max(lastProcessedBlock, toBlock);
    }

    public void nextCycle() {
        cycleNumber++;
    }

    /** @return streak length after recording the empty cycle */
    public int recordEmptyCycle() {
        return ++emptyCycleStreak;
    }

    public void resetEmptyCycles() {
        emptyCycleStreak = 0;
    }
}
