package com.chainpulse.ingestion.sync.window;

/**
 * Inclusive block range fetched by one cycle.
 */
public record BlockWindow(long fromBlock, long toBlock) {

    public BlockWindow {
        if (fromBlock < 0 || toBlock < fromBlock) {
            throw new IllegalArgumentException("Invalid block window [" + fromBlock + "-" + toBlock + "]");
        }
    }

    public long size() {
        return toBlock - fromBlock + 1;
    }

    @Override
    public String toString() {
        return fromBlock + "-" + toBlock;
    }
}
