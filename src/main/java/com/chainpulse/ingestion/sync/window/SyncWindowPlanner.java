package com.chainpulse.ingestion.sync.window;

import com.chainpulse.ingestion.config.ContinuousSyncProperties;
import com.chainpulse.ingestion.sync.SyncTarget;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Chooses the block window for a cycle. The first cycle looks back a base range from the head; later cycles
 * continue right after the last processed block. When that leaves nothing to scan (head has not moved),
 * the window falls back to a lookback that grows by 100 blocks per cycle, so a cycle always scans something
 * and already-seen data is absorbed by deduplication.
 */
@Component
@RequiredArgsConstructor
public class SyncWindowPlanner {

    static final long FALLBACK_GROWTH_PER_CYCLE = 100;

    private final ContinuousSyncProperties properties;

    public BlockWindow planWindow(long currentHead, Long lastProcessedBlock, int cycleNumber, SyncTarget target) {
        long head = Math.max(0, currentHead);
        long fromBlock;
        if (cycleNumber <= 1 || lastProcessedBlock == null) {
            fromBlock = head - baseRange(target);
        } else {
            fromBlock = lastProcessedBlock + 1;
        }
        if (fromBlock >= head) {
            fromBlock = head - (blockRange(target) + cycleNumber * FALLBACK_GROWTH_PER_CYCLE);
        }
        return new BlockWindow(Math.max(0, fromBlock), head);
    }

    private long baseRange(SyncTarget target) {
        return target.isComprehensive() ? properties.getComprehensiveBaseRange() : properties.getStandardBaseRange();
    }

    private long blockRange(SyncTarget target) {
        Long configured = target.blockRange();
        return configured != null && configured > 0 ? configured : properties.getDefaultBlockRange();
    }
}
