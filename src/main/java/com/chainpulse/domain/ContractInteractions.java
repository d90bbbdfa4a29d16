package com.chainpulse.domain;

import java.util.List;

/**
 * Everything fetched for one contract over one block window.
 */
public record ContractInteractions(
        List<RawContractTransaction> transactions,
        List<ContractEvent> events,
        Summary summary,
        String method
) {

    public record Summary(int totalTransactions, int totalEvents, long blocksScanned) {}

    public static ContractInteractions empty(long blocksScanned, String method) {
        return new ContractInteractions(List.of(), List.of(), new Summary(0, 0, blocksScanned), method);
    }
}
