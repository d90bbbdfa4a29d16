package com.chainpulse.domain;

import java.util.List;

/**
 * A log emitted by the target contract.
 *
 * @param logIndex position of the log in its block; null when the source did not report it
 */
public record ContractEvent(
        String address,
        List<String> topics,
        String data,
        long blockNumber,
        String transactionHash,
        Integer transactionIndex,
        String blockHash,
        Integer logIndex
) {}
