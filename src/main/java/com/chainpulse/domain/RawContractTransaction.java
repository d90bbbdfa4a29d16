package com.chainpulse.domain;

import java.math.BigInteger;

/**
 * A transaction as fetched from the chain, before normalization. Quantities are raw wei / gas units.
 *
 * @param blockTimestamp block time in epoch seconds, null when the block could not be resolved
 * @param status         receipt status, null when no receipt was available
 */
public record RawContractTransaction(
        String hash,
        String from,
        String to,
        BigInteger value,
        BigInteger gasPrice,
        BigInteger gasUsed,
        BigInteger gasLimit,
        String input,
        long blockNumber,
        Long blockTimestamp,
        Boolean status
) {}
