package com.chainpulse.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Chain-agnostic view of a contract transaction. Amounts are in ETH (native units), not wei.
 */
@NoArgsConstructor
@Getter
@Setter
public class NormalizedTransaction {

    private String hash;
    private String chain;
    private String fromAddress;
    private String toAddress;
    private long blockNumber;
    private Instant blockTimestamp;
    /** Four-byte selector, e.g. {@code 0xa9059cbb}; null for plain value transfers. */
    private String functionSignature;
    private String functionName;
    private BigDecimal valueEth = BigDecimal.ZERO;
    private BigDecimal gasCostEth = BigDecimal.ZERO;
    private long gasUsed;
    private boolean success;
    /** False when no receipt was available; the transaction then counts as neither succeeded nor failed. */
    private boolean statusKnown = true;

    public boolean isFailed() {
        return statusKnown && !success;
    }

    protected void copyFrom(NormalizedTransaction other) {
        this.hash = other.hash;
        this.chain = other.chain;
        this.fromAddress = other.fromAddress;
        this.toAddress = other.toAddress;
        this.blockNumber = other.blockNumber;
        this.blockTimestamp = other.blockTimestamp;
        this.functionSignature = other.functionSignature;
        this.functionName = other.functionName;
        this.valueEth = other.valueEth;
        this.gasCostEth = other.gasCostEth;
        this.gasUsed = other.gasUsed;
        this.success = other.success;
        this.statusKnown = other.statusKnown;
    }
}
