package com.chainpulse.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-address aggregate derived from all accumulated transactions and events. Rebuilt every cycle.
 */
@NoArgsConstructor
@Getter
@Setter
public class AccumulatedUser {

    private String address;
    private int transactionCount;
    private BigDecimal totalValue = BigDecimal.ZERO;
    private BigDecimal totalGasSpent = BigDecimal.ZERO;
    private Instant firstSeen;
    private Instant lastSeen;
    private int eventInteractions;
    private double loyaltyScore;
    private double riskScore;
    private UserType userType = UserType.CASUAL;
    private SortedSet<Integer> syncCyclesActive = new TreeSet<>();
    private int lastActiveSync;
}
