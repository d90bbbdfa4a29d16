package com.chainpulse.ingestion.store;

import com.chainpulse.domain.AccumulatedEvent;
import com.chainpulse.domain.AccumulatedTransaction;
import com.chainpulse.domain.AccumulatedUser;
import com.chainpulse.domain.UserType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives per-address users from the full accumulated transaction and event sets. Pure: the same inputs always
 * yield the same users, so re-deriving every cycle never double counts.
 */
@Component
public class UserAggregator {

    private static final BigDecimal WHALE_VALUE = BigDecimal.valueOf(100);
    private static final int POWER_USER_EVENTS = 50;
    private static final int ACTIVE_TRANSACTIONS = 20;
    private static final int EVENT_ACTIVE_EVENTS = 10;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    public List<AccumulatedUser> deriveUsers(Collection<AccumulatedTransaction> transactions,
                                             Collection<AccumulatedEvent> events,
                                             int currentCycle) {
        Map<String, AccumulatedUser> byAddress = new LinkedHashMap<>();
        Map<String, String> senderByTxHash = new HashMap<>();

        for (AccumulatedTransaction tx : transactions) {
            String address = tx.getFromAddress();
            if (address == null) {
                continue;
            }
            senderByTxHash.put(tx.getHash(), address);
            AccumulatedUser user = byAddress.computeIfAbsent(address, a -> newUser(a, currentCycle));
            user.setTransactionCount(user.getTransactionCount() + 1);
            user.setTotalValue(user.getTotalValue().add(nullToZero(tx.getValueEth())));
            user.setTotalGasSpent(user.getTotalGasSpent().add(nullToZero(tx.getGasCostEth())));
            Instant ts = tx.getBlockTimestamp();
            if (ts != null) {
                if (user.getFirstSeen() == null || ts.isBefore(user.getFirstSeen())) {
                    user.setFirstSeen(ts);
                }
                if (user.getLastSeen() == null || ts.isAfter(user.getLastSeen())) {
                    user.setLastSeen(ts);
                }
            }
            markActive(user, tx.getSyncCycle());
        }

        for (AccumulatedEvent event : events) {
            String address = senderByTxHash.get(event.getTransactionHash());
            AccumulatedUser user = address != null ? byAddress.get(address) : null;
            if (user == null) {
                continue;
            }
            user.setEventInteractions(user.getEventInteractions() + 1);
            markActive(user, event.getSyncCycle());
        }

        List<AccumulatedUser> result = new ArrayList<>(byAddress.size());
        for (AccumulatedUser user : byAddress.values()) {
            user.setLoyaltyScore(loyaltyScore(user));
            user.setRiskScore(riskScore(user));
            user.setUserType(classify(user));
            result.add(user);
        }
        return result;
    }

    static UserType classify(AccumulatedUser user) {
        if (user.getTotalValue().compareTo(WHALE_VALUE) > 0) {
            return UserType.WHALE;
        }
        if (user.getEventInteractions() > POWER_USER_EVENTS) {
            return UserType.POWER_USER;
        }
        if (user.getTransactionCount() > ACTIVE_TRANSACTIONS) {
            return UserType.ACTIVE;
        }
        if (user.getEventInteractions() > EVENT_ACTIVE_EVENTS) {
            return UserType.EVENT_ACTIVE;
        }
        return UserType.CASUAL;
    }

    /** min(100, transactions per day of activity × 20), with at least one day of activity. */
    static double loyaltyScore(AccumulatedUser user) {
        double daySpan = 0;
        if (user.getFirstSeen() != null && user.getLastSeen() != null) {
            daySpan = Duration.between(user.getFirstSeen(), user.getLastSeen()).toMillis() / MILLIS_PER_DAY;
        }
        return Math.min(100.0, user.getTransactionCount() / Math.max(1.0, daySpan) * 20);
    }

    static double riskScore(AccumulatedUser user) {
        if (user.getTotalValue().signum() <= 0 || user.getTransactionCount() == 0) {
            return 0;
        }
        return (double) user.getEventInteractions() / user.getTransactionCount() * 10;
    }

    private static AccumulatedUser newUser(String address, int currentCycle) {
        AccumulatedUser user = new AccumulatedUser();
        user.setAddress(address);
        user.setLastActiveSync(currentCycle);
        return user;
    }

    private static void markActive(AccumulatedUser user, int cycle) {
        user.getSyncCyclesActive().add(cycle);
        user.setLastActiveSync(Math.max(user.getLastActiveSync(), cycle));
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
