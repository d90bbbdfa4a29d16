package com.chainpulse.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Supported EVM networks. Chains arrive as free-form strings on analyses and user onboarding
 * (e.g. "ethereum", "lisk"); {@link #fromChain(String)} resolves them.
 */
public enum NetworkId {
    ETHEREUM(Set.of("ethereum", "eth", "mainnet")),
    LISK(Set.of("lisk")),
    BASE(Set.of("base")),
    ARBITRUM(Set.of("arbitrum", "arbitrum-one")),
    OPTIMISM(Set.of("optimism", "op")),
    POLYGON(Set.of("polygon", "matic"));

    private final Set<String> aliases;

    NetworkId(Set<String> aliases) {
        this.aliases = aliases;
    }

    public static Optional<NetworkId> fromChain(String chain) {
        if (chain == null || chain.isBlank()) {
            return Optional.empty();
        }
        String key = chain.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(n -> n.name().equalsIgnoreCase(key) || n.aliases.contains(key))
                .findFirst();
    }
}
