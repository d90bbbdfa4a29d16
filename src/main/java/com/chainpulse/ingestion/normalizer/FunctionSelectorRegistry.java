package com.chainpulse.ingestion.normalizer;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Names for well-known four-byte function selectors. Unknown selectors stay unnamed.
 */
@Component
public class FunctionSelectorRegistry {

    private static final Map<String, String> KNOWN = Map.ofEntries(
            Map.entry("0xa9059cbb", "transfer"),
            Map.entry("0x23b872dd", "transferFrom"),
            Map.entry("0x095ea7b3", "approve"),
            Map.entry("0x40c10f19", "mint"),
            Map.entry("0x42966c68", "burn"),
            Map.entry("0xd0e30db0", "deposit"),
            Map.entry("0x2e1a7d4d", "withdraw"),
            Map.entry("0xa694fc3a", "stake"),
            Map.entry("0x2e17de78", "unstake"),
            Map.entry("0x4e71d92d", "claim"),
            Map.entry("0x38ed1739", "swapExactTokensForTokens"),
            Map.entry("0x7ff36ab5", "swapExactETHForTokens"),
            Map.entry("0x18cbafe5", "swapExactTokensForETH"),
            Map.entry("0xe8e33700", "addLiquidity"),
            Map.entry("0xbaa2abde", "removeLiquidity"),
            Map.entry("0xac9650d8", "multicall"),
            Map.entry("0x3593564c", "execute")
    );

    public Optional<String> nameOf(String selector) {
        if (selector == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(KNOWN.get(selector.toLowerCase(Locale.ROOT)));
    }
}
