package com.chainpulse.ingestion.normalizer;

import com.chainpulse.common.StringUtils;
import com.chainpulse.common.SyncConfigurationException;
import com.chainpulse.domain.NormalizedTransaction;
import com.chainpulse.domain.RawContractTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw chain transactions into {@link NormalizedTransaction}s: ETH-denominated value and gas cost,
 * lower-cased addresses, block time and the called function.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionNormalizer {

    static final String UNKNOWN_FUNCTION = "unknown";

    private final GasCostCalculator gasCostCalculator;
    private final FunctionSelectorRegistry selectorRegistry;

    /**
     * Normalizes the batch. Transactions without hash or sender are skipped.
     *
     * @throws SyncConfigurationException when {@code chain} is missing
     */
    public List<NormalizedTransaction> normalizeTransactions(List<RawContractTransaction> transactions, String chain) {
        if (StringUtils.isBlank(chain)) {
            throw new SyncConfigurationException("Target contract chain is missing from configuration");
        }
        String normalizedChain = chain.strip().toLowerCase(Locale.ROOT);
        List<NormalizedTransaction> result = new ArrayList<>(transactions.size());
        for (RawContractTransaction raw : transactions) {
            if (raw == null || StringUtils.isBlank(raw.hash()) || StringUtils.isBlank(raw.from())) {
                log.debug("Skipping transaction without hash or sender on {}", normalizedChain);
                continue;
            }
            result.add(normalize(raw, normalizedChain));
        }
        return result;
    }

    NormalizedTransaction normalize(RawContractTransaction raw, String chain) {
        NormalizedTransaction tx = new NormalizedTransaction();
        tx.setHash(raw.hash());
        tx.setChain(chain);
        tx.setFromAddress(StringUtils.normalizeAddress(raw.from()));
        tx.setToAddress(StringUtils.normalizeAddress(raw.to()));
        tx.setBlockNumber(raw.blockNumber());
        tx.setBlockTimestamp(raw.blockTimestamp() != null ? Instant.ofEpochSecond(raw.blockTimestamp()) : null);
        tx.setValueEth(gasCostCalculator.weiToEth(raw.value()));
        BigInteger gas = raw.gasUsed() != null ? raw.gasUsed() : raw.gasLimit();
        tx.setGasUsed(gas != null ? gas.longValue() : 0L);
        tx.setGasCostEth(gasCostCalculator.gasCostEth(gas, raw.gasPrice()));
        tx.setSuccess(Boolean.TRUE.equals(raw.status()));
        tx.setStatusKnown(raw.status() != null);

        String selector = selectorOf(raw.input());
        tx.setFunctionSignature(selector);
        tx.setFunctionName(selectorRegistry.nameOf(selector).orElse(selector != null ? selector : UNKNOWN_FUNCTION));
        return tx;
    }

    private static String selectorOf(String input) {
        if (input == null || input.length() < 10 || !input.startsWith("0x")) {
            return null;
        }
        return input.substring(0, 10).toLowerCase(Locale.ROOT);
    }
}
