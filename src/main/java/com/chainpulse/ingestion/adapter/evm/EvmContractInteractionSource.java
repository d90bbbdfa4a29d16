package com.chainpulse.ingestion.adapter.evm;

import com.chainpulse.common.StringUtils;
import com.chainpulse.common.SyncConfigurationException;
import com.chainpulse.domain.ContractEvent;
import com.chainpulse.domain.ContractInteractions;
import com.chainpulse.domain.NetworkId;
import com.chainpulse.domain.RawContractTransaction;
import com.chainpulse.ingestion.adapter.ContractInteractionSource;
import com.chainpulse.ingestion.adapter.RpcException;
import com.chainpulse.ingestion.config.IngestionNetworkProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Interaction-based fetch for EVM contracts: eth_getLogs filtered by contract address over the window, then the
 * transactions behind those logs with their receipts and block timestamps.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvmContractInteractionSource implements ContractInteractionSource {

    public static final String FETCH_METHOD = "interaction-based";

    private static final long MIN_CHUNK_SIZE = 10;

    private final EvmJsonRpcCaller rpcCaller;
    private final EvmChainDataLookup chainDataLookup;
    private final IngestionNetworkProperties networkProperties;

    @Override
    public boolean supports(String chain) {
        return NetworkId.fromChain(chain).isPresent();
    }

    @Override
    public long getCurrentBlockNumber(String chain) {
        NetworkId networkId = resolve(chain);
        JsonNode result = rpcCaller.call(networkId, "eth_blockNumber", List.of());
        String hex = result.asText(null);
        if (hex == null || !hex.startsWith("0x")) {
            throw new RpcException("eth_blockNumber invalid result: " + hex);
        }
        return StringUtils.parseHexQuantity(hex).longValue();
    }

    @Override
    public ContractInteractions fetchContractInteractions(String contractAddress, long fromBlock, long toBlock, String chain) {
        if (StringUtils.isBlank(contractAddress)) {
            throw new SyncConfigurationException("Target contract address is missing from configuration");
        }
        NetworkId networkId = resolve(chain);
        if (fromBlock > toBlock) {
            return ContractInteractions.empty(0, FETCH_METHOD);
        }
        String address = StringUtils.normalizeAddress(contractAddress);
        int batchBlocks = networkProperties.batchBlockSize(networkId.name());

        List<ContractEvent> events = new ArrayList<>();
        long start = fromBlock;
        while (start <= toBlock) {
            long end = Math.min(start + batchBlocks - 1, toBlock);
            events.addAll(fetchLogs(networkId, address, start, end));
            start = end + 1;
        }

        Set<String> txHashes = new LinkedHashSet<>();
        for (ContractEvent event : events) {
            if (event.transactionHash() != null) {
                txHashes.add(event.transactionHash());
            }
        }
        List<RawContractTransaction> transactions = loadTransactions(networkId, txHashes);
        log.debug("Fetched {} events / {} transactions for {} on {} in [{}-{}]",
                events.size(), transactions.size(), address, networkId, fromBlock, toBlock);
        return new ContractInteractions(transactions, events,
                new ContractInteractions.Summary(transactions.size(), events.size(), toBlock - fromBlock + 1),
                FETCH_METHOD);
    }

    private List<ContractEvent> fetchLogs(NetworkId networkId, String address, long fromBlock, long toBlock) {
        Map<String, Object> filter = Map.of(
                "address", address,
                "fromBlock", StringUtils.toHexQuantity(fromBlock),
                "toBlock", StringUtils.toHexQuantity(toBlock));
        try {
            JsonNode result = rpcCaller.call(networkId, "eth_getLogs", List.of(filter));
            List<ContractEvent> events = new ArrayList<>();
            if (result.isArray()) {
                for (JsonNode logNode : result) {
                    if (!logNode.path("removed").asBoolean(false)) {
                        events.add(toEvent(logNode));
                    }
                }
            }
            return events;
        } catch (RpcException e) {
            if (EvmJsonRpcCaller.isRangeTooWideError(e) && (toBlock - fromBlock) > MIN_CHUNK_SIZE) {
                log.warn("Reducing block range [{}-{}] on {}: {}", fromBlock, toBlock, networkId, e.getMessage());
                long mid = fromBlock + (toBlock - fromBlock) / 2;
                List<ContractEvent> combined = new ArrayList<>(fetchLogs(networkId, address, fromBlock, mid));
                combined.addAll(fetchLogs(networkId, address, mid + 1, toBlock));
                return combined;
            }
            throw e;
        }
    }

    private List<RawContractTransaction> loadTransactions(NetworkId networkId, Set<String> txHashes) {
        if (txHashes.isEmpty()) {
            return List.of();
        }
        Map<String, JsonNode> txByHash = chainDataLookup.getTransactions(networkId, txHashes);
        Map<String, JsonNode> receiptByHash = chainDataLookup.getReceipts(networkId, txByHash.keySet());
        Set<Long> blocks = new TreeSet<>();
        for (JsonNode tx : txByHash.values()) {
            BigInteger block = StringUtils.parseHexQuantity(tx.path("blockNumber").asText(null));
            if (block != null) {
                blocks.add(block.longValue());
            }
        }
        Map<Long, Long> timestamps = chainDataLookup.getBlockTimestamps(networkId, blocks);

        List<RawContractTransaction> transactions = new ArrayList<>(txByHash.size());
        for (String hash : txHashes) {
            JsonNode tx = txByHash.get(hash);
            if (tx != null) {
                transactions.add(toRawTransaction(hash, tx, receiptByHash.get(hash), timestamps));
            }
        }
        return transactions;
    }

    static ContractEvent toEvent(JsonNode logNode) {
        List<String> topics = new ArrayList<>();
        for (JsonNode topic : logNode.path("topics")) {
            topics.add(topic.asText());
        }
        return new ContractEvent(
                logNode.path("address").asText(null),
                topics,
                logNode.path("data").asText(null),
                hexLong(logNode.path("blockNumber"), 0L),
                logNode.path("transactionHash").asText(null),
                hexInt(logNode.path("transactionIndex")),
                logNode.path("blockHash").asText(null),
                hexInt(logNode.path("logIndex")));
    }

    static RawContractTransaction toRawTransaction(String hash, JsonNode tx, JsonNode receipt, Map<Long, Long> timestamps) {
        long blockNumber = hexLong(tx.path("blockNumber"), 0L);
        BigInteger gasPrice = null;
        BigInteger gasUsed = null;
        Boolean status = null;
        if (receipt != null) {
            gasPrice = StringUtils.parseHexQuantity(receipt.path("effectiveGasPrice").asText(null));
            gasUsed = StringUtils.parseHexQuantity(receipt.path("gasUsed").asText(null));
            String statusHex = receipt.path("status").asText(null);
            if (statusHex != null) {
                status = "0x1".equalsIgnoreCase(statusHex);
            }
        }
        if (gasPrice == null) {
            gasPrice = StringUtils.parseHexQuantity(tx.path("gasPrice").asText(null));
        }
        return new RawContractTransaction(
                hash,
                tx.path("from").asText(null),
                tx.path("to").isNull() ? null : tx.path("to").asText(null),
                StringUtils.parseHexQuantity(tx.path("value").asText(null)),
                gasPrice,
                gasUsed,
                StringUtils.parseHexQuantity(tx.path("gas").asText(null)),
                tx.path("input").asText(null),
                blockNumber,
                timestamps.get(blockNumber),
                status);
    }

    private static NetworkId resolve(String chain) {
        if (StringUtils.isBlank(chain)) {
            throw new SyncConfigurationException("Target contract chain is missing from configuration");
        }
        return NetworkId.fromChain(chain)
                .orElseThrow(() -> new SyncConfigurationException("Unsupported chain: " + chain));
    }

    private static long hexLong(JsonNode node, long fallback) {
        BigInteger value = StringUtils.parseHexQuantity(node.asText(null));
        return value != null ? value.longValue() : fallback;
    }

    private static Integer hexInt(JsonNode node) {
        BigInteger value = StringUtils.parseHexQuantity(node.asText(null));
        return value != null ? value.intValue() : null;
    }
}
