package com.chainpulse.ingestion.adapter.evm;

import com.chainpulse.common.StringUtils;
import com.chainpulse.config.CaffeineConfig;
import com.chainpulse.domain.NetworkId;
import com.chainpulse.ingestion.config.IngestionEvmRpcProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves transactions, receipts and block timestamps in JSON-RPC batches. Results are immutable once mined,
 * so they are kept in Caffeine caches across sync cycles; only cache misses go to the node.
 */
@Slf4j
@Component
public class EvmChainDataLookup {

    private final EvmJsonRpcCaller rpcCaller;
    private final IngestionEvmRpcProperties evmRpcProperties;
    private final Cache transactionCache;
    private final Cache receiptCache;
    private final Cache blockTimestampCache;

    public EvmChainDataLookup(EvmJsonRpcCaller rpcCaller, IngestionEvmRpcProperties evmRpcProperties,
                              CacheManager cacheManager) {
        this.rpcCaller = rpcCaller;
        this.evmRpcProperties = evmRpcProperties;
        this.transactionCache = requireCache(cacheManager, CaffeineConfig.TRANSACTION_CACHE);
        this.receiptCache = requireCache(cacheManager, CaffeineConfig.RECEIPT_CACHE);
        this.blockTimestampCache = requireCache(cacheManager, CaffeineConfig.BLOCK_TIMESTAMP_CACHE);
    }

    /** Transaction objects by hash; hashes the node does not know are absent from the result. */
    public Map<String, JsonNode> getTransactions(NetworkId networkId, Collection<String> txHashes) {
        return resolve(networkId, txHashes, transactionCache, "eth_getTransactionByHash");
    }

    /** Receipts by hash; pending or unknown transactions are absent from the result. */
    public Map<String, JsonNode> getReceipts(NetworkId networkId, Collection<String> txHashes) {
        return resolve(networkId, txHashes, receiptCache, "eth_getTransactionReceipt");
    }

    /** Block timestamps in epoch seconds by block number. */
    public Map<Long, Long> getBlockTimestamps(NetworkId networkId, Collection<Long> blockNumbers) {
        Map<Long, Long> found = new HashMap<>();
        List<Long> missing = new ArrayList<>();
        for (Long block : blockNumbers) {
            Long cached = blockTimestampCache.get(cacheKey(networkId, block), Long.class);
            if (cached != null) {
                found.put(block, cached);
            } else {
                missing.add(block);
            }
        }
        for (List<Long> chunk : chunks(missing)) {
            List<RpcRequest> requests = chunk.stream()
                    .map(b -> new RpcRequest("eth_getBlockByNumber", List.of(StringUtils.toHexQuantity(b), false)))
                    .toList();
            List<JsonNode> results = rpcCaller.batchCall(networkId, requests);
            for (int i = 0; i < chunk.size(); i++) {
                JsonNode block = results.get(i);
                BigInteger ts = block != null ? StringUtils.parseHexQuantity(block.path("timestamp").asText(null)) : null;
                if (ts != null) {
                    found.put(chunk.get(i), ts.longValue());
                    blockTimestampCache.put(cacheKey(networkId, chunk.get(i)), ts.longValue());
                }
            }
        }
        return found;
    }

    private Map<String, JsonNode> resolve(NetworkId networkId, Collection<String> txHashes, Cache cache, String method) {
        Map<String, JsonNode> found = new HashMap<>();
        List<String> missing = new ArrayList<>();
        for (String hash : txHashes) {
            JsonNode cached = cache.get(cacheKey(networkId, hash), JsonNode.class);
            if (cached != null) {
                found.put(hash, cached);
            } else {
                missing.add(hash);
            }
        }
        for (List<String> chunk : chunks(missing)) {
            List<RpcRequest> requests = chunk.stream()
                    .map(h -> new RpcRequest(method, List.of(h)))
                    .toList();
            List<JsonNode> results = rpcCaller.batchCall(networkId, requests);
            for (int i = 0; i < chunk.size(); i++) {
                JsonNode result = results.get(i);
                if (result != null) {
                    found.put(chunk.get(i), result);
                    cache.put(cacheKey(networkId, chunk.get(i)), result);
                }
            }
        }
        if (found.size() < txHashes.size()) {
            log.debug("{}: {} of {} hashes unresolved on {}", method, txHashes.size() - found.size(), txHashes.size(), networkId);
        }
        return found;
    }

    private <T> List<List<T>> chunks(List<T> items) {
        int size = Math.max(1, evmRpcProperties.getLookupBatchSize());
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(items.subList(i, Math.min(items.size(), i + size)));
        }
        return chunks;
    }

    private static String cacheKey(NetworkId networkId, Object key) {
        return networkId.name() + ":" + key;
    }

    private static Cache requireCache(CacheManager cacheManager, String name) {
        Cache cache = cacheManager.getCache(name);
        if (cache == null) {
            throw new IllegalStateException("Cache not configured: " + name);
        }
        return cache;
    }
}
