package com.chainpulse.ingestion.adapter.evm;

import com.chainpulse.domain.NetworkId;
import com.chainpulse.ingestion.adapter.RpcEndpointRotator;
import com.chainpulse.ingestion.adapter.RpcException;
import com.chainpulse.ingestion.config.IngestionEvmRpcProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Executes EVM JSON-RPC calls for a network with endpoint rotation, retry backoff and the shared local
 * rate limiter. Range-too-wide eth_getLogs failures are not retried so the caller can split the window.
 */
@Slf4j
@Component
public class EvmJsonRpcCaller {

    private final EvmRpcClient rpcClient;
    private final Map<String, RpcEndpointRotator> rotatorsByNetwork;
    private final RpcEndpointRotator defaultRotator;
    private final RateLimiter evmRpcRateLimiter;
    private final IngestionEvmRpcProperties evmRpcProperties;
    private final ObjectMapper objectMapper;

    public EvmJsonRpcCaller(
            EvmRpcClient rpcClient,
            @Qualifier("evmRotatorsByNetwork") Map<String, RpcEndpointRotator> rotatorsByNetwork,
            @Qualifier("evmDefaultRpcEndpointRotator") RpcEndpointRotator defaultRotator,
            @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
            IngestionEvmRpcProperties evmRpcProperties,
            ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.rotatorsByNetwork = rotatorsByNetwork;
        this.defaultRotator = defaultRotator;
        this.evmRpcRateLimiter = evmRpcRateLimiter;
        this.evmRpcProperties = evmRpcProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Single call; returns the {@code result} node (may be a JSON null).
     */
    public JsonNode call(NetworkId networkId, String method, Object params) {
        RpcEndpointRotator rotator = rotatorFor(networkId);
        RuntimeException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                backoff(rotator, attempt);
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                acquirePermit(method, endpoint);
                String json = rpcClient.call(endpoint, method, params).block();
                return resultOf(method, parse(method, json));
            } catch (RuntimeException e) {
                if (isRangeTooWideError(e)) {
                    throw e;
                }
                lastException = e;
                log.debug("{} failed on {} for {} (attempt {}): {}", method, endpoint, networkId, attempt + 1, e.getMessage());
            }
        }
        throw exhausted(method, rotator, lastException);
    }

    /**
     * Batch call; returns one {@code result} node per request in request order. Entries whose response is
     * missing or carries an error are {@code null}.
     */
    public List<JsonNode> batchCall(NetworkId networkId, List<RpcRequest> requests) {
        if (requests.isEmpty()) {
            return List.of();
        }
        RpcEndpointRotator rotator = rotatorFor(networkId);
        String method = "batch " + requests.get(0).method();
        RuntimeException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                backoff(rotator, attempt);
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                acquirePermit(method, endpoint);
                String json = rpcClient.batchCall(endpoint, requests).block();
                return resultsInOrder(method, parse(method, json), requests.size());
            } catch (RuntimeException e) {
                lastException = e;
                log.debug("{} ({} req) failed on {} for {} (attempt {}): {}",
                        method, requests.size(), endpoint, networkId, attempt + 1, e.getMessage());
            }
        }
        throw exhausted(method, rotator, lastException);
    }

    private RpcEndpointRotator rotatorFor(NetworkId networkId) {
        return rotatorsByNetwork.getOrDefault(networkId.name(), defaultRotator);
    }

    private void backoff(RpcEndpointRotator rotator, int attempt) {
        try {
            Thread.sleep(rotator.retryDelayMs(attempt - 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry", e);
        }
    }

    private void acquirePermit(String method, String endpoint) {
        long acquireStart = System.nanoTime();
        boolean permitted = evmRpcRateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, evmRpcProperties.getLocalLimiterLogThresholdMs())) {
            log.info("Local EVM RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
    }

    private JsonNode parse(String method, String json) {
        if (json == null) {
            throw new RpcException(method + " returned null");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
    }

    private static JsonNode resultOf(String method, JsonNode root) {
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        return root.path("result");
    }

    private static List<JsonNode> resultsInOrder(String method, JsonNode root, int size) {
        if (!root.isArray()) {
            // Some endpoints answer a batch with a single error object.
            resultOf(method, root);
            throw new RpcException(method + " returned a non-array response");
        }
        List<JsonNode> results = new ArrayList<>(Arrays.asList(new JsonNode[size]));
        for (JsonNode item : root) {
            int id = item.path("id").asInt(-1);
            if (id < 1 || id > size) {
                continue;
            }
            JsonNode error = item.path("error");
            JsonNode result = item.path("result");
            if ((error.isMissingNode() || error.isNull()) && !result.isMissingNode() && !result.isNull()) {
                results.set(id - 1, result);
            }
        }
        return results;
    }

    private static RpcException exhausted(String method, RpcEndpointRotator rotator, RuntimeException lastException) {
        String msg = method + " failed after " + rotator.getMaxAttempts() + " attempts";
        if (lastException != null && lastException.getMessage() != null && !lastException.getMessage().isBlank()) {
            msg += ": " + lastException.getMessage();
        }
        return new RpcException(msg, lastException);
    }

    public static boolean isRangeTooWideError(Exception e) {
        if (e == null || e.getMessage() == null) {
            return false;
        }
        String msg = e.getMessage().toLowerCase(Locale.ROOT);
        return msg.contains("-32701") || msg.contains("query returned more than")
                || msg.contains("too many results") || msg.contains("block range is too wide")
                || msg.contains("exceed maximum block range") || msg.contains("log response size exceeded");
    }
}
