package com.chainpulse.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * EVM JSON-RPC transport. Retries and endpoint rotation live in {@link EvmJsonRpcCaller}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getLogs"
     * @param params      method params
     * @return response body (JSON); errors with {@link com.chainpulse.ingestion.adapter.RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);

    /**
     * JSON-RPC batch call. Request ids are the 1-based positions in {@code requests}.
     *
     * @return response body (JSON array)
     */
    Mono<String> batchCall(String endpointUrl, List<RpcRequest> requests);
}
