package com.chainpulse.ingestion.adapter.evm;

import com.chainpulse.common.RetryPolicy;
import com.chainpulse.domain.NetworkId;
import com.chainpulse.ingestion.adapter.RpcEndpointRotator;
import com.chainpulse.ingestion.adapter.RpcException;
import com.chainpulse.ingestion.config.IngestionEvmRpcProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvmJsonRpcCallerTest {

    private static final RetryPolicy NO_DELAY = new RetryPolicy(0L, 0, 3);

    @Test
    void call_returnsResultNode() {
        StubRpcClient rpc = new StubRpcClient();
        rpc.singleResponses.add("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x10\"}");

        JsonNode result = caller(rpc, rotator("https://a.example")).call(NetworkId.ETHEREUM, "eth_blockNumber", List.of());

        assertThat(result.asText()).isEqualTo("0x10");
        assertThat(rpc.endpoints).containsExactly("https://a.example");
    }

    @Test
    void call_retriesOnNextEndpointAfterFailure() {
        StubRpcClient rpc = new StubRpcClient();
        rpc.singleResponses.add(null);
        rpc.singleResponses.add("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x2\"}");

        JsonNode result = caller(rpc, rotator("https://a.example", "https://b.example"))
                .call(NetworkId.ETHEREUM, "eth_blockNumber", List.of());

        assertThat(result.asText()).isEqualTo("0x2");
        assertThat(rpc.endpoints).containsExactly("https://a.example", "https://b.example");
    }

    @Test
    void call_rpcErrorOnEveryAttempt_throwsAfterMaxAttempts() {
        StubRpcClient rpc = new StubRpcClient();
        for (int i = 0; i < 3; i++) {
            rpc.singleResponses.add("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"header not found\"}}");
        }

        assertThatThrownBy(() -> caller(rpc, rotator("https://a.example")).call(NetworkId.ETHEREUM, "eth_blockNumber", List.of()))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("failed after 3 attempts")
                .hasMessageContaining("header not found");
        assertThat(rpc.calls.get()).isEqualTo(3);
    }

    @Test
    void call_rangeTooWide_isNotRetried() {
        StubRpcClient rpc = new StubRpcClient();
        rpc.singleResponses.add("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32005,\"message\":\"query returned more than 10000 results\"}}");

        assertThatThrownBy(() -> caller(rpc, rotator("https://a.example")).call(NetworkId.ETHEREUM, "eth_getLogs", List.of()))
                .isInstanceOf(RpcException.class)
                .satisfies(e -> assertThat(EvmJsonRpcCaller.isRangeTooWideError((Exception) e)).isTrue());
        assertThat(rpc.calls.get()).isEqualTo(1);
    }

    @Test
    void call_usesNetworkSpecificRotator() {
        StubRpcClient rpc = new StubRpcClient();
        rpc.singleResponses.add("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x1\"}");
        EvmJsonRpcCaller caller = new EvmJsonRpcCaller(rpc, Map.of("LISK", rotator("https://lisk.example")),
                rotator("https://default.example"), fastLimiter(), new IngestionEvmRpcProperties(), new ObjectMapper());

        caller.call(NetworkId.LISK, "eth_blockNumber", List.of());

        assertThat(rpc.endpoints).containsExactly("https://lisk.example");
    }

    @Test
    void batchCall_ordersResultsByIdAndNullsErrors() {
        StubRpcClient rpc = new StubRpcClient();
        rpc.batchResponse = """
                [
                  {"jsonrpc":"2.0","id":3,"result":{"hash":"0xc"}},
                  {"jsonrpc":"2.0","id":1,"result":{"hash":"0xa"}},
                  {"jsonrpc":"2.0","id":2,"error":{"code":-32000,"message":"unknown"}}
                ]
                """;
        List<RpcRequest> requests = List.of(
                new RpcRequest("eth_getTransactionByHash", List.of("0xa")),
                new RpcRequest("eth_getTransactionByHash", List.of("0xb")),
                new RpcRequest("eth_getTransactionByHash", List.of("0xc")));

        List<JsonNode> results = caller(rpc, rotator("https://a.example")).batchCall(NetworkId.ETHEREUM, requests);

        assertThat(results).hasSize(3);
        assertThat(results.get(0).path("hash").asText()).isEqualTo("0xa");
        assertThat(results.get(1)).isNull();
        assertThat(results.get(2).path("hash").asText()).isEqualTo("0xc");
    }

    @Test
    void batchCall_emptyRequests_skipsTransport() {
        StubRpcClient rpc = new StubRpcClient();

        assertThat(caller(rpc, rotator("https://a.example")).batchCall(NetworkId.ETHEREUM, List.of())).isEmpty();
        assertThat(rpc.calls.get()).isZero();
    }

    @Test
    void isRangeTooWideError_recognisesProviderMessages() {
        assertThat(EvmJsonRpcCaller.isRangeTooWideError(new RpcException("Log response size exceeded"))).isTrue();
        assertThat(EvmJsonRpcCaller.isRangeTooWideError(new RpcException("error -32701"))).isTrue();
        assertThat(EvmJsonRpcCaller.isRangeTooWideError(new RpcException("connection reset"))).isFalse();
        assertThat(EvmJsonRpcCaller.isRangeTooWideError(null)).isFalse();
    }

    private static EvmJsonRpcCaller caller(EvmRpcClient rpc, RpcEndpointRotator rotator) {
        return new EvmJsonRpcCaller(rpc, Map.of("ETHEREUM", rotator), rotator, fastLimiter(),
                new IngestionEvmRpcProperties(), new ObjectMapper());
    }

    private static RpcEndpointRotator rotator(String... endpoints) {
        return new RpcEndpointRotator(List.of(endpoints), NO_DELAY);
    }

    private static RateLimiter fastLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000_000)
                .timeoutDuration(Duration.ofMillis(1))
                .build();
        return RateLimiter.of("test-evm-limiter", config);
    }

    /** Replays queued single-call bodies; a null entry becomes a transport error. */
    private static final class StubRpcClient implements EvmRpcClient {

        private final List<String> singleResponses = new ArrayList<>();
        private final List<String> endpoints = new ArrayList<>();
        private final AtomicInteger calls = new AtomicInteger();
        private String batchResponse = "[]";

        @Override
        public Mono<String> call(String endpointUrl, String method, Object params) {
            endpoints.add(endpointUrl);
            int index = calls.getAndIncrement();
            String body = index < singleResponses.size() ? singleResponses.get(index) : null;
            return body != null ? Mono.just(body) : Mono.error(new RpcException("HTTP 503 from " + endpointUrl));
        }

        @Override
        public Mono<String> batchCall(String endpointUrl, List<RpcRequest> requests) {
            endpoints.add(endpointUrl);
            calls.incrementAndGet();
            return Mono.just(batchResponse);
        }
    }
}
