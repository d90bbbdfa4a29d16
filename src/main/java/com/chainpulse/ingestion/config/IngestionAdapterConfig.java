package com.chainpulse.ingestion.config;

import com.chainpulse.common.RetryPolicy;
import com.chainpulse.ingestion.adapter.RpcEndpointRotator;
import com.chainpulse.ingestion.adapter.evm.EvmRpcClient;
import com.chainpulse.ingestion.adapter.evm.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Wires EVM RPC access from per-network config: one rotator per configured network, a default rotator
 * for the rest, the WebClient JSON-RPC client and the shared request limiter.
 */
@Configuration
@EnableConfigurationProperties({ IngestionNetworkProperties.class, IngestionRetryProperties.class,
        IngestionEvmRpcProperties.class, ContinuousSyncProperties.class })
public class IngestionAdapterConfig {

    private static final List<String> DEFAULT_FALLBACK_URLS = List.of("https://eth.llamarpc.com");

    private static RetryPolicy retryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public Map<String, RpcEndpointRotator> evmRotatorsByNetwork(IngestionNetworkProperties properties,
                                                               IngestionRetryProperties retryProperties) {
        return properties.getNetwork().entrySet().stream()
                .filter(e -> e.getValue() != null && !e.getValue().getUrls().isEmpty())
                .collect(Collectors.toMap(Map.Entry::getKey,
                        e -> new RpcEndpointRotator(e.getValue().getUrls(), retryPolicy(retryProperties))));
    }

    /** Used for networks without urls under chainpulse.ingestion.network. */
    @Bean
    public RpcEndpointRotator evmDefaultRpcEndpointRotator(IngestionRetryProperties retryProperties) {
        return new RpcEndpointRotator(DEFAULT_FALLBACK_URLS, retryPolicy(retryProperties));
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(IngestionEvmRpcProperties evmRpcProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, evmRpcProperties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, evmRpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }
}
