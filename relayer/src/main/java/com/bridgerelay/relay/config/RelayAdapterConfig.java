package com.bridgerelay.relay.config;

import com.bridgerelay.common.RetryPolicy;
import com.bridgerelay.relay.adapter.ChainClient;
import com.bridgerelay.relay.adapter.RpcEndpointRotator;
import com.bridgerelay.relay.adapter.evm.EvmChainClient;
import com.bridgerelay.relay.adapter.evm.EvmRpcClient;
import com.bridgerelay.relay.adapter.evm.WebClientEvmRpcClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires one EVM chain client per side. Both clients share the JSON-RPC transport and the process-wide
 * request budget; each side rotates over its own endpoints.
 */
@Configuration
@EnableConfigurationProperties({ ChainProperties.class, RelayerProperties.class, RpcRetryProperties.class, EvmRpcProperties.class })
public class RelayAdapterConfig {

    private static RetryPolicy retryPolicy(RpcRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts(),
                retryProperties.getMaxDelayMs());
    }

    @Bean
    public RpcEndpointRotator sourceRpcEndpointRotator(ChainProperties chains, RpcRetryProperties retryProperties) {
        return new RpcEndpointRotator(chains.getSource().displayName(), chains.getSource().getUrls(), retryPolicy(retryProperties));
    }

    @Bean
    public RpcEndpointRotator destinationRpcEndpointRotator(ChainProperties chains, RpcRetryProperties retryProperties) {
        return new RpcEndpointRotator(chains.getDestination().displayName(), chains.getDestination().getUrls(), retryPolicy(retryProperties));
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(EvmRpcProperties evmRpcProperties) {
        int rps = Math.max(1, evmRpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, evmRpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public ChainClient sourceChainClient(
            ChainProperties chains,
            EvmRpcClient evmRpcClient,
            @Qualifier("sourceRpcEndpointRotator") RpcEndpointRotator rotator,
            @Qualifier("evmRpcRateLimiter") RateLimiter rateLimiter,
            EvmRpcProperties evmRpcProperties,
            RelayerProperties relayerProperties,
            ObjectMapper objectMapper) {
        ChainProperties.ChainEntry source = chains.getSource();
        return new EvmChainClient(source.getChainId(), source.displayName(), evmRpcClient, rotator, rateLimiter,
                evmRpcProperties, objectMapper, source.getBridgeContract(), relayerProperties.getGasLimit());
    }

    @Bean
    public ChainClient destinationChainClient(
            ChainProperties chains,
            EvmRpcClient evmRpcClient,
            @Qualifier("destinationRpcEndpointRotator") RpcEndpointRotator rotator,
            @Qualifier("evmRpcRateLimiter") RateLimiter rateLimiter,
            EvmRpcProperties evmRpcProperties,
            RelayerProperties relayerProperties,
            ObjectMapper objectMapper) {
        ChainProperties.ChainEntry destination = chains.getDestination();
        return new EvmChainClient(destination.getChainId(), destination.displayName(), evmRpcClient, rotator, rateLimiter,
                evmRpcProperties, objectMapper, destination.getBridgeContract(), relayerProperties.getGasLimit());
    }
}
