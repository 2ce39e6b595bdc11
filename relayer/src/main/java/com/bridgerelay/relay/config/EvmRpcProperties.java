package com.bridgerelay.relay.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * EVM RPC throttling, timeout and endpoint cool-down settings shared by both chain clients.
 */
@ConfigurationProperties(prefix = "bridgerelay.rpc")
@NoArgsConstructor
@Getter
@Setter
public class EvmRpcProperties {

    /** Global EVM RPC budget (requests per second) for this relayer. */
    private int maxRequestsPerSecond = 50;

    /** Upper bound for a single JSON-RPC round trip. */
    private long requestTimeoutMs = 20_000;

    /** Time to skip an endpoint after rate-limit errors (HTTP 429). */
    private long endpointCooldownMs = 60_000;

    /** Time to skip an endpoint after transient upstream errors (timeouts, 5xx). */
    private long transientErrorCooldownMs = 15_000;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;
}
