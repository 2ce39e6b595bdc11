package com.bridgerelay.relay.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * RPC retry policy inside one call (exponential backoff ± jitter). Cross-cycle back-off is driven by
 * {@link RelayerProperties#getPollingInterval()} and {@link RelayerProperties#getMaxBackoff()}.
 */
@ConfigurationProperties(prefix = "bridgerelay.retry")
@NoArgsConstructor
@Getter
@Setter
public class RpcRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Attempts per call, including the first one. */
    private int maxAttempts = 3;

    /** Ceiling for a single retry delay. */
    private long maxDelayMs = 10_000L;
}
