package com.bridgerelay.relay.adapter;

import com.bridgerelay.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Endpoint health and failover for one chain side. Hands out endpoints in rotation, skipping those cooling
 * down after a rate limit or upstream error, and carries the side's retry budget.
 * <p>
 * When every endpoint is cooling down the one that recovers first is returned, so callers always get an endpoint.
 */
@Slf4j
public class RpcEndpointRotator {

    static final long MIN_COOLDOWN_MS = 1_000L;

    private final String name;
    private final List<String> endpoints;
    private final RetryPolicy retryPolicy;
    private final LongSupplier clock;
    private final AtomicInteger cursor = new AtomicInteger();
    private final Map<String, Long> coolingDownUntilMs = new ConcurrentHashMap<>();

    public RpcEndpointRotator(String name, List<String> endpoints, RetryPolicy retryPolicy) {
        this(name, endpoints, retryPolicy, System::currentTimeMillis);
    }

    RpcEndpointRotator(String name, List<String> endpoints, RetryPolicy retryPolicy, LongSupplier clock) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException(name + ": at least one RPC endpoint required");
        }
        this.name = name;
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.clock = clock;
    }

    /**
     * Next endpoint that is not cooling down.
     */
    public String nextEndpoint() {
        long nowMs = clock.getAsLong();
        String soonest = null;
        long soonestUntil = Long.MAX_VALUE;
        for (int i = 0; i < endpoints.size(); i++) {
            String endpoint = endpoints.get(Math.floorMod(cursor.getAndIncrement(), endpoints.size()));
            long until = coolingDownUntilMs.getOrDefault(endpoint, 0L);
            if (until <= nowMs) {
                return endpoint;
            }
            if (until < soonestUntil) {
                soonest = endpoint;
                soonestUntil = until;
            }
        }
        log.debug("{}: all {} endpoints cooling down, using {} ({} ms left)",
                name, endpoints.size(), soonest, soonestUntil - nowMs);
        return soonest;
    }

    /**
     * Takes the endpoint out of rotation for at least {@code cooldownMs} (minimum one second). Ignored with a
     * single endpoint, since there is nothing to fail over to.
     */
    public void coolDown(String endpoint, long cooldownMs, String reason) {
        if (endpoints.size() < 2 || !endpoints.contains(endpoint)) {
            return;
        }
        long effectiveMs = Math.max(MIN_COOLDOWN_MS, cooldownMs);
        long nowMs = clock.getAsLong();
        Long previousUntil = coolingDownUntilMs.put(endpoint, nowMs + effectiveMs);
        if (previousUntil == null || previousUntil <= nowMs) {
            log.warn("{}: endpoint {} cooled down for {} ms due to {}", name, endpoint, effectiveMs, reason);
        }
    }

    public boolean isCoolingDown(String endpoint) {
        Long until = coolingDownUntilMs.get(endpoint);
        return until != null && until > clock.getAsLong();
    }

    /**
     * Delay in ms before retrying after the given attempt (0-based).
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
