package com.bridgerelay.relay.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Relay loop settings: window size, confirmation lag, polling cadence and checkpoint location.
 */
@ConfigurationProperties(prefix = "bridgerelay.relayer")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class RelayerProperties {

    public static final String LATEST = "latest";

    /** Relayer account used to sign mint transactions (held by the node or remote signer). */
    @NotBlank
    private String signingAccount;

    /** Max blocks per scan window. */
    @Min(1)
    private int maxWindowSize = 100;

    /** Blocks to stay behind the source tip. */
    @PositiveOrZero
    private long confirmationLag = 12;

    @NotNull
    private Duration pollingInterval = Duration.ofSeconds(30);

    /** Ceiling for the back-off after consecutive failed cycles. */
    @NotNull
    private Duration maxBackoff = Duration.ofMinutes(5);

    /** First block to scan when no checkpoint exists: a block number or "latest" (confirmed tip). */
    @NotBlank
    @Pattern(regexp = "latest|\\d+")
    private String startBlock = LATEST;

    @NotBlank
    private String checkpointFile = "relayer_state.json";

    /** Number of processed idempotency keys kept in the checkpoint. */
    @Min(1)
    private int dedupCapacity = 10_000;

    @Min(21_000)
    private long gasLimit = 2_000_000;

    /** How long shutdown waits for the loop to finish its current commit. */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(60);
}
