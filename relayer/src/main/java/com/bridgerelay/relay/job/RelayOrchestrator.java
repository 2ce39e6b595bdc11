package com.bridgerelay.relay.job;

import com.bridgerelay.common.Hex;
import com.bridgerelay.common.RetryPolicy;
import com.bridgerelay.domain.Checkpoint;
import com.bridgerelay.domain.DomainEvent;
import com.bridgerelay.domain.RelayAction;
import com.bridgerelay.domain.ScanWindow;
import com.bridgerelay.domain.SignedAction;
import com.bridgerelay.domain.SubmissionHandle;
import com.bridgerelay.relay.action.ActionBuilder;
import com.bridgerelay.relay.action.MalformedEventException;
import com.bridgerelay.relay.adapter.ChainClient;
import com.bridgerelay.relay.adapter.RpcException;
import com.bridgerelay.relay.adapter.SubmissionException;
import com.bridgerelay.relay.adapter.SubmissionRejectedException;
import com.bridgerelay.relay.checkpoint.CheckpointStore;
import com.bridgerelay.relay.checkpoint.StorageException;
import com.bridgerelay.relay.config.RelayerProperties;
import com.bridgerelay.relay.scan.RangeScanner;
import com.bridgerelay.relay.scan.TransientFetchException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The relay control loop: fetch the source tip, scan the next confirmed window, mint every new event on the
 * destination chain in (block, logIndex) order, then commit progress.
 * <p>
 * The checkpoint only advances over blocks whose events are all submitted or intentionally skipped. A retryable
 * submission failure stops the window and the checkpoint stops just before the failing event's block.
 */
@Slf4j
public class RelayOrchestrator {

    private static final double BACKOFF_JITTER = 0.2;

    private final ChainClient sourceClient;
    private final ChainClient destinationClient;
    private final CheckpointStore checkpointStore;
    private final RangeScanner rangeScanner;
    private final ActionBuilder actionBuilder;
    private final RelayerProperties properties;
    private final RetryPolicy backoffPolicy;

    public RelayOrchestrator(ChainClient sourceClient,
                             ChainClient destinationClient,
                             CheckpointStore checkpointStore,
                             RangeScanner rangeScanner,
                             ActionBuilder actionBuilder,
                             RelayerProperties properties) {
        this.sourceClient = sourceClient;
        this.destinationClient = destinationClient;
        this.checkpointStore = checkpointStore;
        this.rangeScanner = rangeScanner;
        this.actionBuilder = actionBuilder;
        this.properties = properties;
        this.backoffPolicy = new RetryPolicy(
                properties.getPollingInterval().toMillis(),
                BACKOFF_JITTER,
                Integer.MAX_VALUE,
                Math.max(properties.getPollingInterval().toMillis(), properties.getMaxBackoff().toMillis()));
    }

    /**
     * Startup checks: both chains reachable, checkpoint storage usable, signing account well-formed.
     * A fresh deployment gets its start position committed here.
     *
     * @throws StartupException if a chain cannot be reached or the signing account is invalid
     * @throws StorageException if the checkpoint cannot be read or written
     */
    public CycleContext initialize() {
        if (!Hex.isAddress(properties.getSigningAccount())) {
            throw new StartupException("Signing account is not a 20-byte hex address: " + properties.getSigningAccount());
        }
        long sourceTip = probe(sourceClient, "source");
        probe(destinationClient, "destination");

        checkpointStore.verifyWritable();
        Checkpoint checkpoint = checkpointStore.load();
        if (checkpoint.isZero()) {
            long start = resolveStartPosition(sourceTip);
            if (start > 0) {
                checkpoint = checkpointStore.commit(start, List.of());
            }
            log.info("No checkpoint for chain {}, starting after block {} (start-block={})",
                    sourceClient.chainId(), start, properties.getStartBlock());
        } else {
            log.info("Resuming chain {} after block {} ({} processed ids)",
                    checkpoint.chainId(), checkpoint.lastScannedBlock(), checkpoint.processedIds().size());
        }
        return new CycleContext(checkpoint);
    }

    /**
     * Last scanned block for a fresh deployment. {@code latest} means the current confirmed tip, so only
     * events locked after startup are relayed. A number N means scanning starts at N (block 0 is never scanned).
     */
    long resolveStartPosition(long sourceTip) {
        String startBlock = properties.getStartBlock();
        if (startBlock == null || RelayerProperties.LATEST.equalsIgnoreCase(startBlock)) {
            return Math.max(0, sourceTip - properties.getConfirmationLag());
        }
        long first = Long.parseLong(startBlock);
        return Math.max(0, first - 1);
    }

    private static long probe(ChainClient client, String side) {
        try {
            long tip = client.getTipHeight();
            log.info("Connected to {} chain {} at block {}", side, client.chainId(), tip);
            return tip;
        } catch (RpcException e) {
            throw new StartupException("Cannot reach " + side + " chain " + client.chainId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Run cycles until cancelled. Never throws: every cycle failure is logged and backed off.
     */
    public void run(CycleContext ctx, CancellationToken token) {
        log.info("Relay loop started (window={}, lag={}, interval={})",
                properties.getMaxWindowSize(), properties.getConfirmationLag(), properties.getPollingInterval());
        while (!token.isCancelled()) {
            try {
                CycleReport report = runCycle(ctx, token);
                if (report.failed() || report.submitted() > 0 || report.rejected() > 0) {
                    log.info("Relay {}", report);
                } else {
                    log.debug("Relay {}", report);
                }
            } catch (RuntimeException e) {
                ctx.recordFailure();
                log.error("Relay cycle failed unexpectedly", e);
            }
            if (token.isCancelled()) {
                break;
            }
            ctx.setState(RelayState.SLEEP);
            if (token.sleep(sleepDuration(ctx))) {
                break;
            }
            ctx.setState(RelayState.IDLE);
        }
        ctx.setState(RelayState.SHUTTING_DOWN);
        log.info("Relay loop stopped at block {} ({} cycles)", ctx.getCheckpoint().lastScannedBlock(), ctx.getCycles());
    }

    /**
     * Polling interval after a clean cycle; exponential back-off after consecutive failed ones.
     */
    Duration sleepDuration(CycleContext ctx) {
        int failures = ctx.getConsecutiveFailures();
        if (failures == 0) {
            return properties.getPollingInterval();
        }
        return Duration.ofMillis(backoffPolicy.delayMs(failures - 1));
    }

    /** One iteration without external cancellation. */
    public CycleReport runCycle(CycleContext ctx) {
        return runCycle(ctx, new CancellationToken());
    }

    /**
     * One iteration, from FETCH_TIP to the point where the loop would sleep. The report's final state is
     * {@link RelayState#SLEEP} or {@link RelayState#SHUTTING_DOWN}.
     */
    public CycleReport runCycle(CycleContext ctx, CancellationToken token) {
        CycleRun run = new CycleRun(ctx.nextCycle());

        if (enter(ctx, RelayState.FETCH_TIP, token)) {
            return run.finish(ctx, RelayState.SHUTTING_DOWN);
        }
        long sourceTip;
        try {
            sourceTip = sourceClient.getTipHeight();
        } catch (RpcException e) {
            log.warn("Failed to fetch source tip: {}", e.getMessage());
            return run.fail(ctx);
        }

        if (enter(ctx, RelayState.COMPUTE_WINDOW, token)) {
            return run.finish(ctx, RelayState.SHUTTING_DOWN);
        }
        Optional<ScanWindow> window = rangeScanner.nextWindow(
                ctx.getCheckpoint(), sourceTip, properties.getMaxWindowSize(), properties.getConfirmationLag());
        if (window.isEmpty()) {
            log.debug("No confirmed blocks to scan (tip={}, lastScanned={})", sourceTip, ctx.getCheckpoint().lastScannedBlock());
            if (!ctx.getPendingKeys().isEmpty()) {
                commit(ctx, run, ctx.getCheckpoint().lastScannedBlock());
            }
            return run.finish(ctx, RelayState.SLEEP);
        }
        run.window = window.get();

        if (enter(ctx, RelayState.SCAN, token)) {
            return run.finish(ctx, RelayState.SHUTTING_DOWN);
        }
        List<DomainEvent> events;
        try {
            events = rangeScanner.scan(run.window);
        } catch (TransientFetchException e) {
            log.warn("Scan of blocks {} failed: {}", run.window, e.getMessage());
            return run.fail(ctx);
        }

        ctx.setState(RelayState.BUILD_AND_SUBMIT);
        long resolvedThrough = submitAll(ctx, run, events, token);

        // never skip the commit once work has been submitted, even when cancelled
        ctx.setState(RelayState.COMMIT);
        commit(ctx, run, resolvedThrough);

        return run.finish(ctx, token.isCancelled() ? RelayState.SHUTTING_DOWN : RelayState.SLEEP);
    }

    /**
     * Submits events in order. Returns the last block whose events are all resolved.
     */
    private long submitAll(CycleContext ctx, CycleRun run, List<DomainEvent> events, CancellationToken token) {
        for (DomainEvent event : events) {
            if (token.isCancelled()) {
                log.info("Cancelled before event {}:{}, committing submitted work", event.sourceTxHash(), event.logIndex());
                return event.sourceBlockNumber() - 1;
            }
            RelayAction action;
            try {
                action = actionBuilder.build(event);
            } catch (MalformedEventException e) {
                run.malformed++;
                log.warn("Skipping malformed event {}:{} in block {}: {}",
                        event.sourceTxHash(), event.logIndex(), event.sourceBlockNumber(), e.getMessage());
                continue;
            }
            String key = action.idempotencyKey().canonical();
            if (ctx.isProcessed(key)) {
                run.skipped++;
                log.debug("Event {} already processed, skipping", key);
                continue;
            }
            try {
                SignedAction signed = destinationClient.sign(action, properties.getSigningAccount());
                SubmissionHandle handle = destinationClient.submit(signed);
                ctx.addPending(key);
                run.submitted++;
                log.info("Relayed {} of {} to {} (tx={}{})", action.amount(), action.assetId(), action.recipient(),
                        handle.transactionHash(), handle.alreadyKnown() ? ", already known" : "");
            } catch (SubmissionRejectedException e) {
                ctx.addPending(key);
                run.rejected++;
                log.error("Destination permanently rejected event {}, not retrying: {}", key, e.getMessage());
            } catch (SubmissionException e) {
                run.failed = true;
                log.warn("Submission of event {} failed, retrying from block {} next cycle: {}",
                        key, event.sourceBlockNumber(), e.getMessage());
                return event.sourceBlockNumber() - 1;
            }
        }
        return run.window.toBlock();
    }

    private void commit(CycleContext ctx, CycleRun run, long resolvedThrough) {
        Checkpoint current = ctx.getCheckpoint();
        long newLast = Math.max(current.lastScannedBlock(), resolvedThrough);
        if (newLast == current.lastScannedBlock() && ctx.getPendingKeys().isEmpty()) {
            return;
        }
        try {
            Checkpoint committed = checkpointStore.commit(newLast, List.copyOf(ctx.getPendingKeys()));
            ctx.setCheckpoint(committed);
            ctx.clearPending();
        } catch (StorageException e) {
            run.failed = true;
            log.error("Checkpoint commit to block {} failed, keeping {} submitted key(s) in memory: {}",
                    newLast, ctx.getPendingKeys().size(), e.getMessage());
        }
    }

    private static boolean enter(CycleContext ctx, RelayState state, CancellationToken token) {
        if (token.isCancelled()) {
            return true;
        }
        ctx.setState(state);
        return false;
    }

    private static final class CycleRun {
        private final long cycle;
        private ScanWindow window;
        private int submitted;
        private int skipped;
        private int malformed;
        private int rejected;
        private boolean failed;

        private CycleRun(long cycle) {
            this.cycle = cycle;
        }

        private CycleReport fail(CycleContext ctx) {
            failed = true;
            return finish(ctx, RelayState.SLEEP);
        }

        private CycleReport finish(CycleContext ctx, RelayState finalState) {
            if (failed) {
                ctx.recordFailure();
            } else {
                ctx.recordSuccess();
            }
            ctx.setState(finalState);
            return new CycleReport(cycle, finalState, window, submitted, skipped, malformed, rejected,
                    ctx.getCheckpoint().lastScannedBlock(), failed);
        }
    }
}
