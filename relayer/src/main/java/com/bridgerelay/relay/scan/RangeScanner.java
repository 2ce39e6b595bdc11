package com.bridgerelay.relay.scan;

import com.bridgerelay.domain.Checkpoint;
import com.bridgerelay.domain.DomainEvent;
import com.bridgerelay.domain.LogFilter;
import com.bridgerelay.domain.RawLog;
import com.bridgerelay.domain.ScanWindow;
import com.bridgerelay.relay.adapter.ChainClient;
import com.bridgerelay.relay.adapter.RpcException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Computes the next bounded block window behind the confirmed source tip and turns its raw logs into
 * {@link DomainEvent}s ordered by (block number, log index).
 */
@Slf4j
@RequiredArgsConstructor
public class RangeScanner {

    static final Comparator<DomainEvent> SCAN_ORDER = Comparator
            .comparingLong(DomainEvent::sourceBlockNumber)
            .thenComparingLong(DomainEvent::logIndex);

    private final ChainClient sourceClient;
    private final LogFilter logFilter;
    private final TokensLockedLogDecoder decoder;

    /**
     * Next window after the checkpoint, or empty when no confirmed block is left to scan.
     * The window starts at {@code lastScannedBlock + 1}, spans at most {@code maxWindowSize} blocks and
     * ends no later than {@code sourceTip - confirmationLag}.
     */
    public Optional<ScanWindow> nextWindow(Checkpoint checkpoint, long sourceTip, int maxWindowSize, long confirmationLag) {
        if (maxWindowSize < 1) {
            throw new IllegalArgumentException("maxWindowSize must be positive: " + maxWindowSize);
        }
        long confirmedTip = sourceTip - confirmationLag;
        long fromBlock = checkpoint.lastScannedBlock() + 1;
        if (confirmedTip < 0 || fromBlock > confirmedTip) {
            return Optional.empty();
        }
        long toBlock = Math.min(confirmedTip, fromBlock + maxWindowSize - 1);
        return Optional.of(new ScanWindow(fromBlock, toBlock));
    }

    /**
     * Events of the window in ascending (block number, log index) order. Logs that do not decode are dropped.
     *
     * @throws TransientFetchException if the source chain cannot be queried
     */
    public List<DomainEvent> scan(ScanWindow window) {
        List<RawLog> rawLogs;
        try {
            rawLogs = sourceClient.getLogs(window.fromBlock(), window.toBlock(), logFilter);
        } catch (RpcException e) {
            throw new TransientFetchException("Failed to fetch logs for window " + window + ": " + e.getMessage(), e);
        }
        List<DomainEvent> events = rawLogs.stream()
                .map(decoder::decode)
                .flatMap(Optional::stream)
                .filter(e -> e.sourceBlockNumber() >= window.fromBlock() && e.sourceBlockNumber() <= window.toBlock())
                .distinct()
                .sorted(SCAN_ORDER)
                .toList();
        if (!events.isEmpty()) {
            log.info("Found {} TokensLocked event(s) in blocks {} ({} raw logs)", events.size(), window, rawLogs.size());
        }
        return events;
    }
}
