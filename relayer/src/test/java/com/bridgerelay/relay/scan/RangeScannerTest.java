package com.bridgerelay.relay.scan;

import com.bridgerelay.domain.Checkpoint;
import com.bridgerelay.domain.DomainEvent;
import com.bridgerelay.domain.LogFilter;
import com.bridgerelay.domain.RawLog;
import com.bridgerelay.domain.ScanWindow;
import com.bridgerelay.relay.adapter.ChainClient;
import com.bridgerelay.relay.adapter.RpcException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static com.bridgerelay.relay.scan.TokensLockedLogs.lockLog;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RangeScannerTest {

    private static final LogFilter FILTER = new LogFilter(TokensLockedLogs.BRIDGE,
            List.of(TokensLockedLogDecoder.TOKENS_LOCKED_TOPIC));

    @Mock
    private ChainClient sourceClient;

    private RangeScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new RangeScanner(sourceClient, FILTER, TokensLockedLogs.decoder());
    }

    @Test
    @DisplayName("checkpoint 100, tip 150, lag 12, window 100 -> [101, 138]")
    void nextWindow_stopsAtConfirmedTip() {
        Optional<ScanWindow> window = scanner.nextWindow(new Checkpoint(1L, 100L, List.of()), 150L, 100, 12L);

        assertThat(window).contains(new ScanWindow(101L, 138L));
    }

    @Test
    void nextWindow_boundedByMaxWindowSize() {
        Optional<ScanWindow> window = scanner.nextWindow(new Checkpoint(1L, 100L, List.of()), 10_000L, 100, 12L);

        assertThat(window).contains(new ScanWindow(101L, 200L));
        assertThat(window.get().size()).isEqualTo(100L);
    }

    @Test
    void nextWindow_noConfirmedWork_isEmpty() {
        Checkpoint cp = new Checkpoint(1L, 138L, List.of());

        assertThat(scanner.nextWindow(cp, 150L, 100, 12L)).isEmpty();
        assertThat(scanner.nextWindow(cp, 140L, 100, 12L)).isEmpty();
        assertThat(scanner.nextWindow(Checkpoint.zero(1L), 5L, 100, 12L)).as("tip below lag").isEmpty();
    }

    @Test
    void nextWindow_singleBlockWindow() {
        assertThat(scanner.nextWindow(new Checkpoint(1L, 138L, List.of()), 151L, 100, 12L))
                .contains(new ScanWindow(139L, 139L));
    }

    @Test
    void nextWindow_invalidWindowSize_throws() {
        assertThatThrownBy(() -> scanner.nextWindow(Checkpoint.zero(1L), 100L, 0, 12L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scan_returnsEventsSortedByBlockAndLogIndex() {
        List<RawLog> logs = new ArrayList<>(List.of(
                lockLog(101L, 1, 0L), lockLog(101L, 1, 5L), lockLog(102L, 2, 1L),
                lockLog(110L, 3, 0L), lockLog(110L, 4, 2L), lockLog(137L, 5, 9L)));
        Collections.shuffle(logs, new Random(42));
        when(sourceClient.getLogs(101L, 138L, FILTER)).thenReturn(logs);

        List<DomainEvent> events = scanner.scan(new ScanWindow(101L, 138L));

        assertThat(events).extracting(DomainEvent::sourceBlockNumber).containsExactly(101L, 101L, 102L, 110L, 110L, 137L);
        assertThat(events).extracting(DomainEvent::logIndex).containsExactly(0L, 5L, 1L, 0L, 2L, 9L);
    }

    @Test
    void scan_dropsUndecodableAndDuplicateLogs() {
        RawLog good = lockLog(101L, 1, 0L);
        RawLog removed = new RawLog(good.address(), good.topics(), good.data(), good.blockNumber(),
                TokensLockedLogs.txHash(2), "0x1", true);
        RawLog outsideWindow = lockLog(500L, 3, 0L);
        when(sourceClient.getLogs(eq(101L), eq(138L), any())).thenReturn(List.of(good, removed, good, outsideWindow));

        List<DomainEvent> events = scanner.scan(new ScanWindow(101L, 138L));

        assertThat(events).hasSize(1);
        assertThat(events.get(0).sourceTxHash()).isEqualTo(TokensLockedLogs.txHash(1));
    }

    @Test
    void scan_transportFailure_throwsTransientFetchException() {
        when(sourceClient.getLogs(anyLong(), anyLong(), any())).thenThrow(new RpcException("connection refused"));

        assertThatThrownBy(() -> scanner.scan(new ScanWindow(101L, 138L)))
                .isInstanceOf(TransientFetchException.class)
                .hasMessageContaining("[101, 138]")
                .hasCauseInstanceOf(RpcException.class);
    }
}
