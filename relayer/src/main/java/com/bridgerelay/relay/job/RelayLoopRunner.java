package com.bridgerelay.relay.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Future;

/**
 * Runs the {@link RelayOrchestrator} on the single-thread {@code relay-loop} executor for the lifetime of the
 * application context.
 * <p>
 * Startup checks run inside {@link #start()}, so an unreachable chain or unusable checkpoint fails context
 * refresh and the process exits non-zero. {@link #stop()} cancels the loop and shuts the executor down, which
 * waits up to its await-termination timeout for the in-flight commit.
 */
@Slf4j
public class RelayLoopRunner implements SmartLifecycle {

    private final RelayOrchestrator orchestrator;
    private final ThreadPoolTaskExecutor executor;

    private volatile boolean running;
    private volatile CancellationToken token;
    private volatile Future<?> loop;

    public RelayLoopRunner(RelayOrchestrator orchestrator, ThreadPoolTaskExecutor executor) {
        this.orchestrator = orchestrator;
        this.executor = executor;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        CycleContext ctx = orchestrator.initialize();
        CancellationToken newToken = new CancellationToken();
        token = newToken;
        loop = executor.submitCompletable(() -> orchestrator.run(ctx, newToken))
                .whenComplete((ignored, e) -> {
                    if (e != null) {
                        log.error("Relay loop terminated unexpectedly", e);
                    }
                });
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping relay loop");
        token.cancel();
        executor.shutdown();
        if (!loop.isDone()) {
            log.warn("Relay loop did not finish within the shutdown timeout; last commit may be pending");
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    boolean isLoopAlive() {
        Future<?> current = loop;
        return current != null && !current.isDone();
    }
}
