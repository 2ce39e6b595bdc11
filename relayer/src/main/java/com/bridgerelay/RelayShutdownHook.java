package com.bridgerelay;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.function.IntConsumer;

/**
 * JVM shutdown hook for SIGINT/SIGTERM: closes the context, which stops the relay loop after its in-flight
 * commit, then terminates with the context's exit code instead of the signal's 128+n status.
 */
@Slf4j
public class RelayShutdownHook implements Runnable {

    static final String THREAD_NAME = "relay-shutdown";

    private final ConfigurableApplicationContext context;
    private final IntConsumer terminator;

    RelayShutdownHook(ConfigurableApplicationContext context, IntConsumer terminator) {
        this.context = context;
        this.terminator = terminator;
    }

    /**
     * Registers the hook for a context started with {@link SpringApplication#setRegisterShutdownHook} off.
     */
    public static void install(ConfigurableApplicationContext context) {
        Runtime runtime = Runtime.getRuntime();
        runtime.addShutdownHook(new Thread(new RelayShutdownHook(context, runtime::halt), THREAD_NAME));
    }

    @Override
    public void run() {
        log.info("Shutdown requested, stopping relayer");
        int exitCode = SpringApplication.exit(context);
        log.info("Relayer stopped (exit code {})", exitCode);
        terminator.accept(exitCode);
    }
}
