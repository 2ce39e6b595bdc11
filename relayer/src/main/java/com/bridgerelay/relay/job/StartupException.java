package com.bridgerelay.relay.job;

/**
 * The relayer cannot start: a chain is unreachable or the configuration is unusable.
 */
public class StartupException extends RuntimeException {

    public StartupException(String message) {
        super(message);
    }

    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
