package com.bridgerelay.relay.scan;

/**
 * Tip or log query failed at the transport level. The relay loop retries on its next cycle.
 */
public class TransientFetchException extends RuntimeException {

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
