package com.bridgerelay.relay.checkpoint;

/**
 * Checkpoint read or write failed. Fatal at startup; at runtime the cycle fails and the checkpoint is left unchanged.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
