package com.bridgerelay.relay.action;

/**
 * Event failed validation and cannot be turned into a relay action. It is skipped permanently.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }
}
