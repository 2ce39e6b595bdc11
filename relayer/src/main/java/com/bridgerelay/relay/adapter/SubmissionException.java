package com.bridgerelay.relay.adapter;

/**
 * Signing or submitting a relay action failed. Retryable unless it is a {@link SubmissionRejectedException}.
 */
public class SubmissionException extends RuntimeException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
