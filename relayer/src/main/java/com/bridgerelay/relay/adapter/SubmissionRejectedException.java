package com.bridgerelay.relay.adapter;

/**
 * The destination chain rejected the action for good (e.g. execution reverted). Resubmitting will not help.
 */
public class SubmissionRejectedException extends SubmissionException {

    public SubmissionRejectedException(String message) {
        super(message);
    }

    public SubmissionRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
