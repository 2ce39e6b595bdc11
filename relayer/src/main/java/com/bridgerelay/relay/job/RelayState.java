package com.bridgerelay.relay.job;

/**
 * States of one relay loop iteration. {@link #SHUTTING_DOWN} is reachable from any state on cancellation.
 */
public enum RelayState {
    IDLE,
    FETCH_TIP,
    COMPUTE_WINDOW,
    SCAN,
    BUILD_AND_SUBMIT,
    COMMIT,
    SLEEP,
    SHUTTING_DOWN
}
