package com.bridgerelay.domain;

/**
 * Acceptance handle returned by the destination chain.
 *
 * @param alreadyKnown true when the node reported the transaction as already in its pool
 */
public record SubmissionHandle(String transactionHash, boolean alreadyKnown) {
}
