package com.bridgerelay.domain;

/**
 * A relay action signed for submission.
 *
 * @param rawTransaction RLP-encoded signed transaction, 0x-prefixed
 * @param transactionHash hash reported by the signer; may be null when the signer returns only the raw form
 */
public record SignedAction(RelayAction action, String rawTransaction, String transactionHash) {
}
