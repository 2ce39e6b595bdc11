package com.bridgerelay.domain;

import java.math.BigInteger;

/**
 * A normalized TokensLocked event from the source chain. Addresses and hashes are lower-case hex.
 */
public record DomainEvent(
        long sourceChainId,
        long sourceBlockNumber,
        String sourceTxHash,
        long logIndex,
        String sender,
        String recipient,
        BigInteger amount,
        String assetId
) {

    public IdempotencyKey idempotencyKey() {
        return IdempotencyKey.of(this);
    }
}
