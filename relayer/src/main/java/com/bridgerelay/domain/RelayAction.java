package com.bridgerelay.domain;

import java.math.BigInteger;

/**
 * Mint instruction for the destination chain, derived from exactly one {@link DomainEvent}.
 *
 * @param nonceHint ordering hint, strictly increasing in (block, logIndex) scan order
 */
public record RelayAction(
        long destinationChainId,
        String recipient,
        BigInteger amount,
        String assetId,
        IdempotencyKey idempotencyKey,
        long nonceHint
) {
}
