package com.bridgerelay.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Identity of one source log entry: (source chain id, source tx hash, log index).
 * The canonical form is what the checkpoint dedup set stores; the digest is passed on-chain as the mint replay guard.
 */
public record IdempotencyKey(long sourceChainId, String sourceTxHash, long logIndex) {

    public IdempotencyKey {
        if (sourceTxHash == null || sourceTxHash.isBlank()) {
            throw new IllegalArgumentException("sourceTxHash is required");
        }
        sourceTxHash = sourceTxHash.toLowerCase(Locale.ROOT);
    }

    public static IdempotencyKey of(DomainEvent event) {
        return new IdempotencyKey(event.sourceChainId(), event.sourceTxHash(), event.logIndex());
    }

    /** {@code chainId:txHash:logIndex}, e.g. {@code 1:0xabc:0}. */
    public String canonical() {
        return sourceChainId + ":" + sourceTxHash + ":" + logIndex;
    }

    /** SHA-256 of {@link #canonical()}; 32 bytes. */
    public byte[] digest() {
        try {
            return MessageDigest.getInstance("SHA-256").digest(canonical().getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return canonical();
    }
}
