package com.bridgerelay.relay.action;

import com.bridgerelay.common.Hex;
import com.bridgerelay.domain.DomainEvent;
import com.bridgerelay.domain.IdempotencyKey;
import com.bridgerelay.domain.RelayAction;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Maps a source {@link DomainEvent} to the destination mint instruction. Pure: the same event always yields an
 * equal action.
 */
public class ActionBuilder {

    /** Bits of the nonce hint reserved for the log index. */
    static final int LOG_INDEX_BITS = 20;

    private static final long MAX_LOG_INDEX = (1L << LOG_INDEX_BITS) - 1;
    private static final long MAX_BLOCK = Long.MAX_VALUE >> LOG_INDEX_BITS;
    private static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
    private static final Pattern TX_HASH = Pattern.compile("^0x[0-9a-fA-F]{1,64}$");

    private final long destinationChainId;

    public ActionBuilder(long destinationChainId) {
        this.destinationChainId = destinationChainId;
    }

    /**
     * @throws MalformedEventException if the event carries an invalid amount, address, hash or position
     */
    public RelayAction build(DomainEvent event) {
        validate(event);
        long nonceHint = (event.sourceBlockNumber() << LOG_INDEX_BITS) | event.logIndex();
        return new RelayAction(
                destinationChainId,
                Hex.lower(event.recipient()),
                event.amount(),
                Hex.lower(event.assetId()),
                IdempotencyKey.of(event),
                nonceHint
        );
    }

    private static void validate(DomainEvent event) {
        BigInteger amount = event.amount();
        if (amount == null || amount.signum() <= 0 || amount.compareTo(MAX_UINT256) > 0) {
            throw new MalformedEventException("Amount out of range: " + amount);
        }
        requireAddress("recipient", event.recipient());
        requireAddress("sender", event.sender());
        requireAddress("asset", event.assetId());
        if (Hex.ZERO_ADDRESS.equalsIgnoreCase(event.recipient())) {
            throw new MalformedEventException("Recipient is the zero address");
        }
        if (event.sourceTxHash() == null || !TX_HASH.matcher(event.sourceTxHash()).matches()) {
            throw new MalformedEventException("Malformed source tx hash: " + event.sourceTxHash());
        }
        if (event.logIndex() < 0 || event.logIndex() > MAX_LOG_INDEX) {
            throw new MalformedEventException("Log index out of range: " + event.logIndex());
        }
        if (event.sourceBlockNumber() < 0 || event.sourceBlockNumber() > MAX_BLOCK) {
            throw new MalformedEventException("Block number out of range: " + event.sourceBlockNumber());
        }
    }

    private static void requireAddress(String field, String value) {
        if (!Hex.isAddress(value)) {
            throw new MalformedEventException("Malformed " + field + " address: " + value);
        }
    }
}
