package com.bridgerelay.relay.scan;

import com.bridgerelay.common.Hex;
import com.bridgerelay.domain.DomainEvent;
import com.bridgerelay.domain.RawLog;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Decodes {@code TokensLocked(address indexed token, address indexed sender, address indexed recipient,
 * uint256 amount, uint256 destinationChainId)} logs emitted by the source bridge contract.
 * <p>
 * Anything that is not a well-formed TokensLocked log of the configured contract, addressed to the configured
 * destination chain, decodes to empty.
 */
@Slf4j
public class TokensLockedLogDecoder {

    /** keccak256("TokensLocked(address,address,address,uint256,uint256)"). */
    public static final String TOKENS_LOCKED_TOPIC = "0x0f7ae9891fe5b877ffdd33621970db3e5d162185914f1db43da2474c9fbc2948";

    private static final int DATA_HEX_LENGTH = 2 + 64 * 2;

    private final String bridgeContract;
    private final long sourceChainId;
    private final long destinationChainId;

    public TokensLockedLogDecoder(String bridgeContract, long sourceChainId, long destinationChainId) {
        this.bridgeContract = Hex.lower(bridgeContract);
        this.sourceChainId = sourceChainId;
        this.destinationChainId = destinationChainId;
    }

    public Optional<DomainEvent> decode(RawLog raw) {
        if (raw == null || raw.removed()) {
            return skip(raw, "removed by reorg");
        }
        if (bridgeContract != null && !bridgeContract.equals(Hex.lower(raw.address()))) {
            return skip(raw, "emitted by " + raw.address());
        }
        List<String> topics = raw.topics();
        if (topics.size() != 4 || !TOKENS_LOCKED_TOPIC.equalsIgnoreCase(topics.get(0))) {
            return skip(raw, "not a TokensLocked log");
        }
        String token = Hex.addressFromWord(topics.get(1));
        String sender = Hex.addressFromWord(topics.get(2));
        String recipient = Hex.addressFromWord(topics.get(3));
        if (token == null || sender == null || recipient == null) {
            return skip(raw, "malformed indexed address");
        }
        String data = raw.data();
        if (data == null || data.length() != DATA_HEX_LENGTH || !data.startsWith("0x")) {
            return skip(raw, "unexpected data length");
        }
        if (!Hex.isWord(raw.transactionHash())) {
            return skip(raw, "malformed transaction hash");
        }
        long blockNumber;
        long logIndex;
        BigInteger amount;
        BigInteger targetChain;
        try {
            blockNumber = Hex.parseQuantity(raw.blockNumber());
            logIndex = Hex.parseQuantity(raw.logIndex());
            amount = new BigInteger(data.substring(2, 66), 16);
            targetChain = new BigInteger(data.substring(66), 16);
        } catch (NumberFormatException e) {
            return skip(raw, "unparsable number: " + e.getMessage());
        }
        if (!targetChain.equals(BigInteger.valueOf(destinationChainId))) {
            return skip(raw, "destined for chain " + targetChain);
        }
        return Optional.of(new DomainEvent(
                sourceChainId,
                blockNumber,
                Hex.lower(raw.transactionHash()),
                logIndex,
                sender,
                recipient,
                amount,
                token
        ));
    }

    private static Optional<DomainEvent> skip(RawLog raw, String reason) {
        if (log.isDebugEnabled()) {
            log.debug("Ignoring log tx={} index={}: {}",
                    raw != null ? raw.transactionHash() : null, raw != null ? raw.logIndex() : null, reason);
        }
        return Optional.empty();
    }
}
