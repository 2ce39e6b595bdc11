package com.bridgerelay.relay.scan;

import com.bridgerelay.domain.DomainEvent;
import com.bridgerelay.domain.RawLog;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static com.bridgerelay.relay.scan.TokensLockedLogs.BRIDGE;
import static com.bridgerelay.relay.scan.TokensLockedLogs.RECIPIENT;
import static com.bridgerelay.relay.scan.TokensLockedLogs.SENDER;
import static com.bridgerelay.relay.scan.TokensLockedLogs.TOKEN;
import static com.bridgerelay.relay.scan.TokensLockedLogs.lockLog;
import static com.bridgerelay.relay.scan.TokensLockedLogs.txHash;
import static org.assertj.core.api.Assertions.assertThat;

class TokensLockedLogDecoderTest {

    private final TokensLockedLogDecoder decoder = TokensLockedLogs.decoder();

    @Test
    void decode_wellFormedLog_yieldsNormalizedEvent() {
        RawLog raw = lockLog(101L, txHash(0xABC).toUpperCase().replace("0X", "0x"), 3L, RECIPIENT,
                new BigInteger("1000000000000000000000"), 137L);

        Optional<DomainEvent> event = decoder.decode(raw);

        assertThat(event).isPresent();
        DomainEvent e = event.get();
        assertThat(e.sourceChainId()).isEqualTo(1L);
        assertThat(e.sourceBlockNumber()).isEqualTo(101L);
        assertThat(e.sourceTxHash()).isEqualTo(txHash(0xabc));
        assertThat(e.logIndex()).isEqualTo(3L);
        assertThat(e.sender()).isEqualTo(SENDER);
        assertThat(e.recipient()).isEqualTo(RECIPIENT);
        assertThat(e.assetId()).isEqualTo(TOKEN);
        assertThat(e.amount()).isEqualTo(new BigInteger("1000000000000000000000"));
    }

    @Test
    void decode_removedLog_isDropped() {
        RawLog raw = lockLog(101L, 1, 0L);
        RawLog removed = new RawLog(raw.address(), raw.topics(), raw.data(), raw.blockNumber(),
                raw.transactionHash(), raw.logIndex(), true);

        assertThat(decoder.decode(removed)).isEmpty();
    }

    @Test
    void decode_otherContract_isDropped() {
        RawLog raw = lockLog(101L, 1, 0L);
        RawLog foreign = new RawLog("0x9999999999999999999999999999999999999999", raw.topics(), raw.data(),
                raw.blockNumber(), raw.transactionHash(), raw.logIndex(), false);

        assertThat(decoder.decode(foreign)).isEmpty();
    }

    @Test
    void decode_contractAddressComparedCaseInsensitively() {
        RawLog raw = lockLog(101L, 1, 0L);
        RawLog upper = new RawLog(BRIDGE.toUpperCase().replace("0X", "0x"), raw.topics(), raw.data(),
                raw.blockNumber(), raw.transactionHash(), raw.logIndex(), false);

        assertThat(decoder.decode(upper)).isPresent();
    }

    @Test
    void decode_wrongTopicOrTopicCount_isDropped() {
        RawLog raw = lockLog(101L, 1, 0L);
        RawLog transfer = new RawLog(raw.address(),
                List.of("0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef",
                        raw.topics().get(1), raw.topics().get(2), raw.topics().get(3)),
                raw.data(), raw.blockNumber(), raw.transactionHash(), raw.logIndex(), false);
        RawLog short3 = new RawLog(raw.address(), raw.topics().subList(0, 3), raw.data(),
                raw.blockNumber(), raw.transactionHash(), raw.logIndex(), false);

        assertThat(decoder.decode(transfer)).isEmpty();
        assertThat(decoder.decode(short3)).isEmpty();
    }

    @Test
    void decode_malformedFields_areDropped() {
        RawLog raw = lockLog(101L, 1, 0L);
        RawLog shortData = new RawLog(raw.address(), raw.topics(), raw.data().substring(0, 66),
                raw.blockNumber(), raw.transactionHash(), raw.logIndex(), false);
        RawLog badBlock = new RawLog(raw.address(), raw.topics(), raw.data(),
                "pending", raw.transactionHash(), raw.logIndex(), false);
        RawLog badHash = new RawLog(raw.address(), raw.topics(), raw.data(),
                raw.blockNumber(), "0x1234", raw.logIndex(), false);
        RawLog dirtyTopic = new RawLog(raw.address(),
                List.of(raw.topics().get(0), "0xff" + raw.topics().get(1).substring(4), raw.topics().get(2), raw.topics().get(3)),
                raw.data(), raw.blockNumber(), raw.transactionHash(), raw.logIndex(), false);

        assertThat(decoder.decode(shortData)).isEmpty();
        assertThat(decoder.decode(badBlock)).isEmpty();
        assertThat(decoder.decode(badHash)).isEmpty();
        assertThat(decoder.decode(dirtyTopic)).isEmpty();
        assertThat(decoder.decode(null)).isEmpty();
    }

    @Test
    void decode_otherDestinationChain_isDropped() {
        RawLog raw = lockLog(101L, txHash(1), 0L, RECIPIENT, BigInteger.TEN, 56L);

        assertThat(decoder.decode(raw)).isEmpty();
    }
}
