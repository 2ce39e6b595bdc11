package com.bridgerelay.relay.action;

import com.bridgerelay.common.Hex;
import com.bridgerelay.domain.DomainEvent;
import com.bridgerelay.domain.IdempotencyKey;
import com.bridgerelay.domain.RelayAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionBuilderTest {

    private static final String USDT = "0xdac17f958d2ee523a2206206994597c13d831ec7";
    private static final String SENDER = "0x4444444444444444444444444444444444444444";
    private static final String RECIPIENT = "0x1111111111111111111111111111111111111111";

    private final ActionBuilder builder = new ActionBuilder(137L);

    @Test
    @DisplayName("event (tx=0xabc, logIndex=0, amount=100, USDT) -> action keyed by (chain, 0xabc, 0)")
    void build_mapsEventToMintAction() {
        DomainEvent event = event("0xabc", 0L, RECIPIENT, BigInteger.valueOf(100));

        RelayAction action = builder.build(event);

        assertThat(action.idempotencyKey()).isEqualTo(new IdempotencyKey(1L, "0xabc", 0L));
        assertThat(action.idempotencyKey().canonical()).isEqualTo("1:0xabc:0");
        assertThat(action.amount()).isEqualTo(BigInteger.valueOf(100));
        assertThat(action.recipient()).isEqualTo(RECIPIENT);
        assertThat(action.assetId()).isEqualTo(USDT);
        assertThat(action.destinationChainId()).isEqualTo(137L);
    }

    @Test
    void build_isDeterministic() {
        DomainEvent event = event("0xabc", 0L, RECIPIENT, BigInteger.valueOf(100));

        assertThat(builder.build(event)).isEqualTo(builder.build(event));
    }

    @Test
    void build_nonceHintIncreasesInScanOrder() {
        long a = builder.build(eventAt(100L, 7L)).nonceHint();
        long b = builder.build(eventAt(100L, 8L)).nonceHint();
        long c = builder.build(eventAt(101L, 0L)).nonceHint();

        assertThat(a).isLessThan(b);
        assertThat(b).isLessThan(c);
        assertThat(c).isEqualTo(101L << 20);
    }

    @Test
    void build_normalizesAddressCase() {
        DomainEvent event = event("0xabc", 0L, RECIPIENT.toUpperCase().replace("0X", "0x"), BigInteger.ONE);

        assertThat(builder.build(event).recipient()).isEqualTo(RECIPIENT);
    }

    @Test
    void build_nonPositiveAmount_isMalformed() {
        assertThatThrownBy(() -> builder.build(event("0xabc", 0L, RECIPIENT, BigInteger.ZERO)))
                .isInstanceOf(MalformedEventException.class)
                .hasMessageContaining("Amount");
        assertThatThrownBy(() -> builder.build(event("0xabc", 0L, RECIPIENT, BigInteger.valueOf(-1))))
                .isInstanceOf(MalformedEventException.class);
        assertThatThrownBy(() -> builder.build(event("0xabc", 0L, RECIPIENT, BigInteger.ONE.shiftLeft(256))))
                .isInstanceOf(MalformedEventException.class);
    }

    @Test
    void build_badAddresses_areMalformed() {
        assertThatThrownBy(() -> builder.build(event("0xabc", 0L, "0x1234", BigInteger.ONE)))
                .isInstanceOf(MalformedEventException.class)
                .hasMessageContaining("recipient");
        assertThatThrownBy(() -> builder.build(event("0xabc", 0L, Hex.ZERO_ADDRESS, BigInteger.ONE)))
                .isInstanceOf(MalformedEventException.class)
                .hasMessageContaining("zero address");
        DomainEvent badAsset = new DomainEvent(1L, 100L, "0xabc", 0L, SENDER, RECIPIENT, BigInteger.ONE, "USDT");
        assertThatThrownBy(() -> builder.build(badAsset))
                .isInstanceOf(MalformedEventException.class)
                .hasMessageContaining("asset");
    }

    @Test
    void build_badTxHashOrLogIndex_isMalformed() {
        assertThatThrownBy(() -> builder.build(event("abc", 0L, RECIPIENT, BigInteger.ONE)))
                .isInstanceOf(MalformedEventException.class);
        assertThatThrownBy(() -> builder.build(event("0xabc", 1L << 20, RECIPIENT, BigInteger.ONE)))
                .isInstanceOf(MalformedEventException.class)
                .hasMessageContaining("Log index");
    }

    private static DomainEvent event(String txHash, long logIndex, String recipient, BigInteger amount) {
        return new DomainEvent(1L, 100L, txHash, logIndex, SENDER, recipient, amount, USDT);
    }

    private static DomainEvent eventAt(long block, long logIndex) {
        return new DomainEvent(1L, block, "0xabc", logIndex, SENDER, RECIPIENT, BigInteger.ONE, USDT);
    }
}
