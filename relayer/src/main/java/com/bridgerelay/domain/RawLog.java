package com.bridgerelay.domain;

import java.util.List;

/**
 * Log entry as returned by eth_getLogs. Numeric fields keep their hex wire form; validation happens in the scanner.
 */
public record RawLog(
        String address,
        List<String> topics,
        String data,
        String blockNumber,
        String transactionHash,
        String logIndex,
        boolean removed
) {

    public RawLog {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
