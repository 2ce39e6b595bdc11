package com.bridgerelay.domain;

import java.util.List;

/**
 * eth_getLogs filter: emitting contract and topic0 alternatives.
 */
public record LogFilter(String address, List<String> topics) {

    public LogFilter {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
