package com.bridgerelay.relay.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Endpoints and bridge contracts of both chains. RPC URLs of one side are rotated round-robin.
 */
@ConfigurationProperties(prefix = "bridgerelay")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    private ChainEntry source = new ChainEntry();

    private ChainEntry destination = new ChainEntry();

    /**
     * One chain's id, JSON-RPC URLs and bridge contract address.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class ChainEntry {

        /** Human-readable name used in logs, e.g. "Ethereum". */
        private String name;
        private long chainId;
        private List<String> urls = new ArrayList<>();
        private String bridgeContract;

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }

        public String displayName() {
            return name != null && !name.isBlank() ? name : "chain-" + chainId;
        }
    }
}
