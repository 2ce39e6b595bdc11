package com.bridgerelay.domain;

/**
 * Inclusive block range scanned in one relay cycle.
 */
public record ScanWindow(long fromBlock, long toBlock) {

    public ScanWindow {
        if (fromBlock < 0 || toBlock < fromBlock) {
            throw new IllegalArgumentException("Invalid scan window [" + fromBlock + ", " + toBlock + "]");
        }
    }

    public long size() {
        return toBlock - fromBlock + 1;
    }

    @Override
    public String toString() {
        return "[" + fromBlock + ", " + toBlock + "]";
    }
}
