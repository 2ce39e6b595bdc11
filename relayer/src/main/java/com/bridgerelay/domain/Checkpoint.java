package com.bridgerelay.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Durable relay progress for one source chain: the highest fully-resolved block and a bounded,
 * insertion-ordered set of idempotency keys already processed.
 * <p>
 * Persisted as JSON by {@code FileCheckpointStore}: {@code {chainId, lastScannedBlock, processedIds[]}}.
 */
public record Checkpoint(long chainId, long lastScannedBlock, List<String> processedIds) {

    public Checkpoint {
        if (lastScannedBlock < 0) {
            throw new IllegalArgumentException("lastScannedBlock must not be negative: " + lastScannedBlock);
        }
        processedIds = processedIds == null ? List.of() : List.copyOf(processedIds);
    }

    /** Checkpoint of a relayer that has never committed anything. */
    public static Checkpoint zero(long chainId) {
        return new Checkpoint(chainId, 0L, List.of());
    }

    @JsonIgnore
    public boolean isZero() {
        return lastScannedBlock == 0L && processedIds.isEmpty();
    }

    /**
     * Next checkpoint after a commit. Newly processed ids are appended in order; when the set exceeds
     * {@code capacity}, the oldest-inserted ids are evicted first.
     */
    public Checkpoint advance(long newLastScannedBlock, Collection<String> newlyProcessedIds, int capacity) {
        if (newLastScannedBlock < lastScannedBlock) {
            throw new IllegalArgumentException("Checkpoint cannot move backwards: "
                    + lastScannedBlock + " -> " + newLastScannedBlock);
        }
        LinkedHashSet<String> ids = new LinkedHashSet<>(processedIds);
        for (String id : newlyProcessedIds) {
            ids.remove(id);
            ids.add(id);
        }
        int overflow = ids.size() - Math.max(0, capacity);
        Iterator<String> it = ids.iterator();
        while (overflow-- > 0 && it.hasNext()) {
            it.next();
            it.remove();
        }
        return new Checkpoint(chainId, newLastScannedBlock, new ArrayList<>(ids));
    }
}
