package com.bridgerelay.relay.job;

import com.bridgerelay.domain.Checkpoint;
import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable state of the relay loop, owned by the loop thread and passed through every transition.
 * <p>
 * Pending keys were submitted in this process but are not yet durably committed (a commit failed).
 * They are never resubmitted and ride along with the next commit.
 */
@Getter
public class CycleContext {

    @Setter
    private RelayState state = RelayState.IDLE;
    @Setter
    private Checkpoint checkpoint;
    private final Set<String> pendingKeys = new LinkedHashSet<>();
    private int consecutiveFailures;
    private long cycles;

    public CycleContext(Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    /** Whether the key is durably recorded or pending commit. */
    public boolean isProcessed(String key) {
        return pendingKeys.contains(key) || checkpoint.processedIds().contains(key);
    }

    void addPending(String key) {
        pendingKeys.add(key);
    }

    void clearPending() {
        pendingKeys.clear();
    }

    public Set<String> getPendingKeys() {
        return Collections.unmodifiableSet(pendingKeys);
    }

    long nextCycle() {
        return ++cycles;
    }

    void recordFailure() {
        consecutiveFailures++;
    }

    void recordSuccess() {
        consecutiveFailures = 0;
    }
}
