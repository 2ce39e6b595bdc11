package com.bridgerelay.relay.checkpoint;

import com.bridgerelay.domain.Checkpoint;

import java.util.Collection;

/**
 * Durable relay progress. The relay loop is the only writer.
 */
public interface CheckpointStore {

    /**
     * Read the persisted checkpoint. A missing or unreadable checkpoint yields {@link Checkpoint#zero(long)}.
     *
     * @throws StorageException if the persisted checkpoint belongs to another chain
     */
    Checkpoint load();

    /**
     * Atomically persist a new last scanned block together with newly processed idempotency keys.
     * Either the previous or the new checkpoint survives a crash, never a partial one.
     *
     * @return the checkpoint now on disk
     * @throws StorageException         if the write fails; the previous checkpoint stays in effect
     * @throws IllegalArgumentException if {@code newLastScannedBlock} is below the current one
     */
    Checkpoint commit(long newLastScannedBlock, Collection<String> newlyProcessedIds);

    /** Last loaded or committed checkpoint. */
    Checkpoint current();

    /**
     * Fail fast when the checkpoint location cannot be written.
     *
     * @throws StorageException if the directory cannot be created or written
     */
    void verifyWritable();
}
