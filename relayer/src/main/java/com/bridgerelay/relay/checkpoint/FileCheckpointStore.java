package com.bridgerelay.relay.checkpoint;

import com.bridgerelay.domain.Checkpoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collection;

/**
 * JSON checkpoint file replaced atomically: the new content is written to a temp file in the same directory,
 * forced to disk, then moved over the checkpoint with {@link StandardCopyOption#ATOMIC_MOVE}.
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    private final Path file;
    private final long chainId;
    private final int dedupCapacity;
    private final ObjectMapper objectMapper;

    private Checkpoint current;

    public FileCheckpointStore(Path file, long chainId, int dedupCapacity, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath();
        this.chainId = chainId;
        this.dedupCapacity = dedupCapacity;
        this.objectMapper = objectMapper;
        this.current = Checkpoint.zero(chainId);
    }

    @Override
    public Checkpoint load() {
        if (!Files.exists(file)) {
            log.warn("No checkpoint at {}; starting from the zero checkpoint", file);
            current = Checkpoint.zero(chainId);
            return current;
        }
        Checkpoint loaded;
        try {
            loaded = objectMapper.readValue(Files.readAllBytes(file), Checkpoint.class);
        } catch (IOException | RuntimeException e) {
            log.warn("Checkpoint at {} is unreadable ({}); starting from the zero checkpoint", file, e.getMessage());
            current = Checkpoint.zero(chainId);
            return current;
        }
        if (loaded == null) {
            log.warn("Checkpoint at {} is empty; starting from the zero checkpoint", file);
            current = Checkpoint.zero(chainId);
            return current;
        }
        if (loaded.chainId() != chainId) {
            throw new StorageException("Checkpoint " + file + " belongs to chain " + loaded.chainId()
                    + ", relayer is configured for chain " + chainId);
        }
        log.info("Loaded checkpoint from {}: lastScannedBlock={}, processedIds={}",
                file, loaded.lastScannedBlock(), loaded.processedIds().size());
        current = loaded;
        return current;
    }

    @Override
    public Checkpoint commit(long newLastScannedBlock, Collection<String> newlyProcessedIds) {
        Checkpoint next = current.advance(newLastScannedBlock, newlyProcessedIds, dedupCapacity);
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(next);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize checkpoint", e);
        }
        Path tmp = null;
        try {
            Files.createDirectories(file.getParent());
            tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(json);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            tmp = null;
        } catch (AtomicMoveNotSupportedException e) {
            throw new StorageException("Filesystem of " + file + " does not support atomic rename", e);
        } catch (IOException e) {
            throw new StorageException("Failed to write checkpoint " + file + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(tmp);
        }
        log.debug("Committed checkpoint lastScannedBlock={} (+{} ids) to {}",
                next.lastScannedBlock(), newlyProcessedIds.size(), file);
        current = next;
        return current;
    }

    @Override
    public Checkpoint current() {
        return current;
    }

    @Override
    public void verifyWritable() {
        Path dir = file.getParent();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create checkpoint directory " + dir, e);
        }
        if (!Files.isWritable(dir)) {
            throw new StorageException("Checkpoint directory " + dir + " is not writable");
        }
        if (Files.exists(file) && !Files.isWritable(file)) {
            throw new StorageException("Checkpoint file " + file + " is not writable");
        }
    }

    public Path getFile() {
        return file;
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete temporary checkpoint file {}: {}", tmp, e.getMessage());
        }
    }
}
