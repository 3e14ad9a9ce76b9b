/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.walkv.store;

import dev.mars.walkv.wal.Bytes;
import dev.mars.walkv.wal.FileWriteAheadLog;
import dev.mars.walkv.wal.LogEntry;
import dev.mars.walkv.wal.StorageException;
import dev.mars.walkv.wal.WalConfig;
import dev.mars.walkv.wal.WalWriteException;
import dev.mars.walkv.wal.WriteAheadLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory key-value map made durable by a {@link WriteAheadLog}.
 * <p>
 * <b>Usage Pattern (Log → Apply):</b>
 * <pre>{@code
 * KeyValueStore store = KeyValueStore.open(config);
 * store.recover();                 // rebuild the map from the log, once
 * store.put(key, value);           // durable when this returns
 * store.get(key);                  // never touches the log
 * store.close();
 * }</pre>
 * <p>
 * <b>Thread Safety:</b>
 * {@code put}, {@code delete}, {@code checkpoint} and {@code recover} hold one
 * exclusive lock around "append to log, then apply to map", so log order, apply
 * order and the order readers observe are the same. {@code get} and {@code keys}
 * take no lock; each map update is a single atomic step, so a reader never sees a
 * half-applied entry.
 * <p>
 * <b>Failure:</b>
 * If the log append throws, the exception propagates unchanged and the map is not
 * touched. The map is never ahead of the durable log.
 */
public final class KeyValueStore implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(KeyValueStore.class);

    private final WriteAheadLog wal;
    private final boolean rotateOnCheckpoint;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile ConcurrentHashMap<Bytes, Bytes> data = new ConcurrentHashMap<>();
    private volatile boolean recovered = false;

    /**
     * Creates a store over an already opened log.
     *
     * @param wal                the log this store takes ownership of
     * @param rotateOnCheckpoint whether {@link #checkpoint()} starts a new segment
     */
    public KeyValueStore(WriteAheadLog wal, boolean rotateOnCheckpoint) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.rotateOnCheckpoint = rotateOnCheckpoint;
    }

    /**
     * Opens a {@link FileWriteAheadLog} in the configured directory and wraps it.
     * The returned store still needs {@link #recover()}.
     *
     * @throws StorageException if the log cannot be opened
     */
    public static KeyValueStore open(WalConfig config) {
        FileWriteAheadLog wal = new FileWriteAheadLog(config);
        wal.open(config.dataDir());
        return new KeyValueStore(wal, config.rotateOnCheckpoint());
    }

    // ========================================================================
    // Recovery
    // ========================================================================

    /**
     * Rebuilds the map by replaying the whole log into an empty map and swapping it in.
     * <p>
     * PUT sets, DELETE removes, CHECKPOINT is skipped. Running it again without
     * writes in between gives the same map.
     *
     * @throws StorageException if the log cannot be read or is damaged mid-stream
     */
    public void recover() {
        writeLock.lock();
        try {
            long startTime = System.currentTimeMillis();
            List<LogEntry> entries = wal.readAll();
            ConcurrentHashMap<Bytes, Bytes> rebuilt = new ConcurrentHashMap<>();
            int puts = 0;
            int deletes = 0;
            int checkpoints = 0;

            for (LogEntry entry : entries) {
                switch (entry.operation()) {
                    case PUT -> {
                        rebuilt.put(entry.key().orElseThrow(), entry.value().orElseThrow());
                        puts++;
                    }
                    case DELETE -> {
                        rebuilt.remove(entry.key().orElseThrow());
                        deletes++;
                    }
                    case CHECKPOINT -> checkpoints++;
                }
            }

            data = rebuilt;
            recovered = true;
            LOG.info("Recovered {} keys from {} entries ({} puts, {} deletes, {} checkpoints) in {} ms",
                    rebuilt.size(), entries.size(), puts, deletes, checkpoints,
                    System.currentTimeMillis() - startTime);
        } finally {
            writeLock.unlock();
        }
    }

    // ========================================================================
    // Mutations
    // ========================================================================

    /**
     * Logs a PUT and then sets the key.
     *
     * @return the sequence number of the logged entry
     * @throws WalWriteException if the log write fails; the map is unchanged
     */
    public long put(Bytes key, Bytes value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        writeLock.lock();
        try {
            ensureRecovered();
            long sequence = wal.append(LogEntry.put(key, value));
            data.put(key, value);
            LOG.debug("PUT {} ({} bytes) seq={}", key, value.length(), sequence);
            return sequence;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Logs a DELETE and then removes the key. Deleting an absent key is still logged.
     *
     * @return true if the key was present
     * @throws WalWriteException if the log write fails; the map is unchanged
     */
    public boolean delete(Bytes key) {
        Objects.requireNonNull(key, "key");
        writeLock.lock();
        try {
            ensureRecovered();
            long sequence = wal.append(LogEntry.delete(key));
            boolean present = data.remove(key) != null;
            LOG.debug("DELETE {} present={} seq={}", key, present, sequence);
            return present;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Logs a CHECKPOINT marker and, if configured, rotates the log so the next
     * entry starts a new segment. The map is not changed.
     * <p>
     * The marker is durable once appended. If the rotation after it fails, the failure
     * is logged, the log keeps appending to the current segment, and the marker's
     * sequence is still returned.
     *
     * @return the sequence number of the marker
     * @throws WalWriteException if the marker cannot be written
     */
    public long checkpoint() {
        writeLock.lock();
        try {
            ensureRecovered();
            long sequence = wal.append(LogEntry.checkpoint());
            if (rotateOnCheckpoint) {
                try {
                    wal.rotate();
                } catch (WalWriteException e) {
                    LOG.error("Checkpoint seq={} is durable but rotating the log failed; "
                            + "continuing in the current segment: {}", sequence, e.getMessage(), e);
                }
            }
            LOG.info("Checkpoint at seq={} ({} keys)", sequence, data.size());
            return sequence;
        } finally {
            writeLock.unlock();
        }
    }

    // ========================================================================
    // Reads
    // ========================================================================

    /**
     * @return the current value, or empty if the key is absent
     */
    public Optional<Bytes> get(Bytes key) {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(data.get(key));
    }

    /**
     * @return a snapshot of the keys present at the time of the call
     */
    public Set<Bytes> keys() {
        return Set.copyOf(data.keySet());
    }

    public int size() {
        return data.size();
    }

    /**
     * @return the sequence number of the last durable entry, or 0 if none
     */
    public long lastSequence() {
        return wal.lastSequence();
    }

    /**
     * Closes the underlying log. The map stays readable but no longer accepts writes.
     */
    @Override
    public void close() {
        writeLock.lock();
        try {
            wal.close();
            LOG.info("Store closed with {} keys", data.size());
        } finally {
            writeLock.unlock();
        }
    }

    private void ensureRecovered() {
        if (!recovered) {
            throw new IllegalStateException("recover() must be called before the store accepts writes");
        }
    }
}
