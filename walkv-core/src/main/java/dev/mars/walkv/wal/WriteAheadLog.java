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
package dev.mars.walkv.wal;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.List;

/**
 * Write-ahead log interface.
 * <p>
 * The store depends solely on this interface, not on concrete implementations.
 * <p>
 * <b>Critical Contract:</b> {@link #append(LogEntry)} returns only once the entry is
 * durable. If it throws, the entry must be treated as never written.
 *
 * @see FileWriteAheadLog
 */
public interface WriteAheadLog extends Closeable {

    /**
     * Opens the log, repairing a torn tail left by a crash. Idempotent.
     *
     * @param dataDir the directory holding the segment files
     * @throws CorruptEntryException if the newest segment is damaged before its end
     * @throws StorageException      if the directory cannot be used
     */
    void open(Path dataDir);

    /**
     * Assigns the next sequence number to the entry, writes it, and forces it to disk.
     * May rotate to a new segment afterwards.
     *
     * @param entry the entry to log; its own sequence number is ignored
     * @return the sequence number assigned
     * @throws WalWriteException if the write or flush failed
     */
    long append(LogEntry entry);

    /**
     * Reads every entry from every segment, oldest first.
     * <p>
     * A torn final write in the newest segment ends the scan: the entries before it
     * are returned. Each call scans from scratch.
     *
     * @return all complete entries in append order
     * @throws CorruptEntryException if a record is damaged with data after it, a sealed
     *                               segment is damaged, or sequences go backwards
     */
    List<LogEntry> readAll();

    /**
     * Seals the current segment and starts a new one.
     *
     * @throws WalWriteException if the new segment cannot be created
     */
    void rotate();

    /**
     * @return the last sequence number written, or 0 if the log is empty
     */
    long lastSequence();

    /**
     * @return the segment files, oldest first
     */
    List<Path> segments();

    /**
     * Flushes and closes the current segment and releases the directory lock.
     * Idempotent.
     */
    @Override
    void close();
}
