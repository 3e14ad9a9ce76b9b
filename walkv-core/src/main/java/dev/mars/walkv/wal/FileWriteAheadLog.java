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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File-based implementation of {@link WriteAheadLog}.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ wal.lock                          // exclusive process lock
 *  ├─ segment-00000000000000000001.wal  // sealed
 *  ├─ segment-00000000000000000002.wal  // sealed
 *  └─ segment-00000000000000000003.wal  // active, append-only
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * Append, rotate, read and close all run under one {@link ReentrantLock}, so a
 * rotation can never split an append and the file position is always consistent.
 * <p>
 * <b>Durability:</b>
 * Every append is forced to disk before it returns. A rotation forces the old
 * segment, creates the new one, and fsyncs the directory before the old segment is
 * closed. Sealed segments are never written again.
 * <p>
 * <b>Crash Recovery:</b>
 * {@link #open(Path)} scans the newest segment and truncates a write torn by a crash:
 * a final record that is incomplete, fails its CRC, or is followed only by zero bytes.
 * A bad record with data after it, in any segment, is reported as a
 * {@link CorruptEntryException} and nothing is truncated.
 * <p>
 * <b>Protection Mechanisms:</b>
 * <ul>
 *   <li><b>File Locking:</b> Exclusive lock on {@code wal.lock} prevents two
 *       processes, or two logs in one JVM, from writing the same directory.</li>
 *   <li><b>Disk Space Checking:</b> Pre-flight check at open and before large writes.</li>
 *   <li><b>Read-After-Write Verification:</b> Optional read-back of every record.</li>
 *   <li><b>Failed State:</b> If a failed write cannot be rolled back, the log refuses
 *       further appends rather than write after garbage.</li>
 * </ul>
 *
 * @see WriteAheadLog
 */
public final class FileWriteAheadLog implements WriteAheadLog {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileWriteAheadLog.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Lock file name */
    private static final String LOCK_FILE = "wal.lock";

    /** Writes above this size re-check free disk space */
    private static final int LARGE_WRITE_BYTES = 1024 * 1024;

    // ========================================================================
    // State
    // ========================================================================

    private final ReentrantLock lock = new ReentrantLock();
    private final WalConfig config;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int maxPayloadSize;
    private final long minFreeSpace;
    private final long segmentSize;
    private final Compression compression;

    private Path dataDir;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private Segment activeSegment;
    private FileChannel activeChannel;
    private long nextSequence = 1;
    private boolean opened = false;
    private boolean failed = false;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a log with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     *
     * @see WalConfig
     */
    public FileWriteAheadLog() {
        this(WalConfig.load());
    }

    /**
     * Creates a log with the specified configuration.
     *
     * @param config the log configuration
     */
    public FileWriteAheadLog(WalConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.syncEnabled = config.syncEnabled();
        this.verifyWrites = config.verifyWrites();
        this.maxPayloadSize = config.maxPayloadSizeBytes();
        this.minFreeSpace = config.minFreeSpaceBytes();
        this.segmentSize = config.segmentSizeBytes();
        this.compression = config.compression();

        LOG.info("FileWriteAheadLog initialized: syncEnabled={}, verifyWrites={}, segmentSize={} bytes, compression={}",
                syncEnabled, verifyWrites, segmentSize, compression);

        if (!syncEnabled) {
            LOG.warn("FileWriteAheadLog created with fsync DISABLED. Do NOT use in production!");
        }
    }

    /**
     * Returns the configuration used by this log.
     */
    public WalConfig config() {
        return config;
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    /**
     * Opens the log in the data directory from the configuration.
     */
    public void open() {
        open(config.dataDir());
    }

    @Override
    public void open(Path dataDir) {
        lock.lock();
        try {
            if (closed) {
                throw new StorageException("WAL has been closed and cannot be reopened");
            }
            if (opened) {
                LOG.debug("WAL already open at {}, ignoring open()", this.dataDir);
                return;
            }
            LOG.info("Opening WAL at: {}", dataDir);
            this.dataDir = dataDir;
            try {
                Files.createDirectories(dataDir);
                acquireExclusiveLock();
                checkDiskSpace();

                List<Segment> existing = Segment.list(dataDir);
                long lastSequence = 0;
                if (existing.isEmpty()) {
                    activeSegment = Segment.of(dataDir, 1);
                    LOG.info("No segments found, starting new log at {}", activeSegment.path().getFileName());
                } else {
                    activeSegment = existing.get(existing.size() - 1);
                    lastSequence = repairTail(activeSegment);
                    for (int i = existing.size() - 2; lastSequence == 0 && i >= 0; i--) {
                        lastSequence = lastSequenceOf(scan(existing.get(i)), existing.get(i), false);
                    }
                }

                activeChannel = FileChannel.open(activeSegment.path(),
                        StandardOpenOption.CREATE,
                        StandardOpenOption.READ,
                        StandardOpenOption.WRITE);
                long size = activeChannel.size();
                activeChannel.position(size);
                nextSequence = lastSequence + 1;
                if (size >= segmentSize) {
                    rotateLocked();
                }
                opened = true;
                LOG.info("WAL opened: segments={}, active={}, nextSequence={}",
                        Math.max(existing.size(), 1), activeSegment.path().getFileName(), nextSequence);
            } catch (IOException e) {
                LOG.error("Failed to open WAL at {}: {}", dataDir, e.getMessage(), e);
                closeActiveChannel();
                releaseExclusiveLock();
                throw new StorageException("Failed to open WAL at " + dataDir, e);
            } catch (RuntimeException e) {
                closeActiveChannel();
                releaseExclusiveLock();
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                LOG.debug("WAL already closed, ignoring duplicate close()");
                return;
            }
            closed = true;
            LOG.info("Closing WAL at: {}", dataDir);
            if (activeChannel != null && activeChannel.isOpen() && syncEnabled && !failed) {
                try {
                    activeChannel.force(true);
                } catch (IOException e) {
                    LOG.warn("Could not flush active segment on close: {}", e.getMessage());
                }
            }
            closeActiveChannel();
            releaseExclusiveLock();
            LOG.info("WAL closed");
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Log Operations
    // ========================================================================

    @Override
    public long append(LogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        checkFieldSize("key", entry.key().map(Bytes::length).orElse(0));
        checkFieldSize("value", entry.value().map(Bytes::length).orElse(0));

        lock.lock();
        try {
            ensureWritable();
            if (activeChannel.size() >= segmentSize) {
                rotateLocked();
            }

            long sequence = nextSequence;
            LogEntry sequenced = entry.withSequence(sequence);
            byte[] record = sequenced.encode(compression);
            writeRecord(record);
            nextSequence = sequence + 1;

            LOG.debug("Appended {} seq={} ({} bytes) to {}",
                    sequenced.operation(), sequence, record.length, activeSegment.path().getFileName());
            return sequence;
        } catch (IOException e) {
            LOG.error("Failed to append entry: {}", e.getMessage(), e);
            throw new WalWriteException("Failed to append entry", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<LogEntry> readAll() {
        lock.lock();
        try {
            if (!opened || closed) {
                throw new StorageException("WAL is not open");
            }
            long startTime = System.currentTimeMillis();
            List<Segment> segments = Segment.list(dataDir);
            List<LogEntry> entries = new ArrayList<>();
            long lastSequence = 0;

            for (int i = 0; i < segments.size(); i++) {
                Segment segment = segments.get(i);
                boolean newest = i == segments.size() - 1;
                Scan scan = scan(segment);

                for (LogEntry entry : scan.entries()) {
                    if (entry.sequence() <= lastSequence) {
                        LOG.error("Sequence regression in {}: {} after {}",
                                segment.path().getFileName(), entry.sequence(), lastSequence);
                        throw new CorruptEntryException("Sequence " + entry.sequence() + " follows "
                                + lastSequence + " in " + segment.path().getFileName());
                    }
                    lastSequence = entry.sequence();
                    entries.add(entry);
                }

                if (scan.corruption() != null) {
                    if (!newest || !scan.tornTail()) {
                        LOG.error("Corrupt record in {} segment {} at offset {}: {}",
                                newest ? "active" : "sealed", segment.path().getFileName(),
                                scan.validBytes(), scan.corruption().getMessage());
                        throw new CorruptEntryException("Corrupt record in segment "
                                + segment.path().getFileName() + " at offset " + scan.validBytes(),
                                scan.corruption());
                    }
                    LOG.warn("Replay stopped at torn tail of {} (offset {}): {}",
                            segment.path().getFileName(), scan.validBytes(), scan.corruption().getMessage());
                }
            }

            LOG.info("WAL replay complete: {} entries from {} segments, {} ms",
                    entries.size(), segments.size(), System.currentTimeMillis() - startTime);
            return entries;
        } catch (IOException e) {
            LOG.error("Failed to read WAL: {}", e.getMessage(), e);
            throw new StorageException("Failed to read WAL", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void rotate() {
        lock.lock();
        try {
            ensureWritable();
            rotateLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long lastSequence() {
        lock.lock();
        try {
            return nextSequence - 1;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Path> segments() {
        lock.lock();
        try {
            if (dataDir == null) {
                return List.of();
            }
            List<Path> paths = new ArrayList<>();
            for (Segment segment : Segment.list(dataDir)) {
                paths.add(segment.path());
            }
            return paths;
        } catch (IOException e) {
            throw new StorageException("Failed to list segments in " + dataDir, e);
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Outcome of scanning one segment.
     *
     * @param entries    records decoded before the first failure
     * @param validBytes length of the well-formed prefix
     * @param fileSize   size of the file when scanned
     * @param corruption the first decode failure, or null if the whole file decoded
     * @param tornTail   whether the failure is an interrupted final write rather than damage
     */
    private record Scan(List<LogEntry> entries, long validBytes, long fileSize,
                        CorruptEntryException corruption, boolean tornTail) {
    }

    /**
     * Reads a segment record by record until end of file or the first record
     * that fails to decode.
     * <p>
     * A failure counts as a torn tail only when nothing after it could be a record:
     * fewer than {@link LogEntry#HEADER_SIZE} bytes remain, the record runs past the end
     * of the file, the failing record is the last one in the file, or everything from
     * the failure to the end is zero bytes. Any other failure is damage.
     */
    private Scan scan(Segment segment) throws IOException {
        List<LogEntry> entries = new ArrayList<>();
        try (FileChannel ch = FileChannel.open(segment.path(), StandardOpenOption.READ)) {
            long fileSize = ch.size();
            long pos = 0;
            ByteBuffer headerBuf = ByteBuffer.allocate(LogEntry.HEADER_SIZE);

            while (pos < fileSize) {
                long remaining = fileSize - pos;
                if (remaining < LogEntry.HEADER_SIZE) {
                    return failedScan(segment, entries, pos, fileSize, true,
                            new CorruptEntryException("Incomplete header: " + remaining + " bytes"));
                }
                headerBuf.clear();
                readFully(ch, headerBuf, pos);

                int recordSize;
                try {
                    recordSize = LogEntry.recordSize(headerBuf);
                } catch (CorruptEntryException e) {
                    return failedScan(segment, entries, pos, fileSize, isZeroFilled(ch, pos, fileSize), e);
                }
                if (remaining < recordSize) {
                    return failedScan(segment, entries, pos, fileSize, true,
                            new CorruptEntryException("Incomplete record: " + remaining
                                    + " of " + recordSize + " bytes"));
                }

                ByteBuffer recordBuf = ByteBuffer.allocate(recordSize);
                readFully(ch, recordBuf, pos);
                recordBuf.flip();
                try {
                    entries.add(LogEntry.decode(recordBuf));
                } catch (CorruptEntryException e) {
                    boolean last = pos + recordSize == fileSize;
                    return failedScan(segment, entries, pos, fileSize, last || isZeroFilled(ch, pos, fileSize), e);
                }
                pos += recordSize;
            }
            LOG.trace("Scanned {}: {} entries, {} bytes", segment.path().getFileName(), entries.size(), fileSize);
            return new Scan(entries, pos, fileSize, null, false);
        }
    }

    private static Scan failedScan(Segment segment, List<LogEntry> entries, long pos, long fileSize,
                                   boolean tornTail, CorruptEntryException e) {
        LOG.debug("Decode failed in {} at offset {} ({}): {}",
                segment.path().getFileName(), pos, tornTail ? "torn tail" : "damage", e.getMessage());
        return new Scan(entries, pos, fileSize, e, tornTail);
    }

    /** Whether every byte from {@code pos} to the end of the file is zero. */
    private static boolean isZeroFilled(FileChannel ch, long pos, long fileSize) throws IOException {
        ByteBuffer chunk = ByteBuffer.allocate(8192);
        long offset = pos;
        while (offset < fileSize) {
            chunk.clear();
            int n = ch.read(chunk, offset);
            if (n < 0) {
                break;
            }
            for (int i = 0; i < n; i++) {
                if (chunk.get(i) != 0) {
                    return false;
                }
            }
            offset += n;
        }
        return true;
    }

    /**
     * Scans the newest segment and cuts off a torn final write. Damage anywhere
     * else in the segment is reported and nothing is truncated.
     *
     * @return the last sequence number in the segment, or 0 if it holds none
     * @throws CorruptEntryException if the segment is damaged before its end
     */
    private long repairTail(Segment segment) throws IOException {
        Scan scan = scan(segment);
        if (scan.corruption() != null && !scan.tornTail()) {
            LOG.error("Corrupt record in {} at offset {} with data after it; refusing to truncate: {}",
                    segment.path().getFileName(), scan.validBytes(), scan.corruption().getMessage());
            throw new CorruptEntryException("Corrupt record in " + segment.path().getFileName()
                    + " at offset " + scan.validBytes(), scan.corruption());
        }
        if (scan.corruption() != null) {
            LOG.warn("Truncating torn tail of {}: {} bytes removed (file was {} bytes, valid data {} bytes): {}",
                    segment.path().getFileName(), scan.fileSize() - scan.validBytes(),
                    scan.fileSize(), scan.validBytes(), scan.corruption().getMessage());
            try (FileChannel ch = FileChannel.open(segment.path(), StandardOpenOption.WRITE)) {
                ch.truncate(scan.validBytes());
                if (syncEnabled) {
                    ch.force(true);
                }
            }
        }
        return lastSequenceOf(scan, segment, true);
    }

    private static long lastSequenceOf(Scan scan, Segment segment, boolean tolerateTail) {
        if (scan.corruption() != null && !tolerateTail) {
            throw new CorruptEntryException("Corrupt record in sealed segment "
                    + segment.path().getFileName() + " at offset " + scan.validBytes(), scan.corruption());
        }
        List<LogEntry> entries = scan.entries();
        return entries.isEmpty() ? 0 : entries.get(entries.size() - 1).sequence();
    }

    private static void readFully(FileChannel ch, ByteBuffer buf, long pos) throws IOException {
        while (buf.hasRemaining()) {
            int n = ch.read(buf, pos + buf.position());
            if (n < 0) {
                throw new CorruptEntryException("Unexpected end of file at offset " + (pos + buf.position()));
            }
        }
    }

    /**
     * Writes one encoded record at the end of the active segment and forces it to disk.
     * On failure the segment is cut back to where the record started.
     * Must be called with the lock held.
     */
    private void writeRecord(byte[] record) throws IOException {
        if (record.length > LARGE_WRITE_BYTES) {
            LOG.debug("Large write detected ({} bytes), checking disk space", record.length);
            checkDiskSpace();
        }

        long writePosition = activeChannel.position();
        LOG.trace("Writing {} bytes at position {} of {}", record.length, writePosition, activeSegment.path().getFileName());
        try {
            ByteBuffer buf = ByteBuffer.wrap(record);
            while (buf.hasRemaining()) {
                activeChannel.write(buf);
            }
            if (syncEnabled) {
                activeChannel.force(true);
            }
            if (verifyWrites) {
                verifyWrittenRecord(writePosition, record);
            }
        } catch (IOException | StorageException e) {
            rollBack(writePosition);
            throw e;
        }
    }

    /**
     * Cuts the active segment back to {@code position} after a failed write. If that
     * also fails the log enters the failed state and refuses further appends.
     */
    private void rollBack(long position) {
        try {
            activeChannel.truncate(position);
            activeChannel.position(position);
            LOG.warn("Rolled back partial write in {} to {} bytes", activeSegment.path().getFileName(), position);
        } catch (IOException e) {
            failed = true;
            LOG.error("Could not roll back partial write in {}; WAL refuses further appends: {}",
                    activeSegment.path().getFileName(), e.getMessage(), e);
        }
    }

    /**
     * Reads a record back after writing it and compares it byte for byte.
     *
     * @throws WalWriteException if the bytes on disk differ
     */
    private void verifyWrittenRecord(long position, byte[] expected) throws IOException {
        ByteBuffer readBuf = ByteBuffer.allocate(expected.length);
        int bytesRead = 0;
        while (readBuf.hasRemaining()) {
            int n = activeChannel.read(readBuf, position + readBuf.position());
            if (n < 0) {
                break;
            }
            bytesRead += n;
        }
        if (bytesRead != expected.length || !Arrays.equals(readBuf.array(), expected)) {
            LOG.error("Write verification failed at position {}: read {} of {} bytes", position, bytesRead, expected.length);
            throw new WalWriteException("Write verification failed at position " + position
                    + ". Possible silent data corruption!");
        }
        LOG.trace("Write verification passed at position {}", position);
    }

    /**
     * Forces the active segment, creates the next one, and switches appends to it.
     * If the new segment cannot be created the current one stays active.
     * Must be called with the lock held.
     */
    private void rotateLocked() {
        try {
            if (activeChannel.size() == 0) {
                LOG.debug("Active segment {} is empty, skipping rotation", activeSegment.path().getFileName());
                return;
            }
            if (syncEnabled) {
                activeChannel.force(true);
            }
            Segment next = activeSegment.next();
            FileChannel nextChannel = FileChannel.open(next.path(),
                    StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE);
            if (syncEnabled) {
                syncDirectory(dataDir);
            }

            Segment sealed = activeSegment;
            long sealedSize = activeChannel.size();
            activeChannel.close();
            activeSegment = next;
            activeChannel = nextChannel;
            LOG.info("Rotated WAL: sealed {} ({} bytes), active {}",
                    sealed.path().getFileName(), sealedSize, next.path().getFileName());
        } catch (IOException e) {
            LOG.error("Failed to rotate WAL segment {}: {}", activeSegment.path().getFileName(), e.getMessage(), e);
            throw new WalWriteException("Failed to rotate WAL segment " + activeSegment.path().getFileName(), e);
        }
    }

    private void ensureWritable() {
        if (closed) {
            throw new WalWriteException("WAL is closed");
        }
        if (!opened) {
            throw new WalWriteException("WAL is not open");
        }
        if (failed) {
            throw new WalWriteException("WAL is in a failed state after an unrecoverable write error; reopen it");
        }
    }

    private void checkFieldSize(String field, int length) {
        if (length > maxPayloadSize) {
            LOG.error("{} too large: {} bytes (max: {})", field, length, maxPayloadSize);
            throw new WalWriteException(field + " too large: " + length + " bytes (max: " + maxPayloadSize + ")");
        }
    }

    /**
     * Fsyncs a directory so that a newly created segment file survives a crash.
     * <p>
     * On Windows this is skipped. On Linux (ext4/xfs) it is required for durability.
     */
    private void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some file systems do not support directory fsync
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Acquires an exclusive lock on the data directory through a separate lock file.
     *
     * @throws StorageException if another process or another log in this JVM holds it
     */
    private void acquireExclusiveLock() throws IOException {
        Path lockPath = dataDir.resolve(LOCK_FILE);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
            if (exclusiveLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StorageException(
                        "Cannot acquire exclusive lock on WAL directory: " + dataDir +
                        ". Another process may be using this storage.");
            }
            LOG.info("Exclusive lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StorageException(
                    "Cannot acquire exclusive lock: lock already held in this JVM", e);
        }
    }

    private void releaseExclusiveLock() {
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }

    private void closeActiveChannel() {
        try {
            if (activeChannel != null && activeChannel.isOpen()) {
                activeChannel.close();
                LOG.debug("Active segment closed");
            }
        } catch (IOException e) {
            LOG.warn("Error closing active segment: {}", e.getMessage());
        }
    }

    /**
     * Checks that sufficient disk space is available.
     *
     * @throws WalWriteException if disk space is below the configured minimum
     */
    private void checkDiskSpace() throws IOException {
        FileStore store = Files.getFileStore(dataDir);
        long usableSpace = store.getUsableSpace();
        long usableSpaceMb = usableSpace / 1024 / 1024;
        long minFreeSpaceMb = minFreeSpace / 1024 / 1024;

        LOG.trace("Disk space check: {} MB available, {} MB required", usableSpaceMb, minFreeSpaceMb);

        if (usableSpace < minFreeSpace) {
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpaceMb, minFreeSpaceMb);
            throw new WalWriteException(
                    "Insufficient disk space: " + usableSpaceMb + " MB available, " +
                    "need at least " + minFreeSpaceMb + " MB.");
        }
    }
}
