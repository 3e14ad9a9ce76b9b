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
import dev.mars.walkv.wal.CorruptEntryException;
import dev.mars.walkv.wal.FileWriteAheadLog;
import dev.mars.walkv.wal.LogEntry;
import dev.mars.walkv.wal.WalConfig;
import dev.mars.walkv.wal.WalWriteException;
import dev.mars.walkv.wal.WriteAheadLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link KeyValueStore}: log-then-apply ordering, durability across
 * restarts, recovery from a torn tail, and behaviour when the log fails.
 */
class KeyValueStoreTest {

    @TempDir
    Path tempDir;

    private KeyValueStore store;

    @BeforeEach
    void setUp() {
        store = open(config(tempDir).build());
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private static WalConfig.Builder config(Path dir) {
        return WalConfig.builder()
                .dataDir(dir)
                .minFreeSpaceMb(0);
    }

    private static KeyValueStore open(WalConfig config) {
        KeyValueStore kv = KeyValueStore.open(config);
        kv.recover();
        return kv;
    }

    private KeyValueStore restart() {
        store.close();
        store = open(config(tempDir).build());
        return store;
    }

    private static Bytes b(String s) {
        return Bytes.of(s);
    }

    private List<Path> listSegments() throws IOException {
        List<Path> segments = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(tempDir, "segment-*.wal")) {
            stream.forEach(segments::add);
        }
        segments.sort(null);
        return segments;
    }

    private static Map<Bytes, Bytes> contents(KeyValueStore kv) {
        Map<Bytes, Bytes> map = new HashMap<>();
        for (Bytes key : kv.keys()) {
            map.put(key, kv.get(key).orElseThrow());
        }
        return map;
    }

    // ========================================================================
    // Basic Operations
    // ========================================================================

    @Nested
    @DisplayName("Basic operations")
    class BasicTests {

        @Test
        @DisplayName("Put, overwrite and delete are visible immediately")
        void putOverwriteDelete() {
            store.put(b("a"), b("1"));
            store.put(b("b"), b("2"));
            store.put(b("a"), b("3"));
            assertTrue(store.delete(b("b")));

            assertEquals(Optional.of(b("3")), store.get(b("a")));
            assertEquals(Optional.empty(), store.get(b("b")));
            assertEquals(Set.of(b("a")), store.keys());
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("Deleting an absent key is logged and reports false")
        void deleteAbsentKey() {
            assertFalse(store.delete(b("missing")));
            assertEquals(1, store.lastSequence());
        }

        @Test
        @DisplayName("Put returns increasing sequence numbers")
        void putSequences() {
            assertEquals(1, store.put(b("a"), b("1")));
            assertEquals(2, store.put(b("a"), b("2")));
            assertEquals(2, store.lastSequence());
        }

        @Test
        @DisplayName("Empty key and empty value are stored")
        void emptyKeyAndValue() {
            store.put(Bytes.EMPTY, Bytes.EMPTY);

            restart();

            assertEquals(Optional.of(Bytes.EMPTY), store.get(Bytes.EMPTY));
        }

        @Test
        @DisplayName("keys() is a snapshot unaffected by later writes")
        void keysSnapshot() {
            store.put(b("a"), b("1"));
            Set<Bytes> snapshot = store.keys();

            store.put(b("b"), b("2"));

            assertEquals(Set.of(b("a")), snapshot);
            assertThrows(UnsupportedOperationException.class, () -> snapshot.add(b("c")));
        }

        @Test
        @DisplayName("Writes before recover are refused")
        void writeBeforeRecover() {
            store.close();
            store = KeyValueStore.open(config(tempDir).build());

            assertThrows(IllegalStateException.class, () -> store.put(b("a"), b("1")));
            assertThrows(IllegalStateException.class, () -> store.delete(b("a")));
            assertThrows(IllegalStateException.class, () -> store.checkpoint());
            assertEquals(Optional.empty(), store.get(b("a")));
        }
    }

    // ========================================================================
    // Durability and Recovery
    // ========================================================================

    @Nested
    @DisplayName("Durability and recovery")
    class RecoveryTests {

        @Test
        @DisplayName("put a, put b, delete a, checkpoint, restart leaves only b")
        void survivesRestart() {
            store.put(b("a"), b("1"));
            store.put(b("b"), b("2"));
            store.delete(b("a"));
            store.checkpoint();

            restart();

            assertEquals(Optional.empty(), store.get(b("a")));
            assertEquals(Optional.of(b("2")), store.get(b("b")));
            assertEquals(Set.of(b("b")), store.keys());
            assertEquals(4, store.lastSequence());
            assertEquals(5, store.put(b("c"), b("3")));
        }

        @Test
        @DisplayName("Damaged record before acknowledged writes fails recovery and keeps them on disk")
        void damageBeforeAcknowledgedWrites() throws IOException {
            for (int i = 0; i < 5; i++) {
                store.put(b("k" + i), b("v" + i));
            }
            store.close();
            Path segment = listSegments().get(0);
            long sizeBefore = Files.size(segment);
            long recordSize = LogEntry.put(b("k0"), b("v0")).encode().length;

            try (FileChannel fc = FileChannel.open(segment, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
                ByteBuffer one = ByteBuffer.allocate(1);
                fc.read(one, recordSize + LogEntry.HEADER_SIZE);
                fc.write(ByteBuffer.wrap(new byte[]{(byte) (one.get(0) ^ 0x01)}), recordSize + LogEntry.HEADER_SIZE);
            }

            assertThrows(CorruptEntryException.class, () -> open(config(tempDir).build()));
            assertEquals(sizeBefore, Files.size(segment));
        }

        @Test
        @DisplayName("Replay applies entries in log order")
        void replayOrder() {
            for (int i = 0; i < 50; i++) {
                store.put(b("k"), b("v" + i));
            }
            store.delete(b("k"));
            store.put(b("k"), b("final"));

            restart();

            assertEquals(Optional.of(b("final")), store.get(b("k")));
        }

        @Test
        @DisplayName("Recover twice without writes gives the same map")
        void recoverIdempotent() {
            store.put(b("a"), b("1"));
            store.put(b("b"), b("2"));
            Map<Bytes, Bytes> before = contents(store);

            store.recover();
            Map<Bytes, Bytes> once = contents(store);
            store.recover();

            assertEquals(before, once);
            assertEquals(once, contents(store));
        }

        @Test
        @DisplayName("Garbage after the last record is ignored on recovery")
        void tornTailTolerated() throws IOException {
            store.put(b("a"), b("1"));
            store.put(b("b"), b("2"));
            store.close();

            List<Path> segments = listSegments();
            Path last = segments.get(segments.size() - 1);
            byte[] partial = LogEntry.put(b("c"), b("3")).withSequence(3).encode();
            try (FileChannel fc = FileChannel.open(last, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                fc.write(ByteBuffer.wrap(partial, 0, partial.length / 2));
            }

            store = open(config(tempDir).build());

            assertEquals(Set.of(b("a"), b("b")), store.keys());
            assertEquals(3, store.put(b("c"), b("3")));
        }

        @Test
        @DisplayName("Rotation does not change the recovered state")
        void rotationEquivalence() {
            Path small = tempDir.resolve("small");
            Path large = tempDir.resolve("large");
            KeyValueStore rotating = open(config(small).segmentSizeBytes(64).build());
            KeyValueStore single = open(config(large).build());
            try {
                for (int i = 0; i < 40; i++) {
                    String key = "key-" + (i % 7);
                    if (i % 5 == 4) {
                        rotating.delete(b(key));
                        single.delete(b(key));
                    } else {
                        rotating.put(b(key), b("value-" + i));
                        single.put(b(key), b("value-" + i));
                    }
                }
            } finally {
                rotating.close();
                single.close();
            }

            KeyValueStore rotatingAgain = open(config(small).segmentSizeBytes(64).build());
            KeyValueStore singleAgain = open(config(large).build());
            try {
                assertEquals(contents(singleAgain), contents(rotatingAgain));
                assertFalse(contents(rotatingAgain).isEmpty());
            } finally {
                rotatingAgain.close();
                singleAgain.close();
            }
        }
    }

    // ========================================================================
    // Checkpoint
    // ========================================================================

    @Nested
    @DisplayName("Checkpoint")
    class CheckpointTests {

        @Test
        @DisplayName("Checkpoint starts a new segment and leaves the map alone")
        void checkpointRotates() {
            store.put(b("a"), b("1"));

            long sequence = store.checkpoint();
            store.put(b("b"), b("2"));

            assertEquals(2, sequence);
            assertEquals(Set.of(b("a"), b("b")), store.keys());

            restart();
            assertEquals(Set.of(b("a"), b("b")), store.keys());
            assertEquals(3, store.lastSequence());
        }

        @Test
        @DisplayName("Checkpoint without rotation stays in the same segment")
        void checkpointWithoutRotation() {
            store.close();
            FileWriteAheadLog wal = new FileWriteAheadLog(config(tempDir).build());
            wal.open();
            store = new KeyValueStore(wal, false);
            store.recover();

            store.put(b("a"), b("1"));
            store.checkpoint();

            assertEquals(1, wal.segments().size());
        }

        @Test
        @DisplayName("Checkpoint whose rotation fails still returns the durable marker")
        void checkpointRotationFails() {
            store.close();
            FileWriteAheadLog real = new FileWriteAheadLog(config(tempDir).build());
            real.open();
            FailingLog failing = new FailingLog(real);
            store = new KeyValueStore(failing, true);
            store.recover();
            store.put(b("a"), b("1"));

            failing.failRotate = true;
            assertEquals(2, store.checkpoint());
            assertEquals(1, real.segments().size());
            assertEquals(3, store.put(b("b"), b("2")));

            restart();
            assertEquals(Set.of(b("a"), b("b")), store.keys());
            assertEquals(3, store.lastSequence());
        }
    }

    // ========================================================================
    // Failure Handling
    // ========================================================================

    @Nested
    @DisplayName("Failure handling")
    class FailureTests {

        @Test
        @DisplayName("A failed log append leaves the map unchanged")
        void failedAppendLeavesMapUnchanged() {
            store.close();
            FileWriteAheadLog real = new FileWriteAheadLog(config(tempDir).build());
            real.open();
            FailingLog failing = new FailingLog(real);
            store = new KeyValueStore(failing, true);
            store.recover();
            store.put(b("a"), b("1"));

            failing.failNext = true;
            assertThrows(WalWriteException.class, () -> store.put(b("a"), b("2")));
            failing.failNext = true;
            assertThrows(WalWriteException.class, () -> store.delete(b("a")));
            failing.failNext = true;
            assertThrows(WalWriteException.class, () -> store.put(b("b"), b("3")));

            assertEquals(Map.of(b("a"), b("1")), contents(store));

            restart();
            assertEquals(Map.of(b("a"), b("1")), contents(store));
        }

        @Test
        @DisplayName("Writes after close fail and keep the map")
        void writeAfterClose() {
            store.put(b("a"), b("1"));
            store.close();

            assertThrows(WalWriteException.class, () -> store.put(b("b"), b("2")));
            assertEquals(Set.of(b("a")), store.keys());
        }
    }

    // ========================================================================
    // Concurrency
    // ========================================================================

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Concurrent writers produce a log that replays to the live map")
        void concurrentWriters() throws Exception {
            store.close();
            WalConfig fast = config(tempDir).syncEnabled(false).segmentSizeBytes(4096).build();
            store = open(fast);

            int threads = 8;
            int opsPerThread = 200;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < threads; t++) {
                    int thread = t;
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < opsPerThread; i++) {
                            Bytes key = b("key-" + (i % 20));
                            if (i % 7 == 0) {
                                store.delete(key);
                            } else {
                                store.put(key, b("t" + thread + "-" + i));
                            }
                            store.get(key);
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> f : futures) {
                    f.get(60, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            Map<Bytes, Bytes> live = contents(store);
            assertEquals((long) threads * opsPerThread, store.lastSequence());

            store.close();
            store = open(fast);

            assertEquals(live, contents(store));
        }
    }

    /** Log wrapper that fails the next append when asked. */
    private static final class FailingLog implements WriteAheadLog {
        private final WriteAheadLog delegate;
        volatile boolean failNext;
        volatile boolean failRotate;

        FailingLog(WriteAheadLog delegate) {
            this.delegate = delegate;
        }

        @Override
        public void open(Path dataDir) {
            delegate.open(dataDir);
        }

        @Override
        public long append(LogEntry entry) {
            if (failNext) {
                failNext = false;
                throw new WalWriteException("injected failure");
            }
            return delegate.append(entry);
        }

        @Override
        public List<LogEntry> readAll() {
            return delegate.readAll();
        }

        @Override
        public void rotate() {
            if (failRotate) {
                throw new WalWriteException("injected rotation failure");
            }
            delegate.rotate();
        }

        @Override
        public long lastSequence() {
            return delegate.lastSequence();
        }

        @Override
        public List<Path> segments() {
            return delegate.segments();
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
