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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LogEntry} encoding and decoding.
 */
class LogEntryTest {

    private static final Bytes KEY = Bytes.of("user:42");
    private static final Bytes VALUE = Bytes.of("{\"name\":\"Ada\"}");

    // ========================================================================
    // Round Trip
    // ========================================================================

    @Nested
    @DisplayName("Round trip")
    class RoundTripTests {

        @Test
        @DisplayName("PUT survives encode and decode unchanged")
        void putRoundTrip() {
            LogEntry entry = LogEntry.put(KEY, VALUE).withSequence(7);

            LogEntry decoded = LogEntry.decode(entry.encode());

            assertEquals(entry, decoded);
            assertEquals(7, decoded.sequence());
            assertEquals(Optional.of(VALUE), decoded.value());
        }

        @Test
        @DisplayName("DELETE carries a key and no value")
        void deleteRoundTrip() {
            LogEntry entry = LogEntry.delete(KEY).withSequence(8);

            LogEntry decoded = LogEntry.decode(entry.encode());

            assertEquals(entry, decoded);
            assertEquals(Operation.DELETE, decoded.operation());
            assertTrue(decoded.value().isEmpty());
        }

        @Test
        @DisplayName("CHECKPOINT carries neither key nor value")
        void checkpointRoundTrip() {
            LogEntry entry = LogEntry.checkpoint().withSequence(9);

            byte[] encoded = entry.encode();

            assertEquals(LogEntry.HEADER_SIZE + LogEntry.CRC_SIZE, encoded.length);
            assertEquals(entry, LogEntry.decode(encoded));
        }

        @Test
        @DisplayName("Empty value is distinct from absent value")
        void emptyValueRoundTrip() {
            LogEntry entry = LogEntry.put(Bytes.EMPTY, Bytes.EMPTY).withSequence(1);

            LogEntry decoded = LogEntry.decode(entry.encode());

            assertEquals(Optional.of(Bytes.EMPTY), decoded.key());
            assertEquals(Optional.of(Bytes.EMPTY), decoded.value());
        }

        @Test
        @DisplayName("Binary content including zero bytes is preserved")
        void binaryRoundTrip() {
            byte[] raw = new byte[512];
            for (int i = 0; i < raw.length; i++) {
                raw[i] = (byte) i;
            }
            LogEntry entry = LogEntry.put(Bytes.copyOf(new byte[]{0, 0, 1}), Bytes.copyOf(raw)).withSequence(3);

            LogEntry decoded = LogEntry.decode(entry.encode());

            assertArrayEquals(raw, decoded.value().orElseThrow().toByteArray());
        }

        @Test
        @DisplayName("Records decode one after another from a single stream")
        void streamOfRecords() {
            LogEntry first = LogEntry.put(KEY, VALUE).withSequence(1);
            LogEntry second = LogEntry.delete(KEY).withSequence(2);
            LogEntry third = LogEntry.checkpoint().withSequence(3);
            byte[] a = first.encode();
            byte[] b = second.encode();
            byte[] c = third.encode();

            ByteBuffer stream = ByteBuffer.allocate(a.length + b.length + c.length);
            stream.put(a).put(b).put(c).flip();

            assertEquals(first, LogEntry.decode(stream));
            assertEquals(second, LogEntry.decode(stream));
            assertEquals(third, LogEntry.decode(stream));
            assertFalse(stream.hasRemaining());
        }
    }

    // ========================================================================
    // Compression
    // ========================================================================

    @Nested
    @DisplayName("Compression")
    class CompressionTests {

        @Test
        @DisplayName("Compressible value is stored deflated and inflated on decode")
        void compressibleValue() {
            Bytes value = Bytes.of("a".repeat(4096));
            LogEntry entry = LogEntry.put(KEY, value).withSequence(1);

            byte[] plain = entry.encode(Compression.NONE);
            byte[] deflated = entry.encode(Compression.DEFLATE);

            assertTrue(deflated.length < plain.length);
            assertEquals(LogEntry.FLAG_COMPRESSED, deflated[7] & LogEntry.FLAG_COMPRESSED);
            assertEquals(entry, LogEntry.decode(deflated));
        }

        @Test
        @DisplayName("Value that does not shrink is stored as is")
        void incompressibleValue() {
            LogEntry entry = LogEntry.put(KEY, Bytes.of("x")).withSequence(1);

            byte[] encoded = entry.encode(Compression.DEFLATE);

            assertEquals(0, encoded[7]);
            assertArrayEquals(entry.encode(Compression.NONE), encoded);
        }

        @Test
        @DisplayName("DELETE is never compressed")
        void deleteIgnoresCompression() {
            LogEntry entry = LogEntry.delete(Bytes.of("k".repeat(1000))).withSequence(1);

            assertArrayEquals(entry.encode(), entry.encode(Compression.DEFLATE));
        }
    }

    // ========================================================================
    // Corruption
    // ========================================================================

    @Nested
    @DisplayName("Corrupt input")
    class CorruptionTests {

        @ParameterizedTest(name = "truncated to {0} bytes")
        @ValueSource(ints = {0, 1, 4, 31, 32, 33, 40, 48})
        void truncatedRecordIsRejected(int length) {
            byte[] full = LogEntry.put(KEY, VALUE).withSequence(1).encode();
            byte[] truncated = Arrays.copyOf(full, Math.min(length, full.length - 1));

            assertThrows(CorruptEntryException.class, () -> LogEntry.decode(truncated));
        }

        @Test
        @DisplayName("Failed decode leaves the buffer position untouched")
        void failedDecodeKeepsPosition() {
            byte[] full = LogEntry.put(KEY, VALUE).withSequence(1).encode();
            ByteBuffer buf = ByteBuffer.wrap(Arrays.copyOf(full, full.length - 2));

            assertThrows(CorruptEntryException.class, () -> LogEntry.decode(buf));
            assertEquals(0, buf.position());
        }

        @Test
        @DisplayName("Bit flip in the value fails the CRC")
        void bitFlipFailsCrc() {
            byte[] bytes = LogEntry.put(KEY, VALUE).withSequence(1).encode();
            bytes[LogEntry.HEADER_SIZE + KEY.length() + 2] ^= 0x10;

            CorruptEntryException e = assertThrows(CorruptEntryException.class, () -> LogEntry.decode(bytes));
            assertTrue(e.getMessage().contains("CRC"));
        }

        @Test
        @DisplayName("Wrong magic is rejected")
        void badMagic() {
            byte[] bytes = LogEntry.checkpoint().withSequence(1).encode();
            bytes[0] = 0;

            assertThrows(CorruptEntryException.class, () -> LogEntry.decode(bytes));
        }

        @Test
        @DisplayName("Zero-filled block is not a record")
        void zeroFill() {
            assertThrows(CorruptEntryException.class, () -> LogEntry.decode(new byte[4096]));
        }

        @Test
        @DisplayName("Trailing bytes after a complete record are rejected")
        void trailingBytes() {
            byte[] full = LogEntry.checkpoint().withSequence(1).encode();
            byte[] padded = Arrays.copyOf(full, full.length + 3);

            assertThrows(CorruptEntryException.class, () -> LogEntry.decode(padded));
        }

        @Test
        @DisplayName("Oversized length field is rejected before allocation")
        void oversizedLength() {
            byte[] bytes = LogEntry.put(KEY, VALUE).withSequence(1).encode();
            ByteBuffer.wrap(bytes).putInt(28, Integer.MAX_VALUE);

            assertThrows(CorruptEntryException.class, () -> LogEntry.decode(bytes));
        }
    }

    // ========================================================================
    // Construction
    // ========================================================================

    @Test
    void putWithoutValueIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new LogEntry(1, Operation.PUT, Optional.of(KEY), Optional.empty(), 0L));
    }

    @Test
    void checkpointWithKeyIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new LogEntry(1, Operation.CHECKPOINT, Optional.of(KEY), Optional.empty(), 0L));
    }

    @Test
    void negativeSequenceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> LogEntry.checkpoint().withSequence(-1));
    }

    @Test
    void withSequenceKeepsEverythingElse() {
        LogEntry entry = LogEntry.put(KEY, VALUE);
        LogEntry sequenced = entry.withSequence(99);

        assertEquals(0, entry.sequence());
        assertEquals(99, sequenced.sequence());
        assertEquals(entry.timestamp(), sequenced.timestamp());
        assertEquals(entry.key(), sequenced.key());
    }
}
