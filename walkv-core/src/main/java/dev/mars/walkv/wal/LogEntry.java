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

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.CRC32C;

/**
 * One logged operation.
 * <p>
 * <b>Record format</b> (big-endian):
 * <pre>
 * MAGIC(4) VERSION(2) OP(1) FLAGS(1) SEQUENCE(8) TIMESTAMP(8) KEY_LEN(4) VALUE_LEN(4)
 * KEY(KEY_LEN) VALUE(VALUE_LEN) CRC32C(4)
 * </pre>
 * The 32-byte header fixes the length of the whole record, so a stream of records
 * needs no separators. A length of {@code -1} marks an absent key or value.
 * The CRC covers the header, key and value as stored.
 *
 * @param sequence  position in the log, assigned by the WAL on append ({@code 0} until then)
 * @param operation what the entry does
 * @param key       the key; present for PUT and DELETE
 * @param value     the value; present for PUT only
 * @param timestamp creation time in epoch millis, informational only
 */
public record LogEntry(
        long sequence,
        Operation operation,
        Optional<Bytes> key,
        Optional<Bytes> value,
        long timestamp
) {

    /** Magic number: 'WALK' in ASCII */
    public static final int MAGIC = 0x57414C4B;

    /** Record format version */
    public static final short VERSION = 1;

    /** MAGIC(4) + VERSION(2) + OP(1) + FLAGS(1) + SEQUENCE(8) + TIMESTAMP(8) + KEY_LEN(4) + VALUE_LEN(4) */
    public static final int HEADER_SIZE = 4 + 2 + 1 + 1 + 8 + 8 + 4 + 4;

    public static final int CRC_SIZE = 4;

    /** Largest key or value the format accepts on read (1 GiB), whatever the writer's limit was */
    public static final int MAX_FIELD_SIZE = 1 << 30;

    /** Flag bit: value bytes are DEFLATE-compressed */
    static final byte FLAG_COMPRESSED = 0x01;

    private static final int ABSENT = -1;
    private static final int KEY_LEN_OFFSET = 24;
    private static final int VALUE_LEN_OFFSET = 28;

    public LogEntry {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must not be negative: " + sequence);
        }
        if (operation.hasKey() != key.isPresent()) {
            throw new IllegalArgumentException(operation + (operation.hasKey()
                    ? " requires a key" : " must not carry a key"));
        }
        if (operation.hasValue() != value.isPresent()) {
            throw new IllegalArgumentException(operation + (operation.hasValue()
                    ? " requires a value" : " must not carry a value"));
        }
    }

    /** A PUT entry without a sequence number. */
    public static LogEntry put(Bytes key, Bytes value) {
        return new LogEntry(0L, Operation.PUT, Optional.of(key), Optional.of(value), System.currentTimeMillis());
    }

    /** A DELETE entry without a sequence number. */
    public static LogEntry delete(Bytes key) {
        return new LogEntry(0L, Operation.DELETE, Optional.of(key), Optional.empty(), System.currentTimeMillis());
    }

    /** A CHECKPOINT marker without a sequence number. */
    public static LogEntry checkpoint() {
        return new LogEntry(0L, Operation.CHECKPOINT, Optional.empty(), Optional.empty(), System.currentTimeMillis());
    }

    /** Returns a copy of this entry carrying the given sequence number. */
    public LogEntry withSequence(long sequence) {
        return new LogEntry(sequence, operation, key, value, timestamp);
    }

    // ========================================================================
    // Encoding
    // ========================================================================

    /** Encodes this entry without compression. */
    public byte[] encode() {
        return encode(Compression.NONE);
    }

    /**
     * Encodes this entry as one self-delimiting record.
     *
     * @param compression applied to the value if it makes it smaller
     */
    public byte[] encode(Compression compression) {
        byte[] keyBytes = key.map(Bytes::array).orElse(null);
        byte[] valueBytes = value.map(Bytes::array).orElse(null);
        byte flags = 0;

        if (valueBytes != null) {
            byte[] compressed = compression.compress(valueBytes);
            if (compressed != null) {
                valueBytes = compressed;
                flags |= FLAG_COMPRESSED;
            }
        }

        int keyLen = keyBytes == null ? 0 : keyBytes.length;
        int valueLen = valueBytes == null ? 0 : valueBytes.length;
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE + keyLen + valueLen + CRC_SIZE);

        buf.putInt(MAGIC);
        buf.putShort(VERSION);
        buf.put(operation.code());
        buf.put(flags);
        buf.putLong(sequence);
        buf.putLong(timestamp);
        buf.putInt(keyBytes == null ? ABSENT : keyLen);
        buf.putInt(valueBytes == null ? ABSENT : valueLen);
        if (keyBytes != null) {
            buf.put(keyBytes);
        }
        if (valueBytes != null) {
            buf.put(valueBytes);
        }

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, buf.position());
        buf.putInt((int) crc.getValue());
        return buf.array();
    }

    // ========================================================================
    // Decoding
    // ========================================================================

    /**
     * Decodes exactly one record.
     *
     * @throws CorruptEntryException if the bytes are not one complete, valid record
     */
    public static LogEntry decode(byte[] bytes) {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        LogEntry entry = decode(buf);
        if (buf.hasRemaining()) {
            throw new CorruptEntryException(buf.remaining() + " trailing bytes after record");
        }
        return entry;
    }

    /**
     * Decodes the record starting at the buffer's position and advances past it.
     * On failure the position is left unchanged.
     *
     * @throws CorruptEntryException if the record is truncated or invalid
     */
    public static LogEntry decode(ByteBuffer buf) {
        int start = buf.position();
        int remaining = buf.remaining();
        if (remaining < HEADER_SIZE) {
            throw new CorruptEntryException("Truncated header: " + remaining + " of " + HEADER_SIZE + " bytes");
        }

        ByteBuffer header = buf.slice(start, HEADER_SIZE);
        int recordSize = recordSize(header);
        if (remaining < recordSize) {
            throw new CorruptEntryException("Truncated record: " + remaining + " of " + recordSize + " bytes");
        }

        ByteBuffer record = buf.slice(start, recordSize);
        CRC32C crc = new CRC32C();
        crc.update(record.slice(0, recordSize - CRC_SIZE));
        int expectedCrc = record.getInt(recordSize - CRC_SIZE);
        if ((int) crc.getValue() != expectedCrc) {
            throw new CorruptEntryException("CRC mismatch: expected=" + expectedCrc
                    + ", computed=" + (int) crc.getValue());
        }

        record.position(6);
        Operation operation = Operation.fromCode(record.get());
        byte flags = record.get();
        long sequence = record.getLong();
        long timestamp = record.getLong();
        int keyLen = record.getInt();
        int valueLen = record.getInt();

        Optional<Bytes> key = readField(record, keyLen);
        Optional<Bytes> value = readField(record, valueLen);
        if ((flags & FLAG_COMPRESSED) != 0) {
            if (value.isEmpty()) {
                throw new CorruptEntryException("Compressed flag set on a record without a value");
            }
            value = Optional.of(Bytes.wrap(Compression.inflate(value.get().array(), MAX_FIELD_SIZE)));
        }

        LogEntry entry;
        try {
            entry = new LogEntry(sequence, operation, key, value, timestamp);
        } catch (IllegalArgumentException e) {
            throw new CorruptEntryException("Invalid record: " + e.getMessage(), e);
        }
        buf.position(start + recordSize);
        return entry;
    }

    /**
     * Validates a record header and returns the size of the full record.
     *
     * @param header a buffer holding at least {@link #HEADER_SIZE} bytes, read with absolute gets
     * @throws CorruptEntryException if the header is not valid
     */
    static int recordSize(ByteBuffer header) {
        int magic = header.getInt(0);
        if (magic != MAGIC) {
            throw new CorruptEntryException("Bad magic: 0x" + Integer.toHexString(magic));
        }
        short version = header.getShort(4);
        if (version != VERSION) {
            throw new CorruptEntryException("Unsupported record version: " + version);
        }
        Operation.fromCode(header.get(6));
        int keyLen = header.getInt(KEY_LEN_OFFSET);
        int valueLen = header.getInt(VALUE_LEN_OFFSET);
        checkLength("key", keyLen);
        checkLength("value", valueLen);
        long size = (long) HEADER_SIZE + Math.max(keyLen, 0) + Math.max(valueLen, 0) + CRC_SIZE;
        if (size > Integer.MAX_VALUE) {
            throw new CorruptEntryException("Record too large: " + size + " bytes");
        }
        return (int) size;
    }

    private static void checkLength(String field, int length) {
        if (length < ABSENT || length > MAX_FIELD_SIZE) {
            throw new CorruptEntryException("Invalid " + field + " length: " + length);
        }
    }

    private static Optional<Bytes> readField(ByteBuffer record, int length) {
        if (length == ABSENT) {
            return Optional.empty();
        }
        byte[] bytes = new byte[length];
        record.get(bytes);
        return Optional.of(Bytes.wrap(bytes));
    }
}
