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

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Value compression applied when a {@link LogEntry} is encoded.
 * <p>
 * Only PUT values are compressed. A record says in its flags whether its value is
 * compressed, so decoding never depends on the writer's setting.
 */
public enum Compression {

    NONE,

    /** zlib stream, default level. */
    DEFLATE;

    /**
     * Compresses the input.
     *
     * @return the compressed bytes, or {@code null} if compression would not shrink the input
     */
    byte[] compress(byte[] input) {
        if (this == NONE || input.length == 0) {
            return null;
        }
        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION);
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(input.length);
            byte[] chunk = new byte[4096];
            while (!deflater.finished()) {
                int n = deflater.deflate(chunk);
                out.write(chunk, 0, n);
                if (out.size() >= input.length) {
                    return null;
                }
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    /**
     * Inflates a value written with {@link #DEFLATE}.
     *
     * @param input    the compressed bytes
     * @param maxBytes upper bound on the inflated size
     * @throws CorruptEntryException if the stream is malformed or inflates past {@code maxBytes}
     */
    static byte[] inflate(byte[] input, int maxBytes) {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(input);
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length * 2));
            byte[] chunk = new byte[4096];
            while (!inflater.finished()) {
                int n = inflater.inflate(chunk);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new CorruptEntryException("Compressed value is truncated");
                }
                out.write(chunk, 0, n);
                if (out.size() > maxBytes) {
                    throw new CorruptEntryException("Compressed value inflates past " + maxBytes + " bytes");
                }
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new CorruptEntryException("Compressed value is malformed", e);
        } finally {
            inflater.end();
        }
    }
}
