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
package dev.mars.walkv.demo;

import dev.mars.walkv.store.KeyValueStore;
import dev.mars.walkv.wal.Bytes;
import dev.mars.walkv.wal.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns text commands into store calls.
 * <p>
 * This is the boundary a network server would sit behind: one line in, one
 * {@link Response} out. Keys and values are UTF-8.
 * <pre>
 * PUT key value...   -> OK seq=N
 * GET key            -> RESULT value | NOT_FOUND
 * DELETE key         -> OK | NOT_FOUND   (logged either way)
 * KEYS               -> RESULT k1 k2 ...
 * CHECKPOINT         -> OK seq=N
 * QUIT               -> OK Goodbye
 * </pre>
 * A storage failure is always answered with {@code ERROR}, never {@code OK}.
 */
public final class CommandProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(CommandProcessor.class);

    private final KeyValueStore store;

    public CommandProcessor(KeyValueStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Executes one command line.
     *
     * @param line the raw command; leading and trailing whitespace is ignored
     * @return the reply, never null
     */
    public Response process(String line) {
        if (line == null || line.isBlank()) {
            return Response.error("Empty command");
        }
        String[] parts = line.strip().split("\\s+", 3);
        String command = parts[0].toUpperCase(Locale.ROOT);

        try {
            switch (command) {
                case "PUT":
                    if (parts.length < 3) {
                        return Response.error("Usage: PUT key value");
                    }
                    long putSeq = store.put(Bytes.of(parts[1]), Bytes.of(parts[2]));
                    return Response.ok("seq=" + putSeq);

                case "GET":
                    if (parts.length != 2) {
                        return Response.error("Usage: GET key");
                    }
                    Optional<Bytes> value = store.get(Bytes.of(parts[1]));
                    return value.map(v -> Response.result(v.toUtf8()))
                            .orElseGet(() -> Response.notFound("Key: " + parts[1] + " not found"));

                case "DELETE":
                    if (parts.length != 2) {
                        return Response.error("Usage: DELETE key");
                    }
                    return store.delete(Bytes.of(parts[1]))
                            ? Response.ok("")
                            : Response.notFound("Key: " + parts[1] + " not found");

                case "KEYS":
                    return Response.result(store.keys().stream()
                            .sorted()
                            .map(Bytes::toUtf8)
                            .collect(Collectors.joining(" ")));

                case "CHECKPOINT":
                    return Response.ok("seq=" + store.checkpoint());

                case "QUIT":
                    return Response.bye();

                default:
                    return Response.error("Unknown command: " + parts[0]);
            }
        } catch (StorageException e) {
            LOG.error("{} failed: {}", command, e.getMessage(), e);
            return Response.error(command + " failed: " + e.getMessage());
        } catch (IllegalStateException e) {
            LOG.warn("{} rejected: {}", command, e.getMessage());
            return Response.error(e.getMessage());
        }
    }
}
