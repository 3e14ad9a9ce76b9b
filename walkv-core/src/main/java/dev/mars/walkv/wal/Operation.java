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

/**
 * Operation recorded by a {@link LogEntry}.
 * <p>
 * The code is the byte written to the record header and must never be renumbered.
 */
public enum Operation {

    /** Sets a key to a value. Carries both key and value. */
    PUT((byte) 1, true, true),

    /** Removes a key. Carries a key only. */
    DELETE((byte) 2, true, false),

    /** Durability marker. Carries neither key nor value. */
    CHECKPOINT((byte) 3, false, false);

    private final byte code;
    private final boolean hasKey;
    private final boolean hasValue;

    Operation(byte code, boolean hasKey, boolean hasValue) {
        this.code = code;
        this.hasKey = hasKey;
        this.hasValue = hasValue;
    }

    public byte code() {
        return code;
    }

    public boolean hasKey() {
        return hasKey;
    }

    public boolean hasValue() {
        return hasValue;
    }

    /**
     * Looks up an operation by its header code.
     *
     * @throws CorruptEntryException if no operation uses that code
     */
    public static Operation fromCode(byte code) {
        for (Operation op : values()) {
            if (op.code == code) {
                return op;
            }
        }
        throw new CorruptEntryException("Unknown operation code: " + code);
    }
}
