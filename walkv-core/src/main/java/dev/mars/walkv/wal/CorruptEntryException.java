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
 * A record could not be decoded: truncated, bad magic or version, inconsistent
 * lengths, or a CRC mismatch.
 * <p>
 * At the tail of the newest segment this is a torn write and replay stops quietly.
 * Anywhere else it means the log is damaged, and it is thrown to the caller.
 */
public class CorruptEntryException extends StorageException {

    public CorruptEntryException(String message) {
        super(message);
    }

    public CorruptEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
