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
 * Writing, flushing or rotating the log failed.
 * <p>
 * The entry being appended is not durable and must not be applied to memory.
 */
public class WalWriteException extends StorageException {

    public WalWriteException(String message) {
        super(message);
    }

    public WalWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
