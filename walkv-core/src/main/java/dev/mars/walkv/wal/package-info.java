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
/**
 * Write-ahead log: record format, segment files, append and replay.
 * <p>
 * <ul>
 *   <li>{@link dev.mars.walkv.wal.LogEntry} - One logged operation and its binary record</li>
 *   <li>{@link dev.mars.walkv.wal.WriteAheadLog} - The log interface</li>
 *   <li>{@link dev.mars.walkv.wal.FileWriteAheadLog} - Segmented file implementation</li>
 *   <li>{@link dev.mars.walkv.wal.WalConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Persist-before-apply:</b> An append is durable before it returns</li>
 *   <li><b>Crash safety:</b> A torn record at the tail is cut off on open</li>
 *   <li><b>Sequential replay:</b> Segments in id order, records in file order</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  ├─ wal.lock
 *  ├─ segment-00000000000000000001.wal   // sealed, never written again
 *  └─ segment-00000000000000000002.wal   // active
 * </pre>
 *
 * @see dev.mars.walkv.wal.WriteAheadLog
 */
package dev.mars.walkv.wal;
