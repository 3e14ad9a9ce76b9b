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
import dev.mars.walkv.wal.WalConfig;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Interactive console for the WAL-backed key-value store.
 * <p>
 * Opens the store, replays the log, then reads one command per line from stdin
 * until {@code QUIT} or end of input. See {@link CommandProcessor} for the commands.
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link WalConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Dwalkv.dataDir=/path -Dwalkv.segmentSizeBytes=4096 ...}</li>
 *   <li>Environment variables: {@code WALKV_DATA_DIR, WALKV_COMPRESSION, ...}</li>
 *   <li>Properties file: {@code walkv.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl walkv-demo -am
 *
 * # Run with a data directory
 * java -cp "walkv-demo/target/walkv-demo-1.0-SNAPSHOT.jar:..." dev.mars.walkv.demo.WalKvDemo /tmp/walkv
 *
 * PUT a 1
 * PUT b 2
 * DELETE a
 * CHECKPOINT
 * QUIT
 * </pre>
 * Run it again on the same directory to see the state recovered from the log.
 *
 * @see WalConfig
 */
public class WalKvDemo {

    public static void main(String[] args) throws Exception {
        PrintStream out = System.out;
        out.println("+---------------------------------------+");
        out.println("|        WAL Key-Value Store            |");
        out.println("+---------------------------------------+");
        out.println();

        // Build configuration with CLI override if provided
        WalConfig config = args.length > 0 && !args[0].isBlank()
                ? WalConfig.builder().dataDir(args[0]).build()
                : WalConfig.load();

        out.println("Configuration: " + config);
        out.println();

        try (KeyValueStore store = KeyValueStore.open(config)) {
            store.recover();
            out.println("[OK] Recovered " + store.size() + " keys from " + config.dataDir().toAbsolutePath()
                    + " (last seq=" + store.lastSequence() + ")");
            out.println("Commands: PUT key value | GET key | DELETE key | KEYS | CHECKPOINT | QUIT");
            out.println();

            CommandProcessor processor = new CommandProcessor(store);
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line;
            out.print("> ");
            out.flush();
            while ((line = in.readLine()) != null) {
                if (!line.isBlank()) {
                    Response response = processor.process(line);
                    out.println(response.render());
                    if (response.close()) {
                        break;
                    }
                }
                out.print("> ");
                out.flush();
            }
        }
        out.println();
        out.println("[OK] Store closed. Run again to see entries replayed.");
    }
}
