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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for the write-ahead log and the store on top of it.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dwalkv.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code WALKV_DATA_DIR})</li>
 *   <li>Properties file ({@code walkv.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>walkv.dataDir</td><td>WALKV_DATA_DIR</td><td>~/.walkv/data</td></tr>
 *   <tr><td>syncEnabled</td><td>walkv.syncEnabled</td><td>WALKV_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>verifyWrites</td><td>walkv.verifyWrites</td><td>WALKV_VERIFY_WRITES</td><td>false</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>walkv.minFreeSpaceMb</td><td>WALKV_MIN_FREE_SPACE_MB</td><td>64</td></tr>
 *   <tr><td>maxPayloadSizeMb</td><td>walkv.maxPayloadSizeMb</td><td>WALKV_MAX_PAYLOAD_SIZE_MB</td><td>16</td></tr>
 *   <tr><td>segmentSizeBytes</td><td>walkv.segmentSizeBytes</td><td>WALKV_SEGMENT_SIZE_BYTES</td><td>10485760</td></tr>
 *   <tr><td>compression</td><td>walkv.compression</td><td>WALKV_COMPRESSION</td><td>NONE</td></tr>
 *   <tr><td>rotateOnCheckpoint</td><td>walkv.rotateOnCheckpoint</td><td>WALKV_ROTATE_ON_CHECKPOINT</td><td>true</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # walkv.properties
 * walkv.dataDir=/var/lib/walkv/data
 * walkv.syncEnabled=true
 * walkv.segmentSizeBytes=67108864
 * walkv.compression=DEFLATE
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * WalConfig config = WalConfig.builder()
 *     .dataDir(Path.of("/var/lib/walkv"))
 *     .segmentSizeBytes(64 * 1024 * 1024)
 *     .build();
 *
 * KeyValueStore store = KeyValueStore.open(config);
 * </pre>
 */
public final class WalConfig {

    private static final Logger LOG = LoggerFactory.getLogger(WalConfig.class);

    private static final String PROPERTIES_FILE = "walkv.properties";

    // Property keys
    private static final String PROP_DATA_DIR = "walkv.dataDir";
    private static final String PROP_SYNC_ENABLED = "walkv.syncEnabled";
    private static final String PROP_VERIFY_WRITES = "walkv.verifyWrites";
    private static final String PROP_MIN_FREE_SPACE_MB = "walkv.minFreeSpaceMb";
    private static final String PROP_MAX_PAYLOAD_SIZE_MB = "walkv.maxPayloadSizeMb";
    private static final String PROP_SEGMENT_SIZE_BYTES = "walkv.segmentSizeBytes";
    private static final String PROP_COMPRESSION = "walkv.compression";
    private static final String PROP_ROTATE_ON_CHECKPOINT = "walkv.rotateOnCheckpoint";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "WALKV_DATA_DIR";
    private static final String ENV_SYNC_ENABLED = "WALKV_SYNC_ENABLED";
    private static final String ENV_VERIFY_WRITES = "WALKV_VERIFY_WRITES";
    private static final String ENV_MIN_FREE_SPACE_MB = "WALKV_MIN_FREE_SPACE_MB";
    private static final String ENV_MAX_PAYLOAD_SIZE_MB = "WALKV_MAX_PAYLOAD_SIZE_MB";
    private static final String ENV_SEGMENT_SIZE_BYTES = "WALKV_SEGMENT_SIZE_BYTES";
    private static final String ENV_COMPRESSION = "WALKV_COMPRESSION";
    private static final String ENV_ROTATE_ON_CHECKPOINT = "WALKV_ROTATE_ON_CHECKPOINT";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".walkv", "data");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final boolean DEFAULT_VERIFY_WRITES = false;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 64;
    private static final int DEFAULT_MAX_PAYLOAD_SIZE_MB = 16;
    private static final long DEFAULT_SEGMENT_SIZE_BYTES = 10L * 1024 * 1024;
    private static final Compression DEFAULT_COMPRESSION = Compression.NONE;
    private static final boolean DEFAULT_ROTATE_ON_CHECKPOINT = true;

    /** Upper bound for maxPayloadSizeMb; the record format itself reads fields up to this size */
    private static final int MAX_PAYLOAD_SIZE_MB = LogEntry.MAX_FIELD_SIZE / (1024 * 1024);

    private final Path dataDir;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int minFreeSpaceMb;
    private final int maxPayloadSizeMb;
    private final long segmentSizeBytes;
    private final Compression compression;
    private final boolean rotateOnCheckpoint;

    private WalConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.syncEnabled = builder.syncEnabled;
        this.verifyWrites = builder.verifyWrites;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.maxPayloadSizeMb = builder.maxPayloadSizeMb;
        this.segmentSizeBytes = builder.segmentSizeBytes;
        this.compression = builder.compression;
        this.rotateOnCheckpoint = builder.rotateOnCheckpoint;
    }

    /** Directory holding the segment files and the lock file. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether to read every record back after writing it and compare it byte for byte with what was written. */
    public boolean verifyWrites() {
        return verifyWrites;
    }

    /** Minimum free disk space in MB required before writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Maximum key or value size in MB accepted by append. Replay is not bound by it. */
    public int maxPayloadSizeMb() {
        return maxPayloadSizeMb;
    }

    /** Segment size in bytes at which the log rotates to a new file. */
    public long segmentSizeBytes() {
        return segmentSizeBytes;
    }

    /** Compression applied to PUT values. */
    public Compression compression() {
        return compression;
    }

    /** Whether a checkpoint closes the current segment. */
    public boolean rotateOnCheckpoint() {
        return rotateOnCheckpoint;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** Maximum key or value size in bytes. */
    public int maxPayloadSizeBytes() {
        return maxPayloadSizeMb * 1024 * 1024;
    }

    @Override
    public String toString() {
        return "WalConfig{" +
                "dataDir=" + dataDir +
                ", syncEnabled=" + syncEnabled +
                ", verifyWrites=" + verifyWrites +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", maxPayloadSizeMb=" + maxPayloadSizeMb +
                ", segmentSizeBytes=" + segmentSizeBytes +
                ", compression=" + compression +
                ", rotateOnCheckpoint=" + rotateOnCheckpoint +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code WalConfig.builder().build()}.
     */
    public static WalConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link WalConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private Boolean syncEnabled;
        private Boolean verifyWrites;
        private Integer minFreeSpaceMb;
        private Integer maxPayloadSizeMb;
        private Long segmentSizeBytes;
        private Compression compression;
        private Boolean rotateOnCheckpoint;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables write verification (default: false). */
        public Builder verifyWrites(boolean verifyWrites) {
            this.verifyWrites = verifyWrites;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 64). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /** Sets maximum key or value size in MB (default: 16). */
        public Builder maxPayloadSizeMb(int maxPayloadSizeMb) {
            this.maxPayloadSizeMb = maxPayloadSizeMb;
            return this;
        }

        /** Sets the rotation threshold in bytes (default: 10 MB). */
        public Builder segmentSizeBytes(long segmentSizeBytes) {
            this.segmentSizeBytes = segmentSizeBytes;
            return this;
        }

        /** Sets value compression (default: NONE). */
        public Builder compression(Compression compression) {
            this.compression = compression;
            return this;
        }

        /** Whether a checkpoint rotates the log (default: true). */
        public Builder rotateOnCheckpoint(boolean rotateOnCheckpoint) {
            this.rotateOnCheckpoint = rotateOnCheckpoint;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a resolved value is out of range
         */
        public WalConfig build() {
            if (dataDir == null) {
                dataDir = resolve(PROP_DATA_DIR, ENV_DATA_DIR, v -> Path.of(v), DEFAULT_DATA_DIR);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, Boolean::parseBoolean, DEFAULT_SYNC_ENABLED);
            }
            if (verifyWrites == null) {
                verifyWrites = resolve(PROP_VERIFY_WRITES, ENV_VERIFY_WRITES, Boolean::parseBoolean, DEFAULT_VERIFY_WRITES);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolve(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, Integer::parseInt, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxPayloadSizeMb == null) {
                maxPayloadSizeMb = resolve(PROP_MAX_PAYLOAD_SIZE_MB, ENV_MAX_PAYLOAD_SIZE_MB, Integer::parseInt, DEFAULT_MAX_PAYLOAD_SIZE_MB);
            }
            if (segmentSizeBytes == null) {
                segmentSizeBytes = resolve(PROP_SEGMENT_SIZE_BYTES, ENV_SEGMENT_SIZE_BYTES, Long::parseLong, DEFAULT_SEGMENT_SIZE_BYTES);
            }
            if (compression == null) {
                compression = resolve(PROP_COMPRESSION, ENV_COMPRESSION,
                        v -> Compression.valueOf(v.trim().toUpperCase(Locale.ROOT)), DEFAULT_COMPRESSION);
            }
            if (rotateOnCheckpoint == null) {
                rotateOnCheckpoint = resolve(PROP_ROTATE_ON_CHECKPOINT, ENV_ROTATE_ON_CHECKPOINT, Boolean::parseBoolean, DEFAULT_ROTATE_ON_CHECKPOINT);
            }

            if (minFreeSpaceMb < 0) {
                throw new IllegalArgumentException("minFreeSpaceMb must not be negative: " + minFreeSpaceMb);
            }
            if (maxPayloadSizeMb <= 0 || maxPayloadSizeMb > MAX_PAYLOAD_SIZE_MB) {
                throw new IllegalArgumentException("maxPayloadSizeMb must be in (0, " + MAX_PAYLOAD_SIZE_MB + "]: "
                        + maxPayloadSizeMb);
            }
            if (segmentSizeBytes <= 0) {
                throw new IllegalArgumentException("segmentSizeBytes must be positive: " + segmentSizeBytes);
            }

            return new WalConfig(this);
        }

        /**
         * Resolves one value: system property, then environment variable, then
         * properties file, then the default. A value that does not parse is
         * skipped with a warning.
         */
        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            String[][] sources = {
                    {"system property " + sysProp, System.getProperty(sysProp)},
                    {"environment variable " + envVar, System.getenv(envVar)},
                    {PROPERTIES_FILE + " entry " + sysProp, fileProperties.getProperty(sysProp)}
            };
            for (String[] source : sources) {
                String value = source[1];
                if (value == null || value.isBlank()) {
                    continue;
                }
                try {
                    return parser.apply(value.trim());
                } catch (IllegalArgumentException e) {
                    LOG.warn("Ignoring invalid {}='{}': {}", source[0], value, e.getMessage());
                }
            }
            return defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = WalConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    LOG.debug("Loaded {} from classpath", PROPERTIES_FILE);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                    LOG.debug("Loaded {} from working directory", PROPERTIES_FILE);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
