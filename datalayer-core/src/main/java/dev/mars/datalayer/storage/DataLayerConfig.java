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
package dev.mars.datalayer.storage;

import dev.mars.datalayer.disk.LogDisk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for the data layer.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Ddatalayer.baseDir=/path})</li>
 *   <li>Environment variables (e.g., {@code DATALAYER_BASE_DIR})</li>
 *   <li>Properties file ({@code datalayer.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>baseDir</td><td>datalayer.baseDir</td><td>DATALAYER_BASE_DIR</td><td>~/.datalayer/data</td></tr>
 *   <tr><td>syncEnabled</td><td>datalayer.syncEnabled</td><td>DATALAYER_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>flushBudget</td><td>datalayer.flushBudget</td><td>DATALAYER_FLUSH_BUDGET</td><td>10000</td></tr>
 *   <tr><td>trickleBudget</td><td>datalayer.trickleBudget</td><td>DATALAYER_TRICKLE_BUDGET</td><td>1000</td></tr>
 *   <tr><td>idleSleepMs</td><td>datalayer.idleSleepMs</td><td>DATALAYER_IDLE_SLEEP_MS</td><td>100</td></tr>
 *   <tr><td>preallocationIntervalMs</td><td>datalayer.preallocationIntervalMs</td><td>DATALAYER_PREALLOCATION_INTERVAL_MS</td><td>1000</td></tr>
 *   <tr><td>optimisticIoIntervalMs</td><td>datalayer.optimisticIoIntervalMs</td><td>DATALAYER_OPTIMISTIC_IO_INTERVAL_MS</td><td>1000</td></tr>
 *   <tr><td>segmentSizeMb</td><td>datalayer.segmentSizeMb</td><td>DATALAYER_SEGMENT_SIZE_MB</td><td>64</td></tr>
 *   <tr><td>writeBufferEntries</td><td>datalayer.writeBufferEntries</td><td>DATALAYER_WRITE_BUFFER_ENTRIES</td><td>65536</td></tr>
 *   <tr><td>writeBufferMb</td><td>datalayer.writeBufferMb</td><td>DATALAYER_WRITE_BUFFER_MB</td><td>16</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # datalayer.properties
 * datalayer.baseDir=/var/lib/datalayer
 * datalayer.syncEnabled=true
 * datalayer.flushBudget=10000
 * datalayer.idleSleepMs=100
 * </pre>
 */
public final class DataLayerConfig {

    private static final Logger LOG = LoggerFactory.getLogger(DataLayerConfig.class);

    private static final String PROPERTIES_FILE = "datalayer.properties";

    private static final Path DEFAULT_BASE_DIR = Path.of(System.getProperty("user.home"), ".datalayer", "data");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_FLUSH_BUDGET = 10_000;
    private static final int DEFAULT_TRICKLE_BUDGET = 1_000;
    private static final int DEFAULT_IDLE_SLEEP_MS = 100;
    private static final int DEFAULT_PREALLOCATION_INTERVAL_MS = 1_000;
    private static final int DEFAULT_OPTIMISTIC_IO_INTERVAL_MS = 1_000;
    private static final int DEFAULT_SEGMENT_SIZE_MB = 64;
    private static final int DEFAULT_WRITE_BUFFER_ENTRIES = 65_536;
    private static final int DEFAULT_WRITE_BUFFER_MB = 16;

    private final Path baseDir;
    private final boolean syncEnabled;
    private final int flushBudget;
    private final int trickleBudget;
    private final int idleSleepMs;
    private final int preallocationIntervalMs;
    private final int optimisticIoIntervalMs;
    private final int segmentSizeMb;
    private final int writeBufferEntries;
    private final int writeBufferMb;

    private DataLayerConfig(Builder builder) {
        this.baseDir = builder.baseDir;
        this.syncEnabled = builder.syncEnabled;
        this.flushBudget = builder.flushBudget;
        this.trickleBudget = builder.trickleBudget;
        this.idleSleepMs = builder.idleSleepMs;
        this.preallocationIntervalMs = builder.preallocationIntervalMs;
        this.optimisticIoIntervalMs = builder.optimisticIoIntervalMs;
        this.segmentSizeMb = builder.segmentSizeMb;
        this.writeBufferEntries = builder.writeBufferEntries;
        this.writeBufferMb = builder.writeBufferMb;
    }

    /** Directory under which every region keeps its own subdirectory. */
    public Path baseDir() {
        return baseDir;
    }

    /** Whether segment syncs force to the device (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Records moved per disk by each maintenance flush. */
    public int flushBudget() {
        return flushBudget;
    }

    /** Records moved by one {@code trickle} call. */
    public int trickleBudget() {
        return trickleBudget;
    }

    /** Pause after a maintenance cycle that made no progress. */
    public Duration idleSleep() {
        return Duration.ofMillis(idleSleepMs);
    }

    /** Minimum spacing of preallocation passes. */
    public Duration preallocationInterval() {
        return Duration.ofMillis(preallocationIntervalMs);
    }

    /** Minimum spacing of optimistic-IO passes. */
    public Duration optimisticIoInterval() {
        return Duration.ofMillis(optimisticIoIntervalMs);
    }

    public int segmentSizeMb() {
        return segmentSizeMb;
    }

    public int writeBufferEntries() {
        return writeBufferEntries;
    }

    public int writeBufferMb() {
        return writeBufferMb;
    }

    /** Options for the {@link LogDisk}s created under this configuration. */
    public LogDisk.Options diskOptions() {
        return new LogDisk.Options(
                (long) segmentSizeMb * 1024 * 1024,
                writeBufferEntries,
                (long) writeBufferMb * 1024 * 1024,
                syncEnabled);
    }

    @Override
    public String toString() {
        return "DataLayerConfig{" +
                "baseDir=" + baseDir +
                ", syncEnabled=" + syncEnabled +
                ", flushBudget=" + flushBudget +
                ", trickleBudget=" + trickleBudget +
                ", idleSleepMs=" + idleSleepMs +
                ", preallocationIntervalMs=" + preallocationIntervalMs +
                ", optimisticIoIntervalMs=" + optimisticIoIntervalMs +
                ", segmentSizeMb=" + segmentSizeMb +
                ", writeBufferEntries=" + writeBufferEntries +
                ", writeBufferMb=" + writeBufferMb +
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
     * Shorthand for {@code DataLayerConfig.builder().build()}.
     */
    public static DataLayerConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link DataLayerConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path baseDir;
        private Boolean syncEnabled;
        private Integer flushBudget;
        private Integer trickleBudget;
        private Integer idleSleepMs;
        private Integer preallocationIntervalMs;
        private Integer optimisticIoIntervalMs;
        private Integer segmentSizeMb;
        private Integer writeBufferEntries;
        private Integer writeBufferMb;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        public Builder baseDir(Path baseDir) {
            this.baseDir = baseDir;
            return this;
        }

        public Builder baseDir(String baseDir) {
            this.baseDir = Path.of(baseDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets the per-disk maintenance flush budget (default: 10000). */
        public Builder flushBudget(int flushBudget) {
            this.flushBudget = flushBudget;
            return this;
        }

        /** Sets the trickle budget (default: 1000). */
        public Builder trickleBudget(int trickleBudget) {
            this.trickleBudget = trickleBudget;
            return this;
        }

        /** Sets the idle sleep in milliseconds (default: 100). */
        public Builder idleSleepMs(int idleSleepMs) {
            this.idleSleepMs = idleSleepMs;
            return this;
        }

        /** Sets the preallocation pass interval in milliseconds (default: 1000). */
        public Builder preallocationIntervalMs(int preallocationIntervalMs) {
            this.preallocationIntervalMs = preallocationIntervalMs;
            return this;
        }

        /** Sets the optimistic-IO pass interval in milliseconds (default: 1000). */
        public Builder optimisticIoIntervalMs(int optimisticIoIntervalMs) {
            this.optimisticIoIntervalMs = optimisticIoIntervalMs;
            return this;
        }

        /** Sets the segment roll size in MB (default: 64). */
        public Builder segmentSizeMb(int segmentSizeMb) {
            this.segmentSizeMb = segmentSizeMb;
            return this;
        }

        /** Sets the write buffer entry cap (default: 65536). */
        public Builder writeBufferEntries(int writeBufferEntries) {
            this.writeBufferEntries = writeBufferEntries;
            return this;
        }

        /** Sets the write buffer byte cap in MB (default: 16). */
        public Builder writeBufferMb(int writeBufferMb) {
            this.writeBufferMb = writeBufferMb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a numeric setting is not positive
         */
        public DataLayerConfig build() {
            // Resolve each value with priority: programmatic > sysprop > env > file > default
            if (baseDir == null) {
                baseDir = resolve("datalayer.baseDir", "DATALAYER_BASE_DIR", Path::of, DEFAULT_BASE_DIR);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve("datalayer.syncEnabled", "DATALAYER_SYNC_ENABLED",
                        Boolean::parseBoolean, DEFAULT_SYNC_ENABLED);
            }
            if (flushBudget == null) {
                flushBudget = resolveInt("datalayer.flushBudget", "DATALAYER_FLUSH_BUDGET", DEFAULT_FLUSH_BUDGET);
            }
            if (trickleBudget == null) {
                trickleBudget = resolveInt("datalayer.trickleBudget", "DATALAYER_TRICKLE_BUDGET",
                        DEFAULT_TRICKLE_BUDGET);
            }
            if (idleSleepMs == null) {
                idleSleepMs = resolveInt("datalayer.idleSleepMs", "DATALAYER_IDLE_SLEEP_MS", DEFAULT_IDLE_SLEEP_MS);
            }
            if (preallocationIntervalMs == null) {
                preallocationIntervalMs = resolveInt("datalayer.preallocationIntervalMs",
                        "DATALAYER_PREALLOCATION_INTERVAL_MS", DEFAULT_PREALLOCATION_INTERVAL_MS);
            }
            if (optimisticIoIntervalMs == null) {
                optimisticIoIntervalMs = resolveInt("datalayer.optimisticIoIntervalMs",
                        "DATALAYER_OPTIMISTIC_IO_INTERVAL_MS", DEFAULT_OPTIMISTIC_IO_INTERVAL_MS);
            }
            if (segmentSizeMb == null) {
                segmentSizeMb = resolveInt("datalayer.segmentSizeMb", "DATALAYER_SEGMENT_SIZE_MB",
                        DEFAULT_SEGMENT_SIZE_MB);
            }
            if (writeBufferEntries == null) {
                writeBufferEntries = resolveInt("datalayer.writeBufferEntries", "DATALAYER_WRITE_BUFFER_ENTRIES",
                        DEFAULT_WRITE_BUFFER_ENTRIES);
            }
            if (writeBufferMb == null) {
                writeBufferMb = resolveInt("datalayer.writeBufferMb", "DATALAYER_WRITE_BUFFER_MB",
                        DEFAULT_WRITE_BUFFER_MB);
            }

            requirePositive("flushBudget", flushBudget);
            requirePositive("trickleBudget", trickleBudget);
            requirePositive("idleSleepMs", idleSleepMs);
            requirePositive("segmentSizeMb", segmentSizeMb);
            requirePositive("writeBufferEntries", writeBufferEntries);
            requirePositive("writeBufferMb", writeBufferMb);
            if (preallocationIntervalMs < 0 || optimisticIoIntervalMs < 0) {
                throw new IllegalArgumentException("maintenance intervals must not be negative");
            }

            return new DataLayerConfig(this);
        }

        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return parser.apply(value.trim());
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return parser.apply(value.trim());
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return parser.apply(value.trim());
            }

            // 4. Default
            return defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            return resolve(sysProp, envVar, value -> {
                try {
                    return Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    LOG.warn("Ignoring non-numeric {}={}, using {}", sysProp, value, defaultValue);
                    return defaultValue;
                }
            }, defaultValue);
        }

        private static void requirePositive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = DataLayerConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
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
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
