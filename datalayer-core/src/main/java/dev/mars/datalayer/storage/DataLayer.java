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

import dev.mars.datalayer.cluster.Configuration;
import dev.mars.datalayer.cluster.InstanceId;
import dev.mars.datalayer.cluster.RegionId;
import dev.mars.datalayer.disk.Disk;
import dev.mars.datalayer.disk.DiskFactory;
import dev.mars.datalayer.disk.DiskSnapshot;
import dev.mars.datalayer.disk.GetResult;
import dev.mars.datalayer.disk.LogDisk;
import dev.mars.datalayer.disk.ReturnCode;
import dev.mars.datalayer.disk.RollingSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Storage node entry point: the region-to-disk table, the reconciliation
 * steps driven by configuration changes, and the background maintenance loop.
 * <p>
 * <b>Usage Pattern:</b>
 * <pre>{@code
 * try (DataLayer layer = new DataLayer(DataLayerConfig.load())) {
 *     layer.prepare(config, self);
 *     layer.reconfigure(config, self);
 *     layer.cleanup(config, self);
 *
 *     layer.put(region, key, List.of(column), version);
 *     GetResult r = layer.get(region, key);
 * }
 * }</pre>
 * Foreground calls hold a reference on the disk for their whole duration, so
 * a concurrent cleanup never deletes state out from under them. A region
 * with no resident disk answers {@link ReturnCode#MISSING_DISK}.
 */
public final class DataLayer implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(DataLayer.class);

    private final DataLayerConfig config;
    private final DiskTable table = new DiskTable();
    private final ReconciliationEngine reconciliation;
    private final MaintenanceScheduler maintenance;
    private final AtomicBoolean closed = new AtomicBoolean();

    public DataLayer(DataLayerConfig config) {
        this(config, LogDisk.factory(config.diskOptions()));
    }

    public DataLayer(DataLayerConfig config, DiskFactory factory) {
        this(config, factory, Clock.systemUTC());
    }

    /**
     * Creates the data layer and starts its maintenance thread.
     */
    public DataLayer(DataLayerConfig config, DiskFactory factory, Clock clock) {
        this.config = config;
        this.reconciliation = new ReconciliationEngine(table, factory, config.baseDir());
        this.maintenance = new MaintenanceScheduler(table, config, clock);
        maintenance.start();
        LOG.info("Data layer started: {}", config);
    }

    public DataLayerConfig config() {
        return config;
    }

    // ========================================================================
    // Configuration transitions
    // ========================================================================

    /** @see ReconciliationEngine#prepare */
    public int prepare(Configuration newConfig, InstanceId self) {
        return reconciliation.prepare(newConfig, self);
    }

    /** @see ReconciliationEngine#reconfigure */
    public void reconfigure(Configuration newConfig, InstanceId self) {
        reconciliation.reconfigure(newConfig, self);
    }

    /** @see ReconciliationEngine#cleanup */
    public int cleanup(Configuration newConfig, InstanceId self) {
        return reconciliation.cleanup(newConfig, self);
    }

    // ========================================================================
    // Foreground operations
    // ========================================================================

    public GetResult get(RegionId region, byte[] key) {
        Disk disk = table.acquire(region);
        if (disk == null) {
            return GetResult.missingDisk();
        }
        try {
            return disk.get(key);
        } finally {
            disk.release();
        }
    }

    public ReturnCode put(RegionId region, byte[] key, List<byte[]> value, long version) {
        Disk disk = table.acquire(region);
        if (disk == null) {
            return ReturnCode.MISSING_DISK;
        }
        try {
            return disk.put(key, value, version);
        } finally {
            disk.release();
        }
    }

    public ReturnCode del(RegionId region, byte[] key) {
        Disk disk = table.acquire(region);
        if (disk == null) {
            return ReturnCode.MISSING_DISK;
        }
        try {
            return disk.del(key);
        } finally {
            disk.release();
        }
    }

    /**
     * Point-in-time view of every object in the region, or empty if the
     * region has no disk here.
     */
    public Optional<DiskSnapshot> makeSnapshot(RegionId region) {
        Disk disk = table.acquire(region);
        if (disk == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(disk.makeSnapshot(coordinate -> true));
        } finally {
            disk.release();
        }
    }

    /**
     * Snapshot that also reports changes made after it was taken, used to
     * stream a region to another instance. The caller must close it.
     */
    public Optional<RollingSnapshot> makeRollingSnapshot(RegionId region) {
        Disk disk = table.acquire(region);
        if (disk == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(disk.makeRollingSnapshot());
        } finally {
            disk.release();
        }
    }

    /**
     * Flushes a small batch of the region's buffered writes on the calling
     * thread.
     */
    public ReturnCode trickle(RegionId region) {
        Disk disk = table.acquire(region);
        if (disk == null) {
            return ReturnCode.MISSING_DISK;
        }
        try {
            return disk.flush(config.trickleBudget());
        } finally {
            disk.release();
        }
    }

    /**
     * Retained view of every resident disk. The caller must close it.
     */
    public DiskTable.Snapshot disks() {
        return table.snapshot();
    }

    /** Number of maintenance cycles completed so far. */
    public long maintenanceCycles() {
        return maintenance.cycles();
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Stops the maintenance thread. Disks stay resident and usable from the
     * foreground until {@link #close()}.
     */
    public void shutdown() {
        maintenance.shutdown();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        shutdown();
        table.close();
        LOG.info("Data layer closed");
    }
}
