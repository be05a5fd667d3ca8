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

import dev.mars.datalayer.StorageException;
import dev.mars.datalayer.cluster.Configuration;
import dev.mars.datalayer.cluster.EntityId;
import dev.mars.datalayer.cluster.InstanceId;
import dev.mars.datalayer.cluster.RegionId;
import dev.mars.datalayer.disk.Disk;
import dev.mars.datalayer.disk.DiskFactory;
import dev.mars.datalayer.disk.Hasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeSet;

/**
 * Brings the {@link DiskTable} in line with a configuration snapshot.
 * <p>
 * <b>Usage Pattern (every configuration transition):</b>
 * <pre>{@code
 * engine.prepare(config, self);      // create disks we now need
 * engine.reconfigure(config, self);  // migration bookkeeping
 * engine.cleanup(config, self);      // drop disks nobody needs
 * }</pre>
 * {@code prepare} must complete before {@code cleanup} starts, so a region
 * handed to this instance gains its disk before cleanup can judge the old
 * one unreferenced. Both steps are idempotent: replaying the same snapshot
 * creates and drops nothing.
 * <p>
 * Runs synchronously on the thread that delivers the configuration;
 * overlapping deliveries are serialized on the engine.
 * Problems are contained here: a region that cannot be created is logged
 * and skipped, and the rest of the transition proceeds.
 * <p>
 * <b>Directories:</b> every disk created for a region gets a directory of
 * its own, {@code <baseDir>/<region>/disk-<n>}, with {@code n} never reused.
 * A dropped disk that is still held removes only its own directory when
 * released, so a later disk for the same region is unaffected.
 */
public final class ReconciliationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ReconciliationEngine.class);

    private static final String INCARNATION_PREFIX = "disk-";

    private final DiskTable table;
    private final DiskFactory factory;
    private final Path baseDir;
    private long lastIncarnation;

    public ReconciliationEngine(DiskTable table, DiskFactory factory, Path baseDir) {
        this.table = table;
        this.factory = factory;
        this.baseDir = baseDir;
    }

    /**
     * Creates a disk for every region that {@code self} owns an entity of, or
     * that is being transferred to {@code self}, and that has no disk yet.
     * Entities of the reserved unassigned space are ignored.
     *
     * @return the number of disks created
     */
    public synchronized int prepare(Configuration config, InstanceId self) {
        Set<RegionId> present = table.regions();
        Map<RegionId, Integer> regions = config.regions();
        Set<RegionId> wanted = new TreeSet<>();

        for (Map.Entry<EntityId, InstanceId> entry : config.entityMapping().entrySet()) {
            RegionId region = entry.getKey().region();
            if (!region.isUnassigned() && entry.getValue().equals(self)) {
                wanted.add(region);
            }
        }
        wanted.addAll(config.transfersTo(self).values());
        wanted.removeAll(present);

        int created = 0;
        for (RegionId region : wanted) {
            Integer columns = regions.get(region);
            if (columns == null) {
                LOG.error("Configuration {} is inconsistent: {} is assigned to {} but has no size; skipping",
                        config.version(), region, self);
                continue;
            }
            if (createDisk(config, region, columns)) {
                created++;
            }
        }

        LOG.debug("prepare(version={}): created {} disks, {} resident", config.version(), created, table.size());
        return created;
    }

    /**
     * Hook between {@link #prepare} and {@link #cleanup} for migration
     * bookkeeping. Nothing needs to happen here yet.
     */
    public void reconfigure(Configuration config, InstanceId self) {
        LOG.trace("reconfigure(version={}) for {}", config.version(), self);
    }

    /**
     * Drops every resident disk whose region {@code self} neither owns an
     * entity of (anywhere in the region's entity range) nor is receiving by
     * transfer. Regions that are already gone are skipped silently.
     *
     * @return the number of disks dropped
     */
    public synchronized int cleanup(Configuration config, InstanceId self) {
        NavigableMap<EntityId, InstanceId> entities = config.entityMapping();
        Collection<RegionId> transfers = config.transfersTo(self).values();

        int dropped = 0;
        for (RegionId region : table.regions()) {
            boolean owned = entities
                    .subMap(EntityId.first(region), true, EntityId.last(region), true)
                    .containsValue(self);
            if (owned || transfers.contains(region)) {
                continue;
            }
            if (dropDisk(region)) {
                dropped++;
            }
        }

        LOG.debug("cleanup(version={}): dropped {} disks, {} resident", config.version(), dropped, table.size());
        return dropped;
    }

    private boolean createDisk(Configuration config, RegionId region, int columns) {
        LOG.info("Creating {} with {} columns", region, columns);
        Disk disk;
        try {
            Hasher hasher = config.diskHasher(region.subspaceId());
            disk = factory.create(nextIncarnation(region), hasher, columns);
        } catch (RuntimeException e) {
            LOG.error("Failed to create disk for {}: {}", region, e.getMessage(), e);
            return false;
        }

        if (!table.insert(region, disk)) {
            LOG.warn("{} gained a disk concurrently; dropping the one just created", region);
            disk.drop();
            disk.release();
            return false;
        }
        return true;
    }

    /**
     * Picks a directory for a new disk of {@code region}, numbered above every
     * incarnation issued so far and every one already on disk.
     */
    private Path nextIncarnation(RegionId region) {
        Path regionDir = baseDir.resolve(region.pathName());
        long highest = lastIncarnation;
        if (Files.isDirectory(regionDir)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(regionDir, INCARNATION_PREFIX + "*")) {
                for (Path entry : entries) {
                    highest = Math.max(highest, incarnationNumber(entry));
                }
            } catch (IOException e) {
                throw new StorageException("Failed to list " + regionDir, e);
            }
        }
        lastIncarnation = highest + 1;
        return regionDir.resolve(INCARNATION_PREFIX + lastIncarnation);
    }

    private static long incarnationNumber(Path entry) {
        String name = entry.getFileName().toString();
        try {
            return Long.parseLong(name.substring(INCARNATION_PREFIX.length()));
        } catch (NumberFormatException e) {
            LOG.debug("Ignoring unrecognised entry {}", entry);
            return 0;
        }
    }

    private boolean dropDisk(RegionId region) {
        Disk disk = table.remove(region);
        if (disk == null) {
            return false;
        }
        LOG.info("Dropping {}", region);
        disk.drop();
        disk.release();
        return true;
    }
}
