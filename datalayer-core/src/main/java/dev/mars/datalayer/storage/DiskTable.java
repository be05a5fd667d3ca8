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

import dev.mars.datalayer.cluster.RegionId;
import dev.mars.datalayer.disk.Disk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Authoritative mapping from region to the disk that stores it on this instance.
 * <p>
 * <b>Locking:</b> one read/write lock guards the map. Lookups and snapshots
 * take the read lock; {@link #insert} and {@link #remove} take the write lock
 * around the map update only. Creating, dropping and every other disk IO
 * happens outside the lock.
 * <p>
 * <b>Ownership:</b> the table holds one reference to each disk it maps.
 * {@link #acquire} and {@link #snapshot} hand out additional references,
 * taken under the read lock so a concurrent {@link #remove} can never
 * release the table's reference in between. A disk removed from the table
 * stays valid for every holder until the last of them releases it.
 */
public final class DiskTable implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(DiskTable.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final TreeMap<RegionId, Disk> disks = new TreeMap<>();

    /**
     * Returns the region's disk with a reference taken for the caller, who
     * must release it.
     *
     * @return the disk, or null if the region has none
     */
    public Disk acquire(RegionId region) {
        lock.readLock().lock();
        try {
            Disk disk = disks.get(region);
            if (disk != null) {
                disk.retain();
            }
            return disk;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Whether the region currently has a disk. */
    public boolean contains(RegionId region) {
        lock.readLock().lock();
        try {
            return disks.containsKey(region);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Maps {@code region} to {@code disk} unless it already has one. On success
     * the table takes over the caller's reference.
     *
     * @return false if the region already had a disk; the caller keeps its reference
     */
    public boolean insert(RegionId region, Disk disk) {
        lock.writeLock().lock();
        try {
            if (disks.containsKey(region)) {
                return false;
            }
            disks.put(region, disk);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Unmaps the region's disk and hands the table's reference to the caller,
     * who must release it.
     *
     * @return the removed disk, or null if the region had none
     */
    public Disk remove(RegionId region) {
        lock.writeLock().lock();
        try {
            return disks.remove(region);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Regions that currently have a disk, in region order. */
    public NavigableSet<RegionId> regions() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableNavigableSet(new TreeSet<>(disks.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return disks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Shallow copy of the whole mapping. Each disk is retained, not
     * duplicated, so the caller can work through it without holding the lock.
     * Close the snapshot to release the references.
     */
    public Snapshot snapshot() {
        lock.readLock().lock();
        try {
            TreeMap<RegionId, Disk> copy = new TreeMap<>(disks);
            copy.values().forEach(Disk::retain);
            return new Snapshot(copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Empties the table and releases its references without dropping any disk.
     * Used at node teardown.
     */
    @Override
    public void close() {
        List<Disk> removed;
        lock.writeLock().lock();
        try {
            removed = new ArrayList<>(disks.values());
            disks.clear();
        } finally {
            lock.writeLock().unlock();
        }
        for (Disk disk : removed) {
            disk.release();
        }
        LOG.debug("Released {} disks", removed.size());
    }

    /**
     * Point-in-time copy of the table holding one reference per disk.
     */
    public static final class Snapshot implements AutoCloseable {
        private final NavigableMap<RegionId, Disk> disks;
        private boolean closed;

        private Snapshot(TreeMap<RegionId, Disk> disks) {
            this.disks = Collections.unmodifiableNavigableMap(disks);
        }

        /** The captured mapping. Valid until the snapshot is closed. */
        public NavigableMap<RegionId, Disk> disks() {
            return disks;
        }

        /** The captured disk for {@code region}, or null. */
        public Disk get(RegionId region) {
            return disks.get(region);
        }

        public boolean contains(RegionId region) {
            return disks.containsKey(region);
        }

        public NavigableSet<RegionId> regions() {
            return disks.navigableKeySet();
        }

        public int size() {
            return disks.size();
        }

        public boolean isEmpty() {
            return disks.isEmpty();
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            disks.values().forEach(Disk::release);
        }
    }
}
