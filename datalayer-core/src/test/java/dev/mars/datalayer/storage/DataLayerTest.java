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
import dev.mars.datalayer.cluster.EntityId;
import dev.mars.datalayer.cluster.InstanceId;
import dev.mars.datalayer.cluster.RegionId;
import dev.mars.datalayer.cluster.StaticConfiguration;
import dev.mars.datalayer.disk.DiskSnapshot;
import dev.mars.datalayer.disk.GetResult;
import dev.mars.datalayer.disk.ReturnCode;
import dev.mars.datalayer.disk.RollingSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link DataLayer} over real {@link dev.mars.datalayer.disk.LogDisk}s.
 */
class DataLayerTest {

    private static final InstanceId SELF = new InstanceId("10.0.0.1", 2012);
    private static final InstanceId PEER = new InstanceId("10.0.0.2", 2012);

    private static final RegionId A = new RegionId(5, 0, 1, 0x0000000000000000L);
    private static final RegionId B = new RegionId(5, 0, 1, 0x8000000000000000L);

    @TempDir
    Path tempDir;

    private DataLayer layer;

    @BeforeEach
    void setUp() {
        DataLayerConfig config = DataLayerConfig.builder()
                .baseDir(tempDir)
                .syncEnabled(false)
                .idleSleepMs(5)
                .segmentSizeMb(1)
                .writeBufferMb(1)
                .build();
        layer = new DataLayer(config);
    }

    @AfterEach
    void tearDown() {
        layer.close();
    }

    @Test
    void testTransitionDropsHandedOffRegion() throws Exception {
        Configuration v1 = configuration(1, SELF, SELF);
        assertEquals(2, apply(v1));
        try (DiskTable.Snapshot disks = layer.disks()) {
            assertEquals(Set.of(A, B), disks.regions());
        }
        Path dropped = diskDirectory(B);

        assertEquals(ReturnCode.SUCCESS, layer.put(B, bytes("k"), List.of(bytes("v")), 1));

        Configuration v2 = configuration(2, SELF, PEER);
        assertEquals(0, apply(v2));

        try (DiskTable.Snapshot disks = layer.disks()) {
            assertEquals(Set.of(A), disks.regions());
        }
        assertEquals(ReturnCode.MISSING_DISK, layer.get(B, bytes("k")).code());
        assertEquals(ReturnCode.MISSING_DISK, layer.put(B, bytes("k"), List.of(bytes("v")), 2));
        assertEquals(ReturnCode.MISSING_DISK, layer.del(B, bytes("k")));
        assertEquals(ReturnCode.MISSING_DISK, layer.trickle(B));
        assertTrue(layer.makeSnapshot(B).isEmpty());
        awaitRemoval(dropped);
        assertFalse(Files.exists(dropped), "dropped region's files removed");
        assertTrue(Files.isDirectory(diskDirectory(A)));
    }

    @Test
    void testRecreatedRegionSurvivesReleaseOfDroppedDisk() throws Exception {
        apply(configuration(1, SELF, SELF));
        Path first = diskDirectory(B);

        DiskTable.Snapshot held = layer.disks();
        try {
            apply(configuration(2, SELF, PEER));
            assertEquals(1, apply(configuration(3, SELF, SELF)));

            assertEquals(ReturnCode.SUCCESS, layer.put(B, bytes("k"), List.of(bytes("v")), 3));
            // the maintenance thread may have flushed first
            assertNotEquals(ReturnCode.IO_ERROR, layer.trickle(B));
            assertTrue(Files.isDirectory(first), "dropped disk is still held");
        } finally {
            held.close();
        }

        awaitRemoval(first);
        assertFalse(Files.exists(first), "dropped disk removed its own directory");

        Path second = diskDirectory(B);
        assertNotEquals(first, second);
        assertTrue(segmentBytes(second) > 0, "live disk kept its segment");
        assertEquals(ReturnCode.SUCCESS, layer.put(B, bytes("k2"), List.of(bytes("v2")), 4));
        assertNotEquals(ReturnCode.IO_ERROR, layer.trickle(B));
        GetResult result = layer.get(B, bytes("k"));
        assertTrue(result.isFound());
        assertEquals(3, result.version());
    }

    @Test
    void testForegroundOperations() {
        apply(configuration(1, SELF, SELF));

        assertEquals(ReturnCode.SUCCESS, layer.put(A, bytes("alice"), List.of(bytes("engineer")), 3));
        GetResult result = layer.get(A, bytes("alice"));
        assertTrue(result.isFound());
        assertEquals(3, result.version());
        assertArrayEquals(bytes("engineer"), result.value().get(0));

        assertEquals(ReturnCode.WRONG_ARITY, layer.put(A, bytes("bob"), List.of(), 1));
        assertEquals(ReturnCode.SUCCESS, layer.del(A, bytes("alice")));
        assertEquals(ReturnCode.NOT_FOUND, layer.get(A, bytes("alice")).code());
    }

    @Test
    void testTrickleFlushesOnCallingThread() {
        apply(configuration(1, SELF, SELF));
        layer.shutdown();

        layer.put(A, bytes("k"), List.of(bytes("v")), 1);
        assertEquals(ReturnCode.SUCCESS, layer.trickle(A));
        assertEquals(ReturnCode.DID_NOTHING, layer.trickle(A));
    }

    @Test
    void testSnapshots() {
        apply(configuration(1, SELF, SELF));
        layer.put(A, bytes("a"), List.of(bytes("1")), 1);
        layer.put(A, bytes("b"), List.of(bytes("2")), 1);

        Optional<DiskSnapshot> snapshot = layer.makeSnapshot(A);
        assertTrue(snapshot.isPresent());
        int count = 0;
        try (DiskSnapshot snap = snapshot.get()) {
            for (; snap.valid(); snap.next()) {
                count++;
            }
        }
        assertEquals(2, count);

        Optional<RollingSnapshot> rolling = layer.makeRollingSnapshot(A);
        assertTrue(rolling.isPresent());
        try (RollingSnapshot snap = rolling.get()) {
            snap.next();
            snap.next();
            assertFalse(snap.valid());
            layer.put(A, bytes("c"), List.of(bytes("3")), 1);
            assertTrue(snap.valid());
            assertArrayEquals(bytes("c"), snap.key());
        }
        assertTrue(layer.makeRollingSnapshot(B).isPresent());
        assertTrue(layer.makeRollingSnapshot(new RegionId(9, 0, 0, 0L)).isEmpty());
    }

    @Test
    void testMaintenanceDrainsWrites() throws Exception {
        apply(configuration(1, SELF, SELF));
        layer.put(A, bytes("k"), List.of(bytes("v")), 1);

        long deadline = System.currentTimeMillis() + 5000;
        Path dir = diskDirectory(A);
        while (segmentBytes(dir) == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(segmentBytes(dir) > 0, "background flush reached the segment");
        assertTrue(layer.maintenanceCycles() > 0);
    }

    @Test
    void testCloseIsIdempotent() throws Exception {
        apply(configuration(1, SELF, SELF));
        Path dir = diskDirectory(A);
        layer.close();
        layer.close();
        try (DiskTable.Snapshot disks = layer.disks()) {
            assertTrue(disks.isEmpty());
        }
        assertTrue(Files.isDirectory(dir), "close keeps files");
    }

    private int apply(Configuration config) {
        int created = layer.prepare(config, SELF);
        layer.reconfigure(config, SELF);
        layer.cleanup(config, SELF);
        return created;
    }

    private static Configuration configuration(long version, InstanceId ownerA, InstanceId ownerB) {
        return StaticConfiguration.builder()
                .version(version)
                .region(A, 2)
                .region(B, 2)
                .hasher(A.subspaceId(), key -> key.length)
                .entity(new EntityId(A, 0), ownerA)
                .entity(new EntityId(B, 0), ownerB)
                .build();
    }

    /** The directory of the region's current disk. */
    private Path diskDirectory(RegionId region) throws Exception {
        try (Stream<Path> dirs = Files.list(tempDir.resolve(region.pathName()))) {
            return dirs.max((a, b) -> Long.compare(incarnation(a), incarnation(b)))
                    .orElseThrow();
        }
    }

    private static long incarnation(Path dir) {
        return Long.parseLong(dir.getFileName().toString().substring("disk-".length()));
    }

    // the maintenance thread may still hold a dropped disk for the rest of its cycle
    private static void awaitRemoval(Path dir) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (Files.exists(dir) && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
    }

    private static long segmentBytes(Path dir) throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            long total = 0;
            Iterator<Path> it = files.iterator();
            while (it.hasNext()) {
                total += Files.size(it.next());
            }
            return total;
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
