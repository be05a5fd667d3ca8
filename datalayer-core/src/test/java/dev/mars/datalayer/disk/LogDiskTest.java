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
package dev.mars.datalayer.disk;

import dev.mars.datalayer.StorageException;
import dev.mars.datalayer.log.SegmentChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LogDisk}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Point reads and writes, including arity checks</li>
 *   <li>Write buffer limits and the maintenance calls that drain it</li>
 *   <li>Frozen and rolling snapshots</li>
 *   <li>Deletion of a dropped disk on its last release</li>
 * </ul>
 */
class LogDiskTest {

    private static final Hasher FIRST_BYTE = key -> key.length == 0 ? 0 : key[0] & 0xFF;

    private static final LogDisk.Options OPTIONS = new LogDisk.Options(4096, 1024, 1 << 20, false);

    @TempDir
    Path tempDir;

    private Path diskDir;
    private LogDisk disk;

    @BeforeEach
    void setUp() {
        diskDir = tempDir.resolve("region");
        disk = LogDisk.create(diskDir, FIRST_BYTE, 2, OPTIONS);
    }

    @AfterEach
    void tearDown() {
        if (disk.refCnt() > 0) {
            disk.release(disk.refCnt());
        }
    }

    // ========================================================================
    // Foreground Operations
    // ========================================================================

    @Nested
    @DisplayName("Foreground operations")
    class ForegroundTests {

        @Test
        @DisplayName("put then get returns the stored value and version")
        void testPutGet() {
            assertEquals(ReturnCode.SUCCESS, disk.put(bytes("k"), List.of(bytes("v1")), 3));

            GetResult result = disk.get(bytes("k"));
            assertTrue(result.isFound());
            assertEquals(3, result.version());
            assertArrayEquals(bytes("v1"), result.value().get(0));
        }

        @Test
        @DisplayName("put overwrites an existing key")
        void testOverwrite() {
            disk.put(bytes("k"), List.of(bytes("v1")), 1);
            disk.put(bytes("k"), List.of(bytes("v2")), 2);

            GetResult result = disk.get(bytes("k"));
            assertEquals(2, result.version());
            assertArrayEquals(bytes("v2"), result.value().get(0));
        }

        @Test
        @DisplayName("Stored value is isolated from the caller's arrays")
        void testDefensiveCopy() {
            byte[] key = bytes("k");
            byte[] value = bytes("v");
            disk.put(key, List.of(value), 1);
            key[0] = 'x';
            value[0] = 'x';

            assertArrayEquals(bytes("v"), disk.get(bytes("k")).value().get(0));
        }

        @Test
        @DisplayName("Changing an array returned by get leaves the stored value alone")
        void testReadReturnsCopies() {
            disk.put(bytes("k"), List.of(new byte[]{1}), 1);

            disk.get(bytes("k")).value().get(0)[0] = 99;

            assertArrayEquals(new byte[]{1}, disk.get(bytes("k")).value().get(0));
        }

        @Test
        @DisplayName("get of an absent key returns NOT_FOUND")
        void testGetMissing() {
            GetResult result = disk.get(bytes("nope"));
            assertEquals(ReturnCode.NOT_FOUND, result.code());
            assertTrue(result.value().isEmpty());
        }

        @Test
        @DisplayName("del removes the key; deleting again is NOT_FOUND")
        void testDel() {
            disk.put(bytes("k"), List.of(bytes("v")), 1);

            assertEquals(ReturnCode.SUCCESS, disk.del(bytes("k")));
            assertFalse(disk.get(bytes("k")).isFound());
            assertEquals(ReturnCode.NOT_FOUND, disk.del(bytes("k")));
        }

        @Test
        @DisplayName("Wrong number of values is rejected without buffering")
        void testWrongArity() {
            assertEquals(ReturnCode.WRONG_ARITY, disk.put(bytes("k"), List.of(), 1));
            assertEquals(ReturnCode.WRONG_ARITY, disk.put(bytes("k"), List.of(bytes("a"), bytes("b")), 1));
            assertEquals(0, disk.bufferedEntries());
            assertFalse(disk.get(bytes("k")).isFound());
        }

        @Test
        @DisplayName("Column count below one is rejected")
        void testInvalidColumns() {
            assertThrows(IllegalArgumentException.class,
                    () -> LogDisk.create(tempDir.resolve("bad"), FIRST_BYTE, 0, OPTIONS));
        }
    }

    // ========================================================================
    // Write Buffer
    // ========================================================================

    @Nested
    @DisplayName("Write buffer limits")
    class BufferTests {

        @Test
        @DisplayName("Entry limit reports SEARCH_FULL until flushed")
        void testSearchFull() {
            LogDisk small = LogDisk.create(tempDir.resolve("small"), FIRST_BYTE, 2,
                    new LogDisk.Options(4096, 2, 1 << 20, false));
            try {
                assertEquals(ReturnCode.SUCCESS, small.put(bytes("a"), List.of(bytes("1")), 1));
                assertEquals(ReturnCode.SUCCESS, small.put(bytes("b"), List.of(bytes("2")), 1));

                ReturnCode full = small.put(bytes("c"), List.of(bytes("3")), 1);
                assertEquals(ReturnCode.SEARCH_FULL, full);
                assertTrue(full.isBufferFull());
                assertFalse(small.get(bytes("c")).isFound(), "rejected write is not visible");

                assertEquals(ReturnCode.SUCCESS, small.flush(10));
                assertEquals(ReturnCode.SUCCESS, small.put(bytes("c"), List.of(bytes("3")), 1));
            } finally {
                small.release();
            }
        }

        @Test
        @DisplayName("Byte limit reports DATA_FULL")
        void testDataFull() {
            LogDisk small = LogDisk.create(tempDir.resolve("small"), FIRST_BYTE, 2,
                    new LogDisk.Options(4096, 1024, 64, false));
            try {
                byte[] value = new byte[30];
                assertEquals(ReturnCode.SUCCESS, small.put(bytes("k1"), List.of(value), 1));

                ReturnCode full = small.put(bytes("k2"), List.of(value), 1);
                assertEquals(ReturnCode.DATA_FULL, full);
                assertTrue(full.isBufferFull());

                assertEquals(ReturnCode.SUCCESS, small.mandatoryIo());
                assertEquals(ReturnCode.SUCCESS, small.put(bytes("k2"), List.of(value), 1));
            } finally {
                small.release();
            }
        }

        @Test
        @DisplayName("A single oversized record is accepted into an empty buffer")
        void testOversizedRecordIntoEmptyBuffer() {
            LogDisk small = LogDisk.create(tempDir.resolve("small"), FIRST_BYTE, 2,
                    new LogDisk.Options(4096, 1024, 16, false));
            try {
                assertEquals(ReturnCode.SUCCESS, small.put(bytes("k"), List.of(new byte[100]), 1));
                assertEquals(ReturnCode.DATA_FULL, small.put(bytes("j"), List.of(new byte[1]), 1));
            } finally {
                small.release();
            }
        }
    }

    // ========================================================================
    // Maintenance
    // ========================================================================

    @Nested
    @DisplayName("Maintenance operations")
    class MaintenanceTests {

        @Test
        @DisplayName("flush honours its budget")
        void testFlushBudget() {
            for (int i = 0; i < 5; i++) {
                disk.put(bytes("k" + i), List.of(bytes("v")), 1);
            }
            assertEquals(5, disk.bufferedEntries());

            assertEquals(ReturnCode.SUCCESS, disk.flush(2));
            assertEquals(3, disk.bufferedEntries());
            assertEquals(ReturnCode.SUCCESS, disk.flush(100));
            assertEquals(0, disk.bufferedEntries());
            assertEquals(ReturnCode.DID_NOTHING, disk.flush(100));
        }

        @Test
        @DisplayName("flush rejects a non-positive budget")
        void testFlushInvalidBudget() {
            assertThrows(IllegalArgumentException.class, () -> disk.flush(0));
        }

        @Test
        @DisplayName("flush rolls to a new segment once the tail is full")
        void testFlushRolls() {
            LogDisk small = LogDisk.create(tempDir.resolve("small"), FIRST_BYTE, 2,
                    new LogDisk.Options(100, 1024, 1 << 20, false));
            try {
                for (int i = 0; i < 10; i++) {
                    small.put(bytes("k" + i), List.of(new byte[20]), 1);
                }
                small.flush(100);

                SegmentChain chain = small.segments();
                try {
                    assertTrue(chain.size() > 1, "expected a roll, got " + chain);
                    for (int i = 1; i < chain.size(); i++) {
                        assertTrue(chain.lowerBound(i) > chain.lowerBound(i - 1));
                    }
                } finally {
                    chain.release();
                }
            } finally {
                small.release();
            }
        }

        @Test
        @DisplayName("preallocate creates one spare segment at a time")
        void testPreallocate() throws Exception {
            assertEquals(1, segmentFiles(diskDir));
            assertEquals(ReturnCode.SUCCESS, disk.preallocate());
            assertEquals(2, segmentFiles(diskDir));
            assertEquals(ReturnCode.DID_NOTHING, disk.preallocate());
            assertEquals(2, segmentFiles(diskDir));
        }

        @Test
        @DisplayName("A roll consumes the preallocated spare")
        void testRollUsesSpare() throws Exception {
            LogDisk small = LogDisk.create(tempDir.resolve("small"), FIRST_BYTE, 2,
                    new LogDisk.Options(10, 1024, 1 << 20, false));
            try {
                assertEquals(ReturnCode.SUCCESS, small.preallocate());
                small.put(bytes("a"), List.of(bytes("1")), 1);
                small.put(bytes("b"), List.of(bytes("2")), 1);
                small.flush(10);

                assertEquals(2, segmentFiles(tempDir.resolve("small")), "second record went to the spare");
                assertEquals(ReturnCode.SUCCESS, small.preallocate());
            } finally {
                small.release();
            }
        }

        @Test
        @DisplayName("optimisticIo syncs only when there is something new")
        void testOptimisticIo() {
            assertEquals(ReturnCode.DID_NOTHING, disk.optimisticIo());

            disk.put(bytes("k"), List.of(bytes("v")), 1);
            assertEquals(ReturnCode.DID_NOTHING, disk.optimisticIo(), "buffered, not yet flushed");

            disk.flush(10);
            assertEquals(ReturnCode.SUCCESS, disk.optimisticIo());
            assertEquals(ReturnCode.DID_NOTHING, disk.optimisticIo());
        }

        @Test
        @DisplayName("mandatoryIo drains the whole buffer")
        void testMandatoryIo() {
            for (int i = 0; i < 50; i++) {
                disk.put(bytes("k" + i), List.of(bytes("v")), 1);
            }
            assertEquals(ReturnCode.SUCCESS, disk.mandatoryIo());
            assertEquals(0, disk.bufferedEntries());
            assertEquals(ReturnCode.DID_NOTHING, disk.mandatoryIo());
        }
    }

    // ========================================================================
    // Snapshots
    // ========================================================================

    @Nested
    @DisplayName("Snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("Snapshot yields matching entries in key order")
        void testSnapshotFilterAndOrder() {
            disk.put(new byte[]{4}, List.of(bytes("d")), 1);
            disk.put(new byte[]{1}, List.of(bytes("a")), 1);
            disk.put(new byte[]{2}, List.of(bytes("b")), 1);
            disk.put(new byte[]{(byte) 0x80}, List.of(bytes("h")), 1);

            List<Integer> keys = new ArrayList<>();
            try (DiskSnapshot snap = disk.makeSnapshot(c -> c % 2 == 0)) {
                for (; snap.valid(); snap.next()) {
                    keys.add(snap.key()[0] & 0xFF);
                }
            }
            assertEquals(List.of(2, 4, 0x80), keys);
        }

        @Test
        @DisplayName("Snapshot does not see later writes")
        void testSnapshotIsFrozen() {
            disk.put(bytes("a"), List.of(bytes("1")), 1);
            try (DiskSnapshot snap = disk.makeSnapshot(c -> true)) {
                disk.put(bytes("b"), List.of(bytes("2")), 1);
                disk.del(bytes("a"));

                assertTrue(snap.valid());
                assertArrayEquals(bytes("a"), snap.key());
                assertArrayEquals(bytes("1"), snap.value().get(0));
                snap.next();
                assertFalse(snap.valid());
            }
        }

        @Test
        @DisplayName("Exhausted snapshot throws on access")
        void testExhaustedSnapshot() {
            try (DiskSnapshot snap = disk.makeSnapshot(c -> true)) {
                assertFalse(snap.valid());
                assertThrows(NoSuchElementException.class, snap::key);
            }
        }

        @Test
        @DisplayName("Rolling snapshot yields the initial contents, then later changes")
        void testRollingSnapshot() {
            disk.put(bytes("a"), List.of(bytes("1")), 1);

            try (RollingSnapshot snap = disk.makeRollingSnapshot()) {
                assertTrue(snap.valid());
                assertArrayEquals(bytes("a"), snap.key());
                assertTrue(snap.hasValue());
                snap.next();
                assertFalse(snap.valid(), "caught up");

                disk.put(bytes("b"), List.of(bytes("2")), 2);
                disk.del(bytes("a"));

                assertTrue(snap.valid());
                assertArrayEquals(bytes("b"), snap.key());
                assertEquals(2, snap.version());
                snap.next();

                assertTrue(snap.valid());
                assertArrayEquals(bytes("a"), snap.key());
                assertFalse(snap.hasValue());
                assertTrue(snap.value().isEmpty());
                snap.next();
                assertFalse(snap.valid());
            }
        }

        @Test
        @DisplayName("Closed rolling snapshot stops receiving changes")
        void testRollingSnapshotClose() {
            RollingSnapshot snap = disk.makeRollingSnapshot();
            snap.close();
            disk.put(bytes("a"), List.of(bytes("1")), 1);
            assertFalse(snap.valid());
            assertEquals(0, disk.openRollingSnapshots());
        }

        @Test
        @DisplayName("Rolling snapshot stays registered until closed")
        void testRollingSnapshotRegisteredUntilClosed() {
            RollingSnapshot first = disk.makeRollingSnapshot();
            RollingSnapshot second = disk.makeRollingSnapshot();
            assertEquals(2, disk.openRollingSnapshots());

            first.close();
            first.close();
            assertEquals(1, disk.openRollingSnapshots());

            second.close();
            assertEquals(0, disk.openRollingSnapshots());
        }

        @Test
        @DisplayName("Changing arrays returned by snapshots leaves the stored value alone")
        void testSnapshotsReturnCopies() {
            disk.put(bytes("a"), List.of(new byte[]{1}), 1);

            try (DiskSnapshot snap = disk.makeSnapshot(coordinate -> true)) {
                snap.value().get(0)[0] = 99;
            }
            RollingSnapshot rolling = disk.makeRollingSnapshot();
            try {
                assertTrue(rolling.valid());
                rolling.value().get(0)[0] = 98;
            } finally {
                rolling.close();
            }

            assertArrayEquals(new byte[]{1}, disk.get(bytes("a")).value().get(0));
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Releasing an undropped disk keeps its files")
        void testReleaseKeepsFiles() {
            disk.release();
            assertTrue(Files.isDirectory(diskDir));
        }

        @Test
        @DisplayName("Dropped disk is deleted on its last release")
        void testDropDeletesOnLastRelease() {
            disk.retain();
            disk.drop();
            assertTrue(disk.isDropped());

            disk.release();
            assertTrue(Files.isDirectory(diskDir), "a holder remains");
            assertEquals(ReturnCode.SUCCESS, disk.put(bytes("k"), List.of(bytes("v")), 1),
                    "held disk stays usable after drop");

            disk.release();
            assertFalse(Files.exists(diskDir));
        }

        @Test
        @DisplayName("create refuses a directory that already holds files")
        void testCreateRefusesNonEmptyDirectory() throws Exception {
            Path dir = tempDir.resolve("occupied");
            Files.createDirectories(dir);
            Files.writeString(dir.resolve("leftover.log"), "old");

            assertThrows(StorageException.class, () -> LogDisk.create(dir, FIRST_BYTE, 2, OPTIONS));
            assertEquals("old", Files.readString(dir.resolve("leftover.log")));

            assertThrows(StorageException.class, () -> LogDisk.create(diskDir, FIRST_BYTE, 2, OPTIONS),
                    "a live disk's directory is not taken over");
            assertEquals(1, segmentFiles(diskDir));
        }

        @Test
        @DisplayName("create accepts an existing empty directory")
        void testCreateInEmptyDirectory() throws Exception {
            Path dir = tempDir.resolve("empty");
            Files.createDirectories(dir);

            LogDisk fresh = LogDisk.create(dir, FIRST_BYTE, 2, OPTIONS);
            try {
                assertEquals(1, segmentFiles(dir));
                assertFalse(fresh.get(bytes("k")).isFound());
            } finally {
                fresh.release();
            }
        }
    }

    private static long segmentFiles(Path dir) throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().startsWith("segment-")).count();
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
