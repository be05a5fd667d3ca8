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
import dev.mars.datalayer.log.FileSegment;
import dev.mars.datalayer.log.SegmentChain;
import dev.mars.datalayer.log.SegmentedLog;
import io.netty.util.AbstractReferenceCounted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.LongPredicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.CRC32C;

/**
 * {@link Disk} that keeps its index in memory and its writes in a
 * {@link SegmentedLog} of {@link FileSegment}s.
 * <p>
 * <b>Files:</b>
 * <pre>
 * &lt;region dir&gt;/
 *  ├─ segment-00000000.log   // oldest live segment
 *  ├─ segment-00000001.log
 *  └─ segment-0000000N.log   // tail, or a preallocated spare
 * </pre>
 * <p>
 * <b>Write path:</b> {@code put}/{@code del} update the index and append an
 * encoded record to a bounded write buffer. The buffer is bounded both in
 * entries ({@link ReturnCode#SEARCH_FULL}) and bytes ({@link ReturnCode#DATA_FULL}).
 * {@link #flush(int)} moves buffered records to the tail segment, rolling to
 * a new segment once the tail reaches the configured size.
 * <p>
 * <b>Maintenance:</b>
 * <ul>
 *   <li>{@link #preallocate()} creates the next segment file ahead of need</li>
 *   <li>{@link #optimisticIo()} syncs the segment chain</li>
 *   <li>{@link #mandatoryIo()} drains the whole buffer, then syncs</li>
 * </ul>
 * <p>
 * <b>Record format:</b>
 * <pre>
 * MAGIC(4) TYPE(1) VERSION(8) KEY_LEN(4) VALUE_COUNT(4) KEY (VALUE_LEN(4) VALUE)* CRC32C(4)
 * </pre>
 * <p>
 * <b>Thread Safety:</b> all index and buffer state is guarded by the disk
 * monitor. Syncs run outside it so foreground writes are not blocked on fsync.
 */
public final class LogDisk extends AbstractReferenceCounted implements Disk {

    private static final Logger LOG = LoggerFactory.getLogger(LogDisk.class);

    /** Magic number: 'RGND' in ASCII */
    private static final int MAGIC = 0x52474E44;

    private static final byte TYPE_PUT = 1;
    private static final byte TYPE_DEL = 2;

    /** Header size: MAGIC(4) + TYPE(1) + VERSION(8) + KEY_LEN(4) + VALUE_COUNT(4) */
    private static final int HEADER_SIZE = 4 + 1 + 8 + 4 + 4;

    private static final int CRC_SIZE = 4;

    private static final String SEGMENT_FILE_FORMAT = "segment-%08d.log";

    private static final Comparator<Change> KEY_ORDER =
            (a, b) -> Arrays.compareUnsigned(a.key(), b.key());

    /**
     * Tunables of a {@link LogDisk}.
     *
     * @param segmentSizeBytes   tail size at which the log rolls to a new segment
     * @param writeBufferEntries maximum number of buffered writes
     * @param writeBufferBytes   maximum encoded size of buffered writes
     * @param syncEnabled        whether syncs force to the device (should be true in production)
     */
    public record Options(long segmentSizeBytes, int writeBufferEntries, long writeBufferBytes,
                          boolean syncEnabled) {
        public Options {
            if (segmentSizeBytes <= 0 || writeBufferEntries <= 0 || writeBufferBytes <= 0) {
                throw new IllegalArgumentException("disk options must be positive: segmentSizeBytes=" +
                        segmentSizeBytes + ", writeBufferEntries=" + writeBufferEntries +
                        ", writeBufferBytes=" + writeBufferBytes);
            }
        }
    }

    private final Path directory;
    private final Hasher hasher;
    private final int columns;
    private final Options options;
    private final SegmentedLog log = new SegmentedLog();

    private final Map<ByteBuffer, Change> index = new HashMap<>();
    private final ArrayDeque<ByteBuffer> buffer = new ArrayDeque<>();
    private final List<RollingCursor> rollingCursors = new ArrayList<>();
    private long bufferedBytes;
    private FileSegment spare;
    private int nextSegmentNumber;

    private volatile boolean dropped;

    private LogDisk(Path directory, Hasher hasher, int columns, Options options) {
        this.directory = directory;
        this.hasher = hasher;
        this.columns = columns;
        this.options = options;
    }

    /**
     * Returns a factory creating {@link LogDisk}s with the given options.
     */
    public static DiskFactory factory(Options options) {
        return (directory, hasher, columns) -> create(directory, hasher, columns, options);
    }

    /**
     * Creates a fresh disk in {@code directory}, which must be absent or empty.
     * The disk owns the directory from then on and deletes it when dropped.
     *
     * @return the disk, holding one reference owned by the caller
     * @throws StorageException if the directory already holds files, or the
     *                          directory or the first segment cannot be created
     */
    public static LogDisk create(Path directory, Hasher hasher, int columns, Options options) {
        if (columns < 1) {
            throw new IllegalArgumentException("column count must be positive: " + columns);
        }
        try {
            if (Files.isDirectory(directory) && !isEmptyDirectory(directory)) {
                throw new StorageException("Refusing to create a disk in non-empty directory " + directory);
            }
            Files.createDirectories(directory);
        } catch (IOException e) {
            LOG.error("Failed to prepare disk directory {}: {}", directory, e.getMessage(), e);
            throw new StorageException("Failed to prepare disk directory " + directory, e);
        }

        LogDisk disk = new LogDisk(directory, hasher, columns, options);
        try {
            synchronized (disk) {
                disk.rollTo(disk.newSegment());
            }
        } catch (StorageException e) {
            disk.release();
            throw e;
        }
        LOG.debug("LogDisk created: dir={}, columns={}, options={}", directory, columns, options);
        return disk;
    }

    public Path directory() {
        return directory;
    }

    public int columns() {
        return columns;
    }

    public boolean isDropped() {
        return dropped;
    }

    /** Number of rolling snapshots opened and not yet closed. */
    public synchronized int openRollingSnapshots() {
        return rollingCursors.size();
    }

    /** Number of writes buffered but not yet flushed. */
    public synchronized int bufferedEntries() {
        return buffer.size();
    }

    /**
     * Current segment chain, retained for the caller, who must release it.
     */
    public SegmentChain segments() {
        return log.acquire();
    }

    // ========================================================================
    // Foreground Operations
    // ========================================================================

    @Override
    public synchronized GetResult get(byte[] key) {
        Change stored = index.get(ByteBuffer.wrap(key));
        if (stored == null) {
            return GetResult.notFound();
        }
        return GetResult.found(copyOf(stored.value()), stored.version());
    }

    @Override
    public synchronized ReturnCode put(byte[] key, List<byte[]> value, long version) {
        if (value.size() != columns - 1) {
            LOG.debug("Rejecting put to {}: {} values for {} columns", directory, value.size(), columns);
            return ReturnCode.WRONG_ARITY;
        }
        ReturnCode room = enqueue(encode(TYPE_PUT, key, value, version));
        if (room != ReturnCode.SUCCESS) {
            return room;
        }
        byte[] storedKey = key.clone();
        List<byte[]> storedValue = value.stream().map(byte[]::clone).collect(Collectors.toUnmodifiableList());
        Change change = new Change(storedKey, storedValue, version);
        index.put(ByteBuffer.wrap(storedKey), change);
        publish(change);
        return ReturnCode.SUCCESS;
    }

    @Override
    public synchronized ReturnCode del(byte[] key) {
        Change stored = index.get(ByteBuffer.wrap(key));
        if (stored == null) {
            return ReturnCode.NOT_FOUND;
        }
        ReturnCode room = enqueue(encode(TYPE_DEL, key, List.of(), stored.version()));
        if (room != ReturnCode.SUCCESS) {
            return room;
        }
        index.remove(ByteBuffer.wrap(key));
        publish(new Change(stored.key(), null, stored.version()));
        return ReturnCode.SUCCESS;
    }

    @Override
    public synchronized DiskSnapshot makeSnapshot(LongPredicate coordinateFilter) {
        List<Change> entries = new ArrayList<>();
        for (Change stored : index.values()) {
            if (coordinateFilter.test(hasher.hash(stored.key()))) {
                entries.add(stored);
            }
        }
        entries.sort(KEY_ORDER);
        return new FrozenCursor(entries);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Every later {@code put} and {@code del} is queued on the snapshot until
     * it is read or closed, so an abandoned snapshot grows without bound.
     */
    @Override
    public synchronized RollingSnapshot makeRollingSnapshot() {
        List<Change> entries = new ArrayList<>(index.values());
        entries.sort(KEY_ORDER);
        RollingCursor cursor = new RollingCursor(entries);
        rollingCursors.add(cursor);
        return cursor;
    }

    // ========================================================================
    // Maintenance Operations
    // ========================================================================

    @Override
    public synchronized ReturnCode preallocate() {
        if (spare != null) {
            return ReturnCode.DID_NOTHING;
        }
        try {
            spare = newSegment();
            LOG.debug("Preallocated {}", spare.path());
            return ReturnCode.SUCCESS;
        } catch (StorageException e) {
            LOG.warn("Preallocation in {} failed: {}", directory, e.getMessage());
            return ReturnCode.IO_ERROR;
        }
    }

    @Override
    public ReturnCode optimisticIo() {
        try {
            return log.sync() ? ReturnCode.SUCCESS : ReturnCode.DID_NOTHING;
        } catch (StorageException e) {
            LOG.warn("Sync of {} failed: {}", directory, e.getMessage());
            return ReturnCode.IO_ERROR;
        }
    }

    @Override
    public ReturnCode mandatoryIo() {
        ReturnCode flushed = flush(Integer.MAX_VALUE);
        if (flushed == ReturnCode.IO_ERROR) {
            return flushed;
        }
        ReturnCode synced = optimisticIo();
        if (synced == ReturnCode.IO_ERROR) {
            return synced;
        }
        return flushed == ReturnCode.SUCCESS || synced == ReturnCode.SUCCESS
                ? ReturnCode.SUCCESS
                : ReturnCode.DID_NOTHING;
    }

    @Override
    public synchronized ReturnCode flush(int budget) {
        if (budget <= 0) {
            throw new IllegalArgumentException("flush budget must be positive: " + budget);
        }
        if (buffer.isEmpty()) {
            return ReturnCode.DID_NOTHING;
        }
        int written = 0;
        try {
            while (written < budget && !buffer.isEmpty()) {
                ensureTailCapacity();
                ByteBuffer record = buffer.peek();
                log.append(record.duplicate());
                buffer.poll();
                bufferedBytes -= record.remaining();
                written++;
            }
        } catch (StorageException e) {
            LOG.warn("Flush of {} failed after {} records: {}", directory, written, e.getMessage());
            return ReturnCode.IO_ERROR;
        }
        LOG.trace("Flushed {} records in {}, {} still buffered", written, directory, buffer.size());
        return ReturnCode.SUCCESS;
    }

    @Override
    public void drop() {
        dropped = true;
        LOG.debug("Marked {} for removal", directory);
    }

    @Override
    protected void deallocate() {
        synchronized (this) {
            if (spare != null) {
                spare.release();
                spare = null;
            }
            rollingCursors.clear();
        }
        log.close();

        if (dropped) {
            try {
                deleteRecursively(directory);
                LOG.info("Removed dropped disk {}", directory);
            } catch (IOException e) {
                LOG.error("Failed to remove dropped disk {}: {}", directory, e.getMessage(), e);
            }
        } else {
            LOG.debug("Closed disk {}", directory);
        }
    }

    @Override
    public LogDisk touch(Object hint) {
        return this;
    }

    @Override
    public String toString() {
        return "LogDisk{" + directory + ", columns=" + columns + ", refCnt=" + refCnt() + '}';
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private ReturnCode enqueue(ByteBuffer record) {
        if (buffer.size() >= options.writeBufferEntries()) {
            return ReturnCode.SEARCH_FULL;
        }
        // an oversized record still goes through once the buffer is drained
        if (!buffer.isEmpty() && bufferedBytes + record.remaining() > options.writeBufferBytes()) {
            return ReturnCode.DATA_FULL;
        }
        buffer.add(record);
        bufferedBytes += record.remaining();
        return ReturnCode.SUCCESS;
    }

    private void publish(Change change) {
        for (RollingCursor cursor : rollingCursors) {
            cursor.offer(change);
        }
    }

    private synchronized void detach(RollingCursor cursor) {
        rollingCursors.remove(cursor);
    }

    private void ensureTailCapacity() {
        if (log.tailSize() < options.segmentSizeBytes()) {
            return;
        }
        FileSegment next = spare != null ? spare : newSegment();
        spare = null;
        rollTo(next);
    }

    private void rollTo(FileSegment segment) {
        try {
            log.roll(segment);
        } finally {
            // the published chain holds its own reference
            segment.release();
        }
    }

    private FileSegment newSegment() {
        Path path = directory.resolve(String.format(SEGMENT_FILE_FORMAT, nextSegmentNumber++));
        FileSegment segment = FileSegment.create(path, options.syncEnabled());
        if (options.syncEnabled()) {
            syncDirectory(directory);
        }
        return segment;
    }

    private static ByteBuffer encode(byte type, byte[] key, List<byte[]> value, long version) {
        int size = HEADER_SIZE + key.length + CRC_SIZE;
        for (byte[] attribute : value) {
            size += 4 + attribute.length;
        }
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putInt(MAGIC);
        buf.put(type);
        buf.putLong(version);
        buf.putInt(key.length);
        buf.putInt(value.size());
        buf.put(key);
        for (byte[] attribute : value) {
            buf.putInt(attribute.length);
            buf.put(attribute);
        }

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, size - CRC_SIZE);
        buf.putInt((int) crc.getValue());
        buf.flip();
        return buf;
    }

    private static List<byte[]> copyOf(List<byte[]> value) {
        List<byte[]> copy = new ArrayList<>(value.size());
        for (byte[] attribute : value) {
            copy.add(attribute.clone());
        }
        return Collections.unmodifiableList(copy);
    }

    private static void syncDirectory(Path dir) {
        // Skip on Windows - directory sync isn't supported the same way
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            return;
        }
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
        } catch (IOException e) {
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }

    // ========================================================================
    // Cursors
    // ========================================================================

    /**
     * One stored entry, or a delete when {@code value} is null.
     */
    private record Change(byte[] key, List<byte[]> value, long version) {
    }

    private static final class FrozenCursor implements DiskSnapshot {
        private final List<Change> entries;
        private int position;

        private FrozenCursor(List<Change> entries) {
            this.entries = entries;
        }

        @Override
        public boolean valid() {
            return position < entries.size();
        }

        @Override
        public void next() {
            if (position < entries.size()) {
                position++;
            }
        }

        @Override
        public byte[] key() {
            return current().key().clone();
        }

        @Override
        public List<byte[]> value() {
            return copyOf(current().value());
        }

        @Override
        public long version() {
            return current().version();
        }

        @Override
        public void close() {
            position = entries.size();
        }

        private Change current() {
            if (!valid()) {
                throw new NoSuchElementException("snapshot exhausted");
            }
            return entries.get(position);
        }
    }

    private final class RollingCursor implements RollingSnapshot {
        private final ArrayDeque<Change> pending;
        private Change current;
        private boolean closed;
        private boolean backlogReported;

        private RollingCursor(List<Change> initial) {
            this.pending = new ArrayDeque<>(initial);
            this.current = pending.poll();
        }

        private synchronized void offer(Change change) {
            if (!closed) {
                pending.add(change);
                if (!backlogReported && pending.size() > options.writeBufferEntries()) {
                    backlogReported = true;
                    LOG.warn("Rolling snapshot of {} is {} changes behind; is it still being read?",
                            directory, pending.size());
                }
            }
        }

        @Override
        public synchronized boolean valid() {
            if (current == null) {
                current = pending.poll();
            }
            return current != null;
        }

        @Override
        public synchronized void next() {
            current = pending.poll();
        }

        @Override
        public synchronized byte[] key() {
            return current().key().clone();
        }

        @Override
        public synchronized List<byte[]> value() {
            List<byte[]> value = current().value();
            return value == null ? Collections.emptyList() : copyOf(value);
        }

        @Override
        public synchronized long version() {
            return current().version();
        }

        @Override
        public synchronized boolean hasValue() {
            return current().value() != null;
        }

        @Override
        public void close() {
            synchronized (this) {
                if (closed) {
                    return;
                }
                closed = true;
                pending.clear();
                current = null;
            }
            detach(this);
        }

        private Change current() {
            if (!valid()) {
                throw new NoSuchElementException("rolling snapshot has caught up");
            }
            return current;
        }
    }
}
