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
package dev.mars.datalayer.log;

import dev.mars.datalayer.StorageException;
import io.netty.util.AbstractReferenceCounted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * {@link Segment} stored in a single file and written through a {@link FileChannel}.
 * <p>
 * <b>Thread Safety:</b> appends and syncs are serialized on the segment
 * monitor, so the channel position and the synced watermark stay consistent.
 * The channel is closed when the reference count drops to zero.
 */
public final class FileSegment extends AbstractReferenceCounted implements Segment {

    private static final Logger LOG = LoggerFactory.getLogger(FileSegment.class);

    private final Path path;
    private final FileChannel channel;
    private final boolean syncEnabled;

    private long size;
    private long syncedSize;

    private FileSegment(Path path, FileChannel channel, boolean syncEnabled) {
        this.path = path;
        this.channel = channel;
        this.syncEnabled = syncEnabled;
    }

    /**
     * Creates a new, empty segment file. Fails if the file already exists.
     *
     * @param path        the segment file
     * @param syncEnabled if false, {@link #sync()} skips the fsync (ONLY for testing!)
     */
    public static FileSegment create(Path path, boolean syncEnabled) {
        try {
            FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE);
            LOG.debug("Created segment {}", path);
            return new FileSegment(path, channel, syncEnabled);
        } catch (IOException e) {
            LOG.error("Failed to create segment {}: {}", path, e.getMessage(), e);
            throw new StorageException("Failed to create segment " + path, e);
        }
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public synchronized long size() {
        return size;
    }

    @Override
    public synchronized long append(ByteBuffer record) {
        long position = size;
        int length = record.remaining();
        try {
            while (record.hasRemaining()) {
                channel.write(record, size + (length - record.remaining()));
            }
        } catch (IOException e) {
            throw new StorageException("Failed to append to segment " + path, e);
        }
        size += length;
        LOG.trace("Appended {} bytes to {} at position {}", length, path, position);
        return position;
    }

    /**
     * Reads bytes starting at {@code position} into {@code dst}.
     *
     * @return the number of bytes read, or -1 at end of segment
     */
    public synchronized int read(ByteBuffer dst, long position) {
        try {
            return channel.read(dst, position);
        } catch (IOException e) {
            throw new StorageException("Failed to read segment " + path, e);
        }
    }

    @Override
    public synchronized boolean sync() {
        if (syncedSize == size) {
            return false;
        }
        if (syncEnabled) {
            try {
                channel.force(false);
            } catch (IOException e) {
                throw new StorageException("Failed to sync segment " + path, e);
            }
        }
        LOG.trace("Synced {} ({} -> {} bytes)", path, syncedSize, size);
        syncedSize = size;
        return true;
    }

    @Override
    protected void deallocate() {
        try {
            channel.close();
            LOG.debug("Closed segment {}", path);
        } catch (IOException e) {
            LOG.warn("Error closing segment {}: {}", path, e.getMessage());
        }
    }

    @Override
    public FileSegment touch(Object hint) {
        return this;
    }

    @Override
    public String toString() {
        return "FileSegment{" + path + ", refCnt=" + refCnt() + '}';
    }
}
