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

import io.netty.util.IllegalReferenceCountException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Append-only log spread over a {@link SegmentChain}.
 * <p>
 * The log owns one reference to its current chain. Writers are serialized
 * on an internal lock; rolling to a new segment builds the next chain version,
 * publishes it with a single atomic swap and then releases the old version.
 * Readers call {@link #acquire()} and see either the whole old chain or the
 * whole new one, never a partial update, without taking the write lock.
 * <p>
 * Log offsets are global: the first byte of segment {@code i} sits at
 * {@code chain.lowerBound(i)}.
 */
public final class SegmentedLog implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentedLog.class);

    private final AtomicReference<SegmentChain> current = new AtomicReference<>(SegmentChain.empty());
    private final Object writeLock = new Object();

    private Segment tail;
    private long nextOffset;
    private boolean closed;

    /**
     * Appends a record to the tail segment.
     *
     * @return the log offset of the record
     * @throws IllegalStateException if no segment has been rolled in yet, or the log is closed
     */
    public long append(ByteBuffer record) {
        synchronized (writeLock) {
            if (closed) {
                throw new IllegalStateException("log is closed");
            }
            if (tail == null) {
                throw new IllegalStateException("log has no segment; roll() first");
            }
            int length = record.remaining();
            tail.append(record);
            long offset = nextOffset;
            nextOffset += length;
            return offset;
        }
    }

    /**
     * Makes {@code segment} the new tail, starting at the current end of the log.
     * <p>
     * The published chain takes its own reference to {@code segment}; the
     * caller still owns the reference it passed in.
     *
     * @throws IllegalArgumentException if the current tail is still empty
     */
    public void roll(Segment segment) {
        synchronized (writeLock) {
            if (closed) {
                throw new IllegalStateException("log is closed");
            }
            SegmentChain old = current.get();
            SegmentChain next = old.add(nextOffset, segment);
            current.set(next);
            tail = segment;
            old.release();
            LOG.debug("Rolled to {} at offset {} ({} segments)", segment.path(), nextOffset, next.size());
        }
    }

    /**
     * Returns the current chain with one reference taken for the caller, who
     * must {@link SegmentChain#release() release} it. The chain stays a frozen,
     * consistent view no matter how many rolls happen afterwards.
     */
    public SegmentChain acquire() {
        for (;;) {
            SegmentChain chain = current.get();
            try {
                return chain.retain();
            } catch (IllegalReferenceCountException e) {
                // lost a race with roll(): the version we read was retired, reload
                LOG.trace("Chain retired while acquiring, retrying");
            }
        }
    }

    /**
     * Syncs every segment of the current chain.
     *
     * @return true if anything was unsynced
     */
    public boolean sync() {
        SegmentChain chain = acquire();
        try {
            return !chain.isEmpty() && chain.sync(chain.size() - 1);
        } finally {
            chain.release();
        }
    }

    /** Log offset the next append will receive. */
    public long nextOffset() {
        synchronized (writeLock) {
            return nextOffset;
        }
    }

    /** Bytes appended to the tail segment, or 0 if there is none. */
    public long tailSize() {
        synchronized (writeLock) {
            return tail == null ? 0 : tail.size();
        }
    }

    /**
     * Releases the log's reference to its chain. Readers that acquired a
     * chain earlier keep it until they release it themselves.
     */
    @Override
    public void close() {
        synchronized (writeLock) {
            if (closed) {
                return;
            }
            closed = true;
            tail = null;
            current.getAndSet(SegmentChain.empty()).release();
        }
    }
}
