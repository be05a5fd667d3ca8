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

import io.netty.util.AbstractReferenceCounted;
import io.netty.util.IllegalReferenceCountException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, reference-counted list of (lower bound, segment) pairs.
 * <p>
 * A chain is never edited in place. {@link #add(long, Segment)} returns a new
 * chain listing every existing segment plus the new one; the receiver is left
 * untouched and stays valid for whoever still holds it. Segments are shared
 * between versions, not copied: each chain holds its own reference to every
 * segment it lists and releases them when it is deallocated.
 * <p>
 * <b>Invariant:</b> lower bounds strictly increase with the index. Index 0 is
 * the oldest live segment.
 * <p>
 * <b>Usage Pattern (resolve, then access):</b>
 * <pre>{@code
 * SegmentChain chain = log.acquire();
 * try {
 *     int i = chain.find(offset);
 *     if (i >= 0) {
 *         Segment segment = chain.segment(i);
 *         long position = offset - chain.lowerBound(i);
 *         ...
 *     }
 * } finally {
 *     chain.release();
 * }
 * }</pre>
 *
 * @see SegmentedLog
 */
public final class SegmentChain extends AbstractReferenceCounted {

    private static final long[] NO_BOUNDS = new long[0];
    private static final Segment[] NO_SEGMENTS = new Segment[0];

    private final long[] lowerBounds;
    private final Segment[] segments;

    private SegmentChain(long[] lowerBounds, Segment[] segments) {
        this.lowerBounds = lowerBounds;
        this.segments = segments;
    }

    /** Creates an empty chain holding one reference. */
    public static SegmentChain empty() {
        return new SegmentChain(NO_BOUNDS, NO_SEGMENTS);
    }

    /**
     * Returns a new chain with every pair of this chain followed by
     * {@code (lowerBound, segment)}.
     * <p>
     * The new chain takes its own reference to every segment; the caller keeps
     * its reference to {@code segment} and to this chain.
     *
     * @throws IllegalArgumentException         if {@code lowerBound} does not exceed the tail's
     * @throws IllegalReferenceCountException   if this chain was already released
     */
    public SegmentChain add(long lowerBound, Segment segment) {
        Objects.requireNonNull(segment, "segment");
        if (refCnt() == 0) {
            throw new IllegalReferenceCountException(0);
        }
        int n = segments.length;
        if (n > 0 && lowerBound <= lowerBounds[n - 1]) {
            throw new IllegalArgumentException("lower bound " + lowerBound +
                    " must exceed the tail's lower bound " + lowerBounds[n - 1]);
        }

        long[] bounds = Arrays.copyOf(lowerBounds, n + 1);
        bounds[n] = lowerBound;
        Segment[] chained = Arrays.copyOf(segments, n + 1);
        chained[n] = segment;

        int retained = 0;
        try {
            for (Segment s : chained) {
                s.retain();
                retained++;
            }
        } catch (IllegalReferenceCountException e) {
            for (int i = 0; i < retained; i++) {
                chained[i].release();
            }
            throw e;
        }
        return new SegmentChain(bounds, chained);
    }

    /** Number of segments in this chain. */
    public int size() {
        return segments.length;
    }

    /** Whether this chain lists no segments. */
    public boolean isEmpty() {
        return segments.length == 0;
    }

    /**
     * Log offset of the first byte stored in segment {@code i}.
     *
     * @throws IndexOutOfBoundsException unless {@code 0 <= i < size()}
     */
    public long lowerBound(int i) {
        return lowerBounds[Objects.checkIndex(i, segments.length)];
    }

    /**
     * Segment at index {@code i}. The returned segment is valid for as long as
     * this chain is held; retain it to keep it beyond that.
     *
     * @throws IndexOutOfBoundsException unless {@code 0 <= i < size()}
     */
    public Segment segment(int i) {
        return segments[Objects.checkIndex(i, segments.length)];
    }

    /**
     * Index of the segment whose range contains {@code offset}: the last
     * segment whose lower bound is {@code <= offset}.
     *
     * @return the index, or -1 if {@code offset} precedes the first segment
     */
    public int find(long offset) {
        int pos = Arrays.binarySearch(lowerBounds, offset);
        return pos >= 0 ? pos : -(pos + 1) - 1;
    }

    /**
     * Makes segment {@code i} durable. Older segments are synced first, so on
     * return every segment at an index {@code <= i} is at least as durable.
     *
     * @return true if any segment had unsynced bytes
     * @throws IndexOutOfBoundsException unless {@code 0 <= i < size()}
     */
    public boolean sync(int i) {
        Objects.checkIndex(i, segments.length);
        if (refCnt() == 0) {
            throw new IllegalReferenceCountException(0);
        }
        boolean changed = false;
        for (int j = 0; j <= i; j++) {
            changed |= segments[j].sync();
        }
        return changed;
    }

    @Override
    public SegmentChain retain() {
        super.retain();
        return this;
    }

    @Override
    protected void deallocate() {
        for (Segment segment : segments) {
            segment.release();
        }
    }

    @Override
    public SegmentChain touch(Object hint) {
        return this;
    }

    @Override
    public String toString() {
        return "SegmentChain{size=" + segments.length +
                ", lowerBounds=" + Arrays.toString(lowerBounds) +
                ", refCnt=" + refCnt() + '}';
    }
}
