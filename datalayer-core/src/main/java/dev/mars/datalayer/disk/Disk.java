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

import io.netty.util.ReferenceCounted;

import java.util.List;
import java.util.function.LongPredicate;

/**
 * Storage instance for one region.
 * <p>
 * A disk is shared: the region table holds one reference, and every caller
 * that obtained it from the table holds another until it releases it.
 * {@link #drop()} only marks the disk; its on-disk state is deleted once the
 * last reference is released, so a handle taken before the drop stays usable.
 * <p>
 * Maintenance calls ({@link #preallocate()}, {@link #optimisticIo()},
 * {@link #mandatoryIo()}, {@link #flush(int)}) report {@link ReturnCode#SUCCESS}
 * when they did work, {@link ReturnCode#DID_NOTHING} when there was none, a
 * buffer-full code when writes must be drained first, or
 * {@link ReturnCode#IO_ERROR}.
 */
public interface Disk extends ReferenceCounted {

    GetResult get(byte[] key);

    ReturnCode put(byte[] key, List<byte[]> value, long version);

    ReturnCode del(byte[] key);

    /**
     * Takes a frozen view of the entries whose placement coordinate matches.
     */
    DiskSnapshot makeSnapshot(LongPredicate coordinateFilter);

    RollingSnapshot makeRollingSnapshot();

    /** Reserves on-disk space ahead of need. */
    ReturnCode preallocate();

    /** Speculative background work, done when the disk is otherwise idle. */
    ReturnCode optimisticIo();

    /** Work that must happen before buffered writes can make progress. */
    ReturnCode mandatoryIo();

    /**
     * Moves at most {@code budget} buffered writes to stable storage.
     */
    ReturnCode flush(int budget);

    /** Marks the disk for deletion when its last reference is released. */
    void drop();
}
