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

import io.netty.util.ReferenceCounted;

import java.nio.ByteBuffer;
import java.nio.file.Path;

/**
 * One physical, append-only unit of a segmented log.
 * <p>
 * Segments are shared between every {@link SegmentChain} that lists them;
 * the underlying file is closed when the last holder releases it.
 */
public interface Segment extends ReferenceCounted {

    /** File backing this segment. */
    Path path();

    /** Number of bytes appended so far. */
    long size();

    /**
     * Appends the remaining bytes of {@code record}.
     *
     * @return the position within this segment at which the record starts
     * @throws dev.mars.datalayer.StorageException if the write fails
     */
    long append(ByteBuffer record);

    /**
     * Forces appended bytes to the device.
     *
     * @return true if there was anything unsynced
     * @throws dev.mars.datalayer.StorageException if the force fails
     */
    boolean sync();
}
