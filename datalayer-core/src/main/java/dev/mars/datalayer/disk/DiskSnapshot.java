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

import java.util.List;

/**
 * Cursor over a point-in-time view of a disk's contents.
 * <pre>{@code
 * try (DiskSnapshot snap = disk.makeSnapshot(c -> true)) {
 *     for (; snap.valid(); snap.next()) {
 *         process(snap.key(), snap.value(), snap.version());
 *     }
 * }
 * }</pre>
 */
public interface DiskSnapshot extends AutoCloseable {

    /** Whether the cursor is positioned on an entry. */
    boolean valid();

    /** Advances to the next entry. */
    void next();

    /**
     * @throws java.util.NoSuchElementException if not {@link #valid()}
     */
    byte[] key();

    /**
     * @throws java.util.NoSuchElementException if not {@link #valid()}
     */
    List<byte[]> value();

    /**
     * @throws java.util.NoSuchElementException if not {@link #valid()}
     */
    long version();

    @Override
    void close();
}
