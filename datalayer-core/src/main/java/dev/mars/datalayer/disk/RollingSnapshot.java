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

/**
 * Snapshot that, after the contents present when it was taken, keeps
 * yielding every later put and delete until it is closed. Used to stream a
 * region to a transfer destination while it continues to take writes.
 * <p>
 * {@link #valid()} returns false once the cursor has caught up; it turns
 * true again when a new change arrives.
 * <p>
 * Changes queue on the snapshot until they are read, so callers must
 * {@link #close()} it once the stream is finished.
 */
public interface RollingSnapshot extends DiskSnapshot {

    /** False if the current entry records a delete of {@link #key()}. */
    boolean hasValue();
}
