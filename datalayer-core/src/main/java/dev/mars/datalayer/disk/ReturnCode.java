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
 * Outcome vocabulary shared by every disk operation.
 */
public enum ReturnCode {
    /** The operation succeeded; for maintenance calls, work was done. */
    SUCCESS,
    /** The key is not stored on the disk. */
    NOT_FOUND,
    /** The value does not have the disk's column count minus the key. */
    WRONG_ARITY,
    /** No disk is resident for the addressed region. */
    MISSING_DISK,
    /** The write buffer has no room for more bytes. */
    DATA_FULL,
    /** The write buffer has no room for more entries. */
    SEARCH_FULL,
    /** A maintenance call found nothing to do. */
    DID_NOTHING,
    /** The underlying files failed. */
    IO_ERROR;

    /** Whether this is one of the two write-buffer-full conditions. */
    public boolean isBufferFull() {
        return this == DATA_FULL || this == SEARCH_FULL;
    }
}
