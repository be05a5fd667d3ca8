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

import java.nio.file.Path;

/**
 * Creates the storage instance for a region.
 */
@FunctionalInterface
public interface DiskFactory {

    /**
     * @param directory where the disk keeps its files
     * @param hasher    the placement function of the region's subspace
     * @param columns   the column count, key included
     * @return a new disk holding one reference, owned by the caller
     * @throws dev.mars.datalayer.StorageException if the disk cannot be created
     */
    Disk create(Path directory, Hasher hasher, int columns);
}
