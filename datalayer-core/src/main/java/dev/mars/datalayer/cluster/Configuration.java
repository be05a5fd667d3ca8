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
package dev.mars.datalayer.cluster;

import dev.mars.datalayer.disk.Hasher;

import java.util.Map;
import java.util.NavigableMap;

/**
 * Read-only view of one cluster configuration snapshot, as produced by the
 * coordinator.
 * <p>
 * The data layer consumes only the parts it needs to decide which regions
 * must have a disk on this instance: region sizes, entity ownership,
 * in-flight transfers and per-subspace placement functions.
 * Implementations must be immutable; the same snapshot may be handed to
 * {@code prepare}, {@code reconfigure} and {@code cleanup} in turn.
 */
public interface Configuration {

    /** Monotonic version number of this snapshot. */
    long version();

    /**
     * Every region in the configuration with its column count
     * (the key plus value attributes).
     */
    Map<RegionId, Integer> regions();

    /** Ordered mapping from entity to the instance that owns it. */
    NavigableMap<EntityId, InstanceId> entityMapping();

    /**
     * Transfers whose destination is the given instance.
     *
     * @param instance the transfer destination
     * @return transfer id to the region being transferred
     */
    Map<Integer, RegionId> transfersTo(InstanceId instance);

    /**
     * Placement function for keys of the given subspace.
     *
     * @throws IllegalArgumentException if the subspace is unknown
     */
    Hasher diskHasher(SubspaceId subspace);
}
