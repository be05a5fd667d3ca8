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

import java.util.Comparator;

/**
 * One role within a region, mapped by the configuration to the instance
 * that serves it.
 * <p>
 * Entities sort by region first, then by number, so all entities of a region
 * form a contiguous range from {@link #first(RegionId)} to {@link #last(RegionId)}.
 *
 * @param region the region the entity belongs to
 * @param number the role number within the region, in [0, 255]
 */
public record EntityId(RegionId region, int number) implements Comparable<EntityId> {

    public static final int MIN_NUMBER = 0;
    public static final int MAX_NUMBER = 255;

    private static final Comparator<EntityId> ORDER = Comparator
            .comparing(EntityId::region)
            .thenComparingInt(EntityId::number);

    public EntityId {
        if (region == null) {
            throw new IllegalArgumentException("region must not be null");
        }
        if (number < MIN_NUMBER || number > MAX_NUMBER) {
            throw new IllegalArgumentException("entity number must be in [0, 255]: " + number);
        }
    }

    /** Lowest entity of the region's range. */
    public static EntityId first(RegionId region) {
        return new EntityId(region, MIN_NUMBER);
    }

    /** Highest entity of the region's range. */
    public static EntityId last(RegionId region) {
        return new EntityId(region, MAX_NUMBER);
    }

    @Override
    public int compareTo(EntityId other) {
        return ORDER.compare(this, other);
    }
}
