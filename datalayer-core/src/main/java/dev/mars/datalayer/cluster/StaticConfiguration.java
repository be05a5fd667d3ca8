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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Immutable {@link Configuration} assembled with a {@link Builder}.
 * <p>
 * Used wherever a snapshot has to be built locally: by coordinator glue
 * translating the wire form, by the demo and by tests.
 *
 * <pre>
 * Configuration config = StaticConfiguration.builder()
 *     .version(7)
 *     .region(region, 3)
 *     .hasher(region.subspaceId(), key -&gt; 0L)
 *     .entity(new EntityId(region, 0), self)
 *     .transfer(1, other, self)
 *     .build();
 * </pre>
 */
public final class StaticConfiguration implements Configuration {

    private final long version;
    private final Map<RegionId, Integer> regions;
    private final NavigableMap<EntityId, InstanceId> entities;
    private final Map<Integer, Transfer> transfers;
    private final Map<SubspaceId, Hasher> hashers;

    private StaticConfiguration(Builder builder) {
        this.version = builder.version;
        this.regions = Collections.unmodifiableMap(new TreeMap<>(builder.regions));
        this.entities = Collections.unmodifiableNavigableMap(new TreeMap<>(builder.entities));
        this.transfers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.transfers));
        this.hashers = Map.copyOf(builder.hashers);
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public Map<RegionId, Integer> regions() {
        return regions;
    }

    @Override
    public NavigableMap<EntityId, InstanceId> entityMapping() {
        return entities;
    }

    @Override
    public Map<Integer, RegionId> transfersTo(InstanceId instance) {
        Map<Integer, RegionId> result = new TreeMap<>();
        transfers.forEach((id, transfer) -> {
            if (transfer.destination().equals(instance)) {
                result.put(id, transfer.region());
            }
        });
        return result;
    }

    @Override
    public Hasher diskHasher(SubspaceId subspace) {
        Hasher hasher = hashers.get(subspace);
        if (hasher == null) {
            throw new IllegalArgumentException("No placement function for " + subspace);
        }
        return hasher;
    }

    @Override
    public String toString() {
        return "StaticConfiguration{" +
                "version=" + version +
                ", regions=" + regions.size() +
                ", entities=" + entities.size() +
                ", transfers=" + transfers.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * An in-flight transfer of a region towards a destination instance.
     *
     * @param region      the region being moved
     * @param destination the instance receiving the data
     */
    public record Transfer(RegionId region, InstanceId destination) {
    }

    /**
     * Builder for {@link StaticConfiguration}.
     */
    public static final class Builder {
        private long version;
        private final Map<RegionId, Integer> regions = new HashMap<>();
        private final Map<EntityId, InstanceId> entities = new HashMap<>();
        private final Map<Integer, Transfer> transfers = new LinkedHashMap<>();
        private final Map<SubspaceId, Hasher> hashers = new HashMap<>();

        private Builder() {
        }

        /** Sets the snapshot version (default: 0). */
        public Builder version(long version) {
            this.version = version;
            return this;
        }

        /** Declares a region and its column count. */
        public Builder region(RegionId region, int columns) {
            if (columns < 1) {
                throw new IllegalArgumentException("column count must be positive: " + columns);
            }
            regions.put(region, columns);
            return this;
        }

        /** Assigns an entity to its owning instance. */
        public Builder entity(EntityId entity, InstanceId owner) {
            entities.put(entity, owner);
            return this;
        }

        /** Registers an in-flight transfer of a region to an instance. */
        public Builder transfer(int transferId, RegionId region, InstanceId destination) {
            transfers.put(transferId, new Transfer(region, destination));
            return this;
        }

        /** Sets the placement function for a subspace. */
        public Builder hasher(SubspaceId subspace, Hasher hasher) {
            hashers.put(subspace, hasher);
            return this;
        }

        public StaticConfiguration build() {
            return new StaticConfiguration(this);
        }
    }
}
