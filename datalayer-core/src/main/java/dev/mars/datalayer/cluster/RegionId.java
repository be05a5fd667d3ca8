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
 * Identifies one region: a partition of a subspace's key space.
 * <p>
 * A region is addressed by its space and subspace, plus a (prefix, mask)
 * pair selecting the slice of the placement coordinate space it covers.
 * Regions are totally ordered lexicographically over
 * (space, subspace, prefix, mask), with {@code space} and {@code mask}
 * compared as unsigned values.
 *
 * @param space    the space number (unsigned 32-bit)
 * @param subspace the subspace number within the space
 * @param prefix   the number of significant mask bits
 * @param mask     the coordinate mask (unsigned 64-bit)
 */
public record RegionId(long space, int subspace, int prefix, long mask) implements Comparable<RegionId> {

    /** Space number reserved for entities that are not assigned to any real space. */
    public static final long UNASSIGNED_SPACE = 0xFFFFFFFFL - 1;

    private static final Comparator<RegionId> ORDER = Comparator
            .comparingLong(RegionId::space)
            .thenComparingInt(RegionId::subspace)
            .thenComparingInt(RegionId::prefix)
            .thenComparing(RegionId::mask, Long::compareUnsigned);

    public RegionId {
        if (space < 0 || space > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("space out of range: " + space);
        }
        if (subspace < 0) {
            throw new IllegalArgumentException("subspace must be non-negative: " + subspace);
        }
        if (prefix < 0 || prefix > 64) {
            throw new IllegalArgumentException("prefix must be in [0, 64]: " + prefix);
        }
    }

    /** Returns the subspace this region partitions. */
    public SubspaceId subspaceId() {
        return new SubspaceId(space, subspace);
    }

    /** Whether this region belongs to the reserved unassigned space. */
    public boolean isUnassigned() {
        return space == UNASSIGNED_SPACE;
    }

    /**
     * Returns the directory name used for this region's on-disk state.
     * Deterministic: the same region always maps to the same name.
     */
    public String pathName() {
        return space + "-" + subspace + "-" + prefix + "-" + String.format("%016x", mask);
    }

    @Override
    public int compareTo(RegionId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "region(" + space + ", " + subspace + ", " + prefix + ", " + String.format("%016x", mask) + ")";
    }
}
