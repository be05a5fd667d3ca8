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
 * Result of a point read.
 *
 * @param code    {@link ReturnCode#SUCCESS}, {@link ReturnCode#NOT_FOUND} or {@link ReturnCode#MISSING_DISK}
 * @param value   the stored value attributes (empty unless {@code code} is SUCCESS)
 * @param version the stored version (0 unless {@code code} is SUCCESS)
 */
public record GetResult(ReturnCode code, List<byte[]> value, long version) {

    private static final GetResult NOT_FOUND = new GetResult(ReturnCode.NOT_FOUND, List.of(), 0L);
    private static final GetResult MISSING_DISK = new GetResult(ReturnCode.MISSING_DISK, List.of(), 0L);

    public GetResult {
        value = value == null ? List.of() : List.copyOf(value);
    }

    public static GetResult found(List<byte[]> value, long version) {
        return new GetResult(ReturnCode.SUCCESS, value, version);
    }

    public static GetResult notFound() {
        return NOT_FOUND;
    }

    public static GetResult missingDisk() {
        return MISSING_DISK;
    }

    public boolean isFound() {
        return code == ReturnCode.SUCCESS;
    }
}
