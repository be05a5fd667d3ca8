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
package dev.mars.datalayer.storage;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Set;

/**
 * FIFO rotation in which every element appears at most once.
 * <p>
 * An auxiliary set keeps membership checks O(1). Not thread safe: owned by
 * the maintenance thread.
 *
 * @param <T> element type
 */
final class RoundRobinQueue<T> {

    private final ArrayDeque<T> order = new ArrayDeque<>();
    private final Set<T> members = new HashSet<>();

    /**
     * Adds {@code element} at the tail unless it is already queued.
     *
     * @return true if it was added
     */
    boolean offerIfAbsent(T element) {
        if (!members.add(element)) {
            return false;
        }
        order.addLast(element);
        return true;
    }

    /**
     * Removes and returns the head, or null when empty.
     */
    T poll() {
        T head = order.pollFirst();
        if (head != null) {
            members.remove(head);
        }
        return head;
    }

    boolean contains(T element) {
        return members.contains(element);
    }

    int size() {
        return order.size();
    }
}
