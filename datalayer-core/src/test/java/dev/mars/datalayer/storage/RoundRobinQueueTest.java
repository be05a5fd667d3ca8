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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RoundRobinQueue}.
 */
class RoundRobinQueueTest {

    private final RoundRobinQueue<String> queue = new RoundRobinQueue<>();

    @Test
    void testDuplicatesIgnored() {
        assertTrue(queue.offerIfAbsent("a"));
        assertFalse(queue.offerIfAbsent("a"));
        assertTrue(queue.offerIfAbsent("b"));
        assertEquals(2, queue.size());
    }

    @Test
    void testFifoOrder() {
        queue.offerIfAbsent("a");
        queue.offerIfAbsent("b");
        queue.offerIfAbsent("c");

        assertEquals("a", queue.poll());
        assertEquals("b", queue.poll());
        assertEquals("c", queue.poll());
        assertNull(queue.poll());
    }

    @Test
    void testPolledElementCanRejoin() {
        queue.offerIfAbsent("a");
        queue.offerIfAbsent("b");

        String head = queue.poll();
        assertFalse(queue.contains(head));
        assertTrue(queue.offerIfAbsent(head));
        assertEquals("b", queue.poll());
        assertEquals("a", queue.poll());
    }

    @Test
    void testRotationVisitsEveryElement() {
        for (String s : List.of("a", "b", "c")) {
            queue.offerIfAbsent(s);
        }
        List<String> visited = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            String s = queue.poll();
            visited.add(s);
            queue.offerIfAbsent(s);
        }
        assertEquals(List.of("a", "b", "c", "a", "b", "c"), visited);
    }
}
