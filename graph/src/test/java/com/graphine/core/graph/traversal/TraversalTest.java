/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.traversal;

import com.graphine.core.common.exception.GraphineException;
import com.graphine.core.common.iterator.FunctionalIterator;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static com.graphine.core.common.collection.Collections.list;
import static com.graphine.core.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.graphine.core.common.iterator.Iterators.iterate;
import static com.graphine.core.common.iterator.Iterators.single;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TraversalTest {

    private static final long A = 1, B = 2, C = 3, D = 4, E = 5, F = 6, G = 7;

    private final Map<Long, List<Long>> successors = new HashMap<>();
    private final List<Long> expanded = new ArrayList<>();

    private void connect(long from, long to) {
        successors.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
    }

    private final Function<Long, FunctionalIterator<Long>> neighbours = node -> {
        expanded.add(node);
        return single(node).link(iterate(successors.getOrDefault(node, list())));
    };

    private void example() {
        connect(A, B);
        connect(B, D);
        connect(B, F);
        connect(F, E);
        connect(A, C);
        connect(C, G);
        connect(A, E);
    }

    @Test
    public void depth_first_visits_last_discovered_first() {
        example();
        List<Long> order = new Traversal(A, Selector.DEPTH_FIRST, neighbours).toList();
        assertEquals(list(A, E, C, G, B, F, D), order);
    }

    @Test
    public void breadth_first_visits_in_discovery_order() {
        example();
        List<Long> order = new Traversal(A, Selector.BREADTH_FIRST, neighbours).toList();
        assertEquals(list(A, B, C, E, D, F, G), order);
    }

    @Test
    public void cycles_are_visited_once() {
        connect(A, B);
        connect(B, C);
        connect(C, A);
        connect(C, C);
        assertEquals(list(A, B, C), new Traversal(A, Selector.BREADTH_FIRST, neighbours).toList());
    }

    @Test
    public void isolated_root_yields_itself() {
        assertEquals(list(D), new Traversal(D, Selector.DEPTH_FIRST, neighbours).toList());
    }

    @Test
    public void custom_selector_decides_order() {
        example();
        Selector smallestFirst = frontier -> {
            long smallest = frontier.stream().min(Long::compare).orElseThrow();
            frontier.remove(smallest);
            return smallest;
        };
        assertEquals(list(A, B, C, D, E, F, G), new Traversal(A, smallestFirst, neighbours).toList());
    }

    @Test
    public void neighbours_are_expanded_only_when_needed() {
        example();
        FunctionalIterator<Long> traversal = new Traversal(A, Selector.BREADTH_FIRST, neighbours);
        assertEquals(Long.valueOf(A), traversal.next());
        assertEquals(Long.valueOf(B), traversal.next());
        assertEquals(list(A), expanded);
    }

    @Test
    public void selector_must_remove_what_it_returns() {
        example();
        Selector peeking = frontier -> frontier.peekFirst();
        FunctionalIterator<Long> traversal = new Traversal(A, peeking, neighbours);
        try {
            traversal.next();
            fail();
        } catch (GraphineException e) {
            assertEquals(ILLEGAL_STATE.code(), e.errorMessage().code());
        }
    }
}
