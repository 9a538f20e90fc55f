/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.traversal;

import com.graphine.core.common.iterator.AbstractFunctionalIterator;
import com.graphine.core.common.iterator.FunctionalIterator;

import java.util.HashSet;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Function;

/**
 * A lazy walk over the identifiers reachable from a root, in the order chosen by a {@link Selector}.
 *
 * Each step asks the selector for the next frontier identifier, yields it and marks it visited. The neighbours
 * of the identifier just yielded are only added to the frontier when the following one is requested, so
 * nothing is computed ahead of the consumer. A neighbour already visited or already waiting is skipped, so
 * every reachable identifier is yielded exactly once.
 */
public class Traversal extends AbstractFunctionalIterator<Long> {

    private final Selector selector;
    private final Function<Long, FunctionalIterator<Long>> neighboursFn;
    private final Frontier frontier;
    private final Set<Long> visited;
    private Long unexpanded;

    public Traversal(long root, Selector selector, Function<Long, FunctionalIterator<Long>> neighboursFn) {
        this.selector = selector;
        this.neighboursFn = neighboursFn;
        this.frontier = new Frontier();
        this.visited = new HashSet<>();
        this.unexpanded = null;
        frontier.add(root);
    }

    private void expand() {
        if (unexpanded == null) return;
        FunctionalIterator<Long> neighbours = neighboursFn.apply(unexpanded);
        unexpanded = null;
        neighbours.forEachRemaining(neighbour -> {
            if (!visited.contains(neighbour) && !frontier.contains(neighbour)) frontier.add(neighbour);
        });
    }

    @Override
    public boolean hasNext() {
        expand();
        return !frontier.isEmpty();
    }

    @Override
    public Long next() {
        if (!hasNext()) throw new NoSuchElementException();
        long next = frontier.select(selector);
        visited.add(next);
        unexpanded = next;
        return next;
    }

    @Override
    public void recycle() { }
}
