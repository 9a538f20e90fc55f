/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.adjacency;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import java.util.Collections;
import java.util.Set;

/**
 * Index from a node identifier to the identifiers of the edges that start at it, in the order the edges were
 * indexed.
 *
 * The index is kept in step with the element store by the graph: every operation that adds, relocates or
 * removes an edge, or removes a node, calls the matching method here before it returns. Removing a node drops
 * its whole entry without touching the edges that still name it as their start.
 */
public class Adjacency {

    private final SetMultimap<Long, Long> outgoing;

    public Adjacency() {
        this.outgoing = LinkedHashMultimap.create();
    }

    /**
     * Returns a read-only view of the edges starting at {@code node}; empty for a node that was never indexed.
     */
    public Set<Long> outgoing(long node) {
        return Collections.unmodifiableSet(outgoing.get(node));
    }

    public boolean isIndexed(long node) {
        return outgoing.containsKey(node);
    }

    public void edgeAdded(long edge, long start) {
        outgoing.put(start, edge);
    }

    public void edgeRelocated(long edge, long oldStart, long newStart) {
        if (oldStart == newStart) return;
        outgoing.remove(oldStart, edge);
        outgoing.put(newStart, edge);
    }

    public void edgeRemoved(long edge, long start) {
        outgoing.remove(start, edge);
    }

    public void nodeRemoved(long node) {
        outgoing.removeAll(node);
    }
}
