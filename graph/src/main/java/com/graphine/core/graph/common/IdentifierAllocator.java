/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.common;

import com.graphine.core.common.exception.GraphineException;

import java.util.ArrayDeque;
import java.util.Deque;

import static com.graphine.core.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;

/**
 * Issues element identifiers: positive for nodes, negative for edges.
 *
 * A released identifier is the next one issued for its kind (last released, first reused). With nothing to
 * reuse, the next identifier is one past the number of live elements of that kind, which cannot collide with
 * a live identifier because every identifier at or below that magnitude is either live or waiting for reuse.
 */
public class IdentifierAllocator {

    private final FreeList nodes;
    private final FreeList edges;

    public IdentifierAllocator() {
        this.nodes = new FreeList(1);
        this.edges = new FreeList(-1);
    }

    public long node(int liveNodes) {
        return nodes.next(liveNodes);
    }

    public long edge(int liveEdges) {
        return edges.next(liveEdges);
    }

    public void release(long identifier) {
        if (identifier > 0) nodes.release(identifier);
        else if (identifier < 0) edges.release(identifier);
        else throw GraphineException.of(ILLEGAL_ARGUMENT, identifier);
    }

    private static class FreeList {

        private final int sign;
        private final Deque<Long> unused;

        private FreeList(int sign) {
            this.sign = sign;
            this.unused = new ArrayDeque<>();
        }

        private long next(int live) {
            Long reused = unused.pollLast();
            if (reused != null) return reused;
            else return sign * (live + 1L);
        }

        private void release(long identifier) {
            unused.addLast(identifier);
        }
    }
}
