/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.traversal;

import com.graphine.core.common.exception.GraphineException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import static com.graphine.core.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;

/**
 * The identifiers waiting to be visited, in discovery order, with constant-time membership checks.
 */
class Frontier {

    private final Deque<Long> pending;
    private final Set<Long> members;

    Frontier() {
        this.pending = new ArrayDeque<>();
        this.members = new HashSet<>();
    }

    void add(long identifier) {
        if (members.add(identifier)) pending.addLast(identifier);
    }

    boolean contains(long identifier) {
        return members.contains(identifier);
    }

    boolean isEmpty() {
        return pending.isEmpty();
    }

    long select(Selector selector) {
        assert !pending.isEmpty();
        long selected = selector.select(pending);
        if (!members.remove(selected) || pending.size() != members.size()) throw GraphineException.of(ILLEGAL_STATE);
        return selected;
    }
}
