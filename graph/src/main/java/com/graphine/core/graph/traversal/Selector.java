/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.traversal;

import java.util.Deque;

/**
 * Picks the next identifier to visit. A selector must remove exactly the identifier it returns from the
 * frontier, which is never empty when the selector is called.
 */
@FunctionalInterface
public interface Selector {

    Selector DEPTH_FIRST = Deque::removeLast;
    Selector BREADTH_FIRST = Deque::removeFirst;

    long select(Deque<Long> frontier);
}
