/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.adjacency;

import org.junit.Test;

import static com.graphine.core.common.collection.Collections.list;
import static com.graphine.core.common.iterator.Iterators.iterate;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AdjacencyTest {

    @Test
    public void unseen_node_has_no_outgoing_edges() {
        Adjacency adjacency = new Adjacency();
        assertTrue(adjacency.outgoing(9).isEmpty());
        assertFalse(adjacency.isIndexed(9));
    }

    @Test
    public void outgoing_edges_keep_insertion_order() {
        Adjacency adjacency = new Adjacency();
        adjacency.edgeAdded(-3, 1);
        adjacency.edgeAdded(-1, 1);
        adjacency.edgeAdded(-2, 2);
        assertEquals(list(-3L, -1L), iterate(adjacency.outgoing(1)).toList());
        assertEquals(list(-2L), iterate(adjacency.outgoing(2)).toList());
    }

    @Test
    public void relocation_moves_the_edge() {
        Adjacency adjacency = new Adjacency();
        adjacency.edgeAdded(-1, 1);
        adjacency.edgeRelocated(-1, 1, 2);
        assertTrue(adjacency.outgoing(1).isEmpty());
        assertEquals(list(-1L), iterate(adjacency.outgoing(2)).toList());

        adjacency.edgeRelocated(-1, 2, 2);
        assertEquals(list(-1L), iterate(adjacency.outgoing(2)).toList());
    }

    @Test
    public void removals_are_tolerant_of_missing_entries() {
        Adjacency adjacency = new Adjacency();
        adjacency.edgeAdded(-1, 1);
        adjacency.edgeAdded(-2, 1);
        adjacency.nodeRemoved(1);
        assertFalse(adjacency.isIndexed(1));
        adjacency.edgeRemoved(-1, 1);
        adjacency.edgeRelocated(-2, 1, 3);
        assertEquals(list(-2L), iterate(adjacency.outgoing(3)).toList());
    }

    @Test
    public void outgoing_view_is_read_only() {
        Adjacency adjacency = new Adjacency();
        adjacency.edgeAdded(-1, 1);
        try {
            adjacency.outgoing(1).clear();
            fail();
        } catch (UnsupportedOperationException e) {
            assertEquals(1, adjacency.outgoing(1).size());
        }
    }
}
