/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph;

import com.graphine.core.common.exception.GraphineException;
import com.graphine.core.common.parameters.Options;
import com.graphine.core.graph.schema.Schema;
import org.junit.Before;
import org.junit.Test;

import static com.graphine.core.common.collection.Collections.list;
import static com.graphine.core.common.collection.Collections.map;
import static com.graphine.core.common.collection.Collections.pair;
import static com.graphine.core.common.exception.ErrorMessage.ElementRead.UNKNOWN_NODE;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SubgraphGeneratorTest {

    private Graph graph;
    private long newYork, atlanta, seattle, austin;
    private long newYorkToAtlanta, atlantaToSeattle, seattleToAustin, atlantaToNewYork;

    @Before
    public void setUp() {
        graph = new Graph(list("city"), list("distance"));
        newYork = graph.addNode(map(pair("city", "New York")));
        atlanta = graph.addNode(map(pair("city", "Atlanta")));
        seattle = graph.addNode(map(pair("city", "Seattle")));
        austin = graph.addNode(map(pair("city", "Austin")));
        newYorkToAtlanta = graph.addEdge(newYork, atlanta, map(pair("distance", 850)));
        atlantaToSeattle = graph.addEdge(atlanta, seattle, map(pair("distance", 2150)));
        seattleToAustin = graph.addEdge(seattle, austin, map(pair("distance", 2850)));
        atlantaToNewYork = graph.addEdge(atlanta, newYork, map(pair("distance", 850)));
    }

    @Test
    public void subgraph_copies_members_and_edges_between_them() {
        Graph subgraph = graph.subgraph(seattle, atlanta, newYork);

        assertEquals(graph.schema(), subgraph.schema());
        assertEquals(list(map(pair("city", "Seattle")), map(pair("city", "Atlanta")), map(pair("city", "New York"))),
                     subgraph.nodes().map(node -> node.asMap()).toList());
        assertEquals(3, subgraph.size());

        // seattle, atlanta and new york become 1, 2 and 3
        assertEquals(list(2L, 2L, 3L), subgraph.edges().map(edge -> edge.start()).toList());
        assertEquals(list(1L, 3L, 2L), subgraph.edges().map(edge -> edge.end()).toList());
        assertEquals(list(2150, 850, 850), subgraph.edges().map(edge -> edge.get("distance")).toList());
    }

    @Test
    public void subgraph_is_independent_of_its_source() {
        Graph subgraph = graph.subgraph(list(newYork, atlanta));
        subgraph.removeNode(1);
        subgraph.addEdge(2, 2, map(pair("distance", 0)));

        assertEquals(4, graph.order());
        assertEquals(4, graph.size());
        assertEquals(map(pair("city", "New York")), graph.node(newYork).asMap());
        assertEquals(list(newYorkToAtlanta, atlantaToSeattle, seattleToAustin, atlantaToNewYork),
                     graph.edgeIdentifiers().toList());
    }

    @Test
    public void duplicate_members_are_copied_once() {
        Graph subgraph = graph.subgraph(austin, seattle, austin);
        assertEquals(2, subgraph.order());
        assertEquals(list(2L), subgraph.edges().map(edge -> edge.start()).toList());
        assertEquals(list(1L), subgraph.edges().map(edge -> edge.end()).toList());
    }

    @Test
    public void empty_subgraph_keeps_the_schema() {
        Graph subgraph = graph.subgraph();
        assertEquals(0, subgraph.order());
        assertEquals(graph.schema(), subgraph.schema());
    }

    @Test
    public void subgraph_copies_options() {
        Graph cascading = new Graph(new Schema(list("city"), list()), new Options.Graph().cascadeEdgeRemoval(true));
        long a = cascading.addNode(map(pair("city", "a")));
        long b = cascading.addNode(map(pair("city", "b")));
        cascading.addEdge(a, b);

        Graph subgraph = cascading.subgraph(a, b);
        assertTrue(subgraph.options().cascadeEdgeRemoval());
        subgraph.removeNode(2);
        assertEquals(0, subgraph.size());
    }

    @Test
    public void unknown_member_fails_before_building() {
        try {
            graph.subgraph(newYork, 99);
            fail();
        } catch (GraphineException e) {
            assertEquals(UNKNOWN_NODE.code(), e.errorMessage().code());
        }
    }
}
