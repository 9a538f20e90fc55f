/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph;

import com.graphine.core.graph.element.Edge;
import com.graphine.core.graph.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Copies a set of nodes, and the edges running between them, into a new and independent graph.
 *
 * The copies are assigned fresh identifiers in the order the nodes were supplied, and every copied edge is
 * re-pointed at the new identifiers of its endpoints.
 */
class SubgraphGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SubgraphGenerator.class);

    private final Graph source;

    SubgraphGenerator(Graph source) {
        this.source = source;
    }

    Graph generate(Collection<Long> nodes) {
        Set<Long> members = new LinkedHashSet<>(nodes);
        members.forEach(source::node);

        Schema schema = new Schema(source.schema().node().optionalAttributes(),
                                   source.schema().edge().optionalAttributes());
        Graph subgraph = new Graph(schema, source.options().copy());
        Map<Long, Long> translation = new LinkedHashMap<>();
        members.forEach(id -> translation.put(id, subgraph.addNode(source.node(id).optionalValues())));

        int edges = 0;
        for (long id : members) {
            for (Edge edge : source.outgoingEdges(id).toList()) {
                Long end = translation.get(edge.end());
                if (end == null) continue;
                subgraph.addEdge(translation.get(edge.start()), end, edge.optionalValues());
                edges++;
            }
        }
        LOG.debug("Generated subgraph of {} node(s) and {} edge(s) from {}", members.size(), edges, source);
        return subgraph;
    }
}
