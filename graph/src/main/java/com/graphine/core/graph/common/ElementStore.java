/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.common;

import com.graphine.core.common.exception.GraphineException;
import com.graphine.core.common.iterator.FunctionalIterator;
import com.graphine.core.graph.element.Edge;
import com.graphine.core.graph.element.Node;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.graphine.core.common.exception.ErrorMessage.ElementRead.UNKNOWN_EDGE;
import static com.graphine.core.common.exception.ErrorMessage.ElementRead.UNKNOWN_NODE;
import static com.graphine.core.common.iterator.Iterators.iterate;

/**
 * Live nodes and edges, keyed by identifier and iterated in insertion order. Overwriting an identifier keeps
 * its position; removing and re-inserting it moves it to the end.
 *
 * The iterators returned here are views: mutating the store while consuming one fails fast.
 */
public class ElementStore {

    private final Map<Long, Node> nodes;
    private final Map<Long, Edge> edges;

    public ElementStore() {
        this.nodes = new LinkedHashMap<>();
        this.edges = new LinkedHashMap<>();
    }

    public Node node(long identifier) {
        Node node = nodes.get(identifier);
        if (node == null) throw GraphineException.of(UNKNOWN_NODE, identifier);
        return node;
    }

    public Edge edge(long identifier) {
        Edge edge = edges.get(identifier);
        if (edge == null) throw GraphineException.of(UNKNOWN_EDGE, identifier);
        return edge;
    }

    public boolean containsNode(long identifier) {
        return nodes.containsKey(identifier);
    }

    public boolean containsEdge(long identifier) {
        return edges.containsKey(identifier);
    }

    public void put(long identifier, Node node) {
        assert identifier > 0;
        nodes.put(identifier, node);
    }

    public void put(long identifier, Edge edge) {
        assert identifier < 0;
        edges.put(identifier, edge);
    }

    public Node deleteNode(long identifier) {
        Node node = nodes.remove(identifier);
        if (node == null) throw GraphineException.of(UNKNOWN_NODE, identifier);
        return node;
    }

    public Edge deleteEdge(long identifier) {
        Edge edge = edges.remove(identifier);
        if (edge == null) throw GraphineException.of(UNKNOWN_EDGE, identifier);
        return edge;
    }

    public FunctionalIterator<Long> nodeIdentifiers() {
        return iterate(nodes.keySet());
    }

    public FunctionalIterator<Long> edgeIdentifiers() {
        return iterate(edges.keySet());
    }

    public FunctionalIterator<Node> nodes() {
        return iterate(nodes.values());
    }

    public FunctionalIterator<Edge> edges() {
        return iterate(edges.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }
}
