/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph;

import com.graphine.core.common.exception.GraphineException;
import com.graphine.core.common.iterator.FunctionalIterator;
import com.graphine.core.common.parameters.Options;
import com.graphine.core.graph.adjacency.Adjacency;
import com.graphine.core.graph.common.ElementStore;
import com.graphine.core.graph.common.IdentifierAllocator;
import com.graphine.core.graph.element.Edge;
import com.graphine.core.graph.element.Element;
import com.graphine.core.graph.element.Node;
import com.graphine.core.graph.query.AttributeMatcher;
import com.graphine.core.graph.schema.Schema;
import com.graphine.core.graph.traversal.Selector;
import com.graphine.core.graph.traversal.Traversal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static com.graphine.core.common.collection.Collections.map;
import static com.graphine.core.common.exception.ErrorMessage.ElementRead.UNKNOWN_IDENTIFIER;
import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.INCOMPATIBLE_REPLACEMENT;
import static com.graphine.core.common.iterator.Iterators.iterate;
import static com.graphine.core.common.iterator.Iterators.single;

/**
 * An in-memory directed graph whose nodes and edges are immutable attribute records addressed by identifier.
 *
 * Nodes are named by positive identifiers and edges by negative ones. Callers hold identifiers, never the
 * records themselves: modifying an element installs a replacement record under the same identifier.
 *
 * Removing a node does not remove the edges that refer to it, unless {@link Options.Graph#cascadeEdgeRemoval()}
 * is enabled. Such dangling edges stay readable and searchable, but are no longer reachable through the
 * adjacency of their start node.
 */
@NotThreadSafe
public class Graph {

    private static final Logger LOG = LoggerFactory.getLogger(Graph.class);

    private final Schema schema;
    private final Options.Graph options;
    private final ElementStore store;
    private final Adjacency adjacency;
    private final IdentifierAllocator identifiers;

    public Graph(Collection<String> nodeAttributes, Collection<String> edgeAttributes) {
        this(new Schema(nodeAttributes, edgeAttributes), new Options.Graph());
    }

    public Graph(Schema schema, Options.Graph options) {
        this.schema = schema;
        this.options = options;
        this.store = new ElementStore();
        this.adjacency = new Adjacency();
        this.identifiers = new IdentifierAllocator();
    }

    public Schema schema() {
        return schema;
    }

    public Options.Graph options() {
        return options;
    }

    public int order() {
        return store.nodeCount();
    }

    public int size() {
        return store.edgeCount();
    }

    public Element get(long identifier) {
        if (identifier > 0) return store.node(identifier);
        else if (identifier < 0) return store.edge(identifier);
        else throw GraphineException.of(UNKNOWN_IDENTIFIER, identifier);
    }

    public Node node(long identifier) {
        return store.node(identifier);
    }

    public Edge edge(long identifier) {
        return store.edge(identifier);
    }

    /**
     * Installs {@code replacement} under a live identifier, moving an edge between adjacency entries when its
     * start changes. The replacement must be of the identifier's kind and follow this graph's schema.
     */
    public void put(long identifier, Element replacement) {
        if (identifier > 0) {
            store.node(identifier);
            if (!replacement.isNode() || !replacement.layout().equals(schema.node())) {
                throw GraphineException.of(INCOMPATIBLE_REPLACEMENT, replacement, identifier);
            }
            store.put(identifier, replacement.asNode());
        } else if (identifier < 0) {
            Edge original = store.edge(identifier);
            if (!replacement.isEdge() || !replacement.layout().equals(schema.edge())) {
                throw GraphineException.of(INCOMPATIBLE_REPLACEMENT, replacement, identifier);
            }
            store.put(identifier, replacement.asEdge());
            adjacency.edgeRelocated(identifier, original.start(), replacement.asEdge().start());
        } else {
            throw GraphineException.of(UNKNOWN_IDENTIFIER, identifier);
        }
    }

    public Element remove(long identifier) {
        if (identifier > 0) return removeNode(identifier);
        else if (identifier < 0) return removeEdge(identifier);
        else throw GraphineException.of(UNKNOWN_IDENTIFIER, identifier);
    }

    /**
     * Tests whether an equal record is live in this graph. This is a scan over every node or every edge.
     */
    public boolean contains(Element element) {
        if (element.isNode()) return store.nodes().anyMatch(element::equals);
        else return store.edges().anyMatch(element::equals);
    }

    public FunctionalIterator<Long> nodeIdentifiers() {
        return store.nodeIdentifiers();
    }

    public FunctionalIterator<Long> edgeIdentifiers() {
        return store.edgeIdentifiers();
    }

    public FunctionalIterator<Node> nodes() {
        return store.nodes();
    }

    public FunctionalIterator<Edge> edges() {
        return store.edges();
    }

    public long addNode(Map<String, ?> attributes) {
        Node node = Node.of(schema.node(), attributes);
        long identifier = identifiers.node(store.nodeCount());
        store.put(identifier, node);
        LOG.trace("Added node {}: {}", identifier, node);
        return identifier;
    }

    public long addEdge(long start, long end) {
        return addEdge(start, end, map());
    }

    /**
     * Adds an edge from {@code start} to {@code end}. Neither endpoint has to be a live node.
     */
    public long addEdge(long start, long end, Map<String, ?> attributes) {
        Edge edge = Edge.of(schema.edge(), start, end, attributes);
        long identifier = identifiers.edge(store.edgeCount());
        store.put(identifier, edge);
        adjacency.edgeAdded(identifier, start);
        LOG.trace("Added edge {}: {}", identifier, edge);
        return identifier;
    }

    public long modifyNode(long identifier, Map<String, ?> changes) {
        Node replacement = store.node(identifier).replace(changes);
        store.put(identifier, replacement);
        LOG.trace("Modified node {}: {}", identifier, replacement);
        return identifier;
    }

    public long modifyEdge(long identifier, Map<String, ?> changes) {
        Edge original = store.edge(identifier);
        Edge replacement = original.replace(changes);
        store.put(identifier, replacement);
        adjacency.edgeRelocated(identifier, original.start(), replacement.start());
        LOG.trace("Modified edge {}: {}", identifier, replacement);
        return identifier;
    }

    public Node removeNode(long identifier) {
        store.node(identifier);
        if (options.cascadeEdgeRemoval()) {
            List<Long> incident = incidentEdges(identifier).toList();
            incident.forEach(this::removeEdge);
            if (!incident.isEmpty()) LOG.debug("Removing node {} cascaded to edges {}", identifier, incident);
        } else if (LOG.isDebugEnabled()) {
            long dangling = incidentEdges(identifier).count();
            if (dangling > 0) LOG.debug("Removing node {} leaves {} dangling edge(s)", identifier, dangling);
        }
        Node removed = store.deleteNode(identifier);
        adjacency.nodeRemoved(identifier);
        identifiers.release(identifier);
        LOG.trace("Removed node {}: {}", identifier, removed);
        return removed;
    }

    public Edge removeEdge(long identifier) {
        Edge removed = store.deleteEdge(identifier);
        adjacency.edgeRemoved(identifier, removed.start());
        identifiers.release(identifier);
        LOG.trace("Removed edge {}: {}", identifier, removed);
        return removed;
    }

    private FunctionalIterator<Long> incidentEdges(long node) {
        return store.edgeIdentifiers().filter(e -> {
            Edge edge = store.edge(e);
            return edge.start() == node || edge.end() == node;
        });
    }

    /**
     * Lazily scans the nodes for those holding any of the given attribute values. Every call starts a new scan.
     */
    public FunctionalIterator<Node> searchNodes(Map<String, ?> criteria) {
        AttributeMatcher matcher = AttributeMatcher.of(schema.node(), criteria);
        return store.nodes().filter(matcher::matches)
                .onConsumed(() -> LOG.trace("Completed node search for {}", matcher));
    }

    public FunctionalIterator<Edge> searchEdges(Map<String, ?> criteria) {
        AttributeMatcher matcher = AttributeMatcher.of(schema.edge(), criteria);
        return store.edges().filter(matcher::matches)
                .onConsumed(() -> LOG.trace("Completed edge search for {}", matcher));
    }

    /**
     * The identifiers one hop away from a live node: the node itself first, then the end of each of its
     * outgoing edges.
     */
    public FunctionalIterator<Long> adjacentIdentifiers(long node) {
        store.node(node);
        return neighbours(node);
    }

    /**
     * The records of {@link #adjacentIdentifiers(long)}. Reaching the end of a dangling edge fails with an
     * unknown identifier, when it is consumed.
     */
    public FunctionalIterator<Node> adjacentNodes(long node) {
        return adjacentIdentifiers(node).map(store::node);
    }

    public FunctionalIterator<Long> outgoingIdentifiers(long node) {
        store.node(node);
        return iterate(adjacency.outgoing(node));
    }

    public FunctionalIterator<Edge> outgoingEdges(long node) {
        return outgoingIdentifiers(node).map(store::edge);
    }

    private FunctionalIterator<Long> neighbours(long node) {
        return single(node).link(iterate(adjacency.outgoing(node)).map(e -> store.edge(e).end()));
    }

    /**
     * Walks everything reachable from {@code root} along outgoing edges, in the order picked by {@code selector}.
     * The root is not checked against the live nodes, so a walk may resume from a dangling identifier that an
     * earlier walk yielded; such an identifier has no outgoing edges and is yielded alone.
     */
    public FunctionalIterator<Long> traverse(long root, Selector selector) {
        return new Traversal(root, selector, this::neighbours);
    }

    public FunctionalIterator<Long> depthFirst(long root) {
        return traverse(root, Selector.DEPTH_FIRST);
    }

    public FunctionalIterator<Long> breadthFirst(long root) {
        return traverse(root, Selector.BREADTH_FIRST);
    }

    public Graph subgraph(long... nodes) {
        Long[] boxed = new Long[nodes.length];
        for (int i = 0; i < nodes.length; i++) boxed[i] = nodes[i];
        return subgraph(iterate(boxed).toList());
    }

    /**
     * Builds an independent graph holding copies of the given nodes and of every edge between two of them.
     * The copies get fresh identifiers; see {@link SubgraphGenerator}.
     */
    public Graph subgraph(Collection<Long> nodes) {
        return new SubgraphGenerator(this).generate(nodes);
    }

    @Override
    public String toString() {
        return "Graph{order=" + order() + ", size=" + size() + ", " + schema + "}";
    }
}
