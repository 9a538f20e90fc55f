/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.schema;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

import static com.graphine.core.common.collection.Collections.list;

/**
 * The attribute layouts of a graph's nodes and edges, fixed when the graph is constructed.
 *
 * Nodes carry exactly the declared attributes. Edges always carry {@value #START} and {@value #END} ahead of
 * the declared ones.
 */
public class Schema {

    public static final String START = "start";
    public static final String END = "end";

    private static final List<String> REQUIRED_NODE_ATTRIBUTES = list();
    private static final List<String> REQUIRED_EDGE_ATTRIBUTES = list(START, END);

    private final Layout node;
    private final Layout edge;

    public Schema(Collection<String> nodeAttributes, Collection<String> edgeAttributes) {
        this.node = new Layout(Layout.Kind.NODE, REQUIRED_NODE_ATTRIBUTES, nodeAttributes);
        this.edge = new Layout(Layout.Kind.EDGE, REQUIRED_EDGE_ATTRIBUTES, edgeAttributes);
    }

    public Layout node() {
        return node;
    }

    public Layout edge() {
        return edge;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schema that = (Schema) o;
        return node.equals(that.node) && edge.equals(that.edge);
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, edge);
    }

    @Override
    public String toString() {
        return "Schema{" + node + ", " + edge + "}";
    }
}
