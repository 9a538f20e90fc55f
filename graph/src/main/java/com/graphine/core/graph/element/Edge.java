/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.element;

import com.graphine.core.common.exception.GraphineException;
import com.graphine.core.graph.schema.Layout;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.RESERVED_ATTRIBUTE;
import static com.graphine.core.graph.schema.Schema.END;
import static com.graphine.core.graph.schema.Schema.START;

/**
 * A directed edge record. The endpoints are plain node identifiers and are not checked against the nodes of
 * the graph, so an edge may refer to a node that no longer exists.
 */
public final class Edge extends Element {

    private Edge(Layout layout, Object[] values) {
        super(layout, values);
    }

    public static Edge of(Layout layout, long start, long end, Map<String, ?> attributes) {
        assert layout.kind() == Layout.Kind.EDGE;
        if (attributes.containsKey(START)) throw GraphineException.of(RESERVED_ATTRIBUTE, layout.kind(), START);
        if (attributes.containsKey(END)) throw GraphineException.of(RESERVED_ATTRIBUTE, layout.kind(), END);
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(START, start);
        values.put(END, end);
        values.putAll(attributes);
        return new Edge(layout, layout.values(values));
    }

    public long start() {
        return (Long) value(layout().position(START));
    }

    public long end() {
        return (Long) value(layout().position(END));
    }

    @Override
    public Edge replace(Map<String, ?> changes) {
        return new Edge(layout(), replacedValues(changes));
    }

    @Override
    public boolean isEdge() {
        return true;
    }

    @Override
    public Edge asEdge() {
        return this;
    }
}
