/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.element;

import com.graphine.core.common.exception.GraphineException;
import com.graphine.core.graph.schema.Layout;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.graphine.core.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * An immutable record of attribute values, laid out positionally against the {@link Layout} of its graph.
 *
 * Elements are never changed in place: {@link #replace(Map)} returns a new element, which the graph installs
 * under the same identifier. Two elements are equal when they are of the same kind and carry the same
 * attribute names and values, regardless of which graph or identifier they belong to.
 */
public abstract class Element {

    private final Layout layout;
    private final Object[] values;
    private final int hash;

    Element(Layout layout, Object[] values) {
        assert layout.attributes().size() == values.length;
        this.layout = layout;
        this.values = values;
        this.hash = Objects.hash(layout, Arrays.hashCode(values));
    }

    public Layout layout() {
        return layout;
    }

    public List<String> attributes() {
        return layout.attributes();
    }

    public Object get(String attribute) {
        return values[layout.position(attribute)];
    }

    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) map.put(layout.attributes().get(i), values[i]);
        return map;
    }

    /**
     * The values of the attributes a caller declared, leaving out those every element of this kind carries.
     */
    public Map<String, Object> optionalValues() {
        Map<String, Object> map = asMap();
        layout.requiredAttributes().forEach(map::remove);
        return map;
    }

    Object value(int position) {
        return values[position];
    }

    Object[] replacedValues(Map<String, ?> changes) {
        return layout.replace(values, changes);
    }

    public abstract Element replace(Map<String, ?> changes);

    public boolean isNode() {
        return false;
    }

    public boolean isEdge() {
        return false;
    }

    public Node asNode() {
        throw GraphineException.of(ILLEGAL_CAST, getClass().getSimpleName(), Node.class.getSimpleName());
    }

    public Edge asEdge() {
        throw GraphineException.of(ILLEGAL_CAST, getClass().getSimpleName(), Edge.class.getSimpleName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Element that = (Element) o;
        return layout.equals(that.layout) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(getClass().getSimpleName()).append("(");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) builder.append(", ");
            builder.append(layout.attributes().get(i)).append("=").append(values[i]);
        }
        return builder.append(")").toString();
    }
}
