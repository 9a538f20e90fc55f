/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.schema;

import com.graphine.core.common.exception.GraphineException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.graphine.core.common.collection.Collections.list;
import static com.graphine.core.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;
import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.DUPLICATE_ATTRIBUTE;
import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.INVALID_ENDPOINT;
import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.MISSING_ATTRIBUTES;
import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.RESERVED_ATTRIBUTE;
import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.UNEXPECTED_ATTRIBUTES;

/**
 * The fixed, ordered attribute layout shared by every node (or every edge) of one graph.
 *
 * Required attributes always come first, followed by the optional attributes in declaration order. Element
 * values are stored positionally against this layout, so a layout never changes once it is built.
 */
public class Layout {

    public enum Kind {
        NODE("node"),
        EDGE("edge");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private final Kind kind;
    private final List<String> attributes;
    private final int requiredCount;
    private final Map<String, Integer> positions;
    private final int hash;

    Layout(Kind kind, List<String> required, Collection<String> optional) {
        this.kind = kind;
        this.requiredCount = required.size();
        this.positions = new HashMap<>();
        List<String> attributes = new ArrayList<>(required);
        attributes.forEach(attribute -> positions.put(attribute, positions.size()));
        for (String attribute : optional) {
            if (attribute == null) throw GraphineException.of(ILLEGAL_ARGUMENT, "null attribute name");
            else if (required.contains(attribute)) throw GraphineException.of(RESERVED_ATTRIBUTE, kind, attribute);
            else if (positions.containsKey(attribute)) throw GraphineException.of(DUPLICATE_ATTRIBUTE, kind, attribute);
            positions.put(attribute, attributes.size());
            attributes.add(attribute);
        }
        this.attributes = list(attributes);
        this.hash = Objects.hash(kind, this.attributes);
    }

    public Kind kind() {
        return kind;
    }

    public List<String> attributes() {
        return attributes;
    }

    public List<String> requiredAttributes() {
        return attributes.subList(0, requiredCount);
    }

    public List<String> optionalAttributes() {
        return attributes.subList(requiredCount, attributes.size());
    }

    public boolean contains(String attribute) {
        return positions.containsKey(attribute);
    }

    public boolean isRequired(String attribute) {
        Integer position = positions.get(attribute);
        return position != null && position < requiredCount;
    }

    public int position(String attribute) {
        Integer position = positions.get(attribute);
        if (position == null) throw GraphineException.of(UNEXPECTED_ATTRIBUTES, kind, attribute, attributes);
        return position;
    }

    /**
     * Lays out a complete set of attribute values. The supplied names must match the layout exactly.
     */
    public Object[] values(Map<String, ?> supplied) {
        validateNames(supplied);
        List<String> missing = new ArrayList<>();
        for (String attribute : attributes) {
            if (!supplied.containsKey(attribute)) missing.add(attribute);
        }
        if (!missing.isEmpty()) throw GraphineException.of(MISSING_ATTRIBUTES, kind, missing, attributes);

        Object[] values = new Object[attributes.size()];
        supplied.forEach((attribute, value) -> values[positions.get(attribute)] = normalise(attribute, value));
        return values;
    }

    /**
     * Returns a copy of {@code original} with only the named values replaced.
     */
    public Object[] replace(Object[] original, Map<String, ?> changes) {
        assert original.length == attributes.size();
        validateNames(changes);
        Object[] values = original.clone();
        changes.forEach((attribute, value) -> values[positions.get(attribute)] = normalise(attribute, value));
        return values;
    }

    private void validateNames(Map<String, ?> supplied) {
        List<String> unexpected = new ArrayList<>();
        for (String attribute : supplied.keySet()) {
            if (!positions.containsKey(attribute)) unexpected.add(attribute);
        }
        if (!unexpected.isEmpty()) throw GraphineException.of(UNEXPECTED_ATTRIBUTES, kind, unexpected, attributes);
    }

    /**
     * Edge endpoints are node identifiers, held as {@code long} whatever integral type the caller supplied.
     */
    public Object normalise(String attribute, Object value) {
        if (kind == Kind.EDGE && isRequired(attribute)) return endpoint(attribute, value);
        else return value;
    }

    public static long endpoint(String attribute, Object value) {
        if (isEndpoint(value)) return ((Number) value).longValue();
        throw GraphineException.of(INVALID_ENDPOINT, attribute, value);
    }

    public static boolean isEndpoint(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Layout that = (Layout) o;
        return kind == that.kind && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return kind + attributes.toString();
    }
}
