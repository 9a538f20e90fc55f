/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.query;

import com.graphine.core.common.exception.GraphineException;
import com.graphine.core.graph.element.Element;
import com.graphine.core.graph.schema.Layout;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.UNKNOWN_SEARCH_ATTRIBUTE;

/**
 * Matches elements that hold the given value for at least one of the given attributes.
 *
 * Criteria are a disjunction: an element with any matching attribute is accepted, and no criteria accept
 * nothing. Values are compared with {@link Object#equals(Object)}, except edge endpoints, which accept any
 * integral identifier. An endpoint criterion with a non-integral value can never match, so it is dropped.
 */
public class AttributeMatcher {

    private final List<Criterion> criteria;

    private AttributeMatcher(List<Criterion> criteria) {
        this.criteria = criteria;
    }

    public static AttributeMatcher of(Layout layout, Map<String, ?> criteria) {
        List<Criterion> resolved = new ArrayList<>(criteria.size());
        criteria.forEach((attribute, value) -> {
            if (!layout.contains(attribute)) {
                throw GraphineException.of(UNKNOWN_SEARCH_ATTRIBUTE, layout.kind(), attribute, layout.attributes());
            }
            if (isUnmatchableEndpoint(layout, attribute, value)) return;
            resolved.add(new Criterion(attribute, layout.normalise(attribute, value)));
        });
        return new AttributeMatcher(resolved);
    }

    private static boolean isUnmatchableEndpoint(Layout layout, String attribute, Object value) {
        return layout.kind() == Layout.Kind.EDGE && layout.isRequired(attribute) && !Layout.isEndpoint(value);
    }

    public boolean matches(Element element) {
        for (Criterion criterion : criteria) {
            if (Objects.equals(criterion.value, element.get(criterion.attribute))) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return criteria.toString();
    }

    private static class Criterion {

        private final String attribute;
        private final Object value;

        private Criterion(String attribute, Object value) {
            this.attribute = attribute;
            this.value = value;
        }

        @Override
        public String toString() {
            return attribute + "=" + value;
        }
    }
}
