/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.schema;

import com.graphine.core.common.exception.GraphineException;
import org.junit.Test;

import java.util.Map;

import static com.graphine.core.common.collection.Collections.list;
import static com.graphine.core.common.collection.Collections.map;
import static com.graphine.core.common.collection.Collections.pair;
import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.DUPLICATE_ATTRIBUTE;
import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.INVALID_ENDPOINT;
import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.MISSING_ATTRIBUTES;
import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.RESERVED_ATTRIBUTE;
import static com.graphine.core.common.exception.ErrorMessage.SchemaMismatch.UNEXPECTED_ATTRIBUTES;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SchemaTest {

    private final Schema schema = new Schema(list("city", "population"), list("distance"));

    @Test
    public void edge_layout_starts_with_endpoints() {
        assertEquals(list("start", "end", "distance"), schema.edge().attributes());
        assertEquals(list("start", "end"), schema.edge().requiredAttributes());
        assertEquals(list("distance"), schema.edge().optionalAttributes());
        assertTrue(schema.edge().isRequired("start"));
        assertFalse(schema.edge().isRequired("distance"));
    }

    @Test
    public void node_layout_has_no_required_attributes() {
        assertEquals(list("city", "population"), schema.node().attributes());
        assertTrue(schema.node().requiredAttributes().isEmpty());
        assertEquals(1, schema.node().position("population"));
    }

    @Test
    public void schemas_compare_by_layouts() {
        assertEquals(schema, new Schema(list("city", "population"), list("distance")));
        assertFalse(schema.equals(new Schema(list("population", "city"), list("distance"))));
    }

    @Test
    public void duplicate_attribute_is_rejected() {
        try {
            new Schema(list("city", "city"), list());
            fail();
        } catch (GraphineException e) {
            assertEquals(DUPLICATE_ATTRIBUTE.code(), e.errorMessage().code());
        }
    }

    @Test
    public void edge_attribute_named_as_endpoint_is_rejected() {
        try {
            new Schema(list("city"), list("end"));
            fail();
        } catch (GraphineException e) {
            assertEquals(RESERVED_ATTRIBUTE.code(), e.errorMessage().code());
        }
    }

    @Test
    public void values_follow_layout_order() {
        Object[] values = schema.node().values(map(pair("population", 10), pair("city", "Austin")));
        assertArrayEquals(new Object[]{"Austin", 10}, values);
    }

    @Test
    public void values_report_unexpected_attributes_by_name() {
        try {
            schema.node().values(map(pair("city", "Austin"), pair("population", 1), pair("country", "US")));
            fail();
        } catch (GraphineException e) {
            assertEquals(UNEXPECTED_ATTRIBUTES.code(), e.errorMessage().code());
            assertTrue(e.getMessage().contains("country"));
        }
    }

    @Test
    public void values_report_missing_attributes_by_name() {
        try {
            schema.node().values(map(pair("city", "Austin")));
            fail();
        } catch (GraphineException e) {
            assertEquals(MISSING_ATTRIBUTES.code(), e.errorMessage().code());
            assertTrue(e.getMessage().contains("population"));
        }
    }

    @Test
    public void endpoints_are_held_as_long() {
        Map<String, Object> supplied = map(pair("start", 1), pair("end", (short) 2), pair("distance", 3.5));
        assertArrayEquals(new Object[]{1L, 2L, 3.5}, schema.edge().values(supplied));
    }

    @Test
    public void non_integral_endpoint_is_rejected() {
        try {
            schema.edge().values(map(pair("start", 1L), pair("end", "Austin"), pair("distance", 1)));
            fail();
        } catch (GraphineException e) {
            assertEquals(INVALID_ENDPOINT.code(), e.errorMessage().code());
        }
    }

    @Test
    public void replace_changes_only_named_values() {
        Object[] original = new Object[]{"Austin", 10};
        Object[] replaced = schema.node().replace(original, map(pair("population", 11)));
        assertArrayEquals(new Object[]{"Austin", 11}, replaced);
        assertArrayEquals(new Object[]{"Austin", 10}, original);
    }
}
