/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.graph.element;

import com.graphine.core.graph.schema.Layout;

import java.util.Map;

public final class Node extends Element {

    private Node(Layout layout, Object[] values) {
        super(layout, values);
    }

    public static Node of(Layout layout, Map<String, ?> attributes) {
        assert layout.kind() == Layout.Kind.NODE;
        return new Node(layout, layout.values(attributes));
    }

    @Override
    public Node replace(Map<String, ?> changes) {
        return new Node(layout(), replacedValues(changes));
    }

    @Override
    public boolean isNode() {
        return true;
    }

    @Override
    public Node asNode() {
        return this;
    }
}
