/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.common.collection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Collections {

    /**
     * Builds an unmodifiable, insertion-ordered map. Unlike {@code Map.of}, values may be null.
     */
    @SafeVarargs
    public static <K, V> Map<K, V> map(Pair<K, V>... pairs) {
        Map<K, V> map = new LinkedHashMap<>();
        for (Pair<K, V> pair : pairs) map.put(pair.first(), pair.second());
        return java.util.Collections.unmodifiableMap(map);
    }

    public static <K, V> Map<K, V> map() {
        return java.util.Collections.emptyMap();
    }

    @SafeVarargs
    public static <T> List<T> list(T... elements) {
        return list(Arrays.asList(elements));
    }

    public static <T> List<T> list(Collection<T> elements) {
        return java.util.Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public static <A, B> Pair<A, B> pair(A first, B second) {
        return new Pair<>(first, second);
    }
}
