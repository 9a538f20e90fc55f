/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.common.iterator;

import java.util.Arrays;
import java.util.Collection;

public class Iterators {

    public static <T> FunctionalIterator<T> single(T element) {
        return iterate(java.util.Collections.singletonList(element));
    }

    @SafeVarargs
    public static <T> FunctionalIterator<T> iterate(T... elements) {
        return iterate(Arrays.asList(elements));
    }

    /**
     * Iterates a live view of {@code collection}; changing the collection while iterating fails fast.
     */
    public static <T> FunctionalIterator<T> iterate(Collection<T> collection) {
        return new BaseIterator<>(collection.iterator());
    }
}
