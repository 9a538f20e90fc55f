/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.common.iterator;

import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A single-pass iterator with lazy combinators. Combinators wrap the receiver, so it must not be advanced
 * directly once wrapped. Terminal operations drain what they need and then {@link #recycle()} the chain.
 */
public interface FunctionalIterator<T> extends Iterator<T> {

    <U> FunctionalIterator<U> map(Function<T, U> mappingFn);

    FunctionalIterator<T> filter(Predicate<T> predicate);

    FunctionalIterator<T> link(FunctionalIterator<T> iterator);

    /**
     * Runs {@code function} once, when this iterator is first found to be exhausted. It does not run if the
     * consumer stops early.
     */
    FunctionalIterator<T> onConsumed(Runnable function);

    boolean anyMatch(Predicate<T> predicate);

    List<T> toList();

    long count();

    /**
     * Releases whatever this iterator holds for the elements it has not yet produced.
     */
    void recycle();

    @Override
    default void forEachRemaining(Consumer<? super T> action) {
        while (hasNext()) action.accept(next());
        recycle();
    }
}
