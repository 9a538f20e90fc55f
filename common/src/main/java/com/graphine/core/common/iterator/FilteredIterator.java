/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.common.iterator;

import java.util.NoSuchElementException;
import java.util.function.Predicate;

class FilteredIterator<T> extends AbstractFunctionalIterator<T> {

    private final FunctionalIterator<T> iterator;
    private final Predicate<T> predicate;
    private T next;
    private boolean fetched;

    FilteredIterator(FunctionalIterator<T> iterator, Predicate<T> predicate) {
        this.iterator = iterator;
        this.predicate = predicate;
        this.fetched = false;
    }

    @Override
    public boolean hasNext() {
        return fetched || fetchAndCheck();
    }

    private boolean fetchAndCheck() {
        while (iterator.hasNext()) {
            T candidate = iterator.next();
            if (predicate.test(candidate)) {
                next = candidate;
                fetched = true;
                return true;
            }
        }
        return false;
    }

    @Override
    public T next() {
        if (!hasNext()) throw new NoSuchElementException();
        fetched = false;
        T result = next;
        next = null;
        return result;
    }

    @Override
    public void recycle() {
        iterator.recycle();
    }
}
