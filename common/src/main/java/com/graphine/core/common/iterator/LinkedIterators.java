/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.common.iterator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

class LinkedIterators<T> extends AbstractFunctionalIterator<T> {

    private final Deque<FunctionalIterator<T>> iterators;

    LinkedIterators(List<FunctionalIterator<T>> iterators) {
        this.iterators = new ArrayDeque<>(iterators);
    }

    @Override
    public final LinkedIterators<T> link(FunctionalIterator<T> iterator) {
        iterators.addLast(iterator);
        return this;
    }

    @Override
    public boolean hasNext() {
        while (iterators.size() > 1 && !iterators.peekFirst().hasNext()) iterators.removeFirst();
        return !iterators.isEmpty() && iterators.peekFirst().hasNext();
    }

    @Override
    public T next() {
        if (!hasNext()) throw new NoSuchElementException();
        return iterators.peekFirst().next();
    }

    @Override
    public void recycle() {
        iterators.forEach(FunctionalIterator::recycle);
    }
}
