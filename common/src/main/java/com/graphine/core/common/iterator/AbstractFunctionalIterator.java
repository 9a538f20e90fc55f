/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.common.iterator;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

import static com.graphine.core.common.collection.Collections.list;

public abstract class AbstractFunctionalIterator<T> implements FunctionalIterator<T> {

    @Override
    public <U> FunctionalIterator<U> map(Function<T, U> mappingFn) {
        return new MappedIterator<>(this, mappingFn);
    }

    @Override
    public FunctionalIterator<T> filter(Predicate<T> predicate) {
        return new FilteredIterator<>(this, predicate);
    }

    @Override
    public FunctionalIterator<T> link(FunctionalIterator<T> iterator) {
        return new LinkedIterators<>(list(this, iterator));
    }

    @Override
    public FunctionalIterator<T> onConsumed(Runnable function) {
        return new ConsumeHandledIterator<>(this, function);
    }

    @Override
    public boolean anyMatch(Predicate<T> predicate) {
        try {
            while (hasNext()) {
                if (predicate.test(next())) return true;
            }
            return false;
        } finally {
            recycle();
        }
    }

    @Override
    public List<T> toList() {
        List<T> elements = new ArrayList<>();
        forEachRemaining(elements::add);
        return elements;
    }

    @Override
    public long count() {
        long count = 0;
        while (hasNext()) {
            next();
            count++;
        }
        recycle();
        return count;
    }
}
