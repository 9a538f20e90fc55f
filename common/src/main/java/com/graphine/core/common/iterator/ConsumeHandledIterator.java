/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.common.iterator;

import java.util.NoSuchElementException;

/**
 * Runs a callback exactly once, the first time the wrapped iterator reports exhaustion.
 */
class ConsumeHandledIterator<T> extends AbstractFunctionalIterator<T> {

    private final FunctionalIterator<T> iterator;
    private final Runnable onConsumed;
    private boolean isConsumed;

    ConsumeHandledIterator(FunctionalIterator<T> iterator, Runnable onConsumed) {
        this.iterator = iterator;
        this.onConsumed = onConsumed;
        this.isConsumed = false;
    }

    @Override
    public boolean hasNext() {
        boolean hasNext = iterator.hasNext();
        if (!hasNext && !isConsumed) {
            isConsumed = true;
            onConsumed.run();
        }
        return hasNext;
    }

    @Override
    public T next() {
        if (!hasNext()) throw new NoSuchElementException();
        return iterator.next();
    }

    @Override
    public void recycle() {
        iterator.recycle();
    }
}
