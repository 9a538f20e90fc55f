/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.common.collection;

import java.util.Objects;

public class Pair<FIRST, SECOND> {

    private final FIRST first;
    private final SECOND second;
    private final int hash;

    public Pair(FIRST first, SECOND second) {
        this.first = first;
        this.second = second;
        this.hash = Objects.hash(first, second);
    }

    public FIRST first() {
        return first;
    }

    public SECOND second() {
        return second;
    }

    @Override
    public String toString() {
        return "{" + first + ", " + second + "}";
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Pair<?, ?> other = (Pair<?, ?>) obj;
        return Objects.equals(first, other.first) && Objects.equals(second, other.second);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
