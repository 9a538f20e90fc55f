/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.common.exception;

import java.util.Objects;

public class GraphineException extends RuntimeException {

    private final ErrorMessage error;

    private GraphineException(ErrorMessage error, Object... parameters) {
        super(error.message(parameters));
        assert !getMessage().contains("%s");
        this.error = error;
    }

    public static GraphineException of(ErrorMessage errorMessage, Object... parameters) {
        return new GraphineException(errorMessage, parameters);
    }

    public ErrorMessage errorMessage() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphineException that = (GraphineException) o;
        return error.equals(that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(error);
    }
}
