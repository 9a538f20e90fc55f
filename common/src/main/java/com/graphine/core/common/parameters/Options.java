/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.common.parameters;

import javax.annotation.Nullable;

public class Options {

    /**
     * Configuration of a single graph. Values that are not set explicitly fall back to the {@code DEFAULT_*}
     * constants.
     */
    public static class Graph {

        public static final boolean DEFAULT_CASCADE_EDGE_REMOVAL = false;

        @Nullable
        private Boolean cascadeEdgeRemoval;

        public Graph() {
            this.cascadeEdgeRemoval = null;
        }

        public boolean cascadeEdgeRemoval() {
            if (cascadeEdgeRemoval != null) return cascadeEdgeRemoval;
            else return DEFAULT_CASCADE_EDGE_REMOVAL;
        }

        /**
         * When enabled, removing a node first removes every edge that starts or ends at it, so that no dangling
         * edges are left behind.
         */
        public Graph cascadeEdgeRemoval(boolean cascadeEdgeRemoval) {
            this.cascadeEdgeRemoval = cascadeEdgeRemoval;
            return this;
        }

        /**
         * Returns an independent copy holding the effective values, so later changes to either side are not shared.
         */
        public Graph copy() {
            return new Graph().cascadeEdgeRemoval(cascadeEdgeRemoval());
        }

        @Override
        public String toString() {
            return "Options.Graph{cascadeEdgeRemoval=" + cascadeEdgeRemoval() + "}";
        }
    }
}
