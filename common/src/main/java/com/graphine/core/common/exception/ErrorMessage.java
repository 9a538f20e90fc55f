/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphine.core.common.exception;

public abstract class ErrorMessage {

    private final String codePrefix;
    private final int codeNumber;
    private final String messagePrefix;
    private final String messageBody;

    private ErrorMessage(String codePrefix, int codeNumber, String messagePrefix, String messageBody) {
        this.codePrefix = codePrefix;
        this.codeNumber = codeNumber;
        this.messagePrefix = messagePrefix;
        this.messageBody = messageBody;
    }

    public String code() {
        return codePrefix + String.format("%02d", codeNumber);
    }

    public String message(Object... parameters) {
        return String.format(toString(), parameters);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", code(), messagePrefix, messageBody);
    }

    public static class Internal extends ErrorMessage {
        public static final Internal ILLEGAL_STATE =
                new Internal(1, "Illegal internal state!");
        public static final Internal ILLEGAL_ARGUMENT =
                new Internal(2, "Illegal argument provided: '%s'.");
        public static final Internal ILLEGAL_CAST =
                new Internal(3, "Illegal casting operation from '%s' to '%s'.");

        private static final String codePrefix = "INT";
        private static final String messagePrefix = "Invalid Internal State";

        Internal(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class SchemaMismatch extends ErrorMessage {
        public static final SchemaMismatch UNEXPECTED_ATTRIBUTES =
                new SchemaMismatch(1, "The %s attribute(s) '%s' are not declared in the schema '%s'.");
        public static final SchemaMismatch MISSING_ATTRIBUTES =
                new SchemaMismatch(2, "The %s attribute(s) '%s' declared in the schema '%s' were not provided.");
        public static final SchemaMismatch DUPLICATE_ATTRIBUTE =
                new SchemaMismatch(3, "The %s attribute '%s' is declared more than once.");
        public static final SchemaMismatch RESERVED_ATTRIBUTE =
                new SchemaMismatch(4, "The %s attribute '%s' is reserved and is always present.");
        public static final SchemaMismatch INVALID_ENDPOINT =
                new SchemaMismatch(5, "The edge endpoint '%s' must be a node identifier, but received '%s'.");
        public static final SchemaMismatch UNKNOWN_SEARCH_ATTRIBUTE =
                new SchemaMismatch(6, "Cannot search %s by '%s', as it is not declared in the schema '%s'.");
        public static final SchemaMismatch INCOMPATIBLE_REPLACEMENT =
                new SchemaMismatch(7, "The element '%s' cannot replace the element under identifier '%s'.");

        private static final String codePrefix = "SCM";
        private static final String messagePrefix = "Schema Mismatch";

        SchemaMismatch(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class ElementRead extends ErrorMessage {
        public static final ElementRead UNKNOWN_NODE =
                new ElementRead(1, "There is no node with identifier '%s'.");
        public static final ElementRead UNKNOWN_EDGE =
                new ElementRead(2, "There is no edge with identifier '%s'.");
        public static final ElementRead UNKNOWN_IDENTIFIER =
                new ElementRead(3, "The identifier '%s' does not name a node or an edge.");

        private static final String codePrefix = "ELR";
        private static final String messagePrefix = "Invalid Element Read";

        ElementRead(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }
}
