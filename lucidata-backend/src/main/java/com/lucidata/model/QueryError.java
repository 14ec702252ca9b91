package com.lucidata.model;

/**
 * Structured failure from the execution boundary.
 *
 * @param kind failure class
 * @param message human-readable message, passed to the client verbatim
 */
public record QueryError(Kind kind, String message) {

    public enum Kind {
        SYNTAX_ERROR,
        CONSTRAINT_VIOLATION,
        CONNECTION_ERROR,
        OTHER;

        /**
         * Statement-level problems are the caller's fault; the rest are ours.
         *
         * @return true when the error should be reported as a client error
         */
        public boolean isClientError() {
            return this == SYNTAX_ERROR || this == CONSTRAINT_VIOLATION;
        }
    }
}
