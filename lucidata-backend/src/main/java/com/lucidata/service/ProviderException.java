package com.lucidata.service;

/**
 * The language-model backend could not produce a response. Not retried.
 */
public class ProviderException extends Exception {

    /**
     * Failure classes of a completion call.
     */
    public enum Kind {
        NOT_CONFIGURED,
        NETWORK,
        TIMEOUT,
        AUTHENTICATION,
        RATE_LIMITED,
        UPSTREAM,
        INVALID_RESPONSE
    }

    private final Kind kind;

    public ProviderException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProviderException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
