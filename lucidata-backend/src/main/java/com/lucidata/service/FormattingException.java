package com.lucidata.service;

/**
 * Result data could not be rendered in the requested format.
 */
public class FormattingException extends RuntimeException {

    public FormattingException(String message, Throwable cause) {
        super(message, cause);
    }
}
