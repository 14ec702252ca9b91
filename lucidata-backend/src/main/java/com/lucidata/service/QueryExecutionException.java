package com.lucidata.service;

import com.lucidata.model.QueryError;

/**
 * A statement could not be executed. Carries the classified {@link QueryError}.
 */
public class QueryExecutionException extends Exception {

    private final QueryError error;

    public QueryExecutionException(QueryError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public QueryError getError() {
        return error;
    }
}
