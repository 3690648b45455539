package com.entity.linking.match;

/**
 * Thrown when a match query cannot be executed as given, e.g. when no signal was supplied.
 * Not retryable: the caller has to change the query.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
