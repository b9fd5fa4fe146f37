package com.catalog.resolution.api;

/**
 * Thrown when the raw query is empty or whitespace-only, or too long to resolve.
 * A caller error: it is surfaced immediately and never retried.
 */
public class InvalidQueryException extends IllegalArgumentException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
