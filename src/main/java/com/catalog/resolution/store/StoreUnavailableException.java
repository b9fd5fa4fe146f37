package com.catalog.resolution.store;

/**
 * Thrown when the persistent store behind a {@link CandidateStore} cannot be reached.
 * Resolvers propagate it unchanged; retry policy belongs to the caller or the store client.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
