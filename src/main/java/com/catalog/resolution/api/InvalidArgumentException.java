package com.catalog.resolution.api;

/**
 * Thrown for out-of-range resolution arguments: a non-positive result count,
 * a score floor outside [0,1], or a blank locale.
 */
public class InvalidArgumentException extends IllegalArgumentException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
