package com.spotladder.domain;

/**
 * Base type for every failure the engine reports to its callers.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
