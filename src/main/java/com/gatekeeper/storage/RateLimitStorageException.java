package com.gatekeeper.storage;

/**
 * The storage backend could not be read or written. Callers of the limiters treat it
 * as "enforcement unavailable", not as a rejection.
 */
public class RateLimitStorageException extends RuntimeException {

    public RateLimitStorageException(String message) {
        super(message);
    }

    public RateLimitStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
