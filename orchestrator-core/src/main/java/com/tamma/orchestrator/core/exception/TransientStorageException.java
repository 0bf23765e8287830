package com.tamma.orchestrator.core.exception;

/**
 * Raised by a store implementation for failures that are expected to succeed on retry
 * (lost connections, lock contention). Never surfaced to callers directly.
 */
public class TransientStorageException extends RuntimeException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
