package org.example.biolearn.repository;

/**
 * Thrown when the document store cannot be reached or rejects an operation.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
