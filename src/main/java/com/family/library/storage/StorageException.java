package com.family.library.storage;

/**
 * Raised by every {@link LibraryStorage} implementation when the backing store
 * cannot complete a call. Callers report it and abandon the current step.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
