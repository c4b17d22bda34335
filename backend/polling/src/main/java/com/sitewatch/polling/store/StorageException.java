package com.sitewatch.polling.store;

/**
 * A read or write against the persistence layer failed. Callers on the polling path treat the
 * cycle as failed and keep scheduling.
 */
public class StorageException extends IllegalStateException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
