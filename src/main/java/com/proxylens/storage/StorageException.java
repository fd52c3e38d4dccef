package com.proxylens.storage;

/**
 * Exception thrown when a record store operation fails.
 */
public class StorageException extends RuntimeException {

    private final String store;

    public StorageException(String message, String store, Throwable cause) {
        super(message, cause);
        this.store = store;
    }

    public String getStore() {
        return store;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [Store: " + store + "]";
    }
}
