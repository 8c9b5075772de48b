package com.quillkv.store;

/** The backend rejected the statement, or returned data that could not be read. */
public class BackendException extends StoreException {

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
