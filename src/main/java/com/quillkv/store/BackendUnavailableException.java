package com.quillkv.store;

/** The backend could not be reached or did not answer in time. Retryable by the caller. */
public class BackendUnavailableException extends StoreException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
