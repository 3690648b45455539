package com.entity.linking.store;

/**
 * Thrown when a backend collaborator (contact store, item store, search) cannot serve a call:
 * transport error, timeout, non-success status or an undecodable payload.
 */
public class BackendUnavailableException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final String backend;
    private final int status;

    public BackendUnavailableException(String backend, String message) {
        this(backend, NO_STATUS, message, null);
    }

    public BackendUnavailableException(String backend, int status, String message) {
        this(backend, status, message, null);
    }

    public BackendUnavailableException(String backend, int status, String message, Throwable cause) {
        super(backend + ": " + message, cause);
        this.backend = backend;
        this.status = status;
    }

    public String getBackend() {
        return backend;
    }

    /**
     * HTTP status returned by the backend, or {@link #NO_STATUS} when no response was received.
     */
    public int getStatus() {
        return status;
    }
}
