package com.architecture.memory.flowgrade.exception;

/**
 * The inference model could not be reached or refused the call (network, quota, auth, timeout).
 * Never retried here and never cached.
 */
public class InferenceTransportException extends RuntimeException {

    public InferenceTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
