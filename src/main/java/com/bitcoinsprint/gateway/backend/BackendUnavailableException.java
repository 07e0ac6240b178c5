package com.bitcoinsprint.gateway.backend;

import lombok.Getter;

/**
 * The backend could not produce a usable response: timeout, refused or reset connection,
 * or a response the gateway could not frame.
 */
@Getter
public class BackendUnavailableException extends RuntimeException {

    private final boolean timedOut;

    public BackendUnavailableException(String message, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public BackendUnavailableException(String message) {
        super(message);
        this.timedOut = false;
    }
}
