package com.swipesentinel.capture;

/**
 * The device transport is unreachable, timed out, or returned something that
 * could not be turned into an observation.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
