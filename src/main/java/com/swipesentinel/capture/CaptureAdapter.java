package com.swipesentinel.capture;

import com.swipesentinel.model.Observation;

/**
 * The only point where the decision loop touches the device transport.
 *
 * Implementations are used by one session thread at a time. Both calls block
 * until the transport answers or its own timeout elapses; a timeout surfaces as
 * {@link TransportException} (observe) or an error result (execute).
 */
public interface CaptureAdapter {

    /** Captures the current accessibility tree and, when enabled, a screenshot. */
    Observation observe() throws TransportException;

    /** Issues one device-level action. Never throws for transport failures. */
    PrimitiveResult execute(Primitive primitive);

    /**
     * Brings {@code packageName} back to the foreground if something else took
     * over the screen. Returns true when the app is in the foreground afterwards.
     * Adapters without app control report true.
     */
    default boolean ensureForeground(String packageName) throws TransportException {
        return true;
    }
}
