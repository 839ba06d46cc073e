package com.livestanding.protocol;

/**
 * Thrown when an inbound frame is not a valid envelope.
 */
public class EnvelopeFormatException extends RuntimeException {

    public EnvelopeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
