package com.livestanding.protocol;

/**
 * How the client reacts to an {@link Envelope}, decided by its status code.
 *
 * - AUTHENTICATED: server accepted the credential, connection is ready
 * - PAYLOAD: {@code data} carries a snapshot for the dispatcher
 * - ERROR: anything else, treated as a protocol error
 */
public enum EnvelopeKind {
    AUTHENTICATED,
    PAYLOAD,
    ERROR;

    public static EnvelopeKind classify(Envelope envelope, int authenticatedCode, int payloadCode) {
        int code = envelope.codeOrMissing();
        if (code == authenticatedCode) {
            return AUTHENTICATED;
        }
        if (code == payloadCode) {
            return PAYLOAD;
        }
        return ERROR;
    }
}
