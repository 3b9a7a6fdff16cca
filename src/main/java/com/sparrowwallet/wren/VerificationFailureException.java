package com.sparrowwallet.wren;

/**
 * A signature or pre-key bundle check failed. No session is established.
 */
public class VerificationFailureException extends ProtocolException {
    public VerificationFailureException(String message) {
        super(message);
    }

    public VerificationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
