package com.sparrowwallet.wren;

/**
 * Base class of all errors raised by the encryption engine. Every failure is reported synchronously to the caller,
 * and an operation that throws leaves session and pre-key state exactly as it was before the call.
 */
public class ProtocolException extends Exception {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
