package com.sparrowwallet.wren;

/**
 * A wire or persisted structure could not be parsed. Raised before any cryptographic operation is attempted.
 */
public class MalformedMessageException extends ProtocolException {
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
