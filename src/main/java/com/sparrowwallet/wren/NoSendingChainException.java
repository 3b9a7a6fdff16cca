package com.sparrowwallet.wren;

/**
 * The session has no sending chain. This indicates a protocol bug or corrupted persisted state, and the session must
 * be re-established.
 */
public class NoSendingChainException extends ProtocolException {
    public NoSendingChainException() {
        super("No sending chain key available");
    }

    public NoSendingChainException(String message) {
        super(message);
    }
}
