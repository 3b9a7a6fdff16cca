package com.sparrowwallet.wren;

/**
 * A message failed authentication. Counters are not advanced; the message may have been tampered with or replayed.
 */
public class DecryptionFailureException extends ProtocolException {
    public DecryptionFailureException(String message) {
        super(message);
    }

    public DecryptionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
