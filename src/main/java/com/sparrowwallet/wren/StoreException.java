package com.sparrowwallet.wren;

/**
 * The persistent store could not read or write state. The mutation that triggered the write is not committed.
 */
public class StoreException extends ProtocolException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
