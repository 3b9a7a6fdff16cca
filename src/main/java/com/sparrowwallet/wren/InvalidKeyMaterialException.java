package com.sparrowwallet.wren;

/**
 * Key bytes have the wrong length or do not encode a valid key.
 */
public class InvalidKeyMaterialException extends ProtocolException {
    public InvalidKeyMaterialException(String message) {
        super(message);
    }

    public InvalidKeyMaterialException(String message, Throwable cause) {
        super(message, cause);
    }
}
