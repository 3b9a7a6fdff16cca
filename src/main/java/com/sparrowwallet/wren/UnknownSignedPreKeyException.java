package com.sparrowwallet.wren;

public class UnknownSignedPreKeyException extends ProtocolException {
    public UnknownSignedPreKeyException(int signedPreKeyId) {
        super("Unknown signed pre-key ID " + Integer.toUnsignedString(signedPreKeyId));
    }
}
