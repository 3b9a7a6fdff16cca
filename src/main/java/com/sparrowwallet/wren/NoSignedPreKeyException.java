package com.sparrowwallet.wren;

public class NoSignedPreKeyException extends ProtocolException {
    public NoSignedPreKeyException() {
        super("No signed pre-key available");
    }
}
