package com.sparrowwallet.wren;

public class UntrustedIdentityException extends ProtocolException {
    public UntrustedIdentityException(String name) {
        super("No trusted identity for " + name);
    }
}
