package com.sparrowwallet.wren;

/**
 * No session exists for the address. The caller must obtain the peer's pre-key bundle and establish one.
 */
public class UnknownSessionException extends ProtocolException {
    public UnknownSessionException(ProtocolAddress address) {
        super("No session for " + address);
    }
}
