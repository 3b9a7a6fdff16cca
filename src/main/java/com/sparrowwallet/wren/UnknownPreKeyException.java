package com.sparrowwallet.wren;

/**
 * The referenced one-time pre-key does not exist, either because it was never issued or because it has already been
 * consumed.
 */
public class UnknownPreKeyException extends ProtocolException {
    private final int preKeyId;

    public UnknownPreKeyException(int preKeyId) {
        super("Unknown pre-key ID " + Integer.toUnsignedString(preKeyId));
        this.preKeyId = preKeyId;
    }

    public int getPreKeyId() {
        return preKeyId;
    }
}
