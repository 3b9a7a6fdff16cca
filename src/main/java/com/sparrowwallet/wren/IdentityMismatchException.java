package com.sparrowwallet.wren;

import com.sparrowwallet.wren.crypto.IdentityPublicKey;

/**
 * A peer presented an identity key that differs from the one already trusted for its name. This is never resolved
 * automatically; the caller decides whether to replace the trusted key.
 */
public class IdentityMismatchException extends ProtocolException {
    private final String name;
    private final IdentityPublicKey presentedKey;

    public IdentityMismatchException(String name, IdentityPublicKey presentedKey) {
        super("Identity key mismatch for " + name);
        this.name = name;
        this.presentedKey = presentedKey;
    }

    public String getName() {
        return name;
    }

    public IdentityPublicKey getPresentedKey() {
        return presentedKey;
    }
}
