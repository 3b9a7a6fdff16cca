package com.sparrowwallet.wren.x3dh;

import com.sparrowwallet.wren.crypto.DhPublicKey;

import java.util.Arrays;

/**
 * The published half of a signed pre-key, with the identity key's signature over the raw public key bytes.
 */
public record SignedPublicPreKey(int id, DhPublicKey publicKey, byte[] signature) {
    public SignedPublicPreKey {
        signature = Arrays.copyOf(signature, signature.length);
    }

    @Override
    public byte[] signature() {
        return Arrays.copyOf(signature, signature.length);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof SignedPublicPreKey that)) {
            return false;
        }

        return id == that.id && publicKey.equals(that.publicKey) && Arrays.equals(signature, that.signature);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * id + publicKey.hashCode()) + Arrays.hashCode(signature);
    }

    @Override
    public String toString() {
        return "SignedPublicPreKey{id=" + id + ", publicKey=" + publicKey + "}";
    }
}
