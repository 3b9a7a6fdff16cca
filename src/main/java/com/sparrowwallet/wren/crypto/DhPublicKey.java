package com.sparrowwallet.wren.crypto;

import com.sparrowwallet.wren.InvalidKeyMaterialException;
import org.apache.commons.codec.binary.Hex;

import java.security.MessageDigest;
import java.util.Arrays;

/**
 * An X25519 public key, used for ratchet keys, pre-keys, signed pre-keys and ephemeral keys.
 */
public final class DhPublicKey {
    private final byte[] key;

    private DhPublicKey(byte[] key) {
        this.key = key;
    }

    public static DhPublicKey fromBytes(byte[] key) throws InvalidKeyMaterialException {
        Curve25519.checkLength(key, "public key");
        return new DhPublicKey(Arrays.copyOf(key, key.length));
    }

    public byte[] getBytes() {
        return Arrays.copyOf(key, key.length);
    }

    byte[] rawBytes() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof DhPublicKey that)) {
            return false;
        }

        return MessageDigest.isEqual(key, that.key);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(key);
    }

    @Override
    public String toString() {
        return Hex.encodeHexString(key);
    }
}
