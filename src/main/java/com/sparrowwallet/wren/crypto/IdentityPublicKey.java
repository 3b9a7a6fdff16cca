package com.sparrowwallet.wren.crypto;

import com.sparrowwallet.wren.InvalidKeyMaterialException;
import org.apache.commons.codec.binary.Hex;

import java.security.MessageDigest;
import java.util.Arrays;

/**
 * The public half of a long-term Ed25519 identity key. It verifies signatures and, through the Edwards to Montgomery
 * map, acts as an X25519 public key in key agreement.
 */
public final class IdentityPublicKey implements Comparable<IdentityPublicKey> {
    private final byte[] key;
    private final DhPublicKey dhPublicKey;

    private IdentityPublicKey(byte[] key, DhPublicKey dhPublicKey) {
        this.key = key;
        this.dhPublicKey = dhPublicKey;
    }

    public static IdentityPublicKey fromBytes(byte[] key) throws InvalidKeyMaterialException {
        Curve25519.checkLength(key, "identity key");
        byte[] copy = Arrays.copyOf(key, key.length);
        return new IdentityPublicKey(copy, DhPublicKey.fromBytes(Curve25519.edwardsToMontgomery(copy)));
    }

    public byte[] serialize() {
        return Arrays.copyOf(key, key.length);
    }

    public boolean verify(byte[] message, byte[] signature) {
        return Ed25519.verify(key, message, signature);
    }

    /**
     * Returns the X25519 form of this key used in X3DH.
     */
    public DhPublicKey toDhPublicKey() {
        return dhPublicKey;
    }

    @Override
    public int compareTo(IdentityPublicKey other) {
        return Arrays.compareUnsigned(key, other.key);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof IdentityPublicKey that)) {
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
