package com.sparrowwallet.wren.store;

import com.sparrowwallet.wren.InvalidKeyMaterialException;
import com.sparrowwallet.wren.crypto.IdentityKeyPair;

import java.util.Arrays;

/**
 * The persisted form of this device's identity: the Ed25519 public key, its private seed and the registration id.
 */
public record LocalIdentity(byte[] publicKey, byte[] privateKey, int registrationId) {
    public LocalIdentity {
        publicKey = Arrays.copyOf(publicKey, publicKey.length);
        privateKey = Arrays.copyOf(privateKey, privateKey.length);
    }

    public static LocalIdentity of(IdentityKeyPair identityKeyPair, int registrationId) {
        byte[] privateKey = identityKeyPair.getPrivateKeyBytes();
        try {
            return new LocalIdentity(identityKeyPair.getPublicKey().serialize(), privateKey, registrationId);
        } finally {
            Arrays.fill(privateKey, (byte)0);
        }
    }

    public IdentityKeyPair toIdentityKeyPair() throws InvalidKeyMaterialException {
        return IdentityKeyPair.fromBytes(publicKey, privateKey);
    }

    @Override
    public byte[] publicKey() {
        return Arrays.copyOf(publicKey, publicKey.length);
    }

    @Override
    public byte[] privateKey() {
        return Arrays.copyOf(privateKey, privateKey.length);
    }

    @Override
    public String toString() {
        return "LocalIdentity{registrationId=" + registrationId + "}";
    }
}
