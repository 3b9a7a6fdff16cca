package com.sparrowwallet.wren.crypto;

import com.sparrowwallet.wren.InvalidKeyMaterialException;

import javax.security.auth.Destroyable;
import java.util.Arrays;

/**
 * A long-term Ed25519 identity key pair. Signing uses the Ed25519 seed directly; key agreement uses the X25519 scalar
 * derived from the seed by {@link Curve25519#edwardsSeedToMontgomery(byte[])}, which pairs with
 * {@link IdentityPublicKey#toDhPublicKey()} on the other side.
 */
public final class IdentityKeyPair implements Destroyable {
    private final IdentityPublicKey publicKey;
    private final byte[] seed;
    private final byte[] dhPrivateKey;
    private volatile boolean destroyed;

    private IdentityKeyPair(IdentityPublicKey publicKey, byte[] seed, byte[] dhPrivateKey) {
        this.publicKey = publicKey;
        this.seed = seed;
        this.dhPrivateKey = dhPrivateKey;
    }

    public static IdentityKeyPair generate() {
        byte[][] keyPair = Ed25519.generateKeyPair();
        try {
            return fromBytes(keyPair[0], keyPair[1]);
        } catch(InvalidKeyMaterialException e) {
            throw new AssertionError("Generated Ed25519 key was rejected", e);
        } finally {
            Arrays.fill(keyPair[1], (byte)0);
        }
    }

    /**
     * Restore an identity from its stored public key and private seed.
     *
     * @throws InvalidKeyMaterialException if either key is malformed or the seed does not produce the public key
     */
    public static IdentityKeyPair fromBytes(byte[] publicKey, byte[] seed) throws InvalidKeyMaterialException {
        IdentityPublicKey identityPublicKey = IdentityPublicKey.fromBytes(publicKey);
        byte[] seedCopy = Arrays.copyOf(seed, seed.length);
        byte[] dhPrivateKey = Curve25519.edwardsSeedToMontgomery(seedCopy);

        byte[] derivedDhPublic = Curve25519.publicKeyFromPrivate(dhPrivateKey);
        if(!Arrays.equals(derivedDhPublic, identityPublicKey.toDhPublicKey().rawBytes())) {
            Arrays.fill(seedCopy, (byte)0);
            Arrays.fill(dhPrivateKey, (byte)0);
            throw new InvalidKeyMaterialException("Identity private key does not match public key");
        }

        return new IdentityKeyPair(identityPublicKey, seedCopy, dhPrivateKey);
    }

    public IdentityPublicKey getPublicKey() {
        return publicKey;
    }

    public byte[] getPrivateKeyBytes() {
        checkNotDestroyed();
        return Arrays.copyOf(seed, seed.length);
    }

    public byte[] sign(byte[] message) throws InvalidKeyMaterialException {
        checkNotDestroyed();
        return Ed25519.sign(seed, message);
    }

    public byte[] calculateAgreement(DhPublicKey theirPublicKey) throws InvalidKeyMaterialException {
        checkNotDestroyed();
        return Curve25519.calculateAgreement(dhPrivateKey, theirPublicKey.rawBytes());
    }

    @Override
    public void destroy() {
        Arrays.fill(seed, (byte)0);
        Arrays.fill(dhPrivateKey, (byte)0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if(destroyed) {
            throw new IllegalStateException("Identity key pair has been destroyed");
        }
    }

    @Override
    public String toString() {
        return "IdentityKeyPair{publicKey=" + publicKey + "}";
    }
}
