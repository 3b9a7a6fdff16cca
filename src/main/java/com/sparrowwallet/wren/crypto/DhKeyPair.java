package com.sparrowwallet.wren.crypto;

import com.sparrowwallet.wren.InvalidKeyMaterialException;

import javax.security.auth.Destroyable;
import java.util.Arrays;

/**
 * An X25519 key pair. The private scalar is held as a raw byte array so that {@link #destroy()} can overwrite it;
 * after destruction the pair can no longer compute agreements.
 */
public final class DhKeyPair implements Destroyable {
    private final byte[] privateKey;
    private final DhPublicKey publicKey;
    private volatile boolean destroyed;

    private DhKeyPair(byte[] privateKey, DhPublicKey publicKey) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
    }

    public static DhKeyPair generate() {
        byte[] privateKey = Curve25519.generatePrivateKey();
        try {
            return new DhKeyPair(privateKey, DhPublicKey.fromBytes(Curve25519.publicKeyFromPrivate(privateKey)));
        } catch(InvalidKeyMaterialException e) {
            // A freshly clamped scalar is always a valid private key
            throw new AssertionError(e);
        }
    }

    public static DhKeyPair fromPrivateKey(byte[] privateKey) throws InvalidKeyMaterialException {
        Curve25519.checkLength(privateKey, "private key");
        byte[] copy = Arrays.copyOf(privateKey, privateKey.length);
        return new DhKeyPair(copy, DhPublicKey.fromBytes(Curve25519.publicKeyFromPrivate(copy)));
    }

    public DhPublicKey getPublicKey() {
        return publicKey;
    }

    public byte[] getPrivateKeyBytes() {
        checkNotDestroyed();
        return Arrays.copyOf(privateKey, privateKey.length);
    }

    public byte[] calculateAgreement(DhPublicKey theirPublicKey) throws InvalidKeyMaterialException {
        checkNotDestroyed();
        return Curve25519.calculateAgreement(privateKey, theirPublicKey.rawBytes());
    }

    /**
     * Returns an independent pair over a copy of the private key, so that destroying one does not affect the other.
     */
    public DhKeyPair copy() {
        checkNotDestroyed();
        return new DhKeyPair(Arrays.copyOf(privateKey, privateKey.length), publicKey);
    }

    @Override
    public void destroy() {
        Arrays.fill(privateKey, (byte)0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if(destroyed) {
            throw new IllegalStateException("Key pair has been destroyed");
        }
    }

    @Override
    public String toString() {
        return "DhKeyPair{publicKey=" + publicKey + "}";
    }
}
