package com.sparrowwallet.wren.x3dh;

import com.sparrowwallet.wren.InvalidKeyMaterialException;
import com.sparrowwallet.wren.MalformedMessageException;
import com.sparrowwallet.wren.crypto.Curve25519;
import com.sparrowwallet.wren.crypto.DhKeyPair;
import com.sparrowwallet.wren.crypto.DhPublicKey;
import com.sparrowwallet.wren.crypto.Ed25519;
import com.sparrowwallet.wren.crypto.IdentityKeyPair;
import com.sparrowwallet.wren.util.ByteStreamParser;

import javax.security.auth.Destroyable;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;

/**
 * A medium-term pre-key whose public half is signed by the identity key. The responder also uses this key pair as its
 * first ratchet key.
 */
public final class SignedPreKey implements Destroyable {
    public static final int SERIALIZED_LENGTH = 4 + Curve25519.KEY_LENGTH * 2 + Ed25519.SIGNATURE_LENGTH + 8;

    private final int id;
    private final DhKeyPair keyPair;
    private final byte[] signature;
    private final long timestamp;

    public SignedPreKey(int id, DhKeyPair keyPair, byte[] signature, long timestamp) {
        this.id = id;
        this.keyPair = keyPair;
        this.signature = Arrays.copyOf(signature, signature.length);
        this.timestamp = timestamp;
    }

    public static SignedPreKey generate(int id, IdentityKeyPair identityKeyPair) throws InvalidKeyMaterialException {
        DhKeyPair keyPair = DhKeyPair.generate();
        byte[] signature = identityKeyPair.sign(keyPair.getPublicKey().getBytes());
        return new SignedPreKey(id, keyPair, signature, Instant.now().toEpochMilli());
    }

    public int getId() {
        return id;
    }

    public DhKeyPair getKeyPair() {
        return keyPair;
    }

    public byte[] getSignature() {
        return Arrays.copyOf(signature, signature.length);
    }

    /**
     * @return creation time in milliseconds since the epoch
     */
    public long getTimestamp() {
        return timestamp;
    }

    public SignedPublicPreKey getSignedPublicPreKey() {
        return new SignedPublicPreKey(id, keyPair.getPublicKey(), signature);
    }

    /**
     * Encodes as id (4) || private key (32) || public key (32) || signature (64) || timestamp (8).
     */
    public byte[] serialize() {
        byte[] privateKey = keyPair.getPrivateKeyBytes();
        try {
            return ByteBuffer.allocate(SERIALIZED_LENGTH)
                    .putInt(id)
                    .put(privateKey)
                    .put(keyPair.getPublicKey().getBytes())
                    .put(signature)
                    .putLong(timestamp)
                    .array();
        } finally {
            Arrays.fill(privateKey, (byte)0);
        }
    }

    public static SignedPreKey deserialize(byte[] data) throws MalformedMessageException, InvalidKeyMaterialException {
        ByteStreamParser parser = new ByteStreamParser(data, "SignedPreKey");
        int id = parser.readInt();
        byte[] privateKey = parser.readBytes(Curve25519.KEY_LENGTH);
        DhPublicKey publicKey = DhPublicKey.fromBytes(parser.readBytes(Curve25519.KEY_LENGTH));
        byte[] signature = parser.readBytes(Ed25519.SIGNATURE_LENGTH);
        long timestamp = parser.readLong();
        parser.assertEmpty();

        try {
            DhKeyPair keyPair = DhKeyPair.fromPrivateKey(privateKey);
            if(!keyPair.getPublicKey().equals(publicKey)) {
                keyPair.destroy();
                throw new InvalidKeyMaterialException("Signed pre-key " + id + " public key does not match private key");
            }
            return new SignedPreKey(id, keyPair, signature, timestamp);
        } finally {
            Arrays.fill(privateKey, (byte)0);
        }
    }

    @Override
    public void destroy() {
        keyPair.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return keyPair.isDestroyed();
    }

    @Override
    public String toString() {
        return "SignedPreKey{id=" + id + ", publicKey=" + keyPair.getPublicKey() + ", timestamp=" + timestamp + "}";
    }
}
