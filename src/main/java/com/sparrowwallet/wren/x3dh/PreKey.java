package com.sparrowwallet.wren.x3dh;

import com.sparrowwallet.wren.InvalidKeyMaterialException;
import com.sparrowwallet.wren.MalformedMessageException;
import com.sparrowwallet.wren.crypto.Curve25519;
import com.sparrowwallet.wren.crypto.DhKeyPair;
import com.sparrowwallet.wren.crypto.DhPublicKey;
import com.sparrowwallet.wren.util.ByteStreamParser;

import javax.security.auth.Destroyable;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * A one-time pre-key. It is published in a bundle and consumed by the first initial message that names it.
 */
public final class PreKey implements Destroyable {
    public static final int SERIALIZED_LENGTH = 4 + Curve25519.KEY_LENGTH * 2;

    private final int id;
    private final DhKeyPair keyPair;

    public PreKey(int id, DhKeyPair keyPair) {
        this.id = id;
        this.keyPair = keyPair;
    }

    public static PreKey generate(int id) {
        return new PreKey(id, DhKeyPair.generate());
    }

    public int getId() {
        return id;
    }

    public DhKeyPair getKeyPair() {
        return keyPair;
    }

    public PublicPreKey getPublicPreKey() {
        return new PublicPreKey(id, keyPair.getPublicKey());
    }

    /**
     * Encodes as id (4) || private key (32) || public key (32).
     */
    public byte[] serialize() {
        byte[] privateKey = keyPair.getPrivateKeyBytes();
        try {
            return ByteBuffer.allocate(SERIALIZED_LENGTH)
                    .putInt(id)
                    .put(privateKey)
                    .put(keyPair.getPublicKey().getBytes())
                    .array();
        } finally {
            Arrays.fill(privateKey, (byte)0);
        }
    }

    public static PreKey deserialize(byte[] data) throws MalformedMessageException, InvalidKeyMaterialException {
        ByteStreamParser parser = new ByteStreamParser(data, "PreKey");
        int id = parser.readInt();
        byte[] privateKey = parser.readBytes(Curve25519.KEY_LENGTH);
        DhPublicKey publicKey = DhPublicKey.fromBytes(parser.readBytes(Curve25519.KEY_LENGTH));
        parser.assertEmpty();

        try {
            DhKeyPair keyPair = DhKeyPair.fromPrivateKey(privateKey);
            if(!keyPair.getPublicKey().equals(publicKey)) {
                keyPair.destroy();
                throw new InvalidKeyMaterialException("Pre-key " + id + " public key does not match private key");
            }
            return new PreKey(id, keyPair);
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
        return "PreKey{id=" + id + ", publicKey=" + keyPair.getPublicKey() + "}";
    }
}
