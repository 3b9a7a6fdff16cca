package com.sparrowwallet.wren.ratchet;

import com.sparrowwallet.wren.InvalidKeyMaterialException;
import com.sparrowwallet.wren.crypto.DhKeyPair;
import com.sparrowwallet.wren.crypto.DhPublicKey;
import com.sparrowwallet.wren.crypto.Hkdf;

import javax.security.auth.Destroyable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public final class RootKey implements Destroyable {
    public static final int LENGTH = 32;

    private static final byte[] RATCHET_INFO = "WhisperRatchet".getBytes(StandardCharsets.UTF_8);

    private final byte[] key;

    RootKey(byte[] key) {
        if(key.length != LENGTH) {
            throw new IllegalArgumentException("Root key must be " + LENGTH + " bytes");
        }
        this.key = key;
    }

    /**
     * One DH ratchet step: mixes DH(ours, theirs) into this root key, producing the next root key and a new chain key.
     */
    public Step createChain(DhKeyPair ourRatchetKey, DhPublicKey theirRatchetKey) throws InvalidKeyMaterialException {
        byte[] sharedSecret = ourRatchetKey.calculateAgreement(theirRatchetKey);
        byte[] derived = Hkdf.deriveSecrets(sharedSecret, key, RATCHET_INFO, LENGTH + ChainKey.LENGTH);
        try {
            return new Step(new RootKey(Arrays.copyOfRange(derived, 0, LENGTH)), new ChainKey(Arrays.copyOfRange(derived, LENGTH, LENGTH + ChainKey.LENGTH)));
        } finally {
            Arrays.fill(sharedSecret, (byte)0);
            Arrays.fill(derived, (byte)0);
        }
    }

    byte[] getKey() {
        return key;
    }

    RootKey copy() {
        return new RootKey(Arrays.copyOf(key, LENGTH));
    }

    @Override
    public void destroy() {
        Arrays.fill(key, (byte)0);
    }

    public record Step(RootKey rootKey, ChainKey chainKey) {
    }
}
