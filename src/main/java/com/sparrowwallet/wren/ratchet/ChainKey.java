package com.sparrowwallet.wren.ratchet;

import com.sparrowwallet.wren.crypto.Hkdf;

import javax.security.auth.Destroyable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A sending or receiving chain key. Each symmetric ratchet step yields one set of message keys and the next chain key.
 */
public final class ChainKey implements Destroyable {
    public static final int LENGTH = 32;

    private static final byte[] MESSAGE_KEY_SEED = {0x01};
    private static final byte[] CHAIN_KEY_SEED = {0x02};
    private static final byte[] MESSAGE_KEYS_INFO = "WhisperMessageKeys".getBytes(StandardCharsets.UTF_8);

    private final byte[] key;

    ChainKey(byte[] key) {
        if(key.length != LENGTH) {
            throw new IllegalArgumentException("Chain key must be " + LENGTH + " bytes");
        }
        this.key = key;
    }

    public ChainKey getNextChainKey() {
        return new ChainKey(Hkdf.hmacSha256(key, CHAIN_KEY_SEED));
    }

    public MessageKeys getMessageKeys() {
        byte[] seed = Hkdf.hmacSha256(key, MESSAGE_KEY_SEED);
        byte[] derived = Hkdf.deriveSecrets(seed, null, MESSAGE_KEYS_INFO, MessageKeys.DERIVED_LENGTH);
        try {
            return MessageKeys.fromDerived(derived);
        } finally {
            Arrays.fill(seed, (byte)0);
            Arrays.fill(derived, (byte)0);
        }
    }

    byte[] getKey() {
        return key;
    }

    ChainKey copy() {
        return new ChainKey(Arrays.copyOf(key, LENGTH));
    }

    @Override
    public void destroy() {
        Arrays.fill(key, (byte)0);
    }
}
