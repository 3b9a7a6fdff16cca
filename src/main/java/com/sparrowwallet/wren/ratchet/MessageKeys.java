package com.sparrowwallet.wren.ratchet;

import javax.security.auth.Destroyable;
import java.util.Arrays;

/**
 * Keys for a single message, expanded from a chain key seed. Only the first {@link #NONCE_LENGTH} bytes of the IV are
 * used as the AES-GCM nonce.
 */
public final class MessageKeys implements Destroyable {
    public static final int CIPHER_KEY_LENGTH = 32;
    public static final int MAC_KEY_LENGTH = 32;
    public static final int IV_LENGTH = 16;
    public static final int DERIVED_LENGTH = CIPHER_KEY_LENGTH + MAC_KEY_LENGTH + IV_LENGTH;
    static final int NONCE_LENGTH = 12;

    private final byte[] cipherKey;
    private final byte[] macKey;
    private final byte[] iv;

    MessageKeys(byte[] cipherKey, byte[] macKey, byte[] iv) {
        this.cipherKey = cipherKey;
        this.macKey = macKey;
        this.iv = iv;
    }

    static MessageKeys fromDerived(byte[] derived) {
        return new MessageKeys(Arrays.copyOfRange(derived, 0, CIPHER_KEY_LENGTH),
                Arrays.copyOfRange(derived, CIPHER_KEY_LENGTH, CIPHER_KEY_LENGTH + MAC_KEY_LENGTH),
                Arrays.copyOfRange(derived, CIPHER_KEY_LENGTH + MAC_KEY_LENGTH, DERIVED_LENGTH));
    }

    public byte[] getCipherKey() {
        return cipherKey;
    }

    public byte[] getMacKey() {
        return macKey;
    }

    public byte[] getIv() {
        return iv;
    }

    public byte[] getNonce() {
        return Arrays.copyOf(iv, NONCE_LENGTH);
    }

    @Override
    public void destroy() {
        Arrays.fill(cipherKey, (byte)0);
        Arrays.fill(macKey, (byte)0);
        Arrays.fill(iv, (byte)0);
    }
}
