package com.sparrowwallet.wren.x3dh;

import com.sparrowwallet.wren.crypto.DhPublicKey;

import javax.annotation.Nullable;

/**
 * Output of {@link X3dh#initiate}. The shared secret seeds the double ratchet; the ephemeral key and the pre-key ids
 * are sent to the responder in the initial message.
 */
public record X3dhResult(byte[] sharedSecret, DhPublicKey ephemeralPublicKey, @Nullable Integer usedPreKeyId, int signedPreKeyId) {
}
