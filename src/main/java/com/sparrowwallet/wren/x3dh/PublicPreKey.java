package com.sparrowwallet.wren.x3dh;

import com.sparrowwallet.wren.crypto.DhPublicKey;

/**
 * The published half of a one-time pre-key.
 */
public record PublicPreKey(int id, DhPublicKey publicKey) {
}
