package com.sparrowwallet.wren.crypto;

import com.sparrowwallet.wren.InvalidKeyMaterialException;

import java.security.*;
import java.security.interfaces.EdECPrivateKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;

/**
 * Ed25519 signing over raw 32-byte keys.
 */
public class Ed25519 {
    public static final int SIGNATURE_LENGTH = 64;

    private static final String ALGORITHM = "Ed25519";

    private static final byte[] ED25519_PUBLIC_KEY_PREFIX = new byte[] {
        0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00
    };

    private static final byte[] ED25519_PRIVATE_KEY_PREFIX = new byte[] {
        0x30, 0x2e, 0x02, 0x01, 0x00, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x04, 0x22, 0x04, 0x20
    };

    private Ed25519() {
    }

    /**
     * Generate a new Ed25519 key pair.
     *
     * @return two arrays, the 32-byte public key followed by the 32-byte private seed
     */
    public static byte[][] generateKeyPair() {
        try {
            KeyPair keyPair = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
            byte[] encodedPublic = keyPair.getPublic().getEncoded();
            byte[] publicKey = Arrays.copyOfRange(encodedPublic, ED25519_PUBLIC_KEY_PREFIX.length, encodedPublic.length);
            byte[] seed = ((EdECPrivateKey)keyPair.getPrivate()).getBytes().orElseThrow();
            return new byte[][] { publicKey, seed };
        } catch(NoSuchAlgorithmException e) {
            throw new AssertionError("Ed25519 is required by the JDK", e);
        }
    }

    public static byte[] sign(byte[] seed, byte[] message) throws InvalidKeyMaterialException {
        Curve25519.checkLength(seed, "Ed25519 seed");

        byte[] encoded = new byte[ED25519_PRIVATE_KEY_PREFIX.length + Curve25519.KEY_LENGTH];
        System.arraycopy(ED25519_PRIVATE_KEY_PREFIX, 0, encoded, 0, ED25519_PRIVATE_KEY_PREFIX.length);
        System.arraycopy(seed, 0, encoded, ED25519_PRIVATE_KEY_PREFIX.length, Curve25519.KEY_LENGTH);

        try {
            PrivateKey privateKey = KeyFactory.getInstance(ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(encoded));
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initSign(privateKey);
            signature.update(message);
            return signature.sign();
        } catch(NoSuchAlgorithmException e) {
            throw new AssertionError("Ed25519 is required by the JDK", e);
        } catch(GeneralSecurityException e) {
            throw new InvalidKeyMaterialException("Could not sign with Ed25519 key", e);
        } finally {
            Arrays.fill(encoded, (byte)0);
        }
    }

    /**
     * Verify an Ed25519 signature. Malformed keys and signatures verify as false.
     */
    public static boolean verify(byte[] publicKey, byte[] message, byte[] signatureBytes) {
        if(publicKey == null || publicKey.length != Curve25519.KEY_LENGTH || signatureBytes == null || signatureBytes.length != SIGNATURE_LENGTH) {
            return false;
        }

        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initVerify(toPublicKey(publicKey));
            signature.update(message);
            return signature.verify(signatureBytes);
        } catch(NoSuchAlgorithmException e) {
            throw new AssertionError("Ed25519 is required by the JDK", e);
        } catch(GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }

    static PublicKey toPublicKey(byte[] rawKey) throws InvalidKeySpecException, NoSuchAlgorithmException {
        byte[] encoded = new byte[ED25519_PUBLIC_KEY_PREFIX.length + Curve25519.KEY_LENGTH];
        System.arraycopy(ED25519_PUBLIC_KEY_PREFIX, 0, encoded, 0, ED25519_PUBLIC_KEY_PREFIX.length);
        System.arraycopy(rawKey, 0, encoded, ED25519_PUBLIC_KEY_PREFIX.length, Curve25519.KEY_LENGTH);

        return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
    }
}
