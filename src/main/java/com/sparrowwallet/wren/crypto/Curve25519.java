package com.sparrowwallet.wren.crypto;

import com.sparrowwallet.wren.InvalidKeyMaterialException;

import javax.crypto.KeyAgreement;
import java.math.BigInteger;
import java.security.*;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;

/**
 * X25519 operations on raw 32-byte keys, plus the conversions that let an Ed25519 identity key take part in X25519
 * agreements.
 *
 * The JCA providers only accept encoded keys, so raw keys are wrapped with the fixed X.509 and PKCS#8 prefixes for
 * the X25519 algorithm identifier.
 */
public class Curve25519 {
    public static final int KEY_LENGTH = 32;

    private static final String ALGORITHM = "X25519";

    private static final byte[] X25519_PUBLIC_KEY_PREFIX = new byte[] {
        0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x6e, 0x03, 0x21, 0x00
    };

    private static final byte[] X25519_PRIVATE_KEY_PREFIX = new byte[] {
        0x30, 0x2e, 0x02, 0x01, 0x00, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x6e, 0x04, 0x22, 0x04, 0x20
    };

    private static final byte[] BASE_POINT = new byte[KEY_LENGTH];

    // Field prime 2^255 - 19
    private static final BigInteger P = BigInteger.TWO.pow(255).subtract(BigInteger.valueOf(19));

    private static final SecureRandom random = new SecureRandom();

    static {
        BASE_POINT[0] = 9;
    }

    private Curve25519() {
    }

    /**
     * Generate a random clamped X25519 private scalar.
     *
     * @return 32-byte private key
     */
    public static byte[] generatePrivateKey() {
        byte[] privateKey = new byte[KEY_LENGTH];
        random.nextBytes(privateKey);
        clamp(privateKey);
        return privateKey;
    }

    /**
     * Derive the public key for a private scalar by multiplying the base point.
     *
     * @param privateKey 32-byte private key
     * @return 32-byte public key (Montgomery u-coordinate, little-endian)
     */
    public static byte[] publicKeyFromPrivate(byte[] privateKey) throws InvalidKeyMaterialException {
        return calculateAgreement(privateKey, BASE_POINT);
    }

    /**
     * Compute the X25519 shared value between a private scalar and a public point.
     *
     * @param privateKey 32-byte private key
     * @param publicKey 32-byte public key
     * @return 32-byte shared value
     * @throws InvalidKeyMaterialException if either key has the wrong length or the agreement is rejected by the provider
     */
    public static byte[] calculateAgreement(byte[] privateKey, byte[] publicKey) throws InvalidKeyMaterialException {
        checkLength(privateKey, "private key");
        checkLength(publicKey, "public key");

        try {
            KeyAgreement keyAgreement = KeyAgreement.getInstance(ALGORITHM);
            keyAgreement.init(rawBytesToPrivateKey(privateKey));
            keyAgreement.doPhase(rawBytesToPublicKey(publicKey), true);
            return keyAgreement.generateSecret();
        } catch(NoSuchAlgorithmException e) {
            throw new AssertionError("X25519 is required by the JDK", e);
        } catch(GeneralSecurityException | IllegalStateException e) {
            throw new InvalidKeyMaterialException("X25519 agreement failed: " + e.getMessage(), e);
        }
    }

    /**
     * Convert an Ed25519 public key to the equivalent X25519 public key using the birational map u = (1 + y) / (1 - y).
     *
     * @param edwardsPublicKey 32-byte Ed25519 public key
     * @return 32-byte X25519 public key
     * @throws InvalidKeyMaterialException if the key is not a canonical encoding or maps to the point at infinity
     */
    public static byte[] edwardsToMontgomery(byte[] edwardsPublicKey) throws InvalidKeyMaterialException {
        checkLength(edwardsPublicKey, "Ed25519 public key");

        byte[] copy = Arrays.copyOf(edwardsPublicKey, KEY_LENGTH);
        copy[31] &= 0x7F;  // Sign of x is irrelevant to u
        BigInteger y = new BigInteger(1, reverseBytes(copy));
        if(y.compareTo(P) >= 0) {
            throw new InvalidKeyMaterialException("Non-canonical Ed25519 public key");
        }

        BigInteger denominator = BigInteger.ONE.subtract(y).mod(P);
        if(denominator.signum() == 0) {
            throw new InvalidKeyMaterialException("Ed25519 public key has no Montgomery form");
        }

        BigInteger u = BigInteger.ONE.add(y).multiply(denominator.modInverse(P)).mod(P);
        return encodeCoordinate(u);
    }

    /**
     * Derive the X25519 private scalar for an Ed25519 seed. This is the clamped lower half of SHA-512(seed), the same
     * scalar Ed25519 multiplies the base point by, so its public key equals {@link #edwardsToMontgomery(byte[])} of the
     * Ed25519 public key.
     *
     * @param seed 32-byte Ed25519 private key seed
     * @return 32-byte X25519 private key
     */
    public static byte[] edwardsSeedToMontgomery(byte[] seed) throws InvalidKeyMaterialException {
        checkLength(seed, "Ed25519 seed");

        try {
            byte[] hash = MessageDigest.getInstance("SHA-512").digest(seed);
            byte[] scalar = Arrays.copyOf(hash, KEY_LENGTH);
            Arrays.fill(hash, (byte)0);
            clamp(scalar);
            return scalar;
        } catch(NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-512 is required by the JDK", e);
        }
    }

    static void clamp(byte[] scalar) {
        scalar[0] &= (byte)248;
        scalar[31] &= 127;
        scalar[31] |= 64;
    }

    static void checkLength(byte[] key, String description) throws InvalidKeyMaterialException {
        if(key == null || key.length != KEY_LENGTH) {
            throw new InvalidKeyMaterialException("Invalid " + description + " length: " + (key == null ? "null" : key.length));
        }
    }

    private static PublicKey rawBytesToPublicKey(byte[] rawKey) throws GeneralSecurityException {
        byte[] encoded = new byte[X25519_PUBLIC_KEY_PREFIX.length + KEY_LENGTH];
        System.arraycopy(X25519_PUBLIC_KEY_PREFIX, 0, encoded, 0, X25519_PUBLIC_KEY_PREFIX.length);
        System.arraycopy(rawKey, 0, encoded, X25519_PUBLIC_KEY_PREFIX.length, KEY_LENGTH);

        return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
    }

    private static PrivateKey rawBytesToPrivateKey(byte[] rawScalar) throws GeneralSecurityException {
        byte[] encoded = new byte[X25519_PRIVATE_KEY_PREFIX.length + KEY_LENGTH];
        System.arraycopy(X25519_PRIVATE_KEY_PREFIX, 0, encoded, 0, X25519_PRIVATE_KEY_PREFIX.length);
        System.arraycopy(rawScalar, 0, encoded, X25519_PRIVATE_KEY_PREFIX.length, KEY_LENGTH);

        try {
            return KeyFactory.getInstance(ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(encoded));
        } finally {
            Arrays.fill(encoded, (byte)0);
        }
    }

    private static byte[] encodeCoordinate(BigInteger coordinate) {
        byte[] bigEndian = coordinate.toByteArray();
        byte[] result = new byte[KEY_LENGTH];

        // Drop the sign byte BigInteger may prepend
        int srcPos = 0;
        int length = bigEndian.length;
        if(bigEndian.length > KEY_LENGTH) {
            srcPos = bigEndian.length - KEY_LENGTH;
            length = KEY_LENGTH;
        }

        for(int i = 0; i < length; i++) {
            result[i] = bigEndian[srcPos + length - 1 - i];
        }

        return result;
    }

    private static byte[] reverseBytes(byte[] input) {
        byte[] result = new byte[input.length];
        for(int i = 0; i < input.length; i++) {
            result[i] = input[input.length - 1 - i];
        }
        return result;
    }
}
