package com.sparrowwallet.wren.crypto;

import javax.annotation.Nullable;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * HKDF and HMAC over SHA-256.
 *
 * @see <a href="https://www.ietf.org/rfc/rfc5869.txt">IETF RFC 5869: HMAC-based Extract-and-Expand Key Derivation
 * Function (HKDF)</a>
 */
public final class Hkdf {

  public static final int HASH_LENGTH = 32;

  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final int MAX_OUTPUT_LENGTH = 255 * HASH_LENGTH;

  private Hkdf() {
  }

  /**
   * Derives {@code outputLength} bytes of key material from the given input key material.
   *
   * @param inputKeyMaterial the secret input
   * @param salt the extraction salt; a {@code null} or empty salt is replaced by {@link #HASH_LENGTH} zero bytes as
   *             RFC 5869 prescribes
   * @param info context and application specific information
   * @param outputLength the number of bytes to derive, at most 255 * {@link #HASH_LENGTH}
   *
   * @return the derived key material
   */
  public static byte[] deriveSecrets(final byte[] inputKeyMaterial,
                                     @Nullable final byte[] salt,
                                     final byte[] info,
                                     final int outputLength) {

    if (outputLength <= 0 || outputLength > MAX_OUTPUT_LENGTH) {
      throw new IllegalArgumentException("Illegal HKDF output length: " + outputLength);
    }

    final byte[] extractSalt = (salt == null || salt.length == 0) ? new byte[HASH_LENGTH] : salt;
    final byte[] pseudoRandomKey = hmacSha256(extractSalt, inputKeyMaterial);

    final byte[] output = new byte[outputLength];
    final Mac hmac = getHmac();

    try {
      hmac.init(new SecretKeySpec(pseudoRandomKey, "RAW"));

      byte[] block = new byte[0];
      int offset = 0;

      for (int counter = 1; offset < outputLength; counter++) {
        hmac.update(block);
        hmac.update(info);
        hmac.update((byte) counter);
        block = hmac.doFinal();

        final int length = Math.min(block.length, outputLength - offset);
        System.arraycopy(block, 0, output, offset, length);
        offset += length;
      }

      return output;
    } catch (final InvalidKeyException e) {
      // This should never happen for keys we derive/control
      throw new AssertionError(e);
    } finally {
      Arrays.fill(pseudoRandomKey, (byte) 0);
    }
  }

  /**
   * Calculates HMAC-SHA256 of the concatenation of the given inputs.
   *
   * @param key a non-empty HMAC key
   * @param inputs the data to authenticate
   *
   * @return a 32-byte MAC
   */
  public static byte[] hmacSha256(final byte[] key, final byte[]... inputs) {
    final Mac hmac = getHmac();

    try {
      hmac.init(new SecretKeySpec(key, "RAW"));
    } catch (final InvalidKeyException e) {
      throw new IllegalArgumentException(e);
    }

    for (final byte[] input : inputs) {
      hmac.update(input);
    }

    return hmac.doFinal();
  }

  private static Mac getHmac() {
    try {
      return Mac.getInstance(HMAC_ALGORITHM);
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform is required to support HmacSHA256", e);
    }
  }
}
