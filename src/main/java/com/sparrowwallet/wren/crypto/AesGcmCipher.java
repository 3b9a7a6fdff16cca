package com.sparrowwallet.wren.crypto;

import com.sparrowwallet.wren.InvalidKeyMaterialException;

import javax.annotation.Nullable;
import javax.crypto.*;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * AES-256-GCM with a 96-bit nonce and a 128-bit tag. Ciphertexts carry the tag appended to the encrypted bytes.
 */
public final class AesGcmCipher {

  public static final int KEY_LENGTH = 32;
  public static final int NONCE_LENGTH = 12;
  public static final int TAG_LENGTH = 16;

  private static final SecureRandom random = new SecureRandom();

  private AesGcmCipher() {
  }

  @FunctionalInterface
  private interface CipherFinalizer<T> {
    T doFinal() throws IllegalBlockSizeException, BadPaddingException;
  }

  public static byte[] encrypt(final byte[] key,
                               final byte[] nonce,
                               @Nullable final byte[] associatedData,
                               final byte[] plaintext) throws InvalidKeyMaterialException {

    final Cipher cipher = initCipher(Cipher.ENCRYPT_MODE, key, nonce);

    if (associatedData != null) {
      cipher.updateAAD(associatedData);
    }

    return finishEncryption(() -> cipher.doFinal(plaintext));
  }

  /**
   * Decrypts and authenticates the given ciphertext.
   *
   * @throws AEADBadTagException if the tag does not match, including when the ciphertext is too short to hold a tag
   */
  public static byte[] decrypt(final byte[] key,
                               final byte[] nonce,
                               @Nullable final byte[] associatedData,
                               final byte[] ciphertext) throws AEADBadTagException, InvalidKeyMaterialException {

    if (ciphertext.length < TAG_LENGTH) {
      throw new AEADBadTagException("Ciphertexts must be at least " + TAG_LENGTH + " bytes long");
    }

    final Cipher cipher = initCipher(Cipher.DECRYPT_MODE, key, nonce);

    if (associatedData != null) {
      cipher.updateAAD(associatedData);
    }

    return finishDecryption(() -> cipher.doFinal(ciphertext));
  }

  /**
   * Returns a fresh random 96-bit nonce.
   */
  public static byte[] generateNonce() {
    final byte[] nonce = new byte[NONCE_LENGTH];
    random.nextBytes(nonce);
    return nonce;
  }

  private static Cipher initCipher(final int mode, final byte[] key, final byte[] nonce) throws InvalidKeyMaterialException {
    if (key == null || key.length != KEY_LENGTH) {
      throw new InvalidKeyMaterialException("AES-256-GCM requires a " + KEY_LENGTH + "-byte key");
    }
    if (nonce == null || nonce.length != NONCE_LENGTH) {
      throw new InvalidKeyMaterialException("AES-256-GCM requires a " + NONCE_LENGTH + "-byte nonce");
    }

    try {
      final Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
      cipher.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH * 8, nonce));
      return cipher;
    } catch (final NoSuchAlgorithmException | NoSuchPaddingException e) {
      throw new AssertionError("All Java implementations must support AES/GCM/NoPadding", e);
    } catch (final InvalidAlgorithmParameterException e) {
      // This should never happen for a known algorithm with a known "shape" of parameters
      throw new AssertionError(e);
    } catch (final InvalidKeyException e) {
      throw new InvalidKeyMaterialException("Invalid AES key", e);
    }
  }

  private static byte[] finishDecryption(final CipherFinalizer<byte[]> finalizer) throws AEADBadTagException {
    try {
      return finalizer.doFinal();
    } catch (final IllegalBlockSizeException e) {
      // We're not using a block cipher
      throw new AssertionError(e);
    } catch (final BadPaddingException e) {
      if (e instanceof AEADBadTagException aeadBadTagException) {
        throw aeadBadTagException;
      }

      // We're also not using padding
      throw new AssertionError(e);
    }
  }

  private static byte[] finishEncryption(final CipherFinalizer<byte[]> finalizer) {
    try {
      return finalizer.doFinal();
    } catch (final IllegalBlockSizeException | BadPaddingException e) {
      // We're neither using a block cipher nor padding
      throw new AssertionError(e);
    }
  }
}
