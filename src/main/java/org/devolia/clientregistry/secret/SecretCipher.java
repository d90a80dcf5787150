package org.devolia.clientregistry.secret;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic AES-256-GCM encryption of client secrets.
 *
 * <p>The IV is not random: it is the first 96 bits of an HMAC-SHA256 of the plaintext, under a
 * key derived separately from the master key. Equal plaintexts therefore encrypt to equal
 * ciphertexts, which lets a presented secret be encrypted and looked up in the {@link
 * SecretIndex}. Without the master key the plaintext cannot be recovered from a stored value.
 *
 * <p>Encoded form: base64url without padding of {@code iv || ciphertext || tag}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SecretCipher {

  private static final Logger logger = LoggerFactory.getLogger(SecretCipher.class);

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final int GCM_IV_LENGTH = 12;
  private static final int GCM_TAG_LENGTH = 16;
  private static final int KEY_LENGTH = 32;

  private static final String ENCRYPTION_KEY_LABEL = "client-registry/encryption";
  private static final String IV_KEY_LABEL = "client-registry/synthetic-iv";

  private final SecretKeySpec encryptionKey;
  private final SecretKeySpec ivKey;

  /**
   * Constructor with a raw 256-bit master key.
   *
   * @param masterKey the master key bytes
   * @throws IllegalArgumentException if the key is not 32 bytes
   */
  public SecretCipher(byte[] masterKey) {
    if (masterKey == null || masterKey.length != KEY_LENGTH) {
      throw new IllegalArgumentException(
          "Secret master key must be " + KEY_LENGTH + " bytes (256 bits)");
    }
    this.encryptionKey = new SecretKeySpec(deriveKey(masterKey, ENCRYPTION_KEY_LABEL), "AES");
    this.ivKey = new SecretKeySpec(deriveKey(masterKey, IV_KEY_LABEL), HMAC_ALGORITHM);
    logger.debug("Secret cipher initialized");
  }

  /**
   * Creates a cipher from a base64-encoded master key.
   *
   * @param masterKeyBase64 the master key, standard base64
   * @return the cipher
   * @throws IllegalArgumentException if the key is not valid base64 or not 32 bytes
   */
  public static SecretCipher fromBase64Key(String masterKeyBase64) {
    if (masterKeyBase64 == null || masterKeyBase64.trim().isEmpty()) {
      throw new IllegalArgumentException("Secret master key cannot be null or empty");
    }
    return new SecretCipher(Base64.getDecoder().decode(masterKeyBase64.trim()));
  }

  /**
   * Encrypts a plaintext secret.
   *
   * @param plaintext the secret
   * @return the encoded ciphertext
   */
  public String encrypt(String plaintext) {
    byte[] plainBytes = plaintext.getBytes(StandardCharsets.UTF_8);
    try {
      byte[] iv = syntheticIv(plainBytes);

      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
      byte[] encrypted = cipher.doFinal(plainBytes);

      byte[] output = new byte[iv.length + encrypted.length];
      System.arraycopy(iv, 0, output, 0, iv.length);
      System.arraycopy(encrypted, 0, output, iv.length, encrypted.length);
      return Base64.getUrlEncoder().withoutPadding().encodeToString(output);
    } catch (GeneralSecurityException e) {
      logger.error("Failed to encrypt secret", e);
      throw new IllegalStateException("Failed to encrypt secret", e);
    } finally {
      Arrays.fill(plainBytes, (byte) 0);
    }
  }

  /**
   * Decrypts a value produced by {@link #encrypt(String)}.
   *
   * @param encrypted the encoded ciphertext
   * @return the plaintext secret
   * @throws IllegalArgumentException if the value is malformed, tampered with, or was encrypted
   *     under another key
   */
  public String decrypt(String encrypted) {
    byte[] input;
    try {
      input = Base64.getUrlDecoder().decode(encrypted);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Encrypted secret is not valid base64url", e);
    }
    if (input.length < GCM_IV_LENGTH + GCM_TAG_LENGTH) {
      throw new IllegalArgumentException("Encrypted secret is too short");
    }

    byte[] iv = Arrays.copyOfRange(input, 0, GCM_IV_LENGTH);
    byte[] body = Arrays.copyOfRange(input, GCM_IV_LENGTH, input.length);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
      byte[] plainBytes = cipher.doFinal(body);

      // The IV must be the one this plaintext would have produced.
      if (!MessageDigest.isEqual(iv, syntheticIv(plainBytes))) {
        throw new IllegalArgumentException("Encrypted secret failed synthetic IV check");
      }
      return new String(plainBytes, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new IllegalArgumentException("Encrypted secret could not be decrypted", e);
    }
  }

  private byte[] syntheticIv(byte[] plainBytes) throws GeneralSecurityException {
    Mac hmac = Mac.getInstance(HMAC_ALGORITHM);
    hmac.init(ivKey);
    return Arrays.copyOf(hmac.doFinal(plainBytes), GCM_IV_LENGTH);
  }

  private static byte[] deriveKey(byte[] masterKey, String label) {
    try {
      Mac hmac = Mac.getInstance(HMAC_ALGORITHM);
      hmac.init(new SecretKeySpec(masterKey, HMAC_ALGORITHM));
      return Arrays.copyOf(hmac.doFinal(label.getBytes(StandardCharsets.UTF_8)), KEY_LENGTH);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to derive key: " + label, e);
    }
  }
}
