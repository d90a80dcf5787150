package org.devolia.clientregistry.secret;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates client secrets.
 *
 * <p>A secret is {@code secretBytes} bytes from {@link SecureRandom}, base64url encoded without
 * padding (43 characters for the default 32 bytes). Collisions are improbable, not checked.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SecretGenerator {

  private static final Logger logger = LoggerFactory.getLogger(SecretGenerator.class);

  public static final int DEFAULT_SECRET_BYTES = 32;
  private static final int MIN_SECRET_BYTES = 16;

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final SecretCipher cipher;
  private final int secretBytes;

  /**
   * Constructor with the default secret length.
   *
   * @param cipher cipher producing the stored form
   */
  public SecretGenerator(SecretCipher cipher) {
    this(cipher, DEFAULT_SECRET_BYTES);
  }

  /**
   * Constructor with an explicit secret length.
   *
   * @param cipher cipher producing the stored form
   * @param secretBytes number of random bytes per secret, at least 16
   */
  public SecretGenerator(SecretCipher cipher, int secretBytes) {
    if (secretBytes < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException(
          "Secret length must be at least " + MIN_SECRET_BYTES + " bytes: " + secretBytes);
    }
    this.cipher = Objects.requireNonNull(cipher, "cipher cannot be null");
    this.secretBytes = secretBytes;
  }

  /**
   * Generates a new secret and its encrypted form.
   *
   * @return the generated secret
   */
  public GeneratedSecret generate() {
    byte[] bytes = new byte[secretBytes];
    SECURE_RANDOM.nextBytes(bytes);
    String plaintext = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

    GeneratedSecret secret = new GeneratedSecret(plaintext, cipher.encrypt(plaintext));
    logger.debug("Generated client secret ({} bytes)", secretBytes);
    return secret;
  }

  /**
   * Encrypts a presented secret so it can be matched against stored values.
   *
   * @param plaintext the presented secret
   * @return its encrypted form
   */
  public String encrypt(String plaintext) {
    return cipher.encrypt(plaintext);
  }
}
