package org.devolia.clientregistry.secret;

/**
 * A freshly generated secret: the plaintext handed to the client once, and its encrypted form
 * for storage.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class GeneratedSecret {

  private final String plaintext;
  private final String encrypted;

  public GeneratedSecret(String plaintext, String encrypted) {
    this.plaintext = plaintext;
    this.encrypted = encrypted;
  }

  public String getPlaintext() {
    return plaintext;
  }

  public String getEncrypted() {
    return encrypted;
  }

  @Override
  public String toString() {
    return "GeneratedSecret{plaintext=***}";
  }
}
