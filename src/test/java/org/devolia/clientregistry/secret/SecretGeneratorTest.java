package org.devolia.clientregistry.secret;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;
import org.devolia.clientregistry.TestDatabases;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SecretGenerator.
 *
 * @author Devolia
 * @since 1.0.0
 */
class SecretGeneratorTest {

  private final SecretCipher cipher = SecretCipher.fromBase64Key(TestDatabases.secretKey(1));
  private final SecretGenerator generator = new SecretGenerator(cipher);

  @Test
  void testGeneratedSecretShape() {
    GeneratedSecret secret = generator.generate();

    // 32 bytes base64url without padding
    assertEquals(43, secret.getPlaintext().length());
    assertTrue(secret.getPlaintext().matches("[A-Za-z0-9_-]+"));
    assertNotEquals(secret.getPlaintext(), secret.getEncrypted());
    assertEquals(secret.getPlaintext(), cipher.decrypt(secret.getEncrypted()));
  }

  @Test
  void testGeneratedSecretsDoNotRepeat() {
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 500; i++) {
      assertTrue(seen.add(generator.generate().getPlaintext()));
    }
  }

  @Test
  void testEncryptMatchesStoredForm() {
    GeneratedSecret secret = generator.generate();

    assertEquals(secret.getEncrypted(), generator.encrypt(secret.getPlaintext()));
  }

  @Test
  void testToStringHidesPlaintext() {
    GeneratedSecret secret = generator.generate();

    assertFalse(secret.toString().contains(secret.getPlaintext()));
  }

  @Test
  void testCustomLength() {
    assertEquals(22, new SecretGenerator(cipher, 16).generate().getPlaintext().length());
    assertThrows(IllegalArgumentException.class, () -> new SecretGenerator(cipher, 8));
  }
}
