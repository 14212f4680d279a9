package socialpublish.jdbc.migration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Pbkdf2PasswordHasherTest {

  @Test
  void encodesAlgorithmIterationsSaltAndHash() {
    String hash = new Pbkdf2PasswordHasher(1_000).hash("changeme");

    String[] parts = hash.split("\\$");
    assertEquals(4, parts.length);
    assertEquals("pbkdf2-sha256", parts[0]);
    assertEquals("1000", parts[1]);
    assertFalse(hash.contains("changeme"));
  }

  @Test
  void saltsEveryHash() {
    Pbkdf2PasswordHasher hasher = new Pbkdf2PasswordHasher(1_000);

    assertNotEquals(hasher.hash("changeme"), hasher.hash("changeme"));
  }

  @Test
  void rejectsNonPositiveIterations() {
    assertThrows(IllegalArgumentException.class, () -> new Pbkdf2PasswordHasher(0));
  }
}
